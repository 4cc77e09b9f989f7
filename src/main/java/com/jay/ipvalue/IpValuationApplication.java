package com.jay.ipvalue;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class IpValuationApplication {
    public static void main(String[] args) {
        SpringApplication.run(IpValuationApplication.class, args);
    }
}
