package com.jay.ipvalue.controller;

import com.jay.ipvalue.exception.ValuationErrorKind;

public record ErrorResponse(ValuationErrorKind kind, String message) {}
