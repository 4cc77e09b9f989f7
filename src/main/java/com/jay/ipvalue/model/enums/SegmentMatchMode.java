package com.jay.ipvalue.model.enums;

import java.util.Locale;

/** How a requested segment name is compared against disclosed segment labels. */
public enum SegmentMatchMode {
    EXACT,            // case-sensitive, character for character
    CASE_INSENSITIVE, // ignores case only
    NORMALIZED;       // ignores case, spaces and hyphens ("Intelligent-Cloud" == "intelligentcloud")

    public boolean matches(String requested, String label) {
        if (requested == null || label == null) return false;
        return switch (this) {
            case EXACT -> requested.equals(label);
            case CASE_INSENSITIVE -> requested.equalsIgnoreCase(label);
            case NORMALIZED -> normalize(requested).equals(normalize(label));
        };
    }

    private static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT).replace(" ", "").replace("-", "");
    }
}
