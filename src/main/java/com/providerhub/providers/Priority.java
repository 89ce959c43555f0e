package com.providerhub.providers;

import java.util.Locale;

public enum Priority {
    LOW, MEDIUM, HIGH;

    public static Priority parse(String value) {
        if (value == null || value.isBlank()) return MEDIUM;
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
