package com.riansoft.robot_alloc.service;

import java.util.Locale;

public enum CoalitionStrategy {
    GREEDY,
    EXACT;

    public static CoalitionStrategy parse(String value) {
        if (value == null || value.isBlank()) {
            return GREEDY;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown coalition strategy '" + value + "' (expected greedy or exact)", e);
        }
    }
}
