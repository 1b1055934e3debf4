package com.shelterops.availability;

import java.util.Arrays;
import java.util.Optional;

public enum ExceptionKind {
    UNAVAILABLE("unavailable"),
    AVAILABLE("available"),
    MODIFIED("modified");

    private final String value;

    ExceptionKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static Optional<ExceptionKind> fromValue(String value) {
        if (value == null) return Optional.empty();
        String v = value.trim();
        return Arrays.stream(values())
                .filter(k -> k.value.equalsIgnoreCase(v))
                .findFirst();
    }
}
