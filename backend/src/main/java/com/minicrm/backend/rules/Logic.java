package com.minicrm.backend.rules;

import java.util.Locale;
import java.util.Optional;

public enum Logic {
    AND,
    OR;

    public static Optional<Logic> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(code.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
