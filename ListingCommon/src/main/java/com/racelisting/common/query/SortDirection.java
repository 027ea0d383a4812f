package com.racelisting.common.query;

import java.util.Locale;
import java.util.Optional;

public enum SortDirection {
    ASC,
    DESC;

    /**
     * Case-insensitive lookup; empty for null, blank or unknown tokens.
     */
    public static Optional<SortDirection> parse(String token) {
        if (token == null) {
            return Optional.empty();
        }
        switch (token.toUpperCase(Locale.ROOT)) {
            case "ASC":
                return Optional.of(ASC);
            case "DESC":
                return Optional.of(DESC);
            default:
                return Optional.empty();
        }
    }
}
