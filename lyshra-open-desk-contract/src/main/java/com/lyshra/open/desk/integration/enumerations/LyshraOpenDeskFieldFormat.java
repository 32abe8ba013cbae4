package com.lyshra.open.desk.integration.enumerations;

import java.util.Optional;

/**
 * Format kinds a {@code Data} field can declare through its options.
 */
public enum LyshraOpenDeskFieldFormat {
    EMAIL("Email"),
    PHONE("Phone"),
    URL("URL"),
    NAME("Name");

    private final String options;

    LyshraOpenDeskFieldFormat(String options) {
        this.options = options;
    }

    public String getOptions() {
        return options;
    }

    public static Optional<LyshraOpenDeskFieldFormat> fromOptions(String options) {
        if (options == null) {
            return Optional.empty();
        }
        String trimmed = options.trim();
        for (LyshraOpenDeskFieldFormat format : values()) {
            if (format.options.equalsIgnoreCase(trimmed)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
