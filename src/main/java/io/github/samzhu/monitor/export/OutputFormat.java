package io.github.samzhu.monitor.export;

import java.util.Locale;
import java.util.Optional;

/**
 * 表格輸出格式。
 */
public enum OutputFormat {
    MARKDOWN,
    CSV,
    JSON;

    public static Optional<OutputFormat> parse(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(token.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
