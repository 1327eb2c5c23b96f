package ph.extremelogic.common.core.health.api;

import java.util.Locale;
import java.util.Optional;

/**
 * Event severity, ordered from least to most severe.
 */
public enum LogLevel {
    TRACE("trace"),
    DEBUG("debug"),
    INFO("info"),
    ERROR("error");

    private static final LogLevel[] VALUES = values();

    private final String text;

    LogLevel(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    public boolean isMoreSpecificThan(LogLevel other) {
        return this.ordinal() >= other.ordinal();
    }

    /**
     * Looks up a level by its text, ignoring case and surrounding whitespace.
     *
     * @return the level, or empty for null or unrecognized text
     */
    public static Optional<LogLevel> parse(String text) {
        if (text == null) return Optional.empty();
        String word = text.trim().toLowerCase(Locale.ROOT);
        for (LogLevel level : VALUES) {
            if (level.text.equals(word)) {
                return Optional.of(level);
            }
        }
        return Optional.empty();
    }

    // Strict lookup for configuration values
    public static LogLevel fromText(String text) {
        return parse(text).orElseThrow(() ->
                new IllegalArgumentException("No LogLevel found for " + text));
    }

    @Override
    public String toString() {
        return text;
    }
}
