package com.factguard.infrastructure.policy;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A numeric timeframe such as "24 hours" or "7-10 business days", normalized to days.
 *
 * @param minDays lower bound in days
 * @param maxDays upper bound in days (equal to minDays for single values)
 * @param text    the timeframe as written
 */
public record Timeframe(double minDays, double maxDays, String text) {

    private static final Pattern TIMEFRAME = Pattern.compile(
            "(\\d+(?:\\.\\d+)?)(?:\\s*(?:-|to)\\s*(\\d+(?:\\.\\d+)?))?\\s*"
            + "(?:business\\s+|working\\s+|calendar\\s+)?(minute|min|hour|hr|day|week|month)s?\\b",
            Pattern.CASE_INSENSITIVE
    );

    /**
     * First timeframe in the text, if any.
     */
    public static Optional<Timeframe> find(String text) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = TIMEFRAME.matcher(text);
        if (!matcher.find()) {
            return Optional.empty();
        }
        double unit = unitInDays(matcher.group(3));
        double low = Double.parseDouble(matcher.group(1)) * unit;
        double high = matcher.group(2) != null ? Double.parseDouble(matcher.group(2)) * unit : low;
        return Optional.of(new Timeframe(Math.min(low, high), Math.max(low, high), matcher.group().strip()));
    }

    private static double unitInDays(String unit) {
        return switch (unit.toLowerCase(Locale.ROOT)) {
            case "minute", "min" -> 1.0 / 1440;
            case "hour", "hr" -> 1.0 / 24;
            case "week" -> 7;
            case "month" -> 30;
            default -> 1;
        };
    }

    public boolean isShorterThan(Timeframe other) {
        return maxDays < other.minDays;
    }

    public boolean isLongerThan(Timeframe other) {
        return minDays > other.maxDays;
    }
}
