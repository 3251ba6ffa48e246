package com.example.prr.model;

import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Numeric steady-state threshold: a percentage ({@code 99.9%}) or a duration
 * ({@code 300ms}, {@code 2s}, {@code 1m}). Durations are normalised to milliseconds.
 *
 * @param value numeric value (percent, or milliseconds for durations)
 * @param unit  unit of {@code value}
 */
public record Threshold(double value, Unit unit) implements Comparable<Threshold> {

    public enum Unit { PERCENT, MILLISECONDS }

    private static final Pattern QUANTITY = Pattern.compile(
            "^\\s*[<>]?=?\\s*(\\d+(?:\\.\\d+)?)\\s*(%|ms|s|sec|m|min)\\s*$");

    public static Optional<Threshold> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        Matcher m = QUANTITY.matcher(raw.toLowerCase(Locale.ROOT));
        if (!m.matches()) {
            return Optional.empty();
        }
        double number = Double.parseDouble(m.group(1));
        return Optional.of(switch (m.group(2)) {
            case "%" -> new Threshold(number, Unit.PERCENT);
            case "ms" -> new Threshold(number, Unit.MILLISECONDS);
            case "s", "sec" -> new Threshold(number * 1_000, Unit.MILLISECONDS);
            default -> new Threshold(number * 60_000, Unit.MILLISECONDS);
        });
    }

    public static boolean isParseable(String raw) {
        return parse(raw).isPresent();
    }

    @Override
    public int compareTo(Threshold other) {
        if (unit != other.unit) {
            throw new IllegalArgumentException("Cannot compare %s with %s".formatted(unit, other.unit));
        }
        return Double.compare(value, other.value);
    }
}
