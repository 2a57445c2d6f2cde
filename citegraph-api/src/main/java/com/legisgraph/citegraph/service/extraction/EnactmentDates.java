package com.legisgraph.citegraph.service.extraction;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Dates as written in source credits: {@code "Aug. 8, 2005"}, {@code "Sept. 28, 2018"},
 * {@code "July 30, 1965"}.
 */
public final class EnactmentDates {

    private static final Pattern DATE = Pattern.compile("\\b([A-Za-z]+\\.?)\\s+(\\d{1,2}),\\s+(\\d{4})\\b");

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("january", 1),
            Map.entry("feb", 2), Map.entry("february", 2),
            Map.entry("mar", 3), Map.entry("march", 3),
            Map.entry("apr", 4), Map.entry("april", 4),
            Map.entry("may", 5),
            Map.entry("jun", 6), Map.entry("june", 6),
            Map.entry("jul", 7), Map.entry("july", 7),
            Map.entry("aug", 8), Map.entry("august", 8),
            Map.entry("sep", 9), Map.entry("sept", 9), Map.entry("september", 9),
            Map.entry("oct", 10), Map.entry("october", 10),
            Map.entry("nov", 11), Map.entry("november", 11),
            Map.entry("dec", 12), Map.entry("december", 12)
    );

    private EnactmentDates() {
    }

    public static Optional<Integer> month(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String key = name.trim().toLowerCase(Locale.ROOT);
        if (key.endsWith(".")) {
            key = key.substring(0, key.length() - 1);
        }
        return Optional.ofNullable(MONTHS.get(key));
    }

    /**
     * First {@code Month Day, Year} in {@code text} whose month name resolves. An impossible
     * calendar date yields empty rather than an error.
     */
    public static Optional<LocalDate> find(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = DATE.matcher(text);
        while (matcher.find()) {
            Optional<Integer> month = month(matcher.group(1));
            if (month.isPresent()) {
                return toDate(Integer.parseInt(matcher.group(3)), month.get(), Integer.parseInt(matcher.group(2)));
            }
        }
        return Optional.empty();
    }

    public static Optional<LocalDate> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        Matcher matcher = DATE.matcher(value.trim());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        return month(matcher.group(1))
                .flatMap(month -> toDate(Integer.parseInt(matcher.group(3)), month, Integer.parseInt(matcher.group(2))));
    }

    private static Optional<LocalDate> toDate(int year, int month, int day) {
        try {
            return Optional.of(LocalDate.of(year, month, day));
        } catch (DateTimeException ex) {
            return Optional.empty();
        }
    }
}
