package dev.feedcraft.util;

import dev.feedcraft.exception.DateGrammarException;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.time.Month;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.TextStyle;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the RFC 822 date-times used by {@code <pubDate>} and {@code <lastBuildDate>}.
 * <p>
 * Canonical shape: {@code [Day,] DD Mon YY[YY] HH:MM[:SS] [zone]}, for example
 * {@code "Sat, 07 Sep 2002 00:00:01 GMT"} or {@code "7 sep 02 9:30 -0400"}. The tokenizer is as
 * lenient as the dates found in real feeds:
 * <ul>
 *   <li>a leading token ending in a comma ({@code Tues,}) or naming a weekday is skipped unchecked</li>
 *   <li>month and day may be swapped ({@code Jun 10 2003}) and the RFC 850 form
 *       {@code 10-Jun-03} is accepted</li>
 *   <li>a zone may be glued to the time ({@code 04:00:00+0200}); tokens after the zone, such as an
 *       RFC 822 comment {@code (UTC)}, are ignored</li>
 *   <li>years of one or two digits above 68 are 19xx, the rest 20xx; three-digit years are offset
 *       from 1900</li>
 *   <li>zones: {@code +HHMM}/{@code -HHMM}, UT/UTC/GMT/Z and the North American names; no zone,
 *       {@code -0000} or an unknown name falls back to the default offset (UTC)</li>
 * </ul>
 */
public final class RssDates {

    private RssDates() {}

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern DIGITS = Pattern.compile("\\d{1,4}");
    private static final Pattern NUMERIC_ZONE = Pattern.compile("^([+-]?)(\\d{2})(\\d{2})$");

    /** Day-of-week names (full or 3-letter) that may prefix the date. */
    private static final Set<String> DAY_NAMES = buildDayNames();

    /** Lower-case month name (3-letter and full) → Month. */
    private static final Map<String, Month> MONTH_LOOKUP = buildMonthLookup();

    /** Named zones, in hours from UTC. */
    private static final Map<String, Integer> NAMED_ZONES = Map.ofEntries(
            Map.entry("UT", 0), Map.entry("UTC", 0), Map.entry("GMT", 0), Map.entry("Z", 0),
            Map.entry("AST", -4), Map.entry("ADT", -3),
            Map.entry("EST", -5), Map.entry("EDT", -4),
            Map.entry("CST", -6), Map.entry("CDT", -5),
            Map.entry("MST", -7), Map.entry("MDT", -6),
            Map.entry("PST", -8), Map.entry("PDT", -7));

    /**
     * Parse an RFC 822 date, defaulting to UTC when the text carries no usable zone.
     *
     * @throws DateGrammarException if the text is null, blank or not an RFC 822 date
     */
    public static OffsetDateTime parse(String text) {
        return parse(text, ZoneOffset.UTC);
    }

    /**
     * Parse an RFC 822 date, using {@code defaultOffset} when the text carries no usable zone.
     *
     * @throws DateGrammarException if the text is null, blank or not an RFC 822 date
     */
    public static OffsetDateTime parse(String text, ZoneOffset defaultOffset) {
        if (text == null || text.isBlank()) {
            throw new DateGrammarException("RSS date strings must be non-empty.");
        }
        List<String> tokens = tokenize(text.trim());
        if (tokens.size() < 5) {
            throw new DateGrammarException("Invalid RSS date string: '" + text + "'");
        }

        String dd = tokens.get(0);
        String mm = tokens.get(1);
        String yy = tokens.get(2);
        String tm = tokens.get(3);
        String tz = tokens.get(4);

        Month month = MONTH_LOOKUP.get(mm.toLowerCase(Locale.ROOT));
        if (month == null) {
            month = MONTH_LOOKUP.get(dd.toLowerCase(Locale.ROOT));
            dd = mm;
        }
        if (month == null) {
            throw new DateGrammarException("Invalid month in RSS date string: '" + text + "'");
        }
        dd = stripComma(dd);

        if (yy.indexOf(':') >= 0) {
            String swap = yy;
            yy = tm;
            tm = swap;
        }
        yy = stripComma(yy);
        if ((yy.isEmpty() || !Character.isDigit(yy.charAt(0))) && !tz.isEmpty()) {
            String swap = yy;
            yy = tz;
            tz = swap;
        }
        tm = stripComma(tm);

        String[] clock = tm.split(":", -1);
        if (clock.length == 1 && tm.indexOf('.') >= 0) {
            clock = tm.split("\\.", -1);
        }
        if (clock.length < 2 || clock.length > 3) {
            throw new DateGrammarException("Invalid time in RSS date string: '" + text + "'");
        }

        int day = number(dd, text);
        int year = expandYear(number(yy, text), yy.length());
        int hour = number(clock[0], text);
        int minute = number(clock[1], text);
        int second = clock.length == 3 ? number(clock[2], text) : 0;

        try {
            LocalDateTime local = LocalDateTime.of(year, month, day, hour, minute, second);
            return OffsetDateTime.of(local, resolveZone(tz.isEmpty() ? null : tz, defaultOffset));
        } catch (DateTimeException e) {
            throw new DateGrammarException("Out-of-range value in RSS date string: '" + text + "'", e);
        }
    }

    /**
     * Splits the text into at least {@code [day, month, year, time, zone]} when it has that many
     * parts; the zone slot is empty when the text has none.
     */
    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>(Arrays.asList(WHITESPACE.split(text)));
        String first = tokens.get(0);
        if (first.endsWith(",") || DAY_NAMES.contains(first.toLowerCase(Locale.ROOT))) {
            tokens.remove(0);
        } else {
            int comma = first.lastIndexOf(',');
            if (comma >= 0) {
                tokens.set(0, first.substring(comma + 1));
            }
        }

        if (tokens.size() == 3) {
            String[] dashed = tokens.get(0).split("-");
            if (dashed.length == 3) {
                tokens.remove(0);
                tokens.addAll(0, Arrays.asList(dashed));
            }
        }
        if (tokens.size() == 4) {
            String time = tokens.get(3);
            int sign = time.indexOf('+');
            if (sign < 0) {
                sign = time.indexOf('-');
            }
            if (sign > 0) {
                tokens.set(3, time.substring(0, sign));
                tokens.add(time.substring(sign));
            } else {
                tokens.add("");
            }
        }
        return tokens;
    }

    private static String stripComma(String token) {
        return token.endsWith(",") ? token.substring(0, token.length() - 1) : token;
    }

    private static int number(String token, String text) {
        if (!DIGITS.matcher(token).matches()) {
            throw new DateGrammarException("Invalid number '" + token + "' in RSS date string: '" + text + "'");
        }
        return Integer.parseInt(token);
    }

    /**
     * Optional-input variant: {@code null} maps to empty without touching the grammar.
     *
     * @throws DateGrammarException if a non-null text does not parse
     */
    public static Optional<OffsetDateTime> parseOptional(String text) {
        return parseOptional(text, ZoneOffset.UTC);
    }

    public static Optional<OffsetDateTime> parseOptional(String text, ZoneOffset defaultOffset) {
        if (text == null) {
            return Optional.empty();
        }
        return Optional.of(parse(text, defaultOffset));
    }

    static int expandYear(int year, int digits) {
        if (digits <= 2) {
            return year > 68 ? year + 1900 : year + 2000;
        }
        if (digits == 3) {
            return year + 1900;
        }
        return year;
    }

    static ZoneOffset resolveZone(String zone, ZoneOffset defaultOffset) {
        if (zone == null) {
            return defaultOffset;
        }
        Matcher numeric = NUMERIC_ZONE.matcher(zone);
        if (numeric.matches()) {
            // RFC 2822: -0000 means "no zone information"
            if ("-0000".equals(zone)) {
                return defaultOffset;
            }
            int sign = "-".equals(numeric.group(1)) ? -1 : 1;
            return ZoneOffset.ofHoursMinutes(
                    sign * Integer.parseInt(numeric.group(2)),
                    sign * Integer.parseInt(numeric.group(3)));
        }
        Integer hours = NAMED_ZONES.get(zone.toUpperCase(Locale.ROOT));
        return hours == null ? defaultOffset : ZoneOffset.ofHours(hours);
    }

    private static Set<String> buildDayNames() {
        Set<String> names = new HashSet<>();
        for (DayOfWeek day : DayOfWeek.values()) {
            names.add(day.getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT));
            names.add(day.getDisplayName(TextStyle.SHORT, Locale.ENGLISH).toLowerCase(Locale.ROOT));
        }
        return Set.copyOf(names);
    }

    private static Map<String, Month> buildMonthLookup() {
        Map<String, Month> lookup = new HashMap<>();
        for (Month month : Month.values()) {
            lookup.put(month.getDisplayName(TextStyle.FULL, Locale.ENGLISH).toLowerCase(Locale.ROOT), month);
            lookup.put(month.getDisplayName(TextStyle.SHORT, Locale.ENGLISH).toLowerCase(Locale.ROOT), month);
        }
        // common non-standard abbreviation
        lookup.put("sept", Month.SEPTEMBER);
        return Map.copyOf(lookup);
    }
}
