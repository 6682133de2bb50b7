package io.cronhive.utils;

import io.cronhive.core.InvalidScheduleSpecException;
import org.quartz.CronExpression;

import java.text.ParseException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.TimeZone;
import java.util.regex.Pattern;

/**
 * Parses the two recurrence grammars.
 * <p>
 * Supported formats:
 * <ul>
 *   <li>Human-readable intervals: "5 seconds", "2 hours", "1 day 3 hours", "5m", "30" (seconds)</li>
 *   <li>Cron expressions: 5-field Unix cron, 6-field cron with leading seconds, 7-field Quartz cron</li>
 * </ul>
 * <p>
 * Note: Unix cron counts day-of-week 0-7 from Sunday, Quartz 1-7 from Sunday; 5- and 6-field
 * expressions are translated before Quartz sees them.
 */
public final class IntervalParser {

    private static final Pattern HUMAN = Pattern.compile("^\\d+(\\s*[a-z]+)?(\\s+\\d+\\s*[a-z]+)*$");
    private static final Pattern DIGITS = Pattern.compile("^\\d+$");

    private IntervalParser() {
    }

    /**
     * True when {@code spec} has the shape of a human interval (number/unit pairs or bare seconds).
     */
    public static boolean looksHuman(String spec) {
        return spec != null && HUMAN.matcher(spec.trim().toLowerCase(Locale.ROOT)).matches();
    }

    /**
     * Returns true if the string can be parsed as a cron expression.
     */
    public static boolean looksLikeCron(String spec) {
        if (spec == null || looksHuman(spec)) {
            return false;
        }
        try {
            return CronExpression.isValidExpression(normalizeCron(spec));
        } catch (IllegalArgumentException ignored) {
            return false;
        }
    }

    /**
     * Normalize cron expressions into Quartz syntax:
     * - 5-field cron gets seconds "0" prepended.
     * - 6-field cron (leading seconds) is taken as-is.
     * - Unix day-of-week numbers are shifted to Quartz numbering.
     * - exactly one of day-of-month / day-of-week becomes "?".
     * - 7-field expressions are assumed to be Quartz already.
     */
    public static String normalizeCron(String spec) {
        Objects.requireNonNull(spec, "spec must not be null");
        String s = spec.trim();
        if (s.isEmpty()) {
            throw new InvalidScheduleSpecException(spec, "cron expression must not be empty");
        }

        String[] parts = s.split("\\s+");
        if (parts.length == 5) {
            return toQuartzCron(spec, "0", parts[0], parts[1], parts[2], parts[3], parts[4]);
        }
        if (parts.length == 6) {
            return toQuartzCron(spec, parts[0], parts[1], parts[2], parts[3], parts[4], parts[5]);
        }
        if (parts.length == 7) {
            return s;
        }
        throw new InvalidScheduleSpecException(spec, "Cron expression must have 5, 6 or 7 fields: " + spec);
    }

    private static String toQuartzCron(String spec, String sec, String min, String hour, String dayOfMonth,
                                       String month, String dayOfWeek) {
        String dom = dayOfMonth;
        String dow = "?".equals(dayOfWeek) ? dayOfWeek : toQuartzDayOfWeek(dayOfWeek);

        boolean anyDom = "*".equals(dom) || "?".equals(dom);
        boolean anyDow = "*".equals(dow) || "?".equals(dow);

        if (anyDom && anyDow) {
            dom = "*";
            dow = "?";
        } else if (anyDom) {
            dom = "?";
        } else if (anyDow) {
            dow = "?";
        } else {
            throw new InvalidScheduleSpecException(spec,
                    "Cron expression restricting both day-of-month and day-of-week is not supported: " + spec);
        }

        return String.join(" ", sec, min, hour, dom, month, dow);
    }

    /**
     * Shift Unix day-of-week numbers (0-7, Sunday = 0 or 7) to Quartz numbering (1-7, Sunday = 1).
     * Names (MON, FRI) and steps ("/2") are left alone.
     */
    static String toQuartzDayOfWeek(String field) {
        if ("*".equals(field)) {
            return field;
        }
        List<String> items = new ArrayList<>();
        for (String item : field.split(",")) {
            String base = item;
            String step = "";
            int slash = item.indexOf('/');
            if (slash >= 0) {
                base = item.substring(0, slash);
                step = item.substring(slash);
            }

            String suffix = "";
            int hash = base.indexOf('#');
            if (hash >= 0) {
                suffix = base.substring(hash);
                base = base.substring(0, hash);
            } else if (base.endsWith("L") && base.length() > 1) {
                suffix = "L";
                base = base.substring(0, base.length() - 1);
            }

            int dash = base.indexOf('-');
            if (dash > 0) {
                String from = base.substring(0, dash);
                String to = base.substring(dash + 1);
                if ("0".equals(from) && "7".equals(to)) {
                    items.add("1-7" + step);
                    continue;
                }
                if (DIGITS.matcher(from).matches() && "7".equals(to) && step.isEmpty()) {
                    // "5-7" is Friday through Sunday; Quartz ranges do not wrap past Saturday
                    items.add(shiftDay(from) + "-7");
                    items.add("1");
                    continue;
                }
                items.add(shiftDay(from) + "-" + shiftDay(to) + suffix + step);
            } else {
                items.add(shiftDay(base) + suffix + step);
            }
        }
        return String.join(",", items);
    }

    private static String shiftDay(String token) {
        if (!DIGITS.matcher(token).matches()) {
            return token;
        }
        int day = Integer.parseInt(token);
        if (day > 7) {
            return token;
        }
        return Integer.toString((day % 7) + 1);
    }

    /**
     * First occurrence of a Quartz cron expression strictly after {@code from}.
     */
    public static Instant nextCronTime(String quartzCron, ZoneId zone, Instant from) {
        CronExpression exp;
        try {
            exp = new CronExpression(quartzCron);
        } catch (ParseException ex) {
            throw new InvalidScheduleSpecException(quartzCron, "Invalid cron expression: " + quartzCron
                    + " (" + ex.getMessage() + ")", ex);
        }
        exp.setTimeZone(TimeZone.getTimeZone(zone));

        Date nextDate = exp.getNextValidTimeAfter(Date.from(from));
        if (nextDate == null) {
            throw new InvalidScheduleSpecException(quartzCron,
                    "Cron expression produced no next execution time: " + quartzCron);
        }
        return nextDate.toInstant();
    }

    /**
     * Parse "HH:mm" or "HH:mm:ss".
     */
    public static LocalTime parseTimeOfDay(String timeOfDay) {
        try {
            return LocalTime.parse(timeOfDay.trim());
        } catch (DateTimeParseException ex) {
            throw new InvalidScheduleSpecException(timeOfDay,
                    "Invalid timeOfDay. Expected HH:mm or HH:mm:ss: " + timeOfDay, ex);
        }
    }

    public static Duration parseHumanDuration(String input) {
        Objects.requireNonNull(input, "input must not be null");
        try {
            return parseDuration(input);
        } catch (ArithmeticException ex) {
            throw new InvalidScheduleSpecException(input, "Interval too large: " + input, ex);
        }
    }

    private static Duration parseDuration(String input) {
        String s = input.trim().toLowerCase(Locale.ROOT);
        if (s.isEmpty()) {
            throw new InvalidScheduleSpecException(input, "Interval string must not be empty");
        }

        if (DIGITS.matcher(s).matches()) {
            long seconds;
            try {
                seconds = Long.parseLong(s);
            } catch (NumberFormatException ex) {
                throw new InvalidScheduleSpecException(input, "Interval seconds out of range: " + input);
            }
            if (seconds <= 0) {
                throw new InvalidScheduleSpecException(input, "Interval seconds must be positive: " + input);
            }
            return Duration.ofSeconds(seconds);
        }

        if (s.matches("^\\d+\\s*[smhdw]$")) {
            String digits = s.replaceAll("[^0-9]", "");
            char u = s.replaceAll("[0-9\\s]", "").charAt(0);
            long n = parseCount(input, digits);
            Duration d = switch (u) {
                case 's' -> Duration.ofSeconds(n);
                case 'm' -> Duration.ofMinutes(n);
                case 'h' -> Duration.ofHours(n);
                case 'd' -> Duration.ofDays(n);
                case 'w' -> Duration.ofDays(Math.multiplyExact(7L, n));
                default -> throw new InvalidScheduleSpecException(input, "Unsupported compact unit: " + u);
            };
            return requirePositive(input, d);
        }

        String[] parts = s.replaceAll("(\\d)([a-z])", "$1 $2").split("\\s+");
        if (parts.length % 2 != 0) {
            throw new InvalidScheduleSpecException(input,
                    "Invalid interval format. Expected pairs like '3 minutes': " + input);
        }

        boolean seenMonth = false, seenWeek = false, seenDay = false, seenHour = false, seenMinute = false,
                seenSecond = false, seenMillis = false;
        Duration total = Duration.ZERO;

        for (int i = 0; i < parts.length; i += 2) {
            long n = parseCount(input, parts[i]);

            String unit = parts[i + 1];
            if (unit.endsWith("s") && unit.length() > 2) {
                unit = unit.substring(0, unit.length() - 1);
            }

            switch (unit) {
                case "month" -> {
                    if (seenMonth) throw duplicate(input, "month");
                    seenMonth = true;
                    total = total.plus(ChronoUnit.DAYS.getDuration().multipliedBy(Math.multiplyExact(30L, n)));
                }
                case "week" -> {
                    if (seenWeek) throw duplicate(input, "week");
                    seenWeek = true;
                    total = total.plus(ChronoUnit.DAYS.getDuration().multipliedBy(Math.multiplyExact(7L, n)));
                }
                case "day" -> {
                    if (seenDay) throw duplicate(input, "day");
                    seenDay = true;
                    total = total.plus(ChronoUnit.DAYS.getDuration().multipliedBy(n));
                }
                case "hour", "hr" -> {
                    if (seenHour) throw duplicate(input, "hour");
                    seenHour = true;
                    total = total.plus(ChronoUnit.HOURS.getDuration().multipliedBy(n));
                }
                case "minute", "min" -> {
                    if (seenMinute) throw duplicate(input, "minute");
                    seenMinute = true;
                    total = total.plus(ChronoUnit.MINUTES.getDuration().multipliedBy(n));
                }
                case "second", "sec" -> {
                    if (seenSecond) throw duplicate(input, "second");
                    seenSecond = true;
                    total = total.plusSeconds(n);
                }
                case "millisecond", "ms" -> {
                    if (seenMillis) throw duplicate(input, "millisecond");
                    seenMillis = true;
                    total = total.plusMillis(n);
                }
                default -> throw new InvalidScheduleSpecException(input, "Unsupported interval unit: " + parts[i + 1]);
            }
        }

        return requirePositive(input, total);
    }

    private static long parseCount(String input, String token) {
        try {
            long n = Long.parseLong(token);
            if (n < 0) {
                throw new InvalidScheduleSpecException(input, "Interval values must be non-negative");
            }
            return n;
        } catch (NumberFormatException ex) {
            throw new InvalidScheduleSpecException(input, "Invalid number in interval: " + token);
        }
    }

    private static Duration requirePositive(String input, Duration d) {
        if (d.isZero() || d.isNegative()) {
            throw new InvalidScheduleSpecException(input, "Interval must be longer than zero: " + input);
        }
        return d;
    }

    private static InvalidScheduleSpecException duplicate(String input, String unit) {
        return new InvalidScheduleSpecException(input, "Duplicate unit: " + unit);
    }
}
