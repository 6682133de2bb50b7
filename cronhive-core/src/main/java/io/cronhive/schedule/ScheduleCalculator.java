package io.cronhive.schedule;

import io.cronhive.core.InvalidScheduleSpecException;
import io.cronhive.utils.IntervalParser;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.Locale;
import java.util.Objects;

/**
 * Maps a recurrence spec + timezone + base instant to the next run instant.
 *
 * <p>Recurrence specs:
 * <ul>
 *   <li>cron ("0 9 * * 1", "*&#47;5 * * * * *"): evaluated in the job's timezone</li>
 *   <li>human interval ("5 seconds", "1 day 3 hours"): fixed offset, timezone ignored</li>
 *   <li>"AT HH:mm": once a day at that wall-clock time in the job's timezone</li>
 * </ul>
 *
 * <p>Every result is strictly after the base instant. Unparseable input fails with
 * {@link InvalidScheduleSpecException}.
 */
public class ScheduleCalculator {

    static final String AT_PREFIX = "AT ";

    private final Clock clock;

    public ScheduleCalculator() {
        this(Clock.systemUTC());
    }

    public ScheduleCalculator(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Computes the first run strictly after {@code from}.
     *
     * @param spec     cron expression, human interval or "AT HH:mm"
     * @param timezone IANA time zone id (e.g. "Asia/Taipei"); null means system default
     * @param from     base instant, usually the start of the previous run
     */
    public Instant nextRun(String spec, String timezone, Instant from) {
        Objects.requireNonNull(from, "from must not be null");
        String s = requireSpec(spec);
        ZoneId zone = resolveZone(timezone);

        if (s.regionMatches(true, 0, AT_PREFIX, 0, AT_PREFIX.length())) {
            LocalTime timeOfDay = IntervalParser.parseTimeOfDay(s.substring(AT_PREFIX.length()));
            ZonedDateTime base = ZonedDateTime.ofInstant(from, zone);
            ZonedDateTime candidate = base.with(timeOfDay);
            if (!candidate.isAfter(base)) {
                candidate = candidate.plusDays(1).with(timeOfDay);
            }
            return candidate.toInstant();
        }

        if (IntervalParser.looksHuman(s)) {
            return plus(s, from, IntervalParser.parseHumanDuration(s));
        }

        return IntervalParser.nextCronTime(IntervalParser.normalizeCron(s), zone, from);
    }

    /**
     * First run of a new recurring job: now, or the first recurrence after now when
     * {@code skipImmediate} is set.
     */
    public Instant initialRun(String spec, String timezone, Instant now, boolean skipImmediate) {
        if (!skipImmediate) {
            validate(spec, timezone);
            return now;
        }
        return nextRun(spec, timezone, now);
    }

    /**
     * Fails with {@link InvalidScheduleSpecException} unless the schedule and timezone can be evaluated.
     */
    public void validate(String spec, String timezone) {
        nextRun(spec, timezone, clock.instant());
    }

    public boolean isValid(String spec, String timezone) {
        try {
            validate(spec, timezone);
            return true;
        } catch (InvalidScheduleSpecException ex) {
            return false;
        }
    }

    /**
     * Resolves a one-shot schedule string relative to {@code now}.
     *
     * <p>Accepts "now", ISO-8601 instants ("2026-01-20T09:30:00Z"), offset date-times, local date-times
     * (interpreted in {@code timezone}), "in 10 minutes" and bare intervals ("10 minutes").
     */
    public Instant parseRunAt(String when, String timezone, Instant now) {
        Objects.requireNonNull(now, "now must not be null");
        String s = requireSpec(when);
        String lower = s.toLowerCase(Locale.ROOT);

        if ("now".equals(lower)) {
            return now;
        }
        if (lower.startsWith("in ")) {
            return plus(s, now, IntervalParser.parseHumanDuration(s.substring(3)));
        }
        if (IntervalParser.looksHuman(s)) {
            return plus(s, now, IntervalParser.parseHumanDuration(s));
        }

        TemporalAccessor parsed;
        try {
            parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(s, ZonedDateTime::from, LocalDateTime::from);
        } catch (DateTimeParseException ex) {
            throw new InvalidScheduleSpecException(when, "Unrecognized schedule: " + when, ex);
        }
        if (parsed instanceof ZonedDateTime zoned) {
            return zoned.toInstant();
        }
        return ((LocalDateTime) parsed).atZone(resolveZone(timezone)).toInstant();
    }

    // an interval that parses can still land past Instant.MAX
    private static Instant plus(String spec, Instant base, Duration interval) {
        try {
            return base.plus(interval);
        } catch (DateTimeException | ArithmeticException ex) {
            throw new InvalidScheduleSpecException(spec, "Interval too large: " + spec, ex);
        }
    }

    /**
     * Null or blank means the system default zone.
     */
    public static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException ex) {
            throw new InvalidScheduleSpecException(timezone, "Unknown timezone: " + timezone, ex);
        }
    }

    private static String requireSpec(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new InvalidScheduleSpecException(spec, "schedule spec must not be blank");
        }
        return spec.trim();
    }
}
