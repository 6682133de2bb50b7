package io.cronhive.internal;

import io.cronhive.JobBuilder;
import io.cronhive.core.JobRecord;
import io.cronhive.core.JobSpec;
import io.cronhive.core.JobType;
import io.cronhive.core.PersistResult;
import io.cronhive.core.Priority;
import io.cronhive.schedule.ScheduleCalculator;
import io.cronhive.utils.IntervalParser;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Objects;
import java.util.function.Function;

/**
 * Default {@link JobBuilder} implementation.
 *
 * <p>Schedules are validated as they are set, so a bad cron or interval fails at definition time.
 * String schedules resolve against the clock in {@link #build()}.
 */
public class SimpleJobBuilder<T> implements JobBuilder<T> {

    private final String name;
    private final T data;
    private final Function<JobSpec<T>, PersistResult> persister;
    private final ScheduleCalculator calculator;
    private final Clock clock;

    private Instant nextRunAt;
    private String when;
    private String repeatInterval;
    private String repeatTimezone;
    private boolean skipImmediate;
    private boolean disabled;
    private boolean single;

    private Integer priority;

    public SimpleJobBuilder(String name, T data, Function<JobSpec<T>, PersistResult> persister,
                            ScheduleCalculator calculator, Clock clock) {
        Objects.requireNonNull(name, "job name must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("job name must not be blank");
        }
        this.name = name;
        this.data = data;
        this.persister = Objects.requireNonNull(persister, "persister must not be null");
        this.calculator = Objects.requireNonNull(calculator, "calculator must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    @Override
    public JobBuilder<T> priority(Priority priority) {
        Objects.requireNonNull(priority, "priority must not be null");
        this.priority = priority.value();
        return this;
    }

    @Override
    public JobBuilder<T> priority(int priority) {
        this.priority = priority;
        return this;
    }

    @Override
    public JobBuilder<T> timezone(String timezone) {
        Objects.requireNonNull(timezone, "timezone must not be null");
        ScheduleCalculator.resolveZone(timezone);
        this.repeatTimezone = timezone;
        return this;
    }

    @Override
    public JobBuilder<T> schedule(Instant time) {
        Objects.requireNonNull(time, "time must not be null");
        this.nextRunAt = time.truncatedTo(ChronoUnit.MILLIS);
        this.when = null;
        return this;
    }

    @Override
    public JobBuilder<T> schedule(String when) {
        Objects.requireNonNull(when, "when must not be null");
        calculator.parseRunAt(when, repeatTimezone, clock.instant());
        this.when = when;
        this.nextRunAt = null;
        return this;
    }

    @Override
    public JobBuilder<T> repeatAt(String timeOfDay) {
        Objects.requireNonNull(timeOfDay, "timeOfDay must not be null");
        IntervalParser.parseTimeOfDay(timeOfDay);

        this.repeatInterval = "AT " + timeOfDay.trim();
        this.skipImmediate = true;
        return this;
    }

    @Override
    public JobBuilder<T> repeatEvery(String intervalOrCron) {
        return repeatEvery(intervalOrCron, RepeatOptions.defaults());
    }

    @Override
    public JobBuilder<T> repeatEvery(String intervalOrCron, RepeatOptions options) {
        Objects.requireNonNull(intervalOrCron, "intervalOrCron must not be null");

        if (options == null) {
            options = RepeatOptions.defaults();
        }
        if (options.timezone() != null) {
            timezone(options.timezone());
        }

        calculator.validate(intervalOrCron, repeatTimezone);
        this.repeatInterval = intervalOrCron.trim();
        this.skipImmediate = options.skipImmediate();
        return this;
    }

    @Override
    public JobBuilder<T> repeatEvery(Number seconds) {
        return repeatEvery(seconds, RepeatOptions.defaults());
    }

    @Override
    public JobBuilder<T> repeatEvery(Number seconds, RepeatOptions options) {
        Objects.requireNonNull(seconds, "seconds must not be null");

        double asDouble = seconds.doubleValue();
        if (asDouble <= 0) {
            throw new IllegalArgumentException("interval must be a positive number of seconds");
        }
        if (asDouble % 1 != 0) {
            throw new IllegalArgumentException("interval must be an integer number of seconds");
        }
        return repeatEvery(Long.toString(seconds.longValue()), options);
    }

    @Override
    public JobBuilder<T> disable() {
        this.disabled = true;
        return this;
    }

    @Override
    public JobBuilder<T> single() {
        this.single = true;
        return this;
    }

    @Override
    public JobSpec<T> build() {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);

        Instant runAt = nextRunAt;
        if (runAt == null && when != null) {
            runAt = calculator.parseRunAt(when, repeatTimezone, now).truncatedTo(ChronoUnit.MILLIS);
        }

        JobRecord.Repeat repeat = null;
        if (repeatInterval != null) {
            repeat = new JobRecord.Repeat(repeatInterval, repeatTimezone);
            if (runAt == null) {
                runAt = calculator.initialRun(repeatInterval, repeatTimezone, now, skipImmediate)
                        .truncatedTo(ChronoUnit.MILLIS);
            }
        }
        if (single && repeat == null) {
            throw new IllegalStateException("single() requires a repeating job: " + name);
        }
        if (runAt == null) {
            runAt = now;
        }

        return new JobSpec<>(
                name,
                JobType.forRepeat(repeat),
                runAt,
                repeat,
                disabled,
                priority,
                data,
                single
        );
    }

    @Override
    public PersistResult save() {
        JobSpec<T> spec = this.build();
        return persister.apply(spec);
    }

    @Override
    public PersistResult save(JobSpec<T> spec) {
        return persister.apply(spec);
    }
}
