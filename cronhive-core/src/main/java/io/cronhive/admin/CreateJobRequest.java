package io.cronhive.admin;

import java.util.Map;

/**
 * Input of {@link JobAdmin#create(CreateJobRequest)}.
 *
 * @param schedule       one-shot run time: ISO-8601, "now", "in 10 minutes"; null means now
 * @param priority       named level ("low", "normal", "high", ...) or an integer
 * @param repeatInterval cron expression or human interval; null or blank means one-shot
 * @param timezone       IANA zone for cron and local date-times; null means system default
 * @param skipImmediate  for repeating jobs, wait for the first recurrence instead of running now
 */
public record CreateJobRequest(
        String name,
        Map<String, Object> data,
        String schedule,
        String priority,
        String repeatInterval,
        String timezone,
        boolean skipImmediate
) {

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private Map<String, Object> data;
        private String schedule;
        private String priority;
        private String repeatInterval;
        private String timezone;
        private boolean skipImmediate;

        private Builder(String name) {
            this.name = name;
        }

        public Builder data(Map<String, Object> data) {
            this.data = data;
            return this;
        }

        public Builder schedule(String schedule) {
            this.schedule = schedule;
            return this;
        }

        public Builder priority(String priority) {
            this.priority = priority;
            return this;
        }

        public Builder repeatInterval(String repeatInterval) {
            this.repeatInterval = repeatInterval;
            return this;
        }

        public Builder timezone(String timezone) {
            this.timezone = timezone;
            return this;
        }

        public Builder skipImmediate(boolean skipImmediate) {
            this.skipImmediate = skipImmediate;
            return this;
        }

        public CreateJobRequest build() {
            return new CreateJobRequest(name, data, schedule, priority, repeatInterval, timezone, skipImmediate);
        }
    }
}
