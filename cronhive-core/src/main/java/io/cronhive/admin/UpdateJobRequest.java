package io.cronhive.admin;

import java.util.Map;

/**
 * Partial update for {@link JobAdmin#update(String, UpdateJobRequest)}. Null fields are left unchanged.
 *
 * <p>A blank {@code repeatInterval} turns a recurring job into a one-shot.
 */
public record UpdateJobRequest(
        String name,
        Map<String, Object> data,
        String schedule,
        String priority,
        Boolean disabled,
        String repeatInterval,
        String timezone
) {

    public static Builder builder() {
        return new Builder();
    }

    public boolean changesRepeat() {
        return repeatInterval != null || timezone != null;
    }

    public static final class Builder {
        private String name;
        private Map<String, Object> data;
        private String schedule;
        private String priority;
        private Boolean disabled;
        private String repeatInterval;
        private String timezone;

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
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

        public Builder disabled(Boolean disabled) {
            this.disabled = disabled;
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

        public UpdateJobRequest build() {
            return new UpdateJobRequest(name, data, schedule, priority, disabled, repeatInterval, timezone);
        }
    }
}
