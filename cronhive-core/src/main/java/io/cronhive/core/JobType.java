package io.cronhive.core;

public enum JobType {
    ONE_SHOT {
        @Override
        public boolean shouldReschedule() {
            return false;
        }
    },
    RECURRING {
        @Override
        public boolean shouldReschedule() {
            return true;
        }
    };

    public abstract boolean shouldReschedule();

    public static JobType forRepeat(JobRecord.Repeat repeat) {
        return repeat == null ? ONE_SHOT : RECURRING;
    }
}
