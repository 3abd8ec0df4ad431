package io.queueflow.model;

/**
 * Lifecycle state of a job held by the broker.
 */
public enum JobState {
    WAITING(0),
    DELAYED(1),
    ACTIVE(2),
    COMPLETED(3),
    FAILED(4);

    private final int code;

    JobState(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    public static JobState fromCode(int code) {
        for (JobState state : values()) {
            if (state.code == code) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown job state code: " + code);
    }
}
