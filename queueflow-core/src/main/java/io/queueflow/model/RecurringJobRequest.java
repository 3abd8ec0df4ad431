package io.queueflow.model;

import java.util.Objects;

/**
 * A recurring job to install.
 *
 * @param name        task id used for routing materialized jobs
 * @param jobId       stable job id
 * @param pattern     cron pattern (5 or 6 fields)
 * @param tz          IANA time zone id, or {@code null} for UTC
 * @param payloadJson payload each materialized job carries
 */
public record RecurringJobRequest(String name, String jobId, String pattern, String tz, String payloadJson) {

    public RecurringJobRequest {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(jobId, "jobId");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(payloadJson, "payloadJson");
    }

    /** Registration key; a changed pattern or zone yields a different key. */
    public String key() {
        return name + ":" + jobId + ":" + (tz == null ? "" : tz) + ":" + pattern;
    }
}
