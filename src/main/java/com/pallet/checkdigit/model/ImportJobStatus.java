package com.pallet.checkdigit.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Response body for import job polling. {@code report} is set once the job is DONE.
 */
public record ImportJobStatus(

        @JsonProperty("jobId")
        String jobId,

        /**
         * One of RUNNING, DONE, FAILED.
         */
        @JsonProperty("state")
        String state,

        @JsonProperty("processed")
        int processed,

        @JsonProperty("total")
        int total,

        @JsonProperty("message")
        String message,

        @JsonProperty("report")
        ImportReport report

) {
}
