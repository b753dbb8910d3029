package com.umitunal.qworker.serialization;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * JSON shape of a stored job.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
class JobEnvelope {
    @JsonProperty("name")
    public String name;

    @JsonProperty("payload")
    public Map<String, Object> payload;

    @JsonProperty("max_attempts")
    public Integer maxAttempts;

    @JsonProperty("retry_delay")
    public Long retryDelay;

    @JsonProperty("attempts")
    public Integer attempts;

    @JsonProperty("created_at")
    public String createdAt;

    public JobEnvelope() {}
}
