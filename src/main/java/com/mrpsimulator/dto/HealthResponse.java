package com.mrpsimulator.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class HealthResponse {
    String status;
    boolean loaded;
    Long snapshotVersion;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant timestamp;
}
