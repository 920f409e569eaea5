package com.mrpsimulator.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;

@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SnapshotStatsResponse {
    String status;
    String message;
    boolean loaded;
    Long version;
    String source;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    Instant loadedAt;
    Map<String, Integer> rowCounts;
    Integer articleCount;
    Integer centerCount;
}
