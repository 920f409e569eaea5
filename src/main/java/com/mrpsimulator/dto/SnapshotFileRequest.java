package com.mrpsimulator.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class SnapshotFileRequest {
    @NotBlank(message = "path is required")
    String path;

    @Builder.Default
    boolean forceReload = false;
}
