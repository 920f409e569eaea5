package com.mrpsimulator.dto;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class UnitFailure {
    int orderIndex;
    String article;
    String message;
}
