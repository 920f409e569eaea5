package com.mrpsimulator.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class TableDataResponse {
    String table;
    int count;
    int returned;
    List<?> data;
}
