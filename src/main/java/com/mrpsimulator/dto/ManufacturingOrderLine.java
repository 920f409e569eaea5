package com.mrpsimulator.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

// orderNumber and manufacturingOrderId are filled by the aggregator after sorting
@Value
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ManufacturingOrderLine {
    Integer orderNumber;
    String manufacturingOrderId;
    String article;
    String center;
    int routingSequence;
    double quantity;
    double requiredHours;
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    LocalDate dueDate;
    UrgencyStatus status;
    long daysRemaining;
    String orderRef;
    @JsonIgnore
    int sourceIndex;
}
