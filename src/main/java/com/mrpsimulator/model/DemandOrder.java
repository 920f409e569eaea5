package com.mrpsimulator.model;

import com.fasterxml.jackson.annotation.JsonFormat;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.LocalDate;

@Value
@Builder
@Jacksonized
public class DemandOrder {
    String orderRef;

    @NotBlank(message = "article is required")
    String article;

    @DecimalMin(value = "0.0", message = "quantity must be >= 0")
    double quantity;

    @NotNull(message = "dueDate is required")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    LocalDate dueDate;
}
