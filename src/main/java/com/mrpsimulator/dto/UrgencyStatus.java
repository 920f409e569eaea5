package com.mrpsimulator.dto;

public enum UrgencyStatus {
    URGENT,
    NORMAL
}
