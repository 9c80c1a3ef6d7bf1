package com.cityevents.infrastructure.web.dto;

public record HealthStatus(
        String status
) {
    public static HealthStatus pass() {
        return new HealthStatus("pass");
    }
}
