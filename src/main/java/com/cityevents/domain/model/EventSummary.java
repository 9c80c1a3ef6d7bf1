package com.cityevents.domain.model;

/**
 * Simplified projection of an upstream event.
 * Only {@code id} is guaranteed; {@code name} and {@code url} are null when the provider omits them.
 */
public record EventSummary(
        String id,
        String name,
        String url
) {}
