package com.cityevents.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a single discovery lookup.
 * Either a list of events, or the provider's own fault body when it rejected the API key.
 */
public record DiscoveryResult(
        List<EventSummary> events,
        String faultBody
) {
    public static DiscoveryResult found(List<EventSummary> events) {
        return new DiscoveryResult(List.copyOf(Objects.requireNonNull(events)), null);
    }

    public static DiscoveryResult unauthorized(String faultBody) {
        return new DiscoveryResult(List.of(), faultBody == null ? "" : faultBody);
    }

    public boolean isUnauthorized() {
        return faultBody != null;
    }
}
