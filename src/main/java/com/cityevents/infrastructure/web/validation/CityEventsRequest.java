package com.cityevents.infrastructure.web.validation;

import jakarta.validation.constraints.NotBlank;

/**
 * Query parameters of {@code /city_events/} exactly as received, before validation.
 */
public record CityEventsRequest(
        @NotBlank(message = "field required")
        String apiKey,

        @NotBlank(message = "field required")
        String city,

        String postalCode,

        String searchId
) {}
