package com.cityevents.domain.model;

import java.util.Objects;
import java.util.Optional;

public record CityEventsQuery(
        String apiKey,
        String city,
        String postalCode,
        Long searchId
) {
    public CityEventsQuery {
        Objects.requireNonNull(apiKey, "apiKey");
        Objects.requireNonNull(city, "city");
    }

    public static CityEventsQuery of(String apiKey, String city) {
        return new CityEventsQuery(apiKey, city, null, null);
    }

    public Optional<String> postalCodeFilter() {
        return Optional.ofNullable(postalCode).filter(code -> !code.isBlank());
    }
}
