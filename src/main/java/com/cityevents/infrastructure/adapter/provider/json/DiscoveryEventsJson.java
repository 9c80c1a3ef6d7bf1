package com.cityevents.infrastructure.adapter.provider.json;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Optional;

/**
 * Top level of the Discovery API event search payload.
 * The provider drops the whole {@code _embedded} object when a search matches nothing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DiscoveryEventsJson(
        @JsonProperty("_embedded")
        EmbeddedJson embedded
) {
    public Optional<List<EventJson>> events() {
        return Optional.ofNullable(embedded).map(EmbeddedJson::events);
    }
}
