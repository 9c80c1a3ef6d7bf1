package com.cityevents.infrastructure.adapter.mapper;

import com.cityevents.domain.model.EventSummary;
import com.cityevents.infrastructure.adapter.provider.json.DiscoveryEventsJson;
import com.cityevents.infrastructure.adapter.provider.json.EventJson;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class EventMapper {

    private static final Logger logger = LoggerFactory.getLogger(EventMapper.class);

    /**
     * Maps the provider payload to event summaries, keeping the provider's order.
     * An absent {@code _embedded.events} collection maps to an empty list.
     */
    public List<EventSummary> mapToSummaries(DiscoveryEventsJson payload) {
        if (payload == null) {
            return List.of();
        }
        return payload.events()
                .map(events -> events.stream()
                        .map(this::mapToSummary)
                        .filter(Objects::nonNull)
                        .toList())
                .orElseGet(() -> {
                    logger.debug("No embedded events in provider payload");
                    return List.of();
                });
    }

    /**
     * Maps a single provider event, keeping only id, name and url
     */
    private EventSummary mapToSummary(EventJson event) {
        if (event == null || event.id() == null) {
            logger.warn("Skipping provider event without id: {}", event);
            return null;
        }
        return new EventSummary(event.id(), event.name(), event.url());
    }
}
