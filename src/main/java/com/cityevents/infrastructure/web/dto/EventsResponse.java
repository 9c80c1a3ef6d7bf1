package com.cityevents.infrastructure.web.dto;

import com.cityevents.domain.model.EventSummary;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.util.List;

public record EventsResponse(
        Links links,
        List<EventDto> events
) {
    public static EventsResponse fromEvents(String selfUrl, List<EventSummary> events) {
        var eventDtos = events.stream()
                .map(EventDto::fromEvent)
                .toList();

        return new EventsResponse(new Links(selfUrl), eventDtos);
    }

    public record Links(
            String self
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record EventDto(
            String id,
            String name,
            String url
    ) {
        public static EventDto fromEvent(EventSummary event) {
            return new EventDto(
                    event.id(),
                    event.name(),
                    event.url()
            );
        }
    }
}
