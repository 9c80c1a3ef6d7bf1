package com.cityevents.infrastructure.web;

import com.cityevents.application.FindCityEvents;
import com.cityevents.domain.model.CityEventsQuery;
import com.cityevents.domain.model.DiscoveryResult;
import com.cityevents.domain.model.EventSummary;
import com.cityevents.infrastructure.adapter.provider.UpstreamException;
import com.cityevents.infrastructure.web.validation.CityEventsRequestValidator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.ArrayList;
import java.util.List;

import static org.hamcrest.Matchers.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(CityEventsController.class)
@Import(CityEventsRequestValidator.class)
class CityEventsControllerContractTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private FindCityEvents findCityEvents;

    @Test
    void shouldReturnEventsWhenValidRequest() throws Exception {
        // Given
        when(findCityEvents.execute(CityEventsQuery.of("key-123", "Berlin")))
                .thenReturn(DiscoveryResult.found(List.of(
                        new EventSummary("e1", "Concert in Berlin", "https://tm.example/e1"),
                        new EventSummary("e2", "Theater Show", "https://tm.example/e2")
                )));

        // When & Then
        mockMvc.perform(get("/city_events/?api_key=key-123&city=Berlin"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.links.self", is("http://localhost/city_events/?api_key=key-123&city=Berlin")))
                .andExpect(jsonPath("$.events", hasSize(2)))
                .andExpect(jsonPath("$.events[0].id", is("e1")))
                .andExpect(jsonPath("$.events[0].name", is("Concert in Berlin")))
                .andExpect(jsonPath("$.events[0].url", is("https://tm.example/e1")))
                .andExpect(jsonPath("$.events[1].id", is("e2")));
    }

    @Test
    void shouldEchoLiteralRequestUrlIncludingOptionalParameters() throws Exception {
        // Given
        when(findCityEvents.execute(any())).thenReturn(DiscoveryResult.found(List.of()));

        // When & Then
        mockMvc.perform(get("/city_events/?api_key=key-123&city=Berlin&postal_code=10115&search_id=42"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.links.self",
                        is("http://localhost/city_events/?api_key=key-123&city=Berlin&postal_code=10115&search_id=42")));

        verify(findCityEvents).execute(new CityEventsQuery("key-123", "Berlin", "10115", 42L));
    }

    @Test
    void shouldReturnEmptyEventsWhenNoneFound() throws Exception {
        // Given
        when(findCityEvents.execute(any())).thenReturn(DiscoveryResult.found(List.of()));

        // When & Then
        mockMvc.perform(get("/city_events/?api_key=key-123&city=Nowhere"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.events").isArray())
                .andExpect(jsonPath("$.events", hasSize(0)));
    }

    @Test
    void shouldOmitMissingNameAndUrl() throws Exception {
        // Given
        when(findCityEvents.execute(any()))
                .thenReturn(DiscoveryResult.found(List.of(new EventSummary("e3", null, null))));

        // When & Then
        mockMvc.perform(get("/city_events/?api_key=key-123&city=Berlin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.events[0].id", is("e3")))
                .andExpect(jsonPath("$.events[0].name").doesNotExist())
                .andExpect(jsonPath("$.events[0].url").doesNotExist());
    }

    @Test
    void shouldPassThroughUpstreamFaultOn401() throws Exception {
        // Given
        String fault = "{\"fault\":{\"faultstring\":\"Invalid ApiKey\",\"detail\":{\"errorcode\":\"oauth.v2.InvalidApiKey\"}}}";
        when(findCityEvents.execute(any())).thenReturn(DiscoveryResult.unauthorized(fault));

        // When & Then
        mockMvc.perform(get("/city_events/?api_key=bad-key&city=Berlin"))
                .andExpect(status().isUnauthorized())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(content().string(fault));
    }

    @Test
    void shouldReturnUnprocessableEntityWhenCityIsMissing() throws Exception {
        // When & Then
        mockMvc.perform(get("/city_events/?api_key=key-123"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail", hasSize(1)))
                .andExpect(jsonPath("$.detail[0].loc", contains("query", "city")))
                .andExpect(jsonPath("$.detail[0].msg", is("field required")))
                .andExpect(jsonPath("$.detail[0].type", is("value_error.missing")));

        verifyNoInteractions(findCityEvents);
    }

    @Test
    void shouldReturnUnprocessableEntityWhenApiKeyIsMissing() throws Exception {
        // When & Then
        mockMvc.perform(get("/city_events/?city=Berlin"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail[0].loc", contains("query", "api_key")))
                .andExpect(jsonPath("$.detail[0].msg", not(emptyString())));

        verifyNoInteractions(findCityEvents);
    }

    @Test
    void shouldReportEveryMissingParameter() throws Exception {
        // When & Then
        mockMvc.perform(get("/city_events/"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail", hasSize(2)))
                .andExpect(jsonPath("$.detail[0].loc[1]", is("api_key")))
                .andExpect(jsonPath("$.detail[1].loc[1]", is("city")));
    }

    @Test
    void shouldReturnUnprocessableEntityWhenSearchIdIsNotAnInteger() throws Exception {
        // When & Then
        mockMvc.perform(get("/city_events/?api_key=key-123&city=Berlin&search_id=abc"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.detail[0].loc", contains("query", "search_id")))
                .andExpect(jsonPath("$.detail[0].msg", is("value is not a valid integer")));

        verifyNoInteractions(findCityEvents);
    }

    @Test
    void shouldReturnInternalServerErrorWhenUpstreamFails() throws Exception {
        // Given
        when(findCityEvents.execute(any())).thenThrow(new UpstreamException("Discovery provider answered 503", 503));

        // When & Then
        mockMvc.perform(get("/city_events/?api_key=key-123&city=Berlin"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.detail[0].msg", is("Internal Server Error")));
    }

    @Test
    void shouldReturnInternalServerErrorOnUnexpectedException() throws Exception {
        // Given
        when(findCityEvents.execute(any())).thenThrow(new IllegalStateException("boom"));

        // When & Then
        mockMvc.perform(get("/city_events/?api_key=key-123&city=Berlin"))
                .andExpect(status().isInternalServerError())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.detail", hasSize(1)))
                .andExpect(jsonPath("$.detail[0].msg", is("Internal Server Error")));
    }

    @Test
    void shouldAcceptSearchIdBeyondNineDigits() throws Exception {
        // Given
        when(findCityEvents.execute(any())).thenReturn(DiscoveryResult.found(List.of()));

        // When & Then
        mockMvc.perform(get("/city_events/?api_key=key-123&city=Berlin&search_id=1234567890"))
                .andExpect(status().isOk());

        verify(findCityEvents).execute(new CityEventsQuery("key-123", "Berlin", null, 1234567890L));
    }

    @Test
    void shouldPassThroughUpstreamFaultWhenClientAcceptsPlainText() throws Exception {
        // Given
        String fault = "{\"fault\":{\"faultstring\":\"Invalid ApiKey\"}}";
        when(findCityEvents.execute(any())).thenReturn(DiscoveryResult.unauthorized(fault));

        // When & Then
        mockMvc.perform(get("/city_events/?api_key=bad-key&city=Berlin").accept(MediaType.TEXT_PLAIN))
                .andExpect(status().isUnauthorized())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(content().string(fault));
    }

    @Test
    void shouldAcceptPathWithoutTrailingSlash() throws Exception {
        // Given
        when(findCityEvents.execute(any())).thenReturn(DiscoveryResult.found(List.of()));

        // When & Then
        mockMvc.perform(get("/city_events?api_key=key-123&city=Berlin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.links.self", is("http://localhost/city_events?api_key=key-123&city=Berlin")));
    }

    @Test
    void shouldHandleSpecialCharactersInEventNames() throws Exception {
        // Given
        when(findCityEvents.execute(any())).thenReturn(DiscoveryResult.found(List.of(
                new EventSummary("e1", "Café & Music", null),
                new EventSummary("e2", "Rock 'n' Roll Night", null)
        )));

        // When & Then
        mockMvc.perform(get("/city_events/?api_key=key-123&city=Berlin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.events[0].name", is("Café & Music")))
                .andExpect(jsonPath("$.events[1].name", is("Rock 'n' Roll Night")));
    }

    @Test
    void shouldHandleLargeNumberOfEvents() throws Exception {
        // Given
        List<EventSummary> events = new ArrayList<>();
        for (int i = 1; i <= 100; i++) {
            events.add(new EventSummary("e" + i, "Event " + i, null));
        }
        when(findCityEvents.execute(any())).thenReturn(DiscoveryResult.found(events));

        // When & Then
        mockMvc.perform(get("/city_events/?api_key=key-123&city=Berlin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.events", hasSize(100)))
                .andExpect(jsonPath("$.events[99].id", is("e100")));
    }
}
