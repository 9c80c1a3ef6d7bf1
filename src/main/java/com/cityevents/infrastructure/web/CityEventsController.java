package com.cityevents.infrastructure.web;

import com.cityevents.application.FindCityEvents;
import com.cityevents.infrastructure.web.dto.ErrorResponse;
import com.cityevents.infrastructure.web.dto.EventsResponse;
import com.cityevents.infrastructure.web.validation.CityEventsRequest;
import com.cityevents.infrastructure.web.validation.CityEventsRequestValidator;
import com.cityevents.infrastructure.web.validation.ValidationResult;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Tag(name = "City events")
public class CityEventsController {

    private static final Logger logger = LoggerFactory.getLogger(CityEventsController.class);

    private final FindCityEvents findCityEvents;
    private final CityEventsRequestValidator requestValidator;

    public CityEventsController(FindCityEvents findCityEvents, CityEventsRequestValidator requestValidator) {
        this.findCityEvents = findCityEvents;
        this.requestValidator = requestValidator;
    }

    @GetMapping({"/city_events/", "/city_events"})
    @Operation(summary = "Get the details of the events taking place in a particular city")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Events found in the city",
                    content = @Content(schema = @Schema(implementation = EventsResponse.class))),
            @ApiResponse(responseCode = "401", description = "Invalid APIKey",
                    content = @Content(mediaType = MediaType.APPLICATION_JSON_VALUE)),
            @ApiResponse(responseCode = "422", description = "Validation Error",
                    content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
    })
    public ResponseEntity<Object> getCityEvents(
            @Parameter(description = "Ticketmaster API key. This key is passed directly to Ticketmaster")
            @RequestParam(name = "api_key", required = false)
            String apiKey,

            @Parameter(description = "City in which the events are to be found out")
            @RequestParam(name = "city", required = false)
            String city,

            @Parameter(description = "Postal code of the area where the events are to be found out")
            @RequestParam(name = "postal_code", required = false)
            String postalCode,

            @Parameter(description = "Identifier of the search, echoed in the service logs")
            @RequestParam(name = "search_id", required = false)
            String searchId,

            HttpServletRequest request
    ) {
        ValidationResult validation = requestValidator.validate(
                new CityEventsRequest(apiKey, city, postalCode, searchId));

        if (!validation.isValid()) {
            logger.warn("Rejected city events request: {}", validation.errors());
            return ResponseEntity.unprocessableEntity()
                    .body(toErrorResponse(validation.errors()));
        }

        logger.info("Searching events in city '{}'", validation.query().city());
        var result = findCityEvents.execute(validation.query());

        if (result.isUnauthorized()) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(result.faultBody());
        }

        var response = EventsResponse.fromEvents(requestUrl(request), result.events());
        logger.info("Found {} events", response.events().size());
        return ResponseEntity.ok(response);
    }

    private ErrorResponse toErrorResponse(List<ValidationResult.ParameterError> errors) {
        return new ErrorResponse(errors.stream()
                .map(error -> new ErrorResponse.ErrorDetail(
                        List.of("query", error.parameter()), error.message(), error.type()))
                .toList());
    }

    private String requestUrl(HttpServletRequest request) {
        String queryString = request.getQueryString();
        if (queryString == null || queryString.isBlank()) {
            return request.getRequestURL().toString();
        }
        return request.getRequestURL() + "?" + queryString;
    }
}
