package com.cityevents.infrastructure.adapter.provider;

import com.cityevents.domain.model.CityEventsQuery;
import com.cityevents.domain.model.DiscoveryResult;
import com.cityevents.domain.port.out.EventDiscoveryProvider;
import com.cityevents.infrastructure.adapter.mapper.EventMapper;
import com.cityevents.infrastructure.adapter.provider.json.DiscoveryEventsJson;
import java.io.IOException;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import retrofit2.Response;

@Component
public class DiscoveryProviderClient implements EventDiscoveryProvider {

    private static final Logger logger = LoggerFactory.getLogger(DiscoveryProviderClient.class);
    private static final int UNAUTHORIZED = 401;

    private final DiscoveryApi discoveryApi;
    private final EventMapper eventMapper;

    public DiscoveryProviderClient(DiscoveryApi discoveryApi, EventMapper eventMapper) {
        this.discoveryApi = discoveryApi;
        this.eventMapper = eventMapper;
    }

    @Override
    public DiscoveryResult findCityEvents(CityEventsQuery query) {
        Response<DiscoveryEventsJson> response;
        try {
            logger.debug("Searching events for city '{}' via Retrofit", query.city());
            response = discoveryApi.searchEvents(
                    query.apiKey(),
                    query.city(),
                    query.postalCodeFilter().orElse(null)
            ).execute();
        } catch (IOException | RuntimeException e) {
            logger.error("Exception calling discovery provider: {}", e.getMessage());
            throw new UpstreamException("Failed to fetch events from discovery provider", e);
        }

        if (response.code() == UNAUTHORIZED) {
            logger.warn("Discovery provider answered 401 for city '{}'", query.city());
            return DiscoveryResult.unauthorized(readErrorBody(response));
        }

        if (!response.isSuccessful()) {
            logger.error("Discovery provider answered {} for city '{}'", response.code(), query.city());
            throw new UpstreamException("Discovery provider answered " + response.code(), response.code());
        }

        DiscoveryEventsJson body = response.body();
        if (body == null) {
            logger.warn("Empty response body from discovery provider");
        }
        return DiscoveryResult.found(eventMapper.mapToSummaries(body));
    }

    private String readErrorBody(Response<?> response) {
        try (ResponseBody errorBody = response.errorBody()) {
            return errorBody != null ? errorBody.string() : "";
        } catch (IOException e) {
            throw new UpstreamException("Failed to read fault body from discovery provider", e);
        }
    }
}
