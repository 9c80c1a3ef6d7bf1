package com.cityevents.application;

import com.cityevents.domain.model.CityEventsQuery;
import com.cityevents.domain.model.DiscoveryResult;
import com.cityevents.domain.port.out.EventDiscoveryProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class CityEventsUseCase implements FindCityEvents {

    private static final Logger logger = LoggerFactory.getLogger(CityEventsUseCase.class);

    private final EventDiscoveryProvider discoveryProvider;

    public CityEventsUseCase(EventDiscoveryProvider discoveryProvider) {
        this.discoveryProvider = discoveryProvider;
    }

    @Override
    public DiscoveryResult execute(CityEventsQuery query) {
        logger.debug("Searching events in city '{}' (postal code: {})",
                query.city(), query.postalCodeFilter().orElse("-"));

        // Upstream failures propagate; the web layer turns them into a server error
        DiscoveryResult result = discoveryProvider.findCityEvents(query);

        if (result.isUnauthorized()) {
            logger.info("Provider rejected the API key for city '{}'", query.city());
        } else {
            logger.debug("Found {} events in city '{}'", result.events().size(), query.city());
        }
        return result;
    }
}
