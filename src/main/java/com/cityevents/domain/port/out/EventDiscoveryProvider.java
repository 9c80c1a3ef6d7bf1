package com.cityevents.domain.port.out;

import com.cityevents.domain.model.CityEventsQuery;
import com.cityevents.domain.model.DiscoveryResult;

/**
 * Port for looking up events in an external discovery provider.
 * Domain doesn't care about HTTP, JSON, Retrofit, etc.
 */
public interface EventDiscoveryProvider {

    /**
     * Fetch the events the provider lists for the query's city (and postal code, when given).
     *
     * @return the mapped events, or an authorization fault carrying the provider's body verbatim
     * @throws RuntimeException when the provider fails for any other reason
     */
    DiscoveryResult findCityEvents(CityEventsQuery query);
}
