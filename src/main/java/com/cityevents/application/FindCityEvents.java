package com.cityevents.application;

import com.cityevents.domain.model.CityEventsQuery;
import com.cityevents.domain.model.DiscoveryResult;

/**
 * Interface for finding the events taking place in a city.
 * This interface defines a contract for querying events based on a validated city query.
 */
public interface FindCityEvents {

    /**
     * Executes a lookup for the given city, optionally narrowed by postal code.
     *
     * @param query The validated query, carrying the caller's API key.
     * @return The events found, or the provider's authorization fault.
     */
    DiscoveryResult execute(CityEventsQuery query);

}
