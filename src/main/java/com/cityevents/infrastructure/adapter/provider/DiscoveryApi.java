package com.cityevents.infrastructure.adapter.provider;

import com.cityevents.infrastructure.adapter.provider.json.DiscoveryEventsJson;
import retrofit2.Call;
import retrofit2.http.GET;
import retrofit2.http.Query;

/**
 * Interface representing the Ticketmaster Discovery API.
 * This interface defines the contract for interacting with the external API to search events.
 */
public interface DiscoveryApi {

    /**
     * Searches events by city, and by postal code when one is given.
     * Retrofit leaves out query parameters whose value is null, so a null {@code postalCode}
     * produces no {@code postalCode} parameter at all.
     *
     * @param apiKey     the caller's API key, passed through as-is
     * @param city       the city to search in
     * @param postalCode the postal code to narrow the search to, or null
     * @return A `Call` object encapsulating the HTTP request and response for the search.
     */
    @GET("discovery/v2/events.json")
    Call<DiscoveryEventsJson> searchEvents(
            @Query("apikey") String apiKey,
            @Query("city") String city,
            @Query("postalCode") String postalCode
    );
}
