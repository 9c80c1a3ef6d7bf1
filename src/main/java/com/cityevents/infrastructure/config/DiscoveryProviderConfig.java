package com.cityevents.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Connection settings for the events discovery provider
 */
@Component
@ConfigurationProperties(prefix = "city-events.discovery")
public class DiscoveryProviderConfig {

    private String baseUrl = "https://app.ticketmaster.com/";

    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

}
