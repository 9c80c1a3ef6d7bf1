package com.cityevents.infrastructure.config;

import com.cityevents.infrastructure.adapter.provider.DiscoveryApi;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import retrofit2.Retrofit;
import retrofit2.converter.jackson.JacksonConverterFactory;

@Configuration
public class RetrofitProviderConfig {

    @Bean
    public DiscoveryApi discoveryApi(DiscoveryProviderConfig config) {
        return createDiscoveryApi(config.getBaseUrl());
    }

    /**
     * Builds a Retrofit client for the given base URL. The URL must end with a slash.
     */
    public static DiscoveryApi createDiscoveryApi(String baseUrl) {
        ObjectMapper objectMapper = new ObjectMapper();
        objectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        Retrofit retrofit = new Retrofit.Builder()
                .baseUrl(baseUrl)
                .addConverterFactory(JacksonConverterFactory.create(objectMapper))
                .build();

        return retrofit.create(DiscoveryApi.class);
    }
}
