package com.cityevents.infrastructure.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    OpenAPI apiInfo() {
        return new OpenAPI()
                .info(new Info()
                        .title("City Events Service")
                        .version("1.0.0")
                        .description("Stateless service that provides events listed in Ticketmaster, "
                                + "filtered on the basis of city and other parameters"))
                .servers(List.of(new Server().url("/")));
    }
}
