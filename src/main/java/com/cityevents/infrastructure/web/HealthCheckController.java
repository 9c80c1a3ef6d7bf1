package com.cityevents.infrastructure.web;

import com.cityevents.infrastructure.web.dto.HealthStatus;
import io.swagger.v3.oas.annotations.Hidden;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@Hidden
public class HealthCheckController {

    @GetMapping("/health_check")
    public HealthStatus healthCheck() {
        return HealthStatus.pass();
    }
}
