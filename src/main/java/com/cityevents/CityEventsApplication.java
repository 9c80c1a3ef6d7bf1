package com.cityevents;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CityEventsApplication {

    public static void main(String[] args) {
        SpringApplication.run(CityEventsApplication.class, args);
    }
}
