package com.shelterops.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.ZoneId;

@Configuration
public class BusinessTimeConfig {

    // Zone used when a request names none
    @Bean
    public ZoneId businessZoneId(@Value("${app.business.zone:America/New_York}") String zone) {
        return ZoneId.of(zone);
    }
}
