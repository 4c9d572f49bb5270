package com.ai.clinic.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties({ClinicProperties.class, GoogleCalendarProperties.class})
public class ClinicConfig {

    /** Single source of "now" for date resolution and upcoming-appointment queries. */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
