package de.vzg.reposis.crossref.config;

import java.time.Clock;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(CrossrefProperties.class)
public class DepositConfiguration {

    // batch ids and timestamps are always UTC
    @Bean
    public Clock depositClock() {
        return Clock.systemUTC();
    }
}
