package com.aceengine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class AceConfiguration {

    /** Single time source for receipts, journals, reports and learning data. */
    @Bean
    public Clock aceClock() {
        return Clock.systemUTC();
    }
}
