package com.planttracker.backend.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Mapper for the import API: job progress and summaries carry {@code OffsetDateTime} start and
 * end times, and the rows pending in conflicts carry {@code LocalDate} care dates.
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());

        // Pollers compare job times as ISO strings, e.g. 2025-06-15T10:00:00Z
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        // Clients send the whole import options form; keys this version does not know are dropped
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        return mapper;
    }
}
