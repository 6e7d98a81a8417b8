package com.fieldreport.impound.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;

import java.util.TimeZone;

/**
 * JSON settings of the REST API, applied to Boot's ObjectMapper (also used by the SMS client).
 * Instants are written as ISO-8601 UTC strings.
 */
@Configuration
public class JacksonConfig {

    @Bean
    public Jackson2ObjectMapperBuilderCustomizer impoundJsonCustomizer() {
        return JacksonConfig::customize;
    }

    static void customize(Jackson2ObjectMapperBuilder builder) {
        builder.modulesToInstall(new JavaTimeModule())
                .featuresToDisable(
                        SerializationFeature.WRITE_DATES_AS_TIMESTAMPS,
                        // forms from older clients carry extra fields
                        DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES,
                        // a box count of 2.7 is rejected, not truncated to 2
                        DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                .timeZone(TimeZone.getTimeZone("UTC"));
    }

    /**
     * Mapper with the same settings, for use outside the application context.
     */
    public static ObjectMapper apiObjectMapper() {
        Jackson2ObjectMapperBuilder builder = Jackson2ObjectMapperBuilder.json();
        customize(builder);
        return builder.build();
    }
}
