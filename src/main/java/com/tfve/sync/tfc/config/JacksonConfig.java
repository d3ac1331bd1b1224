package com.tfve.sync.tfc.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Central Jackson configuration for the application.
 *
 * <h2>Purpose</h2>
 * <ul>
 *   <li>Read output values without losing numeric precision: floats become {@code BigDecimal} and
 *       tree nodes keep decimals exactly as written.</li>
 *   <li>Write report timestamps as ISO-8601 strings.</li>
 *   <li>Provide a single {@link ObjectMapper} bean for the Spring context.</li>
 * </ul>
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();

        // java.time support for report timestamps.
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        // 1.2345 must stay 1.2345, and 1.50 must not become 1.5.
        mapper.enable(DeserializationFeature.USE_BIG_DECIMAL_FOR_FLOATS);
        mapper.setNodeFactory(JsonNodeFactory.withExactBigDecimals(true));

        return mapper;
    }
}
