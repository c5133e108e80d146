package com.rms.relay.app.admin;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * The one {@link ObjectMapper} shared by every JSON path of the relay.
 *
 * <h2>Users</h2>
 * <ul>
 *   <li>Local bus payloads and service calls ({@code NatsLocalBus}).</li>
 *   <li>Cloud envelopes, desired state and command replies ({@code NatsCloudChannel}).</li>
 *   <li>The relay-state file ({@code FileRelayStateStore}).</li>
 *   <li>Admin responses ({@link RelayAdminController}), where {@code boundAt}
 *       is an {@link java.time.Instant}.</li>
 * </ul>
 *
 * <h2>Settings</h2>
 * <ul>
 *   <li>{@link JavaTimeModule} with ISO-8601 text instead of numeric timestamps.</li>
 *   <li>Unknown properties are ignored, so newer cloud documents still parse.</li>
 * </ul>
 */
@Configuration
public class JacksonConfig {

    @Bean
    @Primary
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
