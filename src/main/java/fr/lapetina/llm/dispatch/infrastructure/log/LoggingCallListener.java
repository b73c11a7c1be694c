package fr.lapetina.llm.dispatch.infrastructure.log;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.llm.dispatch.domain.event.ProviderCallEvent;
import fr.lapetina.llm.dispatch.domain.event.ProviderCallListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * Writes each provider call event as one JSON log line.
 *
 * Sets MDC context for structured logging:
 * - providerId
 * - requestId
 */
public final class LoggingCallListener implements ProviderCallListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingCallListener.class);

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    @Override
    public void onProviderCall(ProviderCallEvent event) {
        MDC.put("providerId", event.providerId());
        MDC.put("requestId", event.requestId());
        try {
            String json = toJson(event);
            if (event.isOk()) {
                log.info("provider_call {}", json);
            } else {
                log.warn("provider_call {}", json);
            }
        } finally {
            MDC.remove("providerId");
            MDC.remove("requestId");
        }
    }

    String toJson(ProviderCallEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.debug("Event serialization failed: providerId={}", event.providerId(), e);
            return event.toString();
        }
    }
}
