package com.providerhub.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.providerhub.providers.ChatRequest;
import com.providerhub.providers.ChatResponse;
import com.providerhub.providers.TokenUsage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.Supplier;

/**
 * Structured request/response events, one JSON object per line on the
 * {@code llm.traffic} logger. Emitting is best-effort and never throws.
 */
public class LlmTrafficLog {

    private static final Logger traffic = LoggerFactory.getLogger("llm.traffic");
    private static final Logger log = LoggerFactory.getLogger(LlmTrafficLog.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final int MAX_TEXT = 2000;

    public void started(String provider, String model, ChatRequest request) {
        emit(LlmTrafficEvent.STARTED, () -> event(LlmTrafficEvent.STARTED, provider, model, request,
                null, null, null, null, null));
    }

    public void success(String provider, String model, ChatRequest request, ChatResponse response,
                        long latencyMs, String fallbackFrom) {
        emit(LlmTrafficEvent.SUCCESS, () -> event(LlmTrafficEvent.SUCCESS, provider, model, request, latencyMs,
                response.usage(), response.content(), null, fallbackFrom));
    }

    public void streamComplete(String provider, String model, ChatRequest request,
                               long latencyMs, String responseText) {
        emit(LlmTrafficEvent.STREAM_COMPLETE, () -> event(LlmTrafficEvent.STREAM_COMPLETE, provider, model,
                request, latencyMs, null, responseText, null, null));
    }

    public void error(String provider, String model, ChatRequest request, long latencyMs, Throwable error) {
        emit(LlmTrafficEvent.ERROR, () -> event(LlmTrafficEvent.ERROR, provider, model, request, latencyMs,
                null, null, String.valueOf(error.getMessage()), null));
    }

    protected void publish(LlmTrafficEvent event) throws JsonProcessingException {
        if (LlmTrafficEvent.ERROR.equals(event.status())) {
            if (traffic.isWarnEnabled()) traffic.warn(render(event));
        } else if (traffic.isInfoEnabled()) {
            traffic.info(render(event));
        }
    }

    static String render(LlmTrafficEvent event) throws JsonProcessingException {
        return MAPPER.writeValueAsString(event);
    }

    private void emit(String status, Supplier<LlmTrafficEvent> event) {
        try {
            publish(event.get());
        } catch (Exception e) {
            log.debug("Failed to write traffic event {}: {}", status, e.getMessage());
        }
    }

    private static LlmTrafficEvent event(String status, String provider, String model, ChatRequest request,
                                         Long latencyMs, TokenUsage usage,
                                         String text, String error, String fallbackFrom) {
        return new LlmTrafficEvent(status, request.requestId(), request.userId(), request.sessionId(),
                provider, model, latencyMs, usage, request.messages().size(), truncate(text), error, fallbackFrom);
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= MAX_TEXT) return value;
        return value.substring(0, MAX_TEXT) + "...";
    }
}
