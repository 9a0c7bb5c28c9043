package com.tomeqa.index.status;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Logs every status event and pushes it to all connected Server-Sent-Events subscribers.
 */
@Service
@Slf4j
public class SseStatusSink implements StatusSink {

    private final CopyOnWriteArrayList<SseEmitter> emitters = new CopyOnWriteArrayList<>();

    public SseEmitter subscribe() {
        SseEmitter emitter = new SseEmitter(Long.MAX_VALUE);
        emitters.add(emitter);

        emitter.onCompletion(() -> emitters.remove(emitter));
        emitter.onTimeout(() -> emitters.remove(emitter));
        emitter.onError(e -> emitters.remove(emitter));

        try {
            emitter.send(SseEmitter.event()
                    .name("connected")
                    .data(Map.of("message", "Subscribed to index status events")));
        } catch (IOException e) {
            log.warn("[STATUS] Failed to send initial SSE event: {}", e.getMessage());
        }
        return emitter;
    }

    @Override
    public void emit(String eventType, Map<String, Object> data) {
        if (eventType.endsWith("failed") || eventType.endsWith("error")) {
            log.warn("[STATUS] {} {}", eventType, data);
        } else {
            log.info("[STATUS] {} {}", eventType, data);
        }

        Map<String, Object> event = new LinkedHashMap<>(data);
        event.put("type", eventType);
        event.put("timestamp", Instant.now().toString());

        for (SseEmitter emitter : emitters) {
            try {
                emitter.send(SseEmitter.event().name(eventType).data(event));
            } catch (IOException | IllegalStateException e) {
                log.debug("[STATUS] Removing disconnected SSE emitter: {}", e.getMessage());
                emitters.remove(emitter);
                safeComplete(emitter);
            }
        }
    }

    public int subscriberCount() {
        return emitters.size();
    }

    private void safeComplete(SseEmitter emitter) {
        try {
            emitter.complete();
        } catch (IllegalStateException e) {
            log.trace("[STATUS] Emitter already closed: {}", e.getMessage());
        }
    }
}
