package com.copyleft.CanvasSync.support;

import com.copyleft.CanvasSync.global.messaging.OutboundEventSender;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 세션별로 보낸 이벤트를 JSON 형태 그대로 기록한다
 */
public class RecordingEventSender implements OutboundEventSender {

    private final ObjectMapper objectMapper;
    private final List<Sent> sent = new ArrayList<>();

    public RecordingEventSender(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void sendEventToSession(String sessionId, Object event) {
        sent.add(new Sent(sessionId, objectMapper.valueToTree(event)));
    }

    public synchronized List<JsonNode> receivedBy(String sessionId) {
        return sent.stream()
                .filter(s -> s.sessionId().equals(sessionId))
                .map(Sent::message)
                .collect(Collectors.toList());
    }

    public synchronized List<JsonNode> receivedBy(String sessionId, String eventName) {
        return receivedBy(sessionId).stream()
                .filter(m -> eventName.equals(m.path("event").asText()))
                .collect(Collectors.toList());
    }

    public synchronized List<String> eventNames(String sessionId) {
        return receivedBy(sessionId).stream()
                .map(m -> m.path("event").asText())
                .collect(Collectors.toList());
    }

    public synchronized void clear() {
        sent.clear();
    }

    private record Sent(String sessionId, JsonNode message) {
    }
}
