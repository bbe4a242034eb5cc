package com.agentrelay.gateway.websocket;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Frames of the control protocol.
 *
 * <ul>
 * <li>Request: {id, method, params?}</li>
 * <li>Response: {id, result} or {id, error}</li>
 * <li>Event: {event, data}</li>
 * </ul>
 */
public final class ProtocolFrames {

    private ProtocolFrames() {
    }

    public static final class ErrorCodes {
        public static final String INVALID_REQUEST = "INVALID_REQUEST";
        public static final String NOT_FOUND = "NOT_FOUND";
        public static final String UNAVAILABLE = "UNAVAILABLE";

        private ErrorCodes() {
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ErrorShape {
        private String code;
        private String message;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ResponseFrame {
        private String id;
        private Object result;
        private ErrorShape error;

        public static ResponseFrame success(String id, Object result) {
            return new ResponseFrame(id, result != null ? result : Map.of(), null);
        }

        public static ResponseFrame failure(String id, String code, String message) {
            return new ResponseFrame(id, null, new ErrorShape(code, message));
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class EventFrame {
        private String event;
        private Object data;

        public static EventFrame of(String event, Object data) {
            return new EventFrame(event, data);
        }
    }
}
