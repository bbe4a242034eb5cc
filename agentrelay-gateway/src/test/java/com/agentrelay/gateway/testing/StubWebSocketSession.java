package com.agentrelay.gateway.testing;

import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketMessage;
import org.springframework.web.socket.WebSocketSession;

import java.lang.reflect.Proxy;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Captures the text frames written to a {@link WebSocketSession}.
 */
public final class StubWebSocketSession {

    private final String id;
    private final List<String> sent = new CopyOnWriteArrayList<>();
    private volatile boolean open = true;
    private final WebSocketSession session;

    public StubWebSocketSession(String id) {
        this.id = id;
        this.session = (WebSocketSession) Proxy.newProxyInstance(
                WebSocketSession.class.getClassLoader(),
                new Class<?>[] { WebSocketSession.class },
                (proxy, method, args) -> switch (method.getName()) {
                    case "getId" -> this.id;
                    case "isOpen" -> open;
                    case "sendMessage" -> {
                        WebSocketMessage<?> message = (WebSocketMessage<?>) args[0];
                        if (message instanceof TextMessage text) {
                            sent.add(text.getPayload());
                        }
                        yield null;
                    }
                    case "close" -> {
                        open = false;
                        yield null;
                    }
                    case "hashCode" -> System.identityHashCode(proxy);
                    case "equals" -> proxy == args[0];
                    case "toString" -> "StubWebSocketSession[" + this.id + "]";
                    default -> throw new UnsupportedOperationException(method.getName());
                });
    }

    public WebSocketSession session() {
        return session;
    }

    public List<String> sent() {
        return sent;
    }

    public String lastSent() {
        if (sent.isEmpty()) {
            throw new AssertionError("nothing sent on " + id);
        }
        return sent.get(sent.size() - 1);
    }

    public void setOpen(boolean open) {
        this.open = open;
    }
}
