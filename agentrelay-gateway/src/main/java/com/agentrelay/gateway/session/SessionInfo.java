package com.agentrelay.gateway.session;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Registry entry for one conversation. Setters are package-private: outside the session
 * package it changes only through {@link SessionRegistry}.
 */
@Data
@Setter(AccessLevel.PACKAGE)
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SessionInfo {
    private String key;
    private String channel;
    private String conversationId;
    private String chatType;
    /** Internal id; names the transcript file. */
    private String sessionId;
    /** Backend's own session id, known after its first run. */
    private String continuationId;
    private int messageCount;
    private long createdAt;
    private long lastMessageAt;
    private volatile boolean activeRun;

    @JsonIgnore
    private volatile PendingApproval pendingApproval;

    @JsonIgnore
    private volatile PendingQuestion pendingQuestion;

    /**
     * Copy suitable for persisting: no run flag, no pending state.
     */
    SessionInfo snapshot() {
        return toBuilder().activeRun(false).pendingApproval(null).pendingQuestion(null).build();
    }
}
