package com.bistroAssist.queryDemo.context.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Conversation state kept between queries of one customer session.
 * 
 * Turns are appended under the session's monitor; readers receive copies.
 * Only the newest turns are stored, but {@link #getTurnCount()} counts every turn of the session.
 */
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ConversationSession {

    @Getter
    private final String sessionId;

    @Getter
    private final String businessId;

    @Getter
    private final String customerId;

    @Getter
    private final Instant startedAt;

    @Getter
    private volatile Instant lastActivityAt;

    @Getter
    private volatile Instant expiresAt;

    @Builder.Default
    private final List<ConversationTurn> turns = new ArrayList<>();

    private int turnCount;

    /**
     * Updates the last activity time and slides the expiry forward.
     */
    public synchronized void touch(Instant now, Duration idleTtl) {
        this.lastActivityAt = now;
        this.expiresAt = now.plus(idleTtl);
    }

    public synchronized void appendTurn(ConversationTurn turn, int maxTurns) {
        turns.add(turn);
        turnCount++;
        while (turns.size() > maxTurns) {
            turns.remove(0);
        }
    }

    /**
     * @return the last {@code limit} turns, oldest first
     */
    public synchronized List<ConversationTurn> recentTurns(int limit) {
        int from = Math.max(0, turns.size() - Math.max(0, limit));
        return List.copyOf(turns.subList(from, turns.size()));
    }

    public synchronized List<ConversationTurn> getTurns() {
        return List.copyOf(turns);
    }

    public synchronized int getTurnCount() {
        return turnCount;
    }
}
