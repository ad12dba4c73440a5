package com.bistroAssist.queryDemo.context.store;

import com.bistroAssist.queryDemo.config.AssistantProperties;
import com.bistroAssist.queryDemo.context.model.ConversationSession;
import com.bistroAssist.queryDemo.context.model.ConversationTurn;
import com.bistroAssist.queryDemo.util.CustomerIdMasker;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Conversation store backed by a Caffeine cache.
 * 
 * Responsibilities:
 * - Get or create sessions per business
 * - Keep a bounded turn history per session
 * - Expire sessions after the configured idle time
 */
@Slf4j
@Service
public class InMemoryConversationStore implements ConversationStore {

    private final Cache<String, ConversationSession> sessionCache;
    private final Duration idleTtl;
    private final int maxStoredTurns;
    private final Clock clock;

    public InMemoryConversationStore(AssistantProperties properties, Clock clock) {
        AssistantProperties.Session settings = properties.getSession();
        this.idleTtl = settings.getIdleTtl();
        this.maxStoredTurns = Math.max(1, settings.getMaxStoredTurns());
        this.clock = clock;
        this.sessionCache = Caffeine.newBuilder()
                .expireAfterAccess(idleTtl)
                .maximumSize(settings.getMaxSessions())
                .removalListener((String key, ConversationSession session, RemovalCause cause) -> {
                    if (session != null) {
                        log.debug("Session removed - businessId: {}, sessionId: {}, cause: {}",
                                session.getBusinessId(), session.getSessionId(), cause);
                    }
                })
                .build();
    }

    @Override
    public ConversationSession getOrCreate(String businessId, String sessionId, String customerId) {
        String effectiveSessionId = sessionId != null && !sessionId.isBlank() ? sessionId : UUID.randomUUID().toString();
        Instant now = clock.instant();

        ConversationSession session = sessionCache.get(key(businessId, effectiveSessionId), k -> {
            log.info("Created new session - businessId: {}, sessionId: {}, customerId: {}",
                    businessId, effectiveSessionId, CustomerIdMasker.mask(customerId));
            return ConversationSession.builder()
                    .sessionId(effectiveSessionId)
                    .businessId(businessId)
                    .customerId(customerId)
                    .startedAt(now)
                    .lastActivityAt(now)
                    .expiresAt(now.plus(idleTtl))
                    .build();
        });
        session.touch(now, idleTtl);
        return session;
    }

    @Override
    public List<ConversationTurn> getHistory(String businessId, String sessionId, int limit) {
        if (sessionId == null) {
            return List.of();
        }
        ConversationSession session = sessionCache.getIfPresent(key(businessId, sessionId));
        return session != null ? session.recentTurns(limit) : List.of();
    }

    @Override
    public void appendTurn(String businessId, String sessionId, ConversationTurn turn) {
        ConversationSession session = sessionCache.getIfPresent(key(businessId, sessionId));
        if (session == null) {
            log.warn("Attempted to append turn to unknown session - businessId: {}, sessionId: {}", businessId, sessionId);
            return;
        }
        session.appendTurn(turn, maxStoredTurns);
        session.touch(clock.instant(), idleTtl);
    }

    private static String key(String businessId, String sessionId) {
        return businessId + ":" + sessionId;
    }
}
