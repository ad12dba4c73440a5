package com.bistroAssist.queryDemo.context.store;

import com.bistroAssist.queryDemo.context.model.ConversationSession;
import com.bistroAssist.queryDemo.context.model.ConversationTurn;

import java.util.List;

/**
 * Conversation sessions keyed by business and session id.
 */
public interface ConversationStore {

    /**
     * Returns the live session, or creates one. A null or unknown session id starts a new session
     * (under the given id when one was supplied).
     */
    ConversationSession getOrCreate(String businessId, String sessionId, String customerId);

    /**
     * @return the last {@code limit} turns, oldest first; empty for unknown sessions
     */
    List<ConversationTurn> getHistory(String businessId, String sessionId, int limit);

    void appendTurn(String businessId, String sessionId, ConversationTurn turn);
}
