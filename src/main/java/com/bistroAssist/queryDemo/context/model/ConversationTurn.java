package com.bistroAssist.queryDemo.context.model;

import com.bistroAssist.queryDemo.intent.model.QueryIntent;

import java.time.Instant;

/**
 * One message of a conversation. {@code intent} is set on user turns only.
 */
public record ConversationTurn(TurnRole role, String content, QueryIntent intent, Instant timestamp) {

    public static ConversationTurn user(String content, QueryIntent intent, Instant timestamp) {
        return new ConversationTurn(TurnRole.USER, content, intent, timestamp);
    }

    public static ConversationTurn assistant(String content, Instant timestamp) {
        return new ConversationTurn(TurnRole.ASSISTANT, content, null, timestamp);
    }
}
