package com.insightframe.api.conversation;

import com.insightframe.api.journal.Experience;

import java.util.List;
import java.util.Map;

/**
 * 会话能力的输入
 */
public record ConversationQuery(String query,
                                Map<String, Object> context,
                                List<Experience> userHistory,
                                Map<String, Object> preferences) {

    public ConversationQuery {
        query = query == null ? "" : query;
        context = context == null ? Map.of() : Map.copyOf(context);
        userHistory = userHistory == null ? List.of() : List.copyOf(userHistory);
        preferences = preferences == null ? Map.of() : Map.copyOf(preferences);
    }

    public static ConversationQuery of(String query) {
        return new ConversationQuery(query, Map.of(), List.of(), Map.of());
    }
}
