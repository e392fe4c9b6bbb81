package com.insightframe.api.conversation;

import java.util.List;

public record ConversationResponse(String response,
                                   double confidence,
                                   List<String> suggestions,
                                   List<String> followUpQuestions) {

    public ConversationResponse {
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        followUpQuestions = followUpQuestions == null ? List.of() : List.copyOf(followUpQuestions);
    }

    public ConversationResponse(String response, double confidence) {
        this(response, confidence, List.of(), List.of());
    }
}
