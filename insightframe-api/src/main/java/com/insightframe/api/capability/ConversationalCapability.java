package com.insightframe.api.capability;

import com.insightframe.api.conversation.ConversationQuery;
import com.insightframe.api.conversation.ConversationResponse;

/**
 * 会话能力
 */
public record ConversationalCapability(String id, String name, String description, Responder responder)
        implements PluginCapability {

    @Override
    public CapabilityKind kind() {
        return CapabilityKind.CONVERSATIONAL;
    }

    public ConversationResponse process(ConversationQuery query) throws Exception {
        return responder.process(query);
    }

    @FunctionalInterface
    public interface Responder {
        ConversationResponse process(ConversationQuery query) throws Exception;
    }
}
