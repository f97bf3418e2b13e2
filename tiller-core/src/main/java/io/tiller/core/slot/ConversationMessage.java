package io.tiller.core.slot;

import java.util.Objects;

/// One message of prior conversation offered to the extraction service as context.
///
/// @param role author of the message, not null
/// @param content message text, not null
public record ConversationMessage(Role role, String content) {

    /// Author of a conversation message.
    public enum Role {
        USER,
        ASSISTANT
    }

    public ConversationMessage {
        Objects.requireNonNull(role, "role must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    public static ConversationMessage user(String content) {
        return new ConversationMessage(Role.USER, content);
    }

    public static ConversationMessage assistant(String content) {
        return new ConversationMessage(Role.ASSISTANT, content);
    }
}
