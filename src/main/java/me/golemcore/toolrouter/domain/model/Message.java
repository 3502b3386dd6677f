package me.golemcore.toolrouter.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A single message in an LLM conversation.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    private String role; // user, assistant, system
    private String content;

    public static Message user(String content) {
        return Message.builder().role("user").content(content).build();
    }

    public boolean isUserMessage() {
        return "user".equals(role);
    }

    public boolean isSystemMessage() {
        return "system".equals(role);
    }
}
