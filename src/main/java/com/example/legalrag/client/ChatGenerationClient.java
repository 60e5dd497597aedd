package com.example.legalrag.client;

import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.prompt.ChatOptions;
import org.springframework.stereotype.Component;

/**
 * Thin wrapper over the configured chat model: one system instruction, one user message, one reply.
 */
@Slf4j
@Component
public class ChatGenerationClient {

    private final ChatClient chatClient;

    public ChatGenerationClient(ChatClient.Builder chatClient) {
        this.chatClient = chatClient.build();
    }

    public String generate(String systemInstruction, String userMessage, double temperature) {
        String content = chatClient.prompt()
            .system(systemInstruction)
            .user(userMessage)
            .options(ChatOptions.builder().temperature(temperature).build())
            .call()
            .content();
        if (content == null) {
            log.warn("Chat model returned no content");
            return "";
        }
        return content.trim();
    }
}
