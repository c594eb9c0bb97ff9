package me.golemcore.chime.adapter.outbound.llm;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import me.golemcore.chime.domain.model.ContentRequest;
import me.golemcore.chime.domain.model.MessageTone;
import me.golemcore.chime.infrastructure.config.ChimeProperties;
import me.golemcore.chime.port.outbound.ContentGeneratorPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Content generator backed by an OpenAI-compatible chat model through
 * langchain4j. The model is created on first use from {@code chime.content.*}
 * and is unavailable while no API key is configured.
 */
@Component
@Slf4j
public class Langchain4jContentGenerator implements ContentGeneratorPort {

    static final String SYSTEM_PROMPT = "You are a helpful assistant that generates text messages. "
            + "Always respond with just the message content, no quotes or additional text.";

    private final ChimeProperties properties;
    private volatile ChatModel chatModel;

    public Langchain4jContentGenerator(ChimeProperties properties) {
        this.properties = properties;
    }

    /**
     * Set the chat model. Package-private for testing.
     */
    void setChatModel(ChatModel chatModel) {
        this.chatModel = chatModel;
    }

    @Override
    public boolean isAvailable() {
        return getOrCreateModel() != null;
    }

    @Override
    public CompletableFuture<String> generate(ContentRequest request) {
        ChatModel model = getOrCreateModel();
        if (model == null) {
            return CompletableFuture.failedFuture(new IllegalStateException("Content generator not configured"));
        }

        return CompletableFuture.supplyAsync(() -> {
            List<ChatMessage> messages = List.of(
                    SystemMessage.from(SYSTEM_PROMPT),
                    UserMessage.from(buildPrompt(request)));
            ChatResponse response = model.chat(messages);
            String text = response != null && response.aiMessage() != null ? response.aiMessage().text() : null;
            if (text == null || text.isBlank()) {
                throw new IllegalStateException("No message generated");
            }
            String cleaned = stripQuotes(text.trim());
            log.debug("[ContentGen] Generated {} chars for {}", cleaned.length(), request.recipientName());
            return cleaned;
        });
    }

    static String buildPrompt(ContentRequest request) {
        String recipient = request.recipientName() != null && !request.recipientName().isBlank()
                ? request.recipientName().trim()
                : "a friend";
        int maxLength = request.maxLength();

        if (request.hasContext()) {
            return "Generate a text message to send to " + recipient + " based on this context: '"
                    + request.context().trim() + "'. Keep it under " + maxLength
                    + " characters. Make it relevant and appropriate.";
        }

        MessageTone tone = request.tone() != null ? request.tone() : MessageTone.FRIENDLY;
        return switch (tone) {
        case FRIENDLY -> "Generate a friendly, casual text message to send to " + recipient + ". Keep it under "
                + maxLength + " characters. Make it sound natural and personal.";
        case PROFESSIONAL -> "Generate a professional text message to send to " + recipient + ". Keep it under "
                + maxLength + " characters. Make it business-appropriate.";
        case FUNNY -> "Generate a funny or humorous text message to send to " + recipient + ". Keep it under "
                + maxLength + " characters. Make it lighthearted and entertaining.";
        case ROMANTIC -> "Generate a romantic text message to send to " + recipient + ". Keep it under "
                + maxLength + " characters. Make it sweet and affectionate.";
        case RANDOM -> "Generate a random text message to send to " + recipient + ". Keep it under "
                + maxLength + " characters. Make it engaging and appropriate.";
        };
    }

    private static String stripQuotes(String text) {
        if (text.length() >= 2 && text.startsWith("\"") && text.endsWith("\"")) {
            return text.substring(1, text.length() - 1).trim();
        }
        return text;
    }

    private ChatModel getOrCreateModel() {
        ChatModel model = this.chatModel;
        if (model != null) {
            return model;
        }
        ChimeProperties.ContentProperties content = properties.getContent();
        if (content.getApiKey() == null || content.getApiKey().isBlank()) {
            return null;
        }
        synchronized (this) {
            if (this.chatModel == null) {
                var builder = OpenAiChatModel.builder()
                        .apiKey(content.getApiKey())
                        .modelName(content.getModel())
                        .maxRetries(0)
                        .timeout(content.getTimeout())
                        .temperature(content.getTemperature());
                if (content.getBaseUrl() != null && !content.getBaseUrl().isBlank()) {
                    builder.baseUrl(content.getBaseUrl());
                }
                this.chatModel = builder.build();
                log.info("[ContentGen] Initialized chat model {}", content.getModel());
            }
            return this.chatModel;
        }
    }
}
