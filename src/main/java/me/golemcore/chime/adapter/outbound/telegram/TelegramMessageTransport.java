package me.golemcore.chime.adapter.outbound.telegram;

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

import me.golemcore.chime.domain.model.DeliveryResult;
import me.golemcore.chime.domain.model.FailureKind;
import me.golemcore.chime.infrastructure.config.ChimeProperties;
import me.golemcore.chime.port.outbound.MessageTransportPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.regex.Pattern;

/**
 * Telegram Bot API transport. Destinations are numeric chat ids (negative for
 * groups) or public {@code @username} handles.
 *
 * <p>
 * Content longer than the configured part length is split at paragraph or
 * line boundaries and sent as ordered parts. Delivery succeeds only when every
 * part was accepted.
 */
@Component
@Slf4j
public class TelegramMessageTransport implements MessageTransportPort {

    private static final String TRANSPORT_ID = "telegram";
    private static final Pattern CHAT_ID_PATTERN = Pattern.compile("-?\\d{1,20}");
    private static final Pattern USERNAME_PATTERN = Pattern.compile("@[A-Za-z][A-Za-z0-9_]{3,31}");
    private static final int HTTP_FORBIDDEN = 403;
    private static final int HTTP_TOO_MANY_REQUESTS = 429;
    private static final int MAX_RETRY_ATTEMPTS = 3;
    private static final int RETRY_AFTER_DEFAULT_SECONDS = 5;
    private static final int RETRY_AFTER_CAP_SECONDS = 30;

    private static final ExecutorService SEND_EXECUTOR = Executors.newFixedThreadPool(2,
            r -> {
                Thread t = new Thread(r, "chime-telegram-send");
                t.setDaemon(true);
                return t;
            });

    private final ChimeProperties properties;
    private volatile TelegramClient telegramClient;

    public TelegramMessageTransport(ChimeProperties properties) {
        this.properties = properties;
    }

    /**
     * Set the TelegramClient instance. Package-private for testing.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient = client;
    }

    @Override
    public String getTransportId() {
        return TRANSPORT_ID;
    }

    @Override
    public boolean isAvailable() {
        return getOrCreateClient() != null;
    }

    @Override
    public boolean isValidDestination(String destination) {
        if (destination == null) {
            return false;
        }
        String trimmed = destination.trim();
        return CHAT_ID_PATTERN.matcher(trimmed).matches() || USERNAME_PATTERN.matcher(trimmed).matches();
    }

    @Override
    public CompletableFuture<DeliveryResult> send(String destination, String content) {
        TelegramClient client = getOrCreateClient();
        if (client == null) {
            return CompletableFuture.completedFuture(
                    DeliveryResult.failed(FailureKind.TRANSPORT_ERROR, "Telegram transport is not configured"));
        }

        String chatId = destination.trim();
        return CompletableFuture.supplyAsync(() -> sendParts(client, chatId, content), SEND_EXECUTOR);
    }

    private DeliveryResult sendParts(TelegramClient client, String chatId, String content) {
        List<String> parts = splitAtNewlines(content, properties.getTelegram().getMaxPartLength());
        int sent = 0;
        for (String part : parts) {
            SendMessage message = SendMessage.builder()
                    .chatId(chatId)
                    .text(part)
                    .build();
            try {
                executeWithRetry(() -> client.execute(message));
                sent++;
            } catch (TelegramApiRequestException e) {
                return failure(chatId, parts.size(), sent, isForbidden(e) ? FailureKind.PERMISSION_DENIED
                        : FailureKind.TRANSPORT_ERROR, e);
            } catch (TelegramApiException e) {
                return failure(chatId, parts.size(), sent, FailureKind.TRANSPORT_ERROR, e);
            }
        }
        log.debug("[Telegram] Delivered {} part(s) to {}", sent, chatId);
        return DeliveryResult.delivered(sent);
    }

    private DeliveryResult failure(String chatId, int total, int sent, FailureKind kind, TelegramApiException e) {
        String detail = total > 1
                ? "Delivered " + sent + " of " + total + " parts: " + e.getMessage()
                : e.getMessage();
        log.warn("[Telegram] Failed to deliver to {} ({}): {}", chatId, kind, detail);
        return DeliveryResult.failed(kind, detail);
    }

    private TelegramClient getOrCreateClient() {
        TelegramClient client = this.telegramClient;
        if (client != null) {
            return client;
        }
        ChimeProperties.TelegramProperties telegram = properties.getTelegram();
        if (!telegram.isEnabled()) {
            return null;
        }
        String token = telegram.getToken();
        if (token == null || token.isBlank()) {
            return null;
        }
        synchronized (this) {
            if (this.telegramClient == null) {
                this.telegramClient = new OkHttpTelegramClient(token);
                log.debug("[Telegram] TelegramClient lazily initialized");
            }
            return this.telegramClient;
        }
    }

    // ===== Rate-limit retry logic =====

    @FunctionalInterface
    interface TelegramApiCall<T> {
        T execute() throws TelegramApiException;
    }

    <T> T executeWithRetry(TelegramApiCall<T> call) throws TelegramApiException {
        for (int attempt = 0;; attempt++) {
            try {
                return call.execute();
            } catch (TelegramApiRequestException e) {
                if (!isRateLimited(e) || attempt >= MAX_RETRY_ATTEMPTS) {
                    throw e;
                }
                int retryAfter = extractRetryAfterSeconds(e);
                log.warn("[Telegram] Rate limited (429), waiting {}s before retry (attempt {}/{})",
                        retryAfter, attempt + 1, MAX_RETRY_ATTEMPTS);
                sleepForRetry(retryAfter);
            }
        }
    }

    private static boolean isForbidden(TelegramApiRequestException e) {
        Integer errorCode = e.getErrorCode();
        return errorCode != null && errorCode == HTTP_FORBIDDEN;
    }

    private static boolean isRateLimited(TelegramApiRequestException e) {
        Integer errorCode = e.getErrorCode();
        return errorCode != null && errorCode == HTTP_TOO_MANY_REQUESTS;
    }

    static int extractRetryAfterSeconds(TelegramApiRequestException e) {
        if (e.getParameters() != null && e.getParameters().getRetryAfter() != null) {
            return Math.min(e.getParameters().getRetryAfter(), RETRY_AFTER_CAP_SECONDS);
        }
        return RETRY_AFTER_DEFAULT_SECONDS;
    }

    /**
     * Package-private for testing; tests override it to skip the wait.
     */
    void sleepForRetry(int seconds) {
        try {
            Thread.sleep(seconds * 1000L);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for rate limit", e);
        }
    }

    /**
     * Split text at paragraph (\n\n) or line (\n) boundaries to keep parts
     * under maxLength, falling back to a hard split.
     */
    static List<String> splitAtNewlines(String text, int maxLength) {
        if (text.length() <= maxLength) {
            return List.of(text);
        }

        List<String> chunks = new ArrayList<>();
        int start = 0;

        while (start < text.length()) {
            if (start + maxLength >= text.length()) {
                chunks.add(text.substring(start));
                break;
            }

            String segment = text.substring(start, start + maxLength);

            int splitAt = segment.lastIndexOf("\n\n");
            if (splitAt > maxLength / 4) {
                chunks.add(text.substring(start, start + splitAt));
                start += splitAt + 2;
                continue;
            }

            splitAt = segment.lastIndexOf('\n');
            if (splitAt > maxLength / 4) {
                chunks.add(text.substring(start, start + splitAt));
                start += splitAt + 1;
                continue;
            }

            chunks.add(text.substring(start, start + maxLength));
            start += maxLength;
        }

        return chunks;
    }
}
