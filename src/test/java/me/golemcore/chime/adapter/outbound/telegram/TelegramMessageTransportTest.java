package me.golemcore.chime.adapter.outbound.telegram;

import me.golemcore.chime.domain.model.DeliveryResult;
import me.golemcore.chime.domain.model.FailureKind;
import me.golemcore.chime.infrastructure.config.ChimeProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.ResponseParameters;
import org.telegram.telegrambots.meta.api.objects.message.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.doNothing;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class TelegramMessageTransportTest {

    private static final String CHAT_ID = "123456";

    private ChimeProperties properties;
    private TelegramClient telegramClient;
    private TelegramMessageTransport transport;

    @BeforeEach
    void setUp() throws Exception {
        properties = new ChimeProperties();
        properties.getTelegram().setEnabled(true);
        properties.getTelegram().setToken("test-token");

        telegramClient = mock(TelegramClient.class);
        when(telegramClient.execute(any(SendMessage.class))).thenReturn(mock(Message.class));

        transport = spy(new TelegramMessageTransport(properties));
        doNothing().when(transport).sleepForRetry(anyInt());
        transport.setTelegramClient(telegramClient);
    }

    // ===== availability / destinations =====

    @Test
    void shouldBeAvailableWhenClientSet() {
        assertTrue(transport.isAvailable());
        assertEquals("telegram", transport.getTransportId());
    }

    @Test
    void shouldNotBeAvailableWhenDisabled() {
        ChimeProperties disabled = new ChimeProperties();
        disabled.getTelegram().setEnabled(false);
        disabled.getTelegram().setToken("test-token");

        assertFalse(new TelegramMessageTransport(disabled).isAvailable());
    }

    @Test
    void shouldNotBeAvailableWhenTokenBlank() {
        ChimeProperties blankToken = new ChimeProperties();
        blankToken.getTelegram().setEnabled(true);
        blankToken.getTelegram().setToken("   ");

        assertFalse(new TelegramMessageTransport(blankToken).isAvailable());
    }

    @Test
    void shouldAcceptChatIdsAndUsernames() {
        assertTrue(transport.isValidDestination("123456"));
        assertTrue(transport.isValidDestination("-1001234567890"));
        assertTrue(transport.isValidDestination(" @alice_bot "));
    }

    @Test
    void shouldRejectMalformedDestinations() {
        assertFalse(transport.isValidDestination(null));
        assertFalse(transport.isValidDestination(""));
        assertFalse(transport.isValidDestination("+1 555 0100"));
        assertFalse(transport.isValidDestination("@ab"));
        assertFalse(transport.isValidDestination("alice"));
    }

    // ===== send =====

    @Test
    void shouldSendShortMessageAsSinglePart() throws Exception {
        DeliveryResult result = transport.send(CHAT_ID, "Good morning").get();

        assertTrue(result.delivered());
        assertEquals(1, result.parts());
        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(telegramClient).execute(captor.capture());
        assertEquals(CHAT_ID, captor.getValue().getChatId());
        assertEquals("Good morning", captor.getValue().getText());
    }

    @Test
    void shouldSendOnDedicatedThreadInsteadOfCommonPool() throws Exception {
        AtomicReference<String> sendingThread = new AtomicReference<>();
        when(telegramClient.execute(any(SendMessage.class))).thenAnswer(invocation -> {
            sendingThread.set(Thread.currentThread().getName());
            return mock(Message.class);
        });

        transport.send(CHAT_ID, "Good morning").get();

        assertEquals("chime-telegram-send", sendingThread.get());
    }

    @Test
    void shouldSendOversizedMessageAsOrderedParts() throws Exception {
        properties.getTelegram().setMaxPartLength(20);

        DeliveryResult result = transport.send(CHAT_ID, "First paragraph\n\nSecond paragraph").get();

        assertTrue(result.delivered());
        assertEquals(2, result.parts());
        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(telegramClient, times(2)).execute(captor.capture());
        assertEquals("First paragraph", captor.getAllValues().get(0).getText());
        assertEquals("Second paragraph", captor.getAllValues().get(1).getText());
    }

    @Test
    void shouldReportPermissionDeniedWhenBotBlocked() throws Exception {
        TelegramApiRequestException forbidden = requestException(403, "Forbidden: bot was blocked by the user");
        when(telegramClient.execute(any(SendMessage.class))).thenThrow(forbidden);

        DeliveryResult result = transport.send(CHAT_ID, "Good morning").get();

        assertFalse(result.delivered());
        assertEquals(FailureKind.PERMISSION_DENIED, result.failureKind());
    }

    @Test
    void shouldReportTransportErrorForNetworkFailure() throws Exception {
        when(telegramClient.execute(any(SendMessage.class))).thenThrow(new TelegramApiException("timeout"));

        DeliveryResult result = transport.send(CHAT_ID, "Good morning").get();

        assertEquals(FailureKind.TRANSPORT_ERROR, result.failureKind());
    }

    @Test
    void shouldReportPartialDeliveryAsFailure() throws Exception {
        properties.getTelegram().setMaxPartLength(20);
        when(telegramClient.execute(any(SendMessage.class)))
                .thenReturn(mock(Message.class))
                .thenThrow(new TelegramApiException("connection reset"));

        DeliveryResult result = transport.send(CHAT_ID, "First paragraph\n\nSecond paragraph").get();

        assertFalse(result.delivered());
        assertEquals(FailureKind.TRANSPORT_ERROR, result.failureKind());
        assertTrue(result.error().startsWith("Delivered 1 of 2 parts"));
    }

    @Test
    void shouldReportNotConfiguredWithoutClient() throws Exception {
        ChimeProperties disabled = new ChimeProperties();

        DeliveryResult result = new TelegramMessageTransport(disabled).send(CHAT_ID, "Good morning").get();

        assertEquals(FailureKind.TRANSPORT_ERROR, result.failureKind());
        assertTrue(result.error().contains("not configured"));
    }

    // ===== rate limits =====

    @Test
    void shouldRetryOn429AndSucceed() throws Exception {
        TelegramApiRequestException rateLimited = rateLimitException(5);
        when(telegramClient.execute(any(SendMessage.class)))
                .thenThrow(rateLimited)
                .thenReturn(mock(Message.class));

        DeliveryResult result = transport.send(CHAT_ID, "Good morning").get();

        assertTrue(result.delivered());
        verify(telegramClient, times(2)).execute(any(SendMessage.class));
        verify(transport).sleepForRetry(5);
    }

    @Test
    void shouldGiveUpAfterMaxRetries() throws Exception {
        TelegramApiRequestException rateLimited = rateLimitException(1);
        when(telegramClient.execute(any(SendMessage.class))).thenThrow(rateLimited);

        DeliveryResult result = transport.send(CHAT_ID, "Good morning").get();

        assertEquals(FailureKind.TRANSPORT_ERROR, result.failureKind());
        verify(telegramClient, times(4)).execute(any(SendMessage.class));
    }

    @Test
    void shouldCapRetryAfter() {
        assertEquals(30, TelegramMessageTransport.extractRetryAfterSeconds(rateLimitException(600)));
    }

    // ===== splitting =====

    @Test
    void shouldNotSplitShortText() {
        assertEquals(List.of("short"), TelegramMessageTransport.splitAtNewlines("short", 100));
    }

    @Test
    void shouldSplitAtLineBreakWhenNoParagraph() {
        List<String> parts = TelegramMessageTransport.splitAtNewlines("line one here\nline two here", 20);

        assertEquals(List.of("line one here", "line two here"), parts);
    }

    @Test
    void shouldHardSplitTextWithoutNewlines() {
        List<String> parts = TelegramMessageTransport.splitAtNewlines("a".repeat(25), 10);

        assertEquals(3, parts.size());
        assertEquals("a".repeat(10), parts.get(0));
        assertEquals("a".repeat(5), parts.get(2));
    }

    private static TelegramApiRequestException requestException(int code, String message) {
        TelegramApiRequestException ex = mock(TelegramApiRequestException.class);
        when(ex.getErrorCode()).thenReturn(code);
        when(ex.getMessage()).thenReturn("[" + code + "] " + message);
        return ex;
    }

    private static TelegramApiRequestException rateLimitException(int retryAfterSeconds) {
        TelegramApiRequestException ex = requestException(429, "Too Many Requests: retry after " + retryAfterSeconds);
        ResponseParameters params = new ResponseParameters(null, retryAfterSeconds);
        when(ex.getParameters()).thenReturn(params);
        return ex;
    }
}
