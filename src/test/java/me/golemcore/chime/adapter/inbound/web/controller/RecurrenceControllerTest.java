package me.golemcore.chime.adapter.inbound.web.controller;

import me.golemcore.chime.domain.model.ContentSource;
import me.golemcore.chime.domain.model.FiringOutcome;
import me.golemcore.chime.domain.model.Frequency;
import me.golemcore.chime.domain.model.MessagePayload;
import me.golemcore.chime.domain.model.MessageTone;
import me.golemcore.chime.domain.model.PeriodUnit;
import me.golemcore.chime.domain.model.RecurrenceDefinition;
import me.golemcore.chime.domain.model.ScheduledLink;
import me.golemcore.chime.domain.service.RecurrenceService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RecurrenceControllerTest {

    private static final String ID = "rec-00000001";
    private static final Instant CREATED = Instant.parse("2026-05-01T10:00:00Z");

    private RecurrenceService recurrenceService;
    private RecurrenceController controller;

    @BeforeEach
    void setUp() {
        recurrenceService = mock(RecurrenceService.class);
        controller = new RecurrenceController(recurrenceService);
    }

    @Test
    void shouldListRecurrences() {
        when(recurrenceService.listAll()).thenReturn(List.of(definition(true)));

        StepVerifier.create(controller.list())
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    List<RecurrenceController.RecurrenceDto> body = response.getBody();
                    assertNotNull(body);
                    assertEquals(1, body.size());
                    assertEquals(ID, body.get(0).id());
                    assertEquals("9:00 AM", body.get(0).displayTime());
                    assertEquals("SUCCESS", body.get(0).lastOutcome());
                })
                .verifyComplete();
    }

    @Test
    void shouldGetRecurrence() {
        when(recurrenceService.find(ID)).thenReturn(Optional.of(definition(true)));

        StepVerifier.create(controller.get(ID))
                .assertNext(response -> {
                    assertEquals(HttpStatus.OK, response.getStatusCode());
                    assertEquals("123456", response.getBody().destination());
                    assertEquals("STATIC", response.getBody().contentSource());
                })
                .verifyComplete();
    }

    @Test
    void shouldReturnNotFoundForUnknownRecurrence() {
        when(recurrenceService.find("missing")).thenReturn(Optional.empty());

        ResponseStatusException ex = assertThrows(ResponseStatusException.class, () -> controller.get("missing"));
        assertEquals(HttpStatus.NOT_FOUND, ex.getStatusCode());
    }

    @Test
    void shouldCreateRecurrenceWithDefaults() {
        when(recurrenceService.create(any())).thenReturn(definition(true));

        StepVerifier.create(controller.create(request(9, 0, null, null, null)))
                .assertNext(response -> assertEquals(HttpStatus.CREATED, response.getStatusCode()))
                .verifyComplete();

        ArgumentCaptor<RecurrenceDefinition> captor = ArgumentCaptor.forClass(RecurrenceDefinition.class);
        verify(recurrenceService).create(captor.capture());
        RecurrenceDefinition draft = captor.getValue();
        assertEquals(9, draft.getTargetHour());
        assertTrue(draft.isRecurring());
        assertEquals(Frequency.DAILY, draft.getFrequency());
        assertEquals(PeriodUnit.DAYS, draft.getCustomUnit());
        assertEquals(ContentSource.STATIC, draft.getPayload().getContentSource());
        assertEquals(MessageTone.FRIENDLY, draft.getPayload().getTone());
    }

    @Test
    void shouldParseEnumsCaseInsensitively() {
        when(recurrenceService.create(any())).thenReturn(definition(true));

        StepVerifier.create(controller.create(request(7, 30, "custom", 3, "hours")))
                .expectNextCount(1)
                .verifyComplete();

        ArgumentCaptor<RecurrenceDefinition> captor = ArgumentCaptor.forClass(RecurrenceDefinition.class);
        verify(recurrenceService).create(captor.capture());
        assertEquals(Frequency.CUSTOM, captor.getValue().getFrequency());
        assertEquals(3, captor.getValue().getCustomPeriod());
        assertEquals(PeriodUnit.HOURS, captor.getValue().getCustomUnit());
    }

    @Test
    void shouldRejectUnknownFrequency() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.create(request(9, 0, "fortnightly", null, null)));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        verify(recurrenceService, never()).create(any());
    }

    @Test
    void shouldRejectMissingTime() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.create(request(null, 0, null, null, null)));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
    }

    @Test
    void shouldRejectZeroCustomPeriod() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.create(request(9, 0, "CUSTOM", 0, "DAYS")));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
    }

    @Test
    void shouldMapValidationFailureToBadRequest() {
        when(recurrenceService.create(any()))
                .thenThrow(new IllegalArgumentException("targetHour must be between 0 and 23"));

        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.create(request(25, 0, null, null, null)));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        assertEquals("targetHour must be between 0 and 23", ex.getReason());
    }

    @Test
    void shouldKeepEnabledFlagWhenUpdateOmitsIt() {
        when(recurrenceService.find(ID)).thenReturn(Optional.of(definition(false)));
        when(recurrenceService.update(any())).thenReturn(definition(false));

        StepVerifier.create(controller.update(ID, request(10, 15, null, null, null)))
                .assertNext(response -> assertEquals(HttpStatus.OK, response.getStatusCode()))
                .verifyComplete();

        ArgumentCaptor<RecurrenceDefinition> captor = ArgumentCaptor.forClass(RecurrenceDefinition.class);
        verify(recurrenceService).update(captor.capture());
        assertEquals(ID, captor.getValue().getId());
        assertFalse(captor.getValue().isEnabled());
        assertEquals(10, captor.getValue().getTargetHour());
    }

    @Test
    void shouldDeleteRecurrence() {
        when(recurrenceService.find(ID)).thenReturn(Optional.of(definition(true)));

        StepVerifier.create(controller.delete(ID))
                .assertNext(response -> assertEquals(ID, response.getBody().id()))
                .verifyComplete();

        verify(recurrenceService).delete(ID);
    }

    @Test
    void shouldToggleRecurrence() {
        when(recurrenceService.find(ID)).thenReturn(Optional.of(definition(true)));
        when(recurrenceService.setEnabled(ID, false)).thenReturn(definition(false));

        StepVerifier.create(controller.setEnabled(ID, new RecurrenceController.ToggleRequest(false)))
                .assertNext(response -> assertFalse(response.getBody().enabled()))
                .verifyComplete();
    }

    @Test
    void shouldRejectToggleWithoutValue() {
        ResponseStatusException ex = assertThrows(ResponseStatusException.class,
                () -> controller.setEnabled(ID, new RecurrenceController.ToggleRequest(null)));

        assertEquals(HttpStatus.BAD_REQUEST, ex.getStatusCode());
        verify(recurrenceService, never()).setEnabled(anyString(), anyBoolean());
    }

    @Test
    void shouldPreviewNextOccurrence() {
        Instant fireAt = Instant.parse("2026-05-05T09:00:00Z");
        when(recurrenceService.find(ID)).thenReturn(Optional.of(definition(true)));
        when(recurrenceService.previewNext(ID))
                .thenReturn(new ScheduledLink(ID, Duration.ofHours(3), fireAt, false));

        StepVerifier.create(controller.next(ID))
                .assertNext(response -> {
                    RecurrenceController.NextOccurrenceResponse body = response.getBody();
                    assertEquals(fireAt, body.fireAt());
                    assertEquals(Duration.ofHours(3).toMillis(), body.delayMillis());
                    assertFalse(body.catchUp());
                })
                .verifyComplete();
    }

    private static RecurrenceController.RecurrenceRequest request(Integer hour, Integer minute, String frequency,
            Integer customPeriod, String customUnit) {
        return new RecurrenceController.RecurrenceRequest(hour, minute, null, frequency, customPeriod, customUnit,
                null, null, "Sam", "123456", "Good morning", null, null, null);
    }

    private static RecurrenceDefinition definition(boolean enabled) {
        return RecurrenceDefinition.builder()
                .id(ID)
                .targetHour(9)
                .targetMinute(0)
                .recurring(true)
                .enabled(enabled)
                .createdAt(CREATED)
                .updatedAt(CREATED)
                .lastOutcome(FiringOutcome.SUCCESS)
                .payload(MessagePayload.builder()
                        .recipientName("Sam")
                        .destination("123456")
                        .message("Good morning")
                        .build())
                .build();
    }
}
