package me.golemcore.chime.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import me.golemcore.chime.domain.model.ContentSource;
import me.golemcore.chime.domain.model.Frequency;
import me.golemcore.chime.domain.model.MessagePayload;
import me.golemcore.chime.domain.model.MessageTone;
import me.golemcore.chime.domain.model.PeriodUnit;
import me.golemcore.chime.domain.model.RecurrenceDefinition;
import me.golemcore.chime.domain.model.ScheduledLink;
import me.golemcore.chime.domain.service.RecurrenceService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Recurrence management endpoints.
 */
@RestController
@RequestMapping("/api/recurrences")
@RequiredArgsConstructor
public class RecurrenceController {

    private final RecurrenceService recurrenceService;

    @GetMapping
    public Mono<ResponseEntity<List<RecurrenceDto>>> list() {
        List<RecurrenceDto> recurrences = recurrenceService.listAll().stream()
                .map(RecurrenceController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(recurrences));
    }

    @GetMapping("/{id}")
    public Mono<ResponseEntity<RecurrenceDto>> get(@PathVariable String id) {
        RecurrenceDefinition definition = requireExisting(id);
        return Mono.just(ResponseEntity.ok(toDto(definition)));
    }

    @PostMapping
    public Mono<ResponseEntity<RecurrenceDto>> create(@RequestBody RecurrenceRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }

        try {
            RecurrenceDefinition created = recurrenceService.create(toDefinition(null, request, true));
            return Mono.just(ResponseEntity.status(HttpStatus.CREATED).body(toDto(created)));
        } catch (IllegalArgumentException e) {
            throw badRequest(e.getMessage());
        }
    }

    @PutMapping("/{id}")
    public Mono<ResponseEntity<RecurrenceDto>> update(@PathVariable String id,
            @RequestBody RecurrenceRequest request) {
        if (request == null) {
            throw badRequest("Request body is required");
        }
        RecurrenceDefinition existing = requireExisting(id);
        boolean enabled = request.enabled() != null ? request.enabled() : existing.isEnabled();

        try {
            RecurrenceDefinition updated = recurrenceService.update(toDefinition(id, request, enabled));
            return Mono.just(ResponseEntity.ok(toDto(updated)));
        } catch (IllegalArgumentException e) {
            throw badRequest(e.getMessage());
        }
    }

    @DeleteMapping("/{id}")
    public Mono<ResponseEntity<DeleteRecurrenceResponse>> delete(@PathVariable String id) {
        requireExisting(id);
        recurrenceService.delete(id);
        return Mono.just(ResponseEntity.ok(new DeleteRecurrenceResponse(id)));
    }

    @PostMapping("/{id}/enabled")
    public Mono<ResponseEntity<RecurrenceDto>> setEnabled(@PathVariable String id,
            @RequestBody ToggleRequest request) {
        if (request == null || request.enabled() == null) {
            throw badRequest("enabled is required");
        }
        requireExisting(id);
        RecurrenceDefinition latest = recurrenceService.setEnabled(id, request.enabled());
        return Mono.just(ResponseEntity.ok(toDto(latest)));
    }

    @GetMapping("/{id}/next")
    public Mono<ResponseEntity<NextOccurrenceResponse>> next(@PathVariable String id) {
        RecurrenceDefinition definition = requireExisting(id);
        ScheduledLink link = recurrenceService.previewNext(id);
        return Mono.just(ResponseEntity.ok(new NextOccurrenceResponse(
                definition.getId(),
                link.intendedFireAt(),
                link.delay().toMillis(),
                link.catchUp())));
    }

    private RecurrenceDefinition requireExisting(String id) {
        if (id == null || id.isBlank()) {
            throw badRequest("id is required");
        }
        return recurrenceService.find(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Recurrence not found: " + id));
    }

    private static RecurrenceDefinition toDefinition(String id, RecurrenceRequest request, boolean enabled) {
        if (request.hour() == null || request.minute() == null) {
            throw badRequest("hour and minute are required");
        }

        Frequency frequency = parseEnum(Frequency.class, request.frequency(), Frequency.DAILY, "frequency");
        PeriodUnit unit = parseEnum(PeriodUnit.class, request.customUnit(), PeriodUnit.DAYS, "customUnit");
        int period = request.customPeriod() != null ? request.customPeriod() : 1;
        if (frequency == Frequency.CUSTOM && period < 1) {
            throw badRequest("customPeriod must be at least 1");
        }

        MessagePayload payload = MessagePayload.builder()
                .recipientName(request.recipientName())
                .destination(request.destination())
                .message(request.message())
                .contentSource(parseEnum(ContentSource.class, request.contentSource(), ContentSource.STATIC,
                        "contentSource"))
                .tone(parseEnum(MessageTone.class, request.tone(), MessageTone.FRIENDLY, "tone"))
                .generationContext(request.generationContext())
                .build();

        return RecurrenceDefinition.builder()
                .id(id)
                .targetHour(request.hour())
                .targetMinute(request.minute())
                .recurring(request.recurring() == null || request.recurring())
                .frequency(frequency)
                .customPeriod(period)
                .customUnit(unit)
                .enabled(enabled)
                .startDate(request.startDate())
                .payload(payload)
                .build();
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, E defaultValue, String field) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Enum.valueOf(type, value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw badRequest("Unsupported " + field + ": " + value);
        }
    }

    private static RecurrenceDto toDto(RecurrenceDefinition definition) {
        MessagePayload payload = definition.getPayload() != null ? definition.getPayload() : new MessagePayload();
        return new RecurrenceDto(
                definition.getId(),
                definition.getTargetHour(),
                definition.getTargetMinute(),
                definition.getDisplayTime(),
                definition.isRecurring(),
                definition.getFrequency() != null ? definition.getFrequency().name() : null,
                definition.getCustomPeriod(),
                definition.getCustomUnit() != null ? definition.getCustomUnit().name() : null,
                definition.isEnabled(),
                payload.getRecipientName(),
                payload.getDestination(),
                payload.getMessage(),
                payload.getContentSource() != null ? payload.getContentSource().name() : null,
                payload.getTone() != null ? payload.getTone().name() : null,
                payload.getGenerationContext(),
                definition.getStartDate(),
                definition.getCreatedAt(),
                definition.getUpdatedAt(),
                definition.getLastFiredAt(),
                definition.getLastAttemptAt(),
                definition.getLastOutcome() != null ? definition.getLastOutcome().name() : null,
                definition.getLastError());
    }

    private static ResponseStatusException badRequest(String message) {
        return new ResponseStatusException(HttpStatus.BAD_REQUEST, message);
    }

    public record RecurrenceRequest(
            Integer hour,
            Integer minute,
            Boolean recurring,
            String frequency,
            Integer customPeriod,
            String customUnit,
            Boolean enabled,
            Instant startDate,
            String recipientName,
            String destination,
            String message,
            String contentSource,
            String tone,
            String generationContext) {
    }

    public record ToggleRequest(Boolean enabled) {
    }

    public record RecurrenceDto(
            String id,
            int hour,
            int minute,
            String displayTime,
            boolean recurring,
            String frequency,
            int customPeriod,
            String customUnit,
            boolean enabled,
            String recipientName,
            String destination,
            String message,
            String contentSource,
            String tone,
            String generationContext,
            Instant startDate,
            Instant createdAt,
            Instant updatedAt,
            Instant lastFiredAt,
            Instant lastAttemptAt,
            String lastOutcome,
            String lastError) {
    }

    public record NextOccurrenceResponse(String id, Instant fireAt, long delayMillis, boolean catchUp) {
    }

    public record DeleteRecurrenceResponse(String id) {
    }
}
