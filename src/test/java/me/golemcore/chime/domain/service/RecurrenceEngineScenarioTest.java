package me.golemcore.chime.domain.service;

import me.golemcore.chime.domain.model.DeliveryResult;
import me.golemcore.chime.domain.model.FailureKind;
import me.golemcore.chime.domain.model.FiringJob;
import me.golemcore.chime.domain.model.FiringOutcome;
import me.golemcore.chime.domain.model.FiringResult;
import me.golemcore.chime.domain.model.Frequency;
import me.golemcore.chime.domain.model.MessagePayload;
import me.golemcore.chime.domain.model.RecurrenceDefinition;
import me.golemcore.chime.infrastructure.config.ChimeProperties;
import me.golemcore.chime.port.outbound.ContentGeneratorPort;
import me.golemcore.chime.port.outbound.MessageTransportPort;
import me.golemcore.chime.testsupport.InMemoryRecurrenceStore;
import me.golemcore.chime.testsupport.MutableClock;
import me.golemcore.chime.testsupport.RecordingJobExecutor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Whole-engine flows: facade, chain manager and firing handler against an
 * in-memory store and an executor that tests fire by hand.
 */
class RecurrenceEngineScenarioTest {

    private static final Instant EIGHT_AM = Instant.parse("2026-05-04T08:00:00Z");
    private static final Instant NINE_AM = Instant.parse("2026-05-04T09:00:00Z");
    private static final Instant TOMORROW_NINE_AM = Instant.parse("2026-05-05T09:00:00Z");

    private InMemoryRecurrenceStore store;
    private RecordingJobExecutor executor;
    private MutableClock clock;
    private ChimeProperties properties;
    private MessageTransportPort transport;
    private RecurrenceService service;
    private FiringHandler handler;

    @BeforeEach
    void setUp() {
        setUpEngine(ZoneOffset.UTC, EIGHT_AM);
    }

    private void setUpEngine(ZoneId zone, Instant now) {
        store = new InMemoryRecurrenceStore();
        clock = new MutableClock(now, zone);
        properties = new ChimeProperties();
        transport = mock(MessageTransportPort.class);
        when(transport.isValidDestination(anyString())).thenReturn(true);
        when(transport.send(anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(DeliveryResult.delivered(1)));
        startProcess();
    }

    /**
     * Builds the engine over the current store with an empty executor, as a
     * process restart does.
     */
    private void startProcess() {
        executor = new RecordingJobExecutor();
        StalenessPolicy stalenessPolicy = new ElapsedTimeStalenessPolicy(Duration.ofHours(2));
        JobChainManager chainManager = new JobChainManager(new NextOccurrenceCalculator(), executor,
                stalenessPolicy, clock);
        service = new RecurrenceService(store, chainManager, clock);
        ContentResolver contentResolver = new ContentResolver(mock(ContentGeneratorPort.class), properties);
        handler = new FiringHandler(store, service, stalenessPolicy, contentResolver, transport, properties, clock);
    }

    @Test
    void shouldFireAtTargetTimeAndScheduleNextDayWithoutDrift() {
        RecurrenceDefinition definition = service.create(dailyAt(9, 0, true));
        assertEquals(Duration.ofHours(1), executor.pendingDelay(definition.getId()));

        clock.set(NINE_AM.plus(Duration.ofMinutes(37)));
        FiringResult result = handler.handle(executor.take(definition.getId()));

        assertEquals(FiringOutcome.SUCCESS, result.outcome());
        FiringJob next = executor.pending(definition.getId()).orElseThrow();
        assertEquals(TOMORROW_NINE_AM, next.intendedFireAt());
        assertEquals(Duration.ofHours(23).plusMinutes(23), executor.pendingDelay(definition.getId()));
    }

    @Test
    void shouldSendOneShotOnceAndSkipSpuriousSecondFiring() {
        RecurrenceDefinition definition = service.create(dailyAt(9, 0, false));
        clock.set(NINE_AM);
        FiringJob job = executor.take(definition.getId());

        FiringResult first = handler.handle(job);
        FiringResult second = handler.handle(job);

        assertEquals(FiringOutcome.SUCCESS, first.outcome());
        assertEquals(FiringOutcome.SKIPPED, second.outcome());
        assertFalse(store.get(definition.getId()).orElseThrow().isEnabled());
        assertTrue(executor.pendingKeys().isEmpty());
        verify(transport, times(1)).send(anyString(), anyString());
    }

    @Test
    void shouldNotResendOneShotWhenSendOutlivesDeliveryTimeout() {
        properties.getFiring().setDeliveryTimeout(Duration.ofMillis(300));
        AtomicInteger delivered = new AtomicInteger();
        CompletableFuture<DeliveryResult> slowSend = CompletableFuture.supplyAsync(() -> {
            delivered.incrementAndGet();
            return DeliveryResult.delivered(1);
        }, CompletableFuture.delayedExecutor(600, TimeUnit.MILLISECONDS));
        when(transport.send(anyString(), anyString())).thenReturn(slowSend);
        RecurrenceDefinition definition = service.create(dailyAt(9, 0, false));
        clock.set(NINE_AM);

        FiringResult result = handler.handle(executor.take(definition.getId()));
        slowSend.join();

        assertEquals(FiringOutcome.FAILED, result.outcome());
        assertEquals(FailureKind.DELIVERY_UNCONFIRMED, result.failureKind());
        assertEquals(1, delivered.get());
        assertFalse(store.get(definition.getId()).orElseThrow().isEnabled());
        assertTrue(executor.pendingKeys().isEmpty());

        clock.set(TOMORROW_NINE_AM);
        startProcess();
        service.rescheduleAllEnabled();

        assertTrue(executor.pendingKeys().isEmpty());
        verify(transport, times(1)).send(anyString(), anyString());
    }

    @Test
    void shouldSkipStaleFiringAndKeepChainAlive() {
        RecurrenceDefinition definition = service.create(dailyAt(9, 0, true));
        clock.set(Instant.parse("2026-05-04T11:30:00Z"));

        FiringResult result = handler.handle(executor.take(definition.getId()));

        assertEquals(FiringOutcome.SKIPPED, result.outcome());
        verify(transport, never()).send(anyString(), anyString());
        assertEquals(TOMORROW_NINE_AM, executor.pending(definition.getId()).orElseThrow().intendedFireAt());
        assertEquals(FiringOutcome.SKIPPED, store.get(definition.getId()).orElseThrow().getLastOutcome());
    }

    @Test
    void shouldEndChainWhenDisabledBetweenEnqueueAndFiring() {
        RecurrenceDefinition definition = service.create(dailyAt(9, 0, true));
        FiringJob job = executor.take(definition.getId());
        store.setEnabled(definition.getId(), false);
        clock.set(NINE_AM);

        FiringResult result = handler.handle(job);

        assertEquals(FiringOutcome.SKIPPED, result.outcome());
        assertTrue(executor.pendingKeys().isEmpty());
        verify(transport, never()).send(anyString(), anyString());
    }

    @Test
    void shouldKeepSingleJobThroughEditsAndToggles() {
        RecurrenceDefinition definition = service.create(dailyAt(9, 0, true));

        service.update(definition.toBuilder().targetMinute(15).build());
        service.setEnabled(definition.getId(), false);
        service.setEnabled(definition.getId(), true);
        service.update(definition.toBuilder().targetMinute(30).build());

        assertEquals(1, executor.pendingKeys().size());
        assertEquals(Instant.parse("2026-05-04T09:30:00Z"),
                executor.pending(definition.getId()).orElseThrow().intendedFireAt());
    }

    @Test
    void shouldCatchUpMissedOccurrenceOnceAfterRestart() {
        RecurrenceDefinition definition = service.create(dailyAt(9, 0, true));

        clock.set(Instant.parse("2026-05-04T09:30:00Z"));
        startProcess();
        service.rescheduleAllEnabled();

        assertEquals(Duration.ZERO, executor.pendingDelay(definition.getId()));
        FiringResult result = handler.handle(executor.take(definition.getId()));
        assertEquals(FiringOutcome.SUCCESS, result.outcome());

        clock.set(Instant.parse("2026-05-04T09:31:00Z"));
        startProcess();
        service.rescheduleAllEnabled();

        assertEquals(TOMORROW_NINE_AM, executor.pending(definition.getId()).orElseThrow().intendedFireAt());
        verify(transport, times(1)).send(anyString(), anyString());
    }

    @Test
    void shouldNotCatchUpStaleOccurrenceAfterLongOutage() {
        RecurrenceDefinition definition = service.create(dailyAt(9, 0, true));

        clock.set(Instant.parse("2026-05-04T15:00:00Z"));
        startProcess();
        service.rescheduleAllEnabled();

        assertEquals(TOMORROW_NINE_AM, executor.pending(definition.getId()).orElseThrow().intendedFireAt());
        assertEquals(Duration.ofHours(18), executor.pendingDelay(definition.getId()));
    }

    @Test
    void shouldKeepLocalTimeAcrossDaylightSavingChange() {
        ZoneId newYork = ZoneId.of("America/New_York");
        setUpEngine(newYork, ZonedDateTime.of(2026, 3, 7, 8, 0, 0, 0, newYork).toInstant());
        RecurrenceDefinition definition = service.create(dailyAt(9, 0, true));

        clock.set(ZonedDateTime.of(2026, 3, 7, 9, 0, 0, 0, newYork).toInstant());
        handler.handle(executor.take(definition.getId()));

        Instant next = executor.pending(definition.getId()).orElseThrow().intendedFireAt();
        assertEquals(ZonedDateTime.of(2026, 3, 8, 9, 0, 0, 0, newYork).toInstant(), next);
        assertEquals(Duration.ofHours(23), executor.pendingDelay(definition.getId()));
    }

    @Test
    void shouldStepHourlyChainAfterDailyAnchoredStart() {
        RecurrenceDefinition draft = dailyAt(9, 0, true);
        draft.setFrequency(Frequency.HOURLY);
        RecurrenceDefinition definition = service.create(draft);
        assertEquals(NINE_AM, executor.pending(definition.getId()).orElseThrow().intendedFireAt());

        clock.set(NINE_AM.plusSeconds(2));
        handler.handle(executor.take(definition.getId()));

        assertEquals(Instant.parse("2026-05-04T10:00:00Z"),
                executor.pending(definition.getId()).orElseThrow().intendedFireAt());
    }

    private static RecurrenceDefinition dailyAt(int hour, int minute, boolean recurring) {
        return RecurrenceDefinition.builder()
                .targetHour(hour)
                .targetMinute(minute)
                .recurring(recurring)
                .frequency(Frequency.DAILY)
                .payload(MessagePayload.builder()
                        .recipientName("Alice")
                        .destination("123456")
                        .message("Good morning")
                        .build())
                .build();
    }
}
