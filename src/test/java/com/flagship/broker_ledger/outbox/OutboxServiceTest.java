package com.flagship.broker_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.broker_ledger.event.EpisodeOpenedEvent;
import com.flagship.broker_ledger.ledger.BalanceReference;
import com.flagship.broker_ledger.money.BeneficiarySplit;
import com.flagship.broker_ledger.snapshot.LossSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.IllegalTransactionStateException;
import org.springframework.transaction.support.TransactionTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxServiceTest {

    private static final int MAX_RETRIES = 5;

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("broker_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private TransactionTemplate transactionTemplate;

    @Autowired
    private ObjectMapper objectMapper;

    private static EpisodeOpenedEvent episodeOpened(UUID accountId) {
        return EpisodeOpenedEvent.from(LossSnapshot.open(accountId,
            new BalanceReference(LocalDate.of(2024, 1, 2), new BigDecimal("100"), 2L),
            new BigDecimal("900"), BeneficiarySplit.single(BigDecimal.TEN)));
    }

    private OutboxEvent recordInTransaction(UUID accountId) {
        return transactionTemplate.execute(status -> outboxService.record(episodeOpened(accountId)));
    }

    @Test
    @DisplayName("Recorded event carries the account as aggregate and a JSON payload")
    void recordsEvent() throws Exception {
        UUID accountId = UUID.randomUUID();

        OutboxEvent event = recordInTransaction(accountId);

        assertNotNull(event.getId());
        assertEquals("ClientExchangeAccount", event.getAggregateType());
        assertEquals(accountId, event.getAggregateId());
        assertEquals(EpisodeOpenedEvent.EVENT_TYPE, event.getEventType());
        assertFalse(event.isPublished());
        assertEquals(0, event.getRetryCount());

        JsonNode payload = objectMapper.readTree(event.getPayload());
        assertEquals(accountId.toString(), payload.get("accountId").asText());
        assertEquals("LOSS", payload.get("direction").asText());
    }

    @Test
    @DisplayName("Recording outside a transaction is refused")
    void recordNeedsTransaction() {
        assertThrows(IllegalTransactionStateException.class,
            () -> outboxService.record(episodeOpened(UUID.randomUUID())));
    }

    @Test
    @DisplayName("Published events leave the backlog")
    void markPublished() {
        UUID accountId = UUID.randomUUID();
        OutboxEvent event = recordInTransaction(accountId);

        outboxService.markPublished(event.getId());

        OutboxEvent stored = outboxService.eventsForAccount(accountId).get(0);
        assertTrue(stored.isPublished());
        assertTrue(outboxService.lockUnpublished(1000, MAX_RETRIES).stream()
            .noneMatch(e -> e.getId().equals(event.getId())));
    }

    @Test
    @DisplayName("Events past the retry limit are no longer picked up")
    void deadLettered() {
        UUID accountId = UUID.randomUUID();
        OutboxEvent event = recordInTransaction(accountId);

        for (int i = 0; i < MAX_RETRIES; i++) {
            outboxService.markFailed(event.getId(), "broker unavailable");
        }

        OutboxEvent stored = outboxService.eventsForAccount(accountId).get(0);
        assertEquals(MAX_RETRIES, stored.getRetryCount());
        assertEquals("broker unavailable", stored.getLastError());
        assertTrue(stored.isDeadLettered(MAX_RETRIES));
        assertTrue(outboxService.lockUnpublished(1000, MAX_RETRIES).stream()
            .noneMatch(e -> e.getId().equals(event.getId())));
    }
}
