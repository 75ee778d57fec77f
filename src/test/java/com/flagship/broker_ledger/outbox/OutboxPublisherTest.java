package com.flagship.broker_ledger.outbox;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.broker_ledger.account.AccountService;
import com.flagship.broker_ledger.account.ClientType;
import com.flagship.broker_ledger.ledger.LedgerService;
import com.flagship.broker_ledger.settlement.SettlementService;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.KafkaContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drains the outbox into a real broker and checks that events arrive keyed
 * by account, in ledger order, and are marked published afterwards.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxPublisherTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("broker_ledger_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static KafkaContainer kafka = new KafkaContainer(
            DockerImageName.parse("confluentinc/cp-kafka:7.5.0"));

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.kafka.bootstrap-servers", kafka::getBootstrapServers);
        // Publisher bean is needed, but the test drives it by hand
        registry.add("outbox.publisher.enabled", () -> "true");
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
    }

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private LedgerService ledgerService;

    @Autowired
    private SettlementService settlementService;

    @Autowired
    private ObjectMapper objectMapper;

    @Value("${kafka.topic.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    private UUID accountId;
    private KafkaConsumer<String, String> consumer;

    @BeforeEach
    void setUp() {
        accountId = accountService.createAccount("client-" + UUID.randomUUID().toString().substring(0, 8),
            "Bybit", ClientType.COMPANY, new BigDecimal("1"), new BigDecimal("9")).getId();

        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(ledgerEventsTopic));
    }

    @AfterEach
    void tearDown() {
        consumer.close();
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private List<ConsumerRecord<String, String>> pollForAccount(int expected) {
        List<ConsumerRecord<String, String>> received = new ArrayList<>();
        long deadline = System.currentTimeMillis() + 15000;
        while (received.size() < expected && System.currentTimeMillis() < deadline) {
            consumer.poll(Duration.ofMillis(500)).forEach(record -> {
                if (accountId.toString().equals(record.key())) {
                    received.add(record);
                }
            });
        }
        return received;
    }

    @Test
    @DisplayName("Episode and settlement events reach Kafka in ledger order")
    void publishesInOrder() throws Exception {
        printTestHeader("Outbox Publishes to Kafka");
        LocalDate day = LocalDate.of(2024, 10, 1);
        ledgerService.createFunding(accountId, new BigDecimal("100"), day, null);
        ledgerService.createBalanceRecord(accountId, day.plusDays(1), new BigDecimal("5"), null, null);
        settlementService.settle(accountId, new BigDecimal("9.5"), day.plusDays(2), "full");

        outboxPublisher.publishPendingEvents();

        List<ConsumerRecord<String, String>> records = pollForAccount(3);
        assertEquals(3, records.size());

        List<String> types = new ArrayList<>();
        for (ConsumerRecord<String, String> record : records) {
            JsonNode payload = objectMapper.readTree(record.value());
            types.add(payload.get("eventType").asText());
        }
        assertEquals(List.of("EpisodeOpened", "SettlementRecorded", "EpisodeClosed"), types);

        assertTrue(outboxService.eventsForAccount(accountId).stream().allMatch(OutboxEvent::isPublished));
        System.out.println("✓ SUCCESS: " + types);
    }
}
