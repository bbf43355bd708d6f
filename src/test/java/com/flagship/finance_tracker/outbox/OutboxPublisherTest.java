package com.flagship.finance_tracker.outbox;

import com.flagship.finance_tracker.card.CreditCard;
import com.flagship.finance_tracker.card.CreditCardService;
import com.flagship.finance_tracker.common.Country;
import com.flagship.finance_tracker.common.CurrencyCode;
import com.flagship.finance_tracker.invoice.CreditCardInvoice;
import com.flagship.finance_tracker.invoice.InvoiceLifecycleService;
import com.flagship.finance_tracker.invoice.event.InvoiceClosedEvent;
import com.flagship.finance_tracker.invoice.event.InvoiceOpenedEvent;
import com.flagship.finance_tracker.obligation.event.ObligationPaidEvent;
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
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Outbox drain into a real Kafka broker.
 *
 * The scheduled poll runs once at startup and then effectively never, so
 * publishing is driven by {@link OutboxPublisher#triggerPublish()}.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class OutboxPublisherTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("finance_tracker_outbox_test")
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
        registry.add("outbox.publisher.enabled", () -> "true");
        registry.add("outbox.publisher.poll-interval-ms", () -> "3600000");
        registry.add("metrics.refresh.enabled", () -> "false");
    }

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private OutboxPublisher outboxPublisher;

    @Autowired
    private CreditCardService creditCardService;

    @Autowired
    private InvoiceLifecycleService invoiceLifecycleService;

    @Value("${kafka.topic.invoices:invoices}")
    private String invoicesTopic;

    private KafkaConsumer<String, String> consumer;

    @BeforeEach
    void setUp() {
        Properties props = new Properties();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, kafka.getBootstrapServers());
        props.put(ConsumerConfig.GROUP_ID_CONFIG, "test-group-" + UUID.randomUUID());
        props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class.getName());
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");

        consumer = new KafkaConsumer<>(props);
        consumer.subscribe(Collections.singletonList(invoicesTopic));
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

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @Test
    @DisplayName("Invoice events reach the invoices topic keyed by invoice id")
    void testPublisher_SendsInvoiceEventsToKafka() {
        printTestHeader("Publish invoice events");

        CreditCard card = creditCardService.register(Country.PORTUGAL, CurrencyCode.EUR,
            new BigDecimal("1.50"), BigDecimal.ZERO, "Outbox Tester", "9876");
        CreditCardInvoice invoice = invoiceLifecycleService.createInitialInvoice(card.getId(), LocalDate.of(2024, 1, 1));
        invoiceLifecycleService.close(invoice.getId());

        assertTrue(outboxService.countUnpublished() >= 2);

        outboxPublisher.triggerPublish();

        assertEquals(0, outboxService.countUnpublished(), "All events should be published");
        assertTrue(outboxService.getEventsForAggregate(AggregateType.CREDIT_CARD_INVOICE, invoice.getId())
            .stream().allMatch(OutboxEvent::isPublished));

        List<ConsumerRecord<String, String>> records = consumeForKey(invoice.getId().toString(), 2, 10000);
        assertEquals(2, records.size());
        assertEquals(InvoiceOpenedEvent.EVENT_TYPE, eventTypeOf(records.get(0)));
        assertEquals(InvoiceClosedEvent.EVENT_TYPE, eventTypeOf(records.get(1)));
        assertTrue(records.get(1).value().contains(invoice.getId().toString()));
        printSuccess("Opened and closed events published in order");
    }

    @Test
    @DisplayName("Events are routed to a topic by aggregate type")
    void testTopicFor() {
        OutboxEvent invoiceEvent = OutboxEvent.create(AggregateType.CREDIT_CARD_INVOICE, UUID.randomUUID(),
            InvoiceOpenedEvent.EVENT_TYPE, "{}", null);
        OutboxEvent obligationEvent = OutboxEvent.create(AggregateType.OBLIGATION_STATUS, UUID.randomUUID(),
            ObligationPaidEvent.EVENT_TYPE, "{}", null);

        assertEquals(invoicesTopic, outboxPublisher.topicFor(invoiceEvent));
        assertEquals("finance.obligations", outboxPublisher.topicFor(obligationEvent));
    }

    private static String eventTypeOf(ConsumerRecord<String, String> record) {
        return new String(record.headers().lastHeader("eventType").value(), StandardCharsets.UTF_8);
    }

    private List<ConsumerRecord<String, String>> consumeForKey(String key, int expected, long timeoutMs) {
        List<ConsumerRecord<String, String>> matching = new ArrayList<>();
        long endTime = System.currentTimeMillis() + timeoutMs;

        while (System.currentTimeMillis() < endTime && matching.size() < expected) {
            for (ConsumerRecord<String, String> record : consumer.poll(Duration.ofMillis(200))) {
                if (key.equals(record.key())) {
                    matching.add(record);
                }
            }
        }
        return matching;
    }
}
