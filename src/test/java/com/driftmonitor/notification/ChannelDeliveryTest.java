package com.driftmonitor.notification;

import com.driftmonitor.support.ScriptedChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ChannelDeliveryTest {

    private ChannelDelivery delivery;

    private final AlertPayload payload = AlertPayload.builder()
        .title("Data drift on psi:region for model credit")
        .severityLabel("CRITICAL")
        .modelId("credit")
        .metricName("psi:region")
        .value(0.88)
        .threshold(0.25)
        .affectedGroups(List.of())
        .incidentRef("incident/1")
        .actionsLinks(List.of())
        .build();

    @BeforeEach
    void setUp() {
        delivery = new ChannelDelivery();
        ReflectionTestUtils.setField(delivery, "maxRetries", 3);
        ReflectionTestUtils.setField(delivery, "initialBackoffMs", 5L);
        ReflectionTestUtils.setField(delivery, "timeoutMs", 200L);
        ReflectionTestUtils.setField(delivery, "poolSize", 4);
        delivery.init();
    }

    @AfterEach
    void tearDown() {
        delivery.shutdown();
    }

    @Test
    void deliver_succeedsFirstTime() {
        var chat = ScriptedChannel.accepting("chat");

        StepVerifier.create(delivery.deliver(chat, payload))
            .assertNext(result -> {
                assertThat(result.delivered()).isTrue();
                assertThat(result.ref()).isEqualTo("chat-ref");
                assertThat(result.attempts()).isEqualTo(1);
            })
            .verifyComplete();
    }

    @Test
    void deliver_transientFailure_isRetriedUntilItSucceeds() {
        var chat = new ScriptedChannel("chat",
            () -> Mono.error(new IllegalStateException("503")),
            () -> Mono.just(DeliveryReceipt.failed("rate limited")),
            () -> Mono.just(DeliveryReceipt.ok("ts-1")));

        StepVerifier.create(delivery.deliver(chat, payload))
            .assertNext(result -> {
                assertThat(result.delivered()).isTrue();
                assertThat(result.ref()).isEqualTo("ts-1");
                assertThat(result.attempts()).isEqualTo(3);
            })
            .verifyComplete();
        assertThat(chat.calls()).isEqualTo(3);
    }

    @Test
    void deliver_exhaustedRetries_yieldFailedResultInsteadOfError() {
        var email = ScriptedChannel.failing("email");

        StepVerifier.create(delivery.deliver(email, payload))
            .assertNext(result -> {
                assertThat(result.delivered()).isFalse();
                assertThat(result.error()).contains("email unreachable");
                assertThat(result.attempts()).isEqualTo(4);
            })
            .verifyComplete();
        assertThat(email.calls()).isEqualTo(4);
    }

    @Test
    void deliver_hangingChannel_timesOutAndIsRetried() {
        var slow = new ScriptedChannel("issue-tracker",
            () -> Mono.never(),
            () -> Mono.just(DeliveryReceipt.ok("https://tracker/1")));

        StepVerifier.create(delivery.deliver(slow, payload))
            .assertNext(result -> {
                assertThat(result.delivered()).isTrue();
                assertThat(result.attempts()).isEqualTo(2);
            })
            .expectComplete()
            .verify(Duration.ofSeconds(5));
    }

    @Test
    void fanOut_oneFailingChannelDoesNotBlockTheOthers() {
        var chat = ScriptedChannel.accepting("chat");
        var email = ScriptedChannel.failing("email");
        var tracker = ScriptedChannel.accepting("issue-tracker");

        StepVerifier.create(delivery.fanOut(List.of(chat, email, tracker), payload))
            .assertNext(report -> {
                assertThat(report.notified()).containsExactly("chat", "issue-tracker");
                assertThat(report.failures()).containsOnlyKeys("email");
                assertThat(report.refs()).containsEntry("chat", "chat-ref");
                assertThat(report.allFailed()).isFalse();
            })
            .expectComplete()
            .verify(Duration.ofSeconds(5));
    }

    @Test
    void fanOut_noChannels_isEmptyReport() {
        StepVerifier.create(delivery.fanOut(List.of(), payload))
            .assertNext(report -> {
                assertThat(report.results()).isEmpty();
                assertThat(report.allFailed()).isFalse();
            })
            .verifyComplete();
    }
}
