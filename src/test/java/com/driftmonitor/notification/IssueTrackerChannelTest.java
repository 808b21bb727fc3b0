package com.driftmonitor.notification;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.client.WireMock;
import com.github.tomakehurst.wiremock.core.WireMockConfiguration;
import org.junit.jupiter.api.*;
import org.springframework.test.util.ReflectionTestUtils;
import reactor.test.StepVerifier;

import static com.github.tomakehurst.wiremock.client.WireMock.*;
import static org.assertj.core.api.Assertions.assertThat;

class IssueTrackerChannelTest {

    private static WireMockServer wireMock;

    private IssueTrackerChannel channel;

    @BeforeAll
    static void startWireMock() {
        wireMock = new WireMockServer(WireMockConfiguration.wireMockConfig().port(9094));
        wireMock.start();
        WireMock.configureFor("localhost", 9094);
    }

    @AfterAll
    static void stopWireMock() { wireMock.stop(); }

    @AfterEach
    void resetStubs() { wireMock.resetAll(); }

    @BeforeEach
    void setUp() {
        WireMock.configureFor("localhost", 9094);
        channel = new IssueTrackerChannel();
        ReflectionTestUtils.setField(channel, "enabled", true);
        ReflectionTestUtils.setField(channel, "baseUrl", "http://localhost:9094");
        ReflectionTestUtils.setField(channel, "repository", "acme/credit-model");
        ReflectionTestUtils.setField(channel, "token", "t0ken");
        ReflectionTestUtils.setField(channel, "timeoutSeconds", 2);
        channel.init();
    }

    @Test
    void deliver_opensIssueAndReturnsItsUrl() {
        stubFor(post(urlEqualTo("/repos/acme/credit-model/issues")).willReturn(aResponse()
            .withStatus(201)
            .withHeader("Content-Type", "application/json")
            .withBody("{\"number\": 17, \"html_url\": \"https://tracker.example.com/acme/credit-model/issues/17\"}")));

        StepVerifier.create(channel.deliver(ChatWebhookChannelTest.payload("CRITICAL")))
            .assertNext(receipt -> assertThat(receipt.ref())
                .isEqualTo("https://tracker.example.com/acme/credit-model/issues/17"))
            .verifyComplete();

        verify(postRequestedFor(urlEqualTo("/repos/acme/credit-model/issues"))
            .withHeader("Authorization", equalTo("Bearer t0ken"))
            .withRequestBody(matchingJsonPath("$.labels[1]", equalTo("critical")))
            .withRequestBody(matchingJsonPath("$.body", containing("gender=female"))));
    }

    @Test
    void renderBody_isMarkdownTable() {
        String body = channel.renderBody(ChatWebhookChannelTest.payload("WARNING"));

        assertThat(body).contains("| Metric | `disparate_impact_ratio:gender` |")
            .contains("| Value | 0.7500 |");
    }
}
