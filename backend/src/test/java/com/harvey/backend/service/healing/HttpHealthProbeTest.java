package com.harvey.backend.service.healing;

import com.github.tomakehurst.wiremock.WireMockServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.get;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static org.assertj.core.api.Assertions.assertThat;

class HttpHealthProbeTest {

    private static final WireMockServer wireMock = new WireMockServer(0);

    private HttpHealthProbe probe;

    @BeforeAll
    static void startWireMock() {
        wireMock.start();
    }

    @AfterAll
    static void stopWireMock() {
        wireMock.stop();
    }

    @BeforeEach
    void setUp() {
        wireMock.resetAll();
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(1000);
        factory.setReadTimeout(500);
        probe = new HttpHealthProbe(new RestTemplate(factory));
    }

    @Test
    void okStatusIsHealthy() {
        wireMock.stubFor(get(urlEqualTo("/health")).willReturn(aResponse().withStatus(200).withBody("{\"status\":\"ok\"}")));

        assertThat(probe.isHealthy(url("/health"))).isTrue();
    }

    @Test
    void serverErrorIsUnhealthy() {
        wireMock.stubFor(get(urlEqualTo("/health")).willReturn(aResponse().withStatus(503)));

        assertThat(probe.isHealthy(url("/health"))).isFalse();
    }

    @Test
    void slowResponseIsUnhealthy() {
        wireMock.stubFor(get(urlEqualTo("/health")).willReturn(aResponse().withStatus(200).withFixedDelay(2000)));

        assertThat(probe.isHealthy(url("/health"))).isFalse();
    }

    @Test
    void unreachableHostIsUnhealthy() {
        assertThat(probe.isHealthy("http://127.0.0.1:1/health")).isFalse();
    }

    private String url(String path) {
        return "http://localhost:" + wireMock.port() + path;
    }
}
