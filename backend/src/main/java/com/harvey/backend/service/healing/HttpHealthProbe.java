package com.harvey.backend.service.healing;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

@Slf4j
@Component
@RequiredArgsConstructor
public class HttpHealthProbe implements HealthProbe {

    @Qualifier("healthProbeRestTemplate")
    private final RestTemplate restTemplate;

    @Override
    public boolean isHealthy(String url) {
        try {
            ResponseEntity<String> response = restTemplate.getForEntity(url, String.class);
            boolean healthy = response.getStatusCode().is2xxSuccessful();
            log.debug("Health probe url={} status={}", url, response.getStatusCode().value());
            return healthy;
        } catch (RestClientException | IllegalArgumentException e) {
            log.warn("Health probe failed url={} error={}", url, e.getMessage());
            return false;
        }
    }
}
