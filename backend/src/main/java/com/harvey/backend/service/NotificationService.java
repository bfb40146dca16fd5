package com.harvey.backend.service;

import com.harvey.backend.config.TrainingProperties;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestTemplate;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Best-effort webhook notifications. Delivery problems are logged and never reach the caller.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private static final String PREFIX = " Harvey Intelligence Engine: ";

    private final TrainingProperties trainingProperties;
    @Qualifier("notificationRestTemplate")
    private final RestTemplate restTemplate;
    @Qualifier("notificationRetry")
    private final Retry notificationRetry;

    public boolean notify(String message, boolean success) {
        log.info("Notification success={} message={}", success, message);
        return send(message, success, success ? "✅" : "❌");
    }

    public boolean critical(String message) {
        log.error("🚨 CRITICAL {}", message);
        return send(message, false, "🚨");
    }

    private boolean send(String message, boolean success, String emoji) {
        String url = trainingProperties.getNotification().getWebhookUrl();
        if (url == null || url.isBlank()) {
            return false;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("text", emoji + PREFIX + message);
        payload.put("message", message);
        payload.put("success", success);
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(payload, headers);
        Supplier<Object> post = () -> restTemplate.postForEntity(url, request, String.class);
        try {
            Retry.decorateSupplier(notificationRetry, post).get();
            return true;
        } catch (RuntimeException e) {
            log.warn("Notification delivery failed url={} error={}", url, e.getMessage());
            return false;
        }
    }
}
