package com.harvey.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class HttpClientConfig {

    @Bean
    public RestTemplate healthProbeRestTemplate(HealingProperties healingProperties) {
        HealingProperties.Probe probe = healingProperties.getProbe();
        return restTemplate(probe.getConnectTimeoutMs(), probe.getReadTimeoutMs());
    }

    @Bean
    public RestTemplate notificationRestTemplate(TrainingProperties trainingProperties) {
        TrainingProperties.Notification notification = trainingProperties.getNotification();
        return restTemplate(notification.getConnectTimeoutMs(), notification.getReadTimeoutMs());
    }

    private RestTemplate restTemplate(int connectTimeoutMs, int readTimeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(connectTimeoutMs);
        factory.setReadTimeout(readTimeoutMs);
        return new RestTemplate(factory);
    }
}
