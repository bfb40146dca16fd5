package com.harvey.backend.config;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.timelimiter.TimeLimiter;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.time.Duration;

@Configuration
public class ResilienceConfig {

    @Bean
    public Retry notificationRetry(TrainingProperties trainingProperties) {
        TrainingProperties.Notification notification = trainingProperties.getNotification();
        RetryConfig config = RetryConfig.custom()
                .maxAttempts(notification.getMaxAttempts())
                .waitDuration(Duration.ofMillis(notification.getRetryDelayMs()))
                .retryExceptions(ResourceAccessException.class, HttpServerErrorException.class)
                .build();
        return Retry.of("notification", config);
    }

    @Bean
    public TimeLimiter trainingTimeLimiter(TrainingProperties trainingProperties) {
        TimeLimiterConfig config = TimeLimiterConfig.custom()
                .timeoutDuration(Duration.ofSeconds(trainingProperties.getJobTimeoutSeconds()))
                .cancelRunningFuture(true)
                .build();
        return TimeLimiter.of("training-job", config);
    }
}
