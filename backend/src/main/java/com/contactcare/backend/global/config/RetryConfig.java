package com.contactcare.backend.global.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.retry.annotation.EnableRetry;

/**
 * Turns on {@code @Retryable}. The retry advice is ordered ahead of the transaction advice,
 * so every attempt runs in its own transaction.
 */
@Configuration
@EnableRetry
public class RetryConfig {
}
