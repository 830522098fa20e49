/*
 * Where: Dispatcher application configuration binding
 * What: Holds queue history retention windows
 * Why: Keep completed/failed job history tunable per environment
 */
package com.example.dispatcher.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dispatch.retention")
public record JobRetentionProperties(
                boolean enabled,
                Duration completedRetention,
                Duration failedRetention,
                Duration cleanupInterval) {
}
