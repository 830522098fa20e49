/*
 * Where: Dispatcher application configuration binding
 * What: Holds the online-session sweep schedule and staleness threshold
 */
package com.example.dispatcher.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "dispatch.session")
public record SessionMonitorProperties(String verifyCron, Duration staleAfter) {}
