package me.golemcore.continuity.infrastructure.config;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.continuity.domain.service.SessionBoundaryTracker;
import me.golemcore.continuity.infrastructure.lifecycle.InitializationResult;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring configuration that provides the shared infrastructure beans and opens
 * the first session on application startup.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Exposes the {@link Clock} every time comparison goes through</li>
 * <li>Exposes the Jackson {@link ObjectMapper} used for all persisted
 * JSON</li>
 * <li>Logs the effective storage and timeout settings</li>
 * <li>Initializes the session boundary tracker via {@code @PostConstruct}</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final ContinuityProperties properties;
    private final SessionBoundaryTracker sessionBoundaryTracker;

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("Continuity core starting...");
        log.info("Storage Path: {}", properties.getStorage().getBasePath());
        log.info("Session timeout: {}", properties.getSession().getTimeout());
        log.info("Default context strategy: {}", properties.getContext().getDefaultStrategy());

        InitializationResult result = sessionBoundaryTracker.initialize();
        if (result.isSuccess()) {
            log.info("Continuity core started, active session: {}", sessionBoundaryTracker.getActiveSessionId());
        } else {
            log.warn("Session tracker failed to start (attempt {}): {}", result.getAttempt(), result.getError());
        }
    }
}
