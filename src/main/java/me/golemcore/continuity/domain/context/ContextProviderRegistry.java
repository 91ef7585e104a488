package me.golemcore.continuity.domain.context;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.continuity.domain.component.ContextProviderComponent;
import me.golemcore.continuity.domain.model.ContextItem;
import me.golemcore.continuity.domain.model.ContextOptions;
import me.golemcore.continuity.domain.model.ContinuityConfigurationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Named registry of context providers, filled once at startup.
 *
 * <p>
 * {@link #fetch} isolates strategies from provider failures: an unknown name or
 * a throwing provider yields an empty list.
 */
@Component
@Slf4j
public class ContextProviderRegistry {

    private final Map<String, ContextProviderComponent> providers = new LinkedHashMap<>();

    public ContextProviderRegistry(List<ContextProviderComponent> components) {
        components.stream()
                .filter(ContextProviderComponent::isEnabled)
                .sorted(Comparator.comparingInt(ContextProviderComponent::getOrder))
                .forEach(this::register);
        log.info("[Context] Registered {} context providers: {}", providers.size(), providers.keySet());
    }

    private void register(ContextProviderComponent provider) {
        String name = provider.getProviderName();
        if (name == null || name.isBlank()) {
            throw new ContinuityConfigurationException(
                    "Context provider without a name: " + provider.getClass().getName());
        }
        if (providers.putIfAbsent(name, provider) != null) {
            throw new ContinuityConfigurationException("Duplicate context provider name: " + name);
        }
    }

    /**
     * Calls one provider and returns its non-null items.
     */
    public List<ContextItem> fetch(String providerName, String query, ContextOptions options) {
        ContextProviderComponent provider = providers.get(providerName);
        if (provider == null) {
            log.debug("[Context] Context provider not found: {}", providerName);
            return List.of();
        }
        try {
            List<ContextItem> items = provider.provide(query, options);
            if (items == null) {
                return List.of();
            }
            return items.stream().filter(Objects::nonNull).toList();
        } catch (RuntimeException e) {
            log.error("[Context] Error getting context from provider {}: {}", providerName, e.getMessage(), e);
            return List.of();
        }
    }

    /**
     * Provider names in registration order.
     */
    public List<String> getProviderNames() {
        return new ArrayList<>(providers.keySet());
    }

    public int size() {
        return providers.size();
    }
}
