package me.golemcore.continuity.domain.context.strategy;

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

import me.golemcore.continuity.domain.context.ContextProviderRegistry;
import me.golemcore.continuity.domain.model.ContextItem;
import me.golemcore.continuity.domain.model.ContextOptions;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything every registered provider has, in registration order.
 */
@Component
public class ComprehensiveContextStrategy implements ContextStrategy {

    public static final String NAME = "comprehensive";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public List<ContextItem> assemble(String query, ContextOptions options, ContextProviderRegistry registry) {
        List<ContextItem> items = new ArrayList<>();
        for (String provider : registry.getProviderNames()) {
            items.addAll(registry.fetch(provider, query, options));
        }
        return items;
    }
}
