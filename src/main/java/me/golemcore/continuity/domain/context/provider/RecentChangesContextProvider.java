package me.golemcore.continuity.domain.context.provider;

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

import me.golemcore.continuity.domain.component.ContextProviderComponent;
import me.golemcore.continuity.domain.context.ProviderNames;
import me.golemcore.continuity.domain.model.ContextItem;
import me.golemcore.continuity.domain.model.ContextOptions;
import me.golemcore.continuity.port.outbound.RecentChangesPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class RecentChangesContextProvider implements ContextProviderComponent {

    private final ObjectProvider<RecentChangesPort> recentChangesPort;

    public RecentChangesContextProvider(ObjectProvider<RecentChangesPort> recentChangesPort) {
        this.recentChangesPort = recentChangesPort;
    }

    @Override
    public String getProviderName() {
        return ProviderNames.RECENT_CHANGES;
    }

    @Override
    public List<ContextItem> provide(String query, ContextOptions options) {
        RecentChangesPort port = recentChangesPort.getIfAvailable();
        if (port == null) {
            return List.of();
        }
        List<ContextItem> items = port.getRecentChanges(query);
        return items != null ? items : List.of();
    }

    @Override
    public int getOrder() {
        return 30;
    }
}
