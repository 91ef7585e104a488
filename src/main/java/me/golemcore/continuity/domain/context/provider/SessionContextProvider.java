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

import lombok.RequiredArgsConstructor;
import me.golemcore.continuity.domain.component.ContextProviderComponent;
import me.golemcore.continuity.domain.context.ProviderNames;
import me.golemcore.continuity.domain.model.BoundaryInfo;
import me.golemcore.continuity.domain.model.BoundaryProximity;
import me.golemcore.continuity.domain.model.ContextItem;
import me.golemcore.continuity.domain.model.ContextOptions;
import me.golemcore.continuity.domain.service.SessionBoundaryTracker;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Describes the active session: its id, predecessor, start time and how close
 * it is to timing out.
 */
@Component
@RequiredArgsConstructor
public class SessionContextProvider implements ContextProviderComponent {

    static final double SESSION_PRIORITY = 0.7;

    private final SessionBoundaryTracker tracker;

    @Override
    public String getProviderName() {
        return ProviderNames.SESSION;
    }

    @Override
    public List<ContextItem> provide(String query, ContextOptions options) {
        String sessionId = options != null && options.getSessionId() != null
                ? options.getSessionId()
                : tracker.getCurrentSessionId();
        BoundaryInfo info = tracker.getBoundaryInfo(sessionId);
        if (!info.isSuccess()) {
            return List.of();
        }

        StringBuilder content = new StringBuilder();
        content.append("Session ID: ").append(info.getSessionId()).append('\n');
        if (info.getPreviousSessionId() != null) {
            content.append("Previous Session: ").append(info.getPreviousSessionId()).append('\n');
        }
        content.append("Session Start: ").append(info.getStartTime()).append('\n');
        BoundaryProximity proximity = info.getProximity() != null ? info.getProximity() : BoundaryProximity.UNKNOWN;
        content.append("Boundary Proximity: ").append(proximity.getValue()).append('\n');
        content.append("Continuity Score: ")
                .append(String.format(Locale.ROOT, "%.2f", info.getContinuityScore()));

        return List.of(ContextItem.builder()
                .type("session_state")
                .id("session-" + info.getSessionId())
                .title("Session State")
                .content(content.toString())
                .priority(SESSION_PRIORITY)
                .build());
    }

    @Override
    public int getOrder() {
        return 40;
    }
}
