package me.golemcore.continuity.adapter.outbound.vision;

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
import me.golemcore.continuity.domain.model.ContextItem;
import me.golemcore.continuity.infrastructure.config.ContinuityProperties;
import me.golemcore.continuity.port.outbound.VisionAnchorPort;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

/**
 * Vision anchor backed by {@code continuity.vision.*} settings.
 */
@Component
@RequiredArgsConstructor
public class PropertiesVisionAnchorAdapter implements VisionAnchorPort {

    static final double VISION_PRIORITY = 0.9;

    private final ContinuityProperties properties;

    @Override
    public Optional<ContextItem> getVisionContext() {
        ContinuityProperties.VisionProperties vision = properties.getVision();
        String statement = vision.getStatement() != null ? vision.getStatement().trim() : "";
        List<String> principles = vision.getPrinciples() != null ? vision.getPrinciples() : List.of();
        if (statement.isEmpty() && principles.isEmpty()) {
            return Optional.empty();
        }

        StringBuilder content = new StringBuilder(statement);
        if (!principles.isEmpty()) {
            if (!content.isEmpty()) {
                content.append("\n\n");
            }
            content.append("Principles:");
            for (String principle : principles) {
                content.append("\n- ").append(principle);
            }
        }

        return Optional.of(ContextItem.builder()
                .type("vision")
                .id("project_vision")
                .title(vision.getTitle())
                .content(content.toString())
                .priority(VISION_PRIORITY)
                .build());
    }
}
