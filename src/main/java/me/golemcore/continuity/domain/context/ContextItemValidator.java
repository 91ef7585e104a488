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
import me.golemcore.continuity.domain.model.ContextItem;
import me.golemcore.continuity.infrastructure.config.ContinuityProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Drops context items that cannot be rendered.
 *
 * <p>
 * An item needs a non-blank type, id, title and content. A priority, when
 * present, must be a number in [0, 1]. With
 * {@code continuity.context.validation-enabled=false} only null items are
 * rejected.
 */
@Component
@Slf4j
public class ContextItemValidator {

    private final boolean enabled;

    public ContextItemValidator(ContinuityProperties properties) {
        this.enabled = properties.getContext().isValidationEnabled();
    }

    public boolean isValid(ContextItem item) {
        if (item == null) {
            return false;
        }
        if (!enabled) {
            return true;
        }
        if (isBlank(item.getType()) || isBlank(item.getId()) || isBlank(item.getTitle())
                || isBlank(item.getContent())) {
            return false;
        }
        Double priority = item.getPriority();
        return priority == null || (!priority.isNaN() && priority >= 0.0 && priority <= 1.0);
    }

    public List<ContextItem> filterValid(List<ContextItem> items) {
        List<ContextItem> valid = new ArrayList<>(items.size());
        for (ContextItem item : items) {
            if (isValid(item)) {
                valid.add(item);
            } else {
                log.warn("[Context] Dropping invalid context item: {}", item != null ? item.getId() : null);
            }
        }
        return valid;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
