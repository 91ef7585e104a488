package me.golemcore.continuity.port.outbound;

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

import me.golemcore.continuity.domain.model.ContextItem;

import java.util.Optional;

/**
 * Port to the project vision anchor: the stable statement of intent that keeps
 * work aligned across session boundaries.
 */
public interface VisionAnchorPort {

    /**
     * @return the vision as a context item, or empty when no vision is configured
     */
    Optional<ContextItem> getVisionContext();
}
