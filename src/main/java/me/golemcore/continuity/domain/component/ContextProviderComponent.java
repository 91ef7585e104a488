package me.golemcore.continuity.domain.component;

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
import me.golemcore.continuity.domain.model.ContextOptions;

import java.util.List;

/**
 * Component that contributes context items for a query.
 *
 * <p>
 * Providers are registered once at startup under a unique name and ordered by
 * {@link #getOrder()}; that order is the registration order used by strategies
 * that call every provider. A provider may throw: the assembler treats any
 * exception as an empty contribution.
 */
public interface ContextProviderComponent extends Component {

    @Override
    default String getComponentType() {
        return "context-provider";
    }

    /**
     * Unique name strategies use to address this provider.
     */
    String getProviderName();

    /**
     * Produces context items for {@code query}. Must honour {@code limit} and
     * {@code minRelevance} from the options where they apply.
     */
    List<ContextItem> provide(String query, ContextOptions options);

    /**
     * Registration order, lower first.
     */
    default int getOrder() {
        return 100;
    }
}
