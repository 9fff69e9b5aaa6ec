package me.golemcore.agent.domain.model;

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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Fragment of a tool call delivered by a streaming provider. The index (or,
 * when absent, the id) identifies which call the fragment belongs to. The
 * arguments fragment is an arbitrary substring of the final JSON text.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ToolCallDelta {

    private Integer index;
    private String id;
    private String name;
    private String argumentsFragment;
}
