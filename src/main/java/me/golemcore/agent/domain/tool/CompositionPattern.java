package me.golemcore.agent.domain.tool;

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

import java.util.Locale;

/**
 * Ways of combining registered tools into a composite tool.
 */
public enum CompositionPattern {

    /**
     * Run tools in sequence, feeding each result into the next tool's arguments.
     */
    PIPELINE,

    /**
     * Run all tools with the same arguments at once; all must succeed.
     */
    PARALLEL,

    /**
     * Pick one tool based on the value of a selector argument.
     */
    CONDITIONAL,

    /**
     * Apply a single tool to every element of an items array.
     */
    MAP,

    /**
     * Fold an items array through a single tool.
     */
    REDUCE;

    public String idPrefix() {
        return name().toLowerCase(Locale.ROOT);
    }
}
