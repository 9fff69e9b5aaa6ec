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

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Options of a composite tool. Each pattern reads only the options it needs.
 */
@Value
@Builder
public class CompositionConfig {

    /**
     * Composite id; defaults to {@code pattern_id1_id2...}.
     */
    String id;

    String description;

    /**
     * CONDITIONAL: name of the argument whose value selects the branch.
     */
    @Builder.Default
    String selectorArgument = "condition";

    /**
     * CONDITIONAL: selector value (as text) to index into the composed tool ids.
     */
    @Builder.Default
    Map<String, Integer> branches = Map.of();

    /**
     * MAP: number of items processed at the same time.
     */
    @Builder.Default
    int concurrency = 1;

    /**
     * MAP: keep going when an item fails.
     */
    @Builder.Default
    boolean continueOnError = false;

    /**
     * REDUCE: starting accumulator value.
     */
    Object initialValue;

    /**
     * REDUCE: combines the accumulator with each item's result. When absent the
     * item's result replaces the accumulator.
     */
    Reducer reducer;

    /**
     * Folds one item result into the accumulator.
     */
    @FunctionalInterface
    public interface Reducer {
        Object reduce(Object accumulator, Object itemResult, int index);
    }

    public static CompositionConfig defaults() {
        return CompositionConfig.builder().build();
    }
}
