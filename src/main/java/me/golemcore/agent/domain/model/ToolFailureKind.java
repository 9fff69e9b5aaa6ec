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

/**
 * Classification of tool failures. Used by the retry policy to tell transient
 * failures from terminal ones and by the console to label error lines.
 */
public enum ToolFailureKind {

    /**
     * Arguments were missing, mistyped, out of range or unknown. Deterministic.
     */
    VALIDATION_FAILED,

    /**
     * No tool with the requested id is registered.
     */
    NOT_FOUND,

    /**
     * The tool's initialize hook failed. The tool stays uninitialized so a later
     * call can try again.
     */
    INITIALIZATION_FAILED,

    /**
     * The tool body threw an exception or returned nothing.
     */
    EXECUTION_FAILED,

    /**
     * The reassembled argument string of a tool call was not valid JSON.
     */
    PARSE_FAILED,

    /**
     * User denied confirmation for a tool action.
     */
    CONFIRMATION_DENIED,

    /**
     * Tool action was blocked by policy (for example a blocked shell command or a
     * path outside the workspace).
     */
    POLICY_DENIED,

    /**
     * The tool ran and returned a failed result on its own.
     */
    TOOL_REPORTED
}
