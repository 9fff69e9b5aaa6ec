package me.golemcore.agent.domain.exception;

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
 * Transport or API failure of the completion provider. Propagated to the
 * caller of the turn.
 */
public class LlmProviderException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int statusCode;

    public LlmProviderException(String message) {
        this(message, -1, null);
    }

    public LlmProviderException(String message, Throwable cause) {
        this(message, -1, cause);
    }

    public LlmProviderException(String message, int statusCode, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status returned by the provider, or -1 when no response was received.
     */
    public int getStatusCode() {
        return statusCode;
    }
}
