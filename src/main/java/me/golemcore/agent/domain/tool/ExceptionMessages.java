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

/**
 * Extracts a readable message from an exception chain.
 */
public final class ExceptionMessages {

    private ExceptionMessages() {
    }

    /**
     * Message of the deepest cause, or its class name when the message is blank.
     */
    public static String rootMessage(Throwable error) {
        if (error == null) {
            return "unknown";
        }

        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null) {
            if (cause.equals(cursor)) {
                break;
            }
            cursor = cause;
            cause = cursor.getCause();
        }

        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }
}
