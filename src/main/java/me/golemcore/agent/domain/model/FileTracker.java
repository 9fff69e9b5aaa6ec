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

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers the content hash of every file read during the session so edits can
 * be refused when the model has not seen the current content.
 */
public class FileTracker {

    private final Map<Path, String> hashes = new ConcurrentHashMap<>();

    public void record(Path file, String content) {
        hashes.put(normalize(file), hash(content));
    }

    public boolean isTracked(Path file) {
        return hashes.containsKey(normalize(file));
    }

    public boolean matches(Path file, String content) {
        String known = hashes.get(normalize(file));
        return known != null && known.equals(hash(content));
    }

    public void forget(Path file) {
        hashes.remove(normalize(file));
    }

    private static Path normalize(Path file) {
        return file.toAbsolutePath().normalize();
    }

    private static String hash(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
