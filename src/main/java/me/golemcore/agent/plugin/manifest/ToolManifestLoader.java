package me.golemcore.agent.plugin.manifest;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads the tool discovery manifest. A missing or unreadable manifest means
 * "no external tools"; the built-in tools apply either way.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ToolManifestLoader {

    private final ObjectMapper objectMapper;

    public Optional<ToolManifest> load(Path manifestPath) {
        if (manifestPath == null || !Files.isRegularFile(manifestPath)) {
            log.debug("[Plugins] No tool manifest at {}", manifestPath);
            return Optional.empty();
        }
        try {
            ToolManifest manifest = objectMapper.readValue(manifestPath.toFile(), ToolManifest.class);
            if (manifest == null || manifest.getTools() == null) {
                log.warn("[Plugins] Manifest {} has no tools list", manifestPath);
                return Optional.empty();
            }
            log.info("[Plugins] Found manifest {} (version {}) with {} entries",
                    manifestPath, manifest.getVersion(), manifest.getTools().size());
            return Optional.of(manifest);
        } catch (IOException e) {
            log.warn("[Plugins] Failed to read manifest {}: {}", manifestPath, e.getMessage());
            return Optional.empty();
        }
    }
}
