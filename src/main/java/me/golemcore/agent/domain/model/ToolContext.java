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

import me.golemcore.agent.port.outbound.ConfirmationPort;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Per-session state handed to every tool invocation: working directory,
 * confirmation gate and flags, todo list, file tracker and free-form
 * attributes.
 *
 * <p>
 * One context is created per conversation session and passed down explicitly,
 * so isolated sessions never share mutable state.
 */
@Getter
public class ToolContext {

    private final String sessionId;
    @Getter(AccessLevel.NONE)
    private final AtomicReference<Path> workingDirectory;
    private final ConfirmationPort confirmationGate;
    private final ConfirmationFlags confirmationFlags;
    private final TodoList todoList;
    private final FileTracker fileTracker;
    private final Map<String, Object> attributes;
    @Getter(AccessLevel.NONE)
    private final Set<ConfirmationGroup> callApprovals;

    @Builder
    private ToolContext(String sessionId, Path workingDirectory, ConfirmationPort confirmationGate,
            ConfirmationFlags confirmationFlags, TodoList todoList, FileTracker fileTracker) {
        this.sessionId = sessionId != null ? sessionId : UUID.randomUUID().toString();
        Path initial = workingDirectory != null ? workingDirectory : Path.of("").toAbsolutePath();
        this.workingDirectory = new AtomicReference<>(initial.toAbsolutePath().normalize());
        this.confirmationGate = confirmationGate;
        this.confirmationFlags = confirmationFlags != null ? confirmationFlags : new ConfirmationFlags();
        this.todoList = todoList != null ? todoList : new TodoList();
        this.fileTracker = fileTracker != null ? fileTracker : new FileTracker();
        this.attributes = new ConcurrentHashMap<>();
        this.callApprovals = null;
    }

    private ToolContext(ToolContext session) {
        this.sessionId = session.sessionId;
        this.workingDirectory = session.workingDirectory;
        this.confirmationGate = session.confirmationGate;
        this.confirmationFlags = session.confirmationFlags;
        this.todoList = session.todoList;
        this.fileTracker = session.fileTracker;
        this.attributes = session.attributes;
        this.callApprovals = EnumSet.noneOf(ConfirmationGroup.class);
    }

    /**
     * View of this context for the attempts of one tool call. It shares all
     * session state and additionally remembers approvals given during the call,
     * so retries of an approved call do not prompt again.
     */
    public ToolContext forCall() {
        return new ToolContext(this);
    }

    public synchronized boolean isApprovedForCall(ConfirmationGroup group) {
        return callApprovals != null && callApprovals.contains(group);
    }

    public synchronized void approveForCall(ConfirmationGroup group) {
        if (callApprovals != null) {
            callApprovals.add(group);
        }
    }

    public Path getWorkingDirectory() {
        return workingDirectory.get();
    }

    public void setWorkingDirectory(Path directory) {
        workingDirectory.set(directory.toAbsolutePath().normalize());
    }

    /**
     * Resolves a user-supplied path against the working directory.
     */
    public Path resolvePath(String path) {
        Path candidate = Path.of(path == null || path.isBlank() ? "." : path);
        if (candidate.isAbsolute()) {
            return candidate.normalize();
        }
        return getWorkingDirectory().resolve(candidate).normalize();
    }
}
