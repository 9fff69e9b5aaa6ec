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

import java.util.EnumSet;
import java.util.Set;

/**
 * Session-scoped confirmation shortcuts: groups approved with "always" and the
 * dangerous bypass switch that skips every prompt.
 */
public class ConfirmationFlags {

    private final Set<ConfirmationGroup> approvedGroups = EnumSet.noneOf(ConfirmationGroup.class);
    private boolean bypassAll;

    public synchronized boolean isApproved(ConfirmationGroup group) {
        return bypassAll || approvedGroups.contains(group);
    }

    public synchronized void approveForSession(ConfirmationGroup group) {
        approvedGroups.add(group);
    }

    public synchronized void setBypassAll(boolean bypassAll) {
        this.bypassAll = bypassAll;
    }

    public synchronized boolean isBypassAll() {
        return bypassAll;
    }

    public synchronized void reset() {
        approvedGroups.clear();
        bypassAll = false;
    }
}
