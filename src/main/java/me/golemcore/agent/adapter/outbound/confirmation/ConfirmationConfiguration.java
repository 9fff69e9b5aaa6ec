package me.golemcore.agent.adapter.outbound.confirmation;

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

import me.golemcore.agent.adapter.inbound.cli.ConsoleIO;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import me.golemcore.agent.port.outbound.ConfirmationPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the confirmation channel: the terminal prompt for interactive
 * sessions, auto-approval for headless runs or when
 * {@code agent.cli.auto-approve} is set.
 */
@Configuration
@Slf4j
public class ConfirmationConfiguration {

    @Bean
    public ConfirmationPort confirmationPort(AgentProperties properties, ConsoleIO console) {
        AgentProperties.CliProperties cli = properties.getCli();
        boolean headless = cli.getPrompt() != null && !cli.getPrompt().isBlank();
        if (cli.isAutoApprove() || headless) {
            log.info("[Confirmation] Using auto-approve (headless: {})", headless);
            return new AutoApproveConfirmationAdapter();
        }
        return new ConsoleConfirmationAdapter(console);
    }
}
