package me.golemcore.agent;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Agent.
 *
 * <p>
 * GolemCore Agent is a terminal assistant built with Spring Boot that lets a
 * language model call tools against the local machine (files, commands,
 * search) and feeds the results back into the conversation.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → ConsoleChatRunner, CommandRouter
 * Domain Layer       → ToolLoopSystem, ToolRegistry, Services
 * Infrastructure     → LLM/Confirmation Adapters, Plugins
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code agent.*}
 * prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AgentApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(AgentApplication.class, args)));
    }

}
