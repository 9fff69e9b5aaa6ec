package me.golemcore.agent.infrastructure.http;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.agent.infrastructure.config.AgentProperties;
import okhttp3.ConnectionPool;
import okhttp3.Interceptor;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Shared {@link OkHttpClient} for the completion provider.
 *
 * <p>
 * {@code agent.http.read-timeout} bounds the pause between two streamed
 * chunks, so no overall call timeout is set: a long streamed answer is fine as
 * long as tokens keep arriving. Every request carries the agent's
 * {@code User-Agent} and is logged at debug level without headers.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class OkHttpConfig {

    static final String USER_AGENT = "golemcore-agent";

    private final AgentProperties properties;

    @Bean
    public OkHttpClient okHttpClient() {
        AgentProperties.HttpProperties http = properties.getHttp();
        ConnectionPool pool = new ConnectionPool(http.getMaxIdleConnections(),
                http.getKeepAliveDuration(), TimeUnit.MILLISECONDS);

        return new OkHttpClient.Builder()
                .connectTimeout(Duration.ofMillis(http.getConnectTimeout()))
                .readTimeout(Duration.ofMillis(http.getReadTimeout()))
                .writeTimeout(Duration.ofMillis(http.getWriteTimeout()))
                .callTimeout(Duration.ZERO)
                .connectionPool(pool)
                .addInterceptor(OkHttpConfig::identifyAndLog)
                .build();
    }

    static Response identifyAndLog(Interceptor.Chain chain) throws IOException {
        Request request = chain.request().newBuilder()
                .header("User-Agent", USER_AGENT)
                .build();
        long start = System.nanoTime();
        Response response = chain.proceed(request);
        log.debug("[HTTP] {} {} -> {} in {} ms", request.method(), request.url().encodedPath(), response.code(),
                (System.nanoTime() - start) / 1_000_000);
        return response;
    }
}
