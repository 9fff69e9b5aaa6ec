package me.golemcore.agent.adapter.inbound.cli;

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

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;

/**
 * Shared terminal handle. The chat loop and the confirmation prompt read from
 * the same input, so every access goes through this class.
 */
@Component
public class ConsoleIO {

    private final BufferedReader reader;
    private final PrintWriter writer;

    @Autowired
    public ConsoleIO() {
        this(new InputStreamReader(System.in, StandardCharsets.UTF_8),
                new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
    }

    // Visible for testing
    public ConsoleIO(Reader input, Writer output) {
        this.reader = input instanceof BufferedReader buffered ? buffered : new BufferedReader(input);
        this.writer = new PrintWriter(output, true);
    }

    /**
     * Prints the prompt and reads one line.
     *
     * @return the line without its terminator, or {@code null} at end of input
     */
    public synchronized String readLine(String prompt) {
        if (prompt != null && !prompt.isEmpty()) {
            writer.print(prompt);
            writer.flush();
        }
        try {
            return reader.readLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read from console", e);
        }
    }

    public void print(String text) {
        writer.print(text);
        writer.flush();
    }

    public void println(String text) {
        writer.println(text);
    }

    public void println() {
        writer.println();
    }
}
