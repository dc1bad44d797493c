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


package me.zenbot.adapter.inbound.console;

import me.zenbot.domain.loop.Agent;
import me.zenbot.domain.model.Event;
import me.zenbot.infrastructure.lifecycle.ShutdownSignal;
import me.zenbot.port.outbound.OutputPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

/**
 * Terminal channel: reads user lines on a background thread and renders agent
 * output on stdout.
 *
 * <p>
 * All writes hold {@link #consoleLock}. While the input thread is waiting at
 * the {@code > } prompt, any output first moves to a fresh line and the prompt
 * is printed again afterwards, so replies from the consumer thread do not run
 * into the user's typing.
 *
 * <p>
 * Input handling:
 * <ul>
 * <li>blank lines are ignored</li>
 * <li>{@code exit}, {@code quit} and end of input request shutdown</li>
 * <li>while the agent is busy a short notice is printed, and the message is
 * still queued</li>
 * </ul>
 */
@Component
@Slf4j
public class ConsoleChannelAdapter implements OutputPort {

    public static final String PROMPT = "> ";
    public static final String BUSY_MESSAGE = "I'm focusing on another task right now. I will get back to you ASAP!";
    private static final Set<String> EXIT_COMMANDS = Set.of("exit", "quit");

    private final InputStream in;
    private final PrintStream out;
    private final Object consoleLock = new Object();

    private volatile boolean inputActive = false;
    private volatile boolean running = false;
    private Thread inputThread;

    public ConsoleChannelAdapter() {
        this(System.in, System.out);
    }

    ConsoleChannelAdapter(InputStream in, PrintStream out) {
        this.in = in;
        this.out = out;
    }

    /**
     * Starts the input thread. Lines are enqueued on the given agent.
     */
    public void start(Agent agent, ShutdownSignal shutdownSignal) {
        if (running) {
            return;
        }
        running = true;
        inputThread = new Thread(() -> readLoop(agent, shutdownSignal), "console-input");
        inputThread.setDaemon(true);
        inputThread.start();
        log.info("[Console] Input thread started");
    }

    public void stop() {
        running = false;
        inputActive = false;
        if (inputThread != null) {
            inputThread.interrupt();
        }
        log.info("[Console] Stopped");
    }

    void readLoop(Agent agent, ShutdownSignal shutdownSignal) {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        try {
            while (running && !shutdownSignal.isShutdownRequested()) {
                showPrompt();
                String line = reader.readLine();
                inputActive = false;
                if (line == null) {
                    log.info("[Console] End of input");
                    break;
                }
                String text = line.strip();
                if (text.isEmpty()) {
                    continue;
                }
                if (EXIT_COMMANDS.contains(text.toLowerCase(Locale.ROOT))) {
                    break;
                }
                if (agent.isBusy()) {
                    emitLine(BUSY_MESSAGE);
                }
                agent.enqueueEvent(Event.userMessage(text));
            }
        } catch (IOException e) {
            log.error("[Console] Failed to read input", e);
        } finally {
            inputActive = false;
            running = false;
            shutdownSignal.requestShutdown();
        }
    }

    private void showPrompt() {
        synchronized (consoleLock) {
            out.print(PROMPT);
            out.flush();
            inputActive = true;
        }
    }

    private void emitLine(String text) {
        synchronized (consoleLock) {
            if (inputActive) {
                out.println();
            }
            out.println(text);
            if (inputActive) {
                out.print(PROMPT);
            }
            out.flush();
        }
    }

    // ==================== OutputPort ====================

    @Override
    public void emitText(String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        emitLine(text);
    }

    @Override
    public void emitStatus(String text) {
        if (text == null || text.isBlank()) {
            return;
        }
        emitLine(text);
    }

    @Override
    public void beginStream() {
        synchronized (consoleLock) {
            if (inputActive) {
                out.println();
            }
            out.flush();
        }
    }

    @Override
    public void emitStreamChunk(String chunk) {
        if (chunk == null || chunk.isEmpty()) {
            return;
        }
        synchronized (consoleLock) {
            out.print(chunk);
            out.flush();
        }
    }

    @Override
    public void endStream() {
        synchronized (consoleLock) {
            out.println();
            if (inputActive) {
                out.print(PROMPT);
            }
            out.flush();
        }
    }
}
