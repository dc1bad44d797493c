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


package me.zenbot.infrastructure.lifecycle;

import me.zenbot.adapter.inbound.console.ConsoleChannelAdapter;
import me.zenbot.auto.ReminderPollScheduler;
import me.zenbot.domain.loop.Agent;
import me.zenbot.port.outbound.LlmPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Runs the single consumer loop on the main thread.
 *
 * <p>
 * Starts the console and the reminder poller as producers, then processes
 * queued events one at a time until shutdown is requested. Events still queued
 * at that point are processed once before the producers are stopped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AgentRunner implements CommandLineRunner {

    static final String BANNER = "ZenBot (type 'exit' to quit)";
    private static final long IDLE_WAIT_MS = 50;

    private final Agent agent;
    private final ConsoleChannelAdapter console;
    private final ReminderPollScheduler reminderPoller;
    private final ShutdownSignal shutdownSignal;

    @Override
    public void run(String... args) throws InterruptedException {
        logBackend();
        console.emitText(BANNER + System.lineSeparator());
        console.start(agent, shutdownSignal);
        reminderPoller.start();
        log.info("[Agent] Consumer loop started");
        try {
            runLoop();
        } finally {
            reminderPoller.shutdown();
            console.stop();
        }
        log.info("[Agent] Consumer loop stopped");
    }

    void logBackend() {
        LlmPort llmPort = agent.getLlmPort();
        log.info("[Agent] LLM backend: provider={}, model={}, streaming={}",
                llmPort.getProviderId(), llmPort.getCurrentModel(), llmPort.supportsStreaming());
        if (!llmPort.isAvailable()) {
            log.warn("[Agent] LLM backend '{}' is not available, replies will fail or be placeholders",
                    llmPort.getProviderId());
        }
    }

    void runLoop() throws InterruptedException {
        while (!shutdownSignal.isShutdownRequested()) {
            if (!agent.processNextQueuedEvent()) {
                shutdownSignal.await(IDLE_WAIT_MS, TimeUnit.MILLISECONDS);
            }
        }
        int remaining = agent.processQueuedEvents();
        if (remaining > 0) {
            log.info("[Agent] Processed {} queued event(s) after shutdown request", remaining);
        }
    }
}
