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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Process-wide stop flag. Set by the console on {@code exit}/EOF and by the
 * Spring context on close (SIGINT/SIGTERM).
 */
@Component
@Slf4j
public class ShutdownSignal {

    private final CountDownLatch latch = new CountDownLatch(1);

    public void requestShutdown() {
        if (latch.getCount() > 0) {
            log.info("Shutdown requested");
        }
        latch.countDown();
    }

    public boolean isShutdownRequested() {
        return latch.getCount() == 0;
    }

    /**
     * Waits up to the given time for a shutdown request.
     *
     * @return true if shutdown was requested
     */
    public boolean await(long timeout, TimeUnit unit) throws InterruptedException {
        return latch.await(timeout, unit);
    }

    @PreDestroy
    public void onContextClose() {
        requestShutdown();
    }
}
