package me.golemcore.runtime.infrastructure.lifecycle;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.runtime.domain.loop.CancellationToken;
import me.golemcore.runtime.domain.loop.DispatchResult;
import me.golemcore.runtime.domain.loop.EventDispatcher;
import me.golemcore.runtime.domain.loop.HandlerRegistry;
import me.golemcore.runtime.infrastructure.config.RuntimeProperties;
import me.golemcore.runtime.port.outbound.EventSourcePort;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Starts the feed subscription and the {@code event-dispatcher} thread once
 * the context is up, and stops them in order on shutdown: cancel the token,
 * let the event in flight finish, then unsubscribe.
 *
 * <p>
 * When the dispatcher stops on its own because of an unclaimed tool, the
 * process exits with {@link DispatchResult#exitCode()}.
 */
@Component
@Slf4j
public class DispatcherLifecycle implements SmartLifecycle {

    private static final long JOIN_TIMEOUT_MILLIS = 30_000;

    private final EventDispatcher dispatcher;
    private final HandlerRegistry registry;
    private final EventSourcePort eventSource;
    private final RuntimeShutdownService shutdownService;
    private final Duration sleepIfIdle;

    private volatile CancellationToken token;
    private volatile Thread dispatcherThread;
    private volatile DispatchResult lastResult;

    public DispatcherLifecycle(EventDispatcher dispatcher, HandlerRegistry registry, EventSourcePort eventSource,
            RuntimeShutdownService shutdownService, RuntimeProperties properties) {
        this.dispatcher = dispatcher;
        this.registry = registry;
        this.eventSource = eventSource;
        this.shutdownService = shutdownService;
        this.sleepIfIdle = properties.getDispatcher().getSleepIfIdle();
    }

    @Override
    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        CancellationToken newToken = new CancellationToken();
        token = newToken;
        eventSource.start(registry.getSubscribedKinds(), registry.getToolDefinitions());

        Thread thread = new Thread(() -> runLoop(newToken), "event-dispatcher");
        thread.setDaemon(false);
        dispatcherThread = thread;
        thread.start();
    }

    @Override
    public synchronized void stop() {
        CancellationToken current = token;
        Thread thread = dispatcherThread;
        if (current == null || thread == null) {
            return;
        }
        log.info("[Dispatcher] Stopping");
        current.cancel();
        if (thread != Thread.currentThread()) {
            try {
                thread.join(JOIN_TIMEOUT_MILLIS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            if (thread.isAlive()) {
                log.warn("[Dispatcher] Thread did not stop within {}ms", JOIN_TIMEOUT_MILLIS);
            }
        }
        eventSource.close();
        dispatcherThread = null;
    }

    @Override
    public boolean isRunning() {
        Thread thread = dispatcherThread;
        return thread != null && thread.isAlive();
    }

    public DispatchResult getLastResult() {
        return lastResult;
    }

    void runLoop(CancellationToken loopToken) {
        DispatchResult result;
        try {
            result = dispatcher.run(sleepIfIdle, loopToken);
        } finally {
            eventSource.close();
        }
        lastResult = result;
        if (result == DispatchResult.FATAL_UNREGISTERED) {
            shutdownService.exit(result.exitCode());
        }
    }
}
