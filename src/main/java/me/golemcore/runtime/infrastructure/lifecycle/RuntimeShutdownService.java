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
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.stereotype.Service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Closes the Spring context and exits the JVM with a given code. Runs on its
 * own non-daemon thread, since closing the context stops the thread that asked
 * for the exit.
 */
@Service
@Slf4j
public class RuntimeShutdownService {

    private final ApplicationContext applicationContext;
    private final AtomicBoolean exiting = new AtomicBoolean(false);

    public RuntimeShutdownService(ApplicationContext applicationContext) {
        this.applicationContext = applicationContext;
    }

    public void exit(int code) {
        if (!exiting.compareAndSet(false, true)) {
            return;
        }
        log.warn("Runtime exiting with code {}", code);
        Thread exitThread = new Thread(() -> {
            int exitCode = SpringApplication.exit(applicationContext, () -> code);
            System.exit(exitCode);
        }, "runtime-exit-thread");
        exitThread.setDaemon(false);
        exitThread.start();
    }

    public boolean isExiting() {
        return exiting.get();
    }
}
