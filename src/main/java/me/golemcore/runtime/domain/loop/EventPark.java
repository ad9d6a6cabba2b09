package me.golemcore.runtime.domain.loop;

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
import me.golemcore.runtime.domain.model.FeedEvent;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Holding area between the event feed and the dispatcher.
 *
 * <p>
 * A single FIFO queue keeps arrival order, which is in particular the order
 * within each conversation. A {@code (source, sequence marker)} pair that was
 * already accepted is dropped, so a feed replay after reconnect does not
 * dispatch an event twice. Process-internal events and events without a
 * marker are never deduplicated. Markers are remembered for the
 * {@link #MAX_SOURCES} most recently active sources only.
 *
 * <p>
 * {@link #submit} is safe from any thread; {@link #poll} is called by the
 * dispatcher thread only.
 */
@Component
@Slf4j
public class EventPark {

    static final int SEEN_MARKERS_PER_SOURCE = 4096;
    static final int MAX_SOURCES = 10_000;

    private final BlockingQueue<FeedEvent> queue = new LinkedBlockingQueue<>();
    private final Map<String, Set<Long>> seenMarkers = new LinkedHashMap<>(16, 0.75f, true) {
        private static final long serialVersionUID = 1L;

        @Override
        protected boolean removeEldestEntry(Map.Entry<String, Set<Long>> eldest) {
            return size() > MAX_SOURCES;
        }
    };

    /**
     * Enqueues an event unless it is a duplicate.
     *
     * @return {@code true} if the event was accepted
     */
    public boolean submit(FeedEvent event) {
        if (event == null || event.kind() == null) {
            return false;
        }
        if (!event.kind().isInternal() && event.sequenceMarker() >= 0 && !markSeen(event)) {
            log.debug("[Park] Dropped duplicate {}", event.describe());
            return false;
        }
        queue.add(event);
        return true;
    }

    /**
     * Returns the oldest event, waiting at most {@code timeout}.
     *
     * @return the event, or {@code null} if none arrived in time
     */
    public FeedEvent poll(Duration timeout) throws InterruptedException {
        return queue.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }

    int trackedSourceCount() {
        synchronized (seenMarkers) {
            return seenMarkers.size();
        }
    }

    private boolean markSeen(FeedEvent event) {
        synchronized (seenMarkers) {
            Set<Long> seen = seenMarkers.computeIfAbsent(event.sourceKey(), key -> new LinkedHashSet<>());
            if (!seen.add(event.sequenceMarker())) {
                return false;
            }
            if (seen.size() > SEEN_MARKERS_PER_SOURCE) {
                Iterator<Long> oldest = seen.iterator();
                oldest.next();
                oldest.remove();
            }
            return true;
        }
    }
}
