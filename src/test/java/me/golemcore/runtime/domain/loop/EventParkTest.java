package me.golemcore.runtime.domain.loop;

import me.golemcore.runtime.domain.model.FeedEvent;
import me.golemcore.runtime.domain.model.FeedEventKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EventParkTest {

    private static final Duration NO_WAIT = Duration.ofMillis(1);

    private EventPark park;

    @BeforeEach
    void setUp() {
        park = new EventPark();
    }

    private static FeedEvent event(String conversationId, long marker) {
        return FeedEvent.builder()
                .kind(FeedEventKind.MESSAGE_APPENDED)
                .conversationId(conversationId)
                .sequenceMarker(marker)
                .build();
    }

    @Test
    void shouldReturnEventsInArrivalOrder() throws InterruptedException {
        park.submit(event("c1", 1));
        park.submit(event("c2", 1));
        park.submit(event("c1", 2));

        assertEquals(1, park.poll(NO_WAIT).sequenceMarker());
        assertEquals("c2", park.poll(NO_WAIT).conversationId());
        assertEquals(2, park.poll(NO_WAIT).sequenceMarker());
        assertNull(park.poll(NO_WAIT));
    }

    @Test
    void shouldDropDuplicateMarkerOfSameConversation() {
        assertTrue(park.submit(event("c1", 7)));
        assertFalse(park.submit(event("c1", 7)));

        assertEquals(1, park.size());
    }

    @Test
    void shouldAcceptSameMarkerFromDifferentSources() {
        assertTrue(park.submit(event("c1", 7)));
        assertTrue(park.submit(event("c2", 7)));
        assertTrue(park.submit(event(null, 7)));

        assertEquals(3, park.size());
    }

    @Test
    void shouldNotDeduplicateInternalOrUnmarkedEvents() {
        FeedEvent completed = FeedEvent.builder()
                .kind(FeedEventKind.TOOL_COMPLETED)
                .conversationId("c1")
                .sequenceMarker(-1)
                .build();

        assertTrue(park.submit(completed));
        assertTrue(park.submit(completed));
        assertTrue(park.submit(event("c1", -1)));
        assertTrue(park.submit(event("c1", -1)));

        assertEquals(4, park.size());
    }

    @Test
    void shouldIgnoreNullEvent() {
        assertFalse(park.submit(null));
        assertTrue(park.isEmpty());
    }

    @Test
    void shouldReturnNullWhenNothingArrivesInTime() throws InterruptedException {
        long start = System.nanoTime();

        assertNull(park.poll(Duration.ofMillis(50)));

        assertTrue(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start) >= 40);
    }

    @Test
    void shouldForgetOldestMarkersBeyondLimit() {
        for (int i = 0; i <= EventPark.SEEN_MARKERS_PER_SOURCE; i++) {
            assertTrue(park.submit(event("c1", i)));
        }

        // marker 0 was evicted, the most recent one is still known
        assertTrue(park.submit(event("c1", 0)));
        assertFalse(park.submit(event("c1", EventPark.SEEN_MARKERS_PER_SOURCE)));
    }

    @Test
    void shouldForgetLeastRecentlyActiveSourceBeyondLimit() {
        assertTrue(park.submit(event("first", 1)));
        for (int i = 0; i < EventPark.MAX_SOURCES; i++) {
            assertTrue(park.submit(event("c" + i, 1)));
        }

        assertEquals(EventPark.MAX_SOURCES, park.trackedSourceCount());
        // the oldest source was dropped together with its markers
        assertTrue(park.submit(event("first", 1)));
        assertFalse(park.submit(event("c" + (EventPark.MAX_SOURCES - 1), 1)));
    }

    @Test
    void shouldKeepRecentlyActiveSourceWhenOthersAreEvicted() {
        assertTrue(park.submit(event("busy", 1)));
        for (int i = 0; i < EventPark.MAX_SOURCES; i++) {
            if (i % 1000 == 0) {
                park.submit(event("busy", i + 2));
            }
            park.submit(event("c" + i, 1));
        }

        assertFalse(park.submit(event("busy", 1)));
    }

    @Test
    void shouldKeepPerConversationOrderWithConcurrentProducers() throws InterruptedException {
        int producers = 4;
        int perProducer = 500;
        ExecutorService executor = Executors.newFixedThreadPool(producers);
        for (int p = 0; p < producers; p++) {
            String conversationId = "c" + p;
            executor.submit(() -> {
                for (int i = 0; i < perProducer; i++) {
                    park.submit(event(conversationId, i));
                }
            });
        }
        executor.shutdown();
        assertTrue(executor.awaitTermination(10, TimeUnit.SECONDS));

        Map<String, List<Long>> seen = new HashMap<>();
        FeedEvent next;
        while ((next = park.poll(NO_WAIT)) != null) {
            seen.computeIfAbsent(next.conversationId(), k -> new ArrayList<>()).add(next.sequenceMarker());
        }

        assertEquals(producers, seen.size());
        for (List<Long> markers : seen.values()) {
            assertEquals(perProducer, markers.size());
            for (int i = 0; i < markers.size(); i++) {
                assertEquals(i, markers.get(i));
            }
        }
    }
}
