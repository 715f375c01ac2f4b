package com.playlistsync.sync;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class QueuedProgressPublisherTest {

    @Test
    void testDeliversInOrder() {
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        QueuedProgressPublisher publisher = new QueuedProgressPublisher((outcomes, i) -> seen.add(i), 100);
        for (int i = 0; i < 10; i++) {
            publisher.onProgress(List.of(), i);
        }
        publisher.close();

        assertEquals(List.of(0, 1, 2, 3, 4, 5, 6, 7, 8, 9), seen);
        assertEquals(0, publisher.droppedCount());
    }

    @Test
    void testDropsOldestWhenConsumerFallsBehind() throws Exception {
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        CountDownLatch started = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        QueuedProgressPublisher publisher = new QueuedProgressPublisher((outcomes, i) -> {
            if (i == 0) {
                started.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }
            seen.add(i);
        }, 2);

        publisher.onProgress(List.of(), 0);
        assertTrue(started.await(5, TimeUnit.SECONDS));
        for (int i = 1; i <= 4; i++) {
            publisher.onProgress(List.of(), i);
        }
        release.countDown();
        publisher.close();

        assertEquals(List.of(0, 3, 4), seen);
        assertEquals(2, publisher.droppedCount());
    }

    @Test
    void testFailingListenerDoesNotStopDelivery() {
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        QueuedProgressPublisher publisher = new QueuedProgressPublisher((outcomes, i) -> {
            if (i == 0) throw new IllegalStateException("listener bug");
            seen.add(i);
        }, 10);
        publisher.onProgress(List.of(), 0);
        publisher.onProgress(List.of(), 1);
        publisher.onProgress(List.of(), 2);
        publisher.close();

        assertEquals(List.of(1, 2), seen);
    }

    @Test
    void testIgnoresProgressAfterClose() {
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        QueuedProgressPublisher publisher = new QueuedProgressPublisher((outcomes, i) -> seen.add(i), 10);
        publisher.close();
        publisher.onProgress(List.of(), 7);

        assertTrue(seen.isEmpty());
    }
}
