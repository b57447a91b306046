package com.changelab.mentor;

import com.changelab.mentor.project.ProjectEventStream;
import com.changelab.mentor.project.ProjectStore;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
class ProjectEventStreamTest {
    @Autowired
    private ProjectEventStream eventStream;

    @Autowired
    private ProjectStore store;

    @Test
    void slowClientDoesNotHoldUpWrites() throws Exception {
        String id = store.create("gaming");
        CountDownLatch release = new CountDownLatch(1);
        CountDownLatch delivered = new CountDownLatch(2);
        AtomicInteger sent = new AtomicInteger();
        SseEmitter slowClient = new SseEmitter(0L) {
            @Override
            public void send(SseEventBuilder builder) throws IOException {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                sent.incrementAndGet();
                delivered.countDown();
            }
        };

        eventStream.attach(id, slowClient);
        var committed = assertTimeoutPreemptively(Duration.ofSeconds(2),
                () -> store.updatePartial(id, Map.of("chosenProblem", "Loot boxes target kids")));
        assertEquals(2, committed.revision());
        assertEquals(0, sent.get());

        release.countDown();
        assertTrue(delivered.await(5, TimeUnit.SECONDS));
        assertEquals(2, sent.get());
    }
}
