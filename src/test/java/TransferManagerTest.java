import com.ordoAetheris.handoff.HandoffDemo;
import com.ordoAetheris.handoff.ShutdownMode;
import com.ordoAetheris.handoff.TransferConfig;
import com.ordoAetheris.handoff.TransferException;
import com.ordoAetheris.handoff.TransferManager;
import com.ordoAetheris.handoff.TransferResult;
import com.ordoAetheris.handoff.TransferTimeoutException;
import com.ordoAetheris.handoff.container.ListSink;
import com.ordoAetheris.handoff.container.ListSource;
import com.ordoAetheris.handoff.container.Sink;
import com.ordoAetheris.handoff.container.Source;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Orchestrator: TransferManager<T>")
class TransferManagerTest {

    // ------------------------------ single producer/consumer ------------------------------

    @Nested
    @DisplayName("One producer, one consumer")
    class Spsc {

        @Test
        @DisplayName("[1,2,3], capacity 2 -> [1,2,3]")
        void transfersAllItems() throws Exception {
            for (ShutdownMode mode : ShutdownMode.values()) {
                ListSink<Integer> sink = run(List.of(1, 2, 3), config(2, 1, 1, mode));
                assertEquals(List.of(1, 2, 3), sink.items(), mode.name());
            }
        }

        @Test
        @DisplayName("[], capacity 2 -> [], workers finish promptly")
        void emptySource() throws Exception {
            for (ShutdownMode mode : ShutdownMode.values()) {
                TransferManager<Integer> manager = new TransferManager<>(config(2, 1, 1, mode));
                ListSink<Integer> sink = new ListSink<>();
                TransferResult result = manager.transfer(new ListSource<>(List.of()), sink);

                assertEquals(0, result.produced());
                assertEquals(0, result.consumed());
                assertTrue(result.elapsed().compareTo(Duration.ofSeconds(2)) < 0);
                assertEquals(List.of(), sink.items());
            }
        }

        @Test
        @DisplayName("[10,20,30], capacity 1 -> [10,20,30]")
        void capacityOne() throws Exception {
            assertEquals(List.of(10, 20, 30), run(List.of(10, 20, 30), config(1, 1, 1, ShutdownMode.BROADCAST)).items());
        }

        @Test
        @DisplayName("order preserved, no reordering")
        void orderPreserved() throws Exception {
            assertEquals(List.of(5, 4, 3, 2, 1), run(List.of(5, 4, 3, 2, 1), config(3, 1, 1, ShutdownMode.SYMMETRIC)).items());
        }

        @Test
        @DisplayName("buffer larger than the data")
        void bufferLargerThanData() throws Exception {
            assertEquals(List.of(1, 2, 3), run(List.of(1, 2, 3), config(10, 1, 1, ShutdownMode.BROADCAST)).items());
        }

        @Test
        @DisplayName("300 items, capacity 5: no loss, order kept")
        void largeVolume() throws Exception {
            List<Integer> data = range(0, 300);
            assertEquals(data, run(data, config(5, 1, 1, ShutdownMode.SYMMETRIC)).items());
        }

        @Test
        @DisplayName("pacing slows the workers down but changes nothing else")
        void pacedTransfer() throws Exception {
            List<Integer> data = range(0, 40);
            TransferConfig paced = TransferConfig.builder()
                    .capacity(3)
                    .pacing(Duration.ofMillis(1))
                    .build();
            assertEquals(data, run(data, paced).items());
        }

        @Test
        @DisplayName("sentinel never reaches the sink; result is balanced")
        void sentinelExcluded() throws Exception {
            ListSink<String> sink = new ListSink<>();
            TransferResult result = new TransferManager<String>(config(2, 1, 1, ShutdownMode.SYMMETRIC))
                    .transfer(new ListSource<>(List.of("7", "8")), sink);

            assertEquals(List.of("7", "8"), sink.items());
            assertEquals(2, result.produced());
            assertEquals(2, result.consumed());
            assertTrue(result.isBalanced());
        }
    }

    // ------------------------------ many producers/consumers ------------------------------

    @Nested
    @DisplayName("Multiple producers and consumers")
    class Mpmc {

        @Test
        @DisplayName("range(20), 2P + 2C, capacity 3 -> permutation, no duplicates")
        void twoByTwo() throws Exception {
            for (ShutdownMode mode : ShutdownMode.values()) {
                List<Integer> data = range(1, 21);
                assertPermutation(data, run(data, config(3, 2, 2, mode)).items());
            }
        }

        @Test
        @DisplayName("range(500), 10P + 10C, capacity 10 -> all 500, within timeout")
        void tenByTen() throws Exception {
            for (ShutdownMode mode : ShutdownMode.values()) {
                List<Integer> data = range(5000, 5500);
                TransferConfig cfg = TransferConfig.builder()
                        .capacity(10).producers(10).consumers(10).shutdownMode(mode)
                        .joinTimeout(Duration.ofSeconds(30))
                        .build();
                ListSink<Integer> sink = new ListSink<>();
                TransferResult result = new TransferManager<Integer>(cfg).transfer(new ListSource<>(data), sink);

                assertEquals(500, result.consumed());
                assertPermutation(data, sink.items());
            }
        }

        @Test
        @DisplayName("asymmetric counts under BROADCAST: 3P+1C, 1P+3C, 4P+2C, 2P+4C")
        void asymmetricCounts() throws Exception {
            int[][] shapes = {{3, 1}, {1, 3}, {4, 2}, {2, 4}};
            for (int[] shape : shapes) {
                List<Integer> data = range(100, 140);
                ListSink<Integer> sink = run(data, config(3, shape[0], shape[1], ShutdownMode.BROADCAST));
                assertPermutation(data, sink.items());
            }
        }

        @Test
        @DisplayName("repeated small runs never lose or duplicate items")
        void repeatedRuns() throws Exception {
            for (int r = 0; r < 50; r++) {
                List<Integer> data = range(0, 200);
                assertPermutation(data, run(data, config(2, 3, 5, ShutdownMode.BROADCAST)).items());
            }
        }
    }

    // ------------------------------------- failures -------------------------------------

    @Nested
    @DisplayName("Configuration, faults and timeouts")
    class Failures {

        @Test
        @DisplayName("SYMMETRIC shutdown with producers != consumers is rejected up front")
        void symmetricMismatchRejected() {
            assertThrows(IllegalArgumentException.class, () -> config(3, 2, 1, ShutdownMode.SYMMETRIC));
        }

        @Test
        @DisplayName("a manager runs exactly one transfer")
        void singleUse() throws Exception {
            TransferManager<Integer> manager = new TransferManager<>(TransferConfig.defaults());
            manager.transfer(new ListSource<>(List.of(1)), new ListSink<>());
            assertThrows(IllegalStateException.class,
                    () -> manager.transfer(new ListSource<>(List.of(1)), new ListSink<>()));
        }

        @Test
        @DisplayName("source fault -> TransferException with the fault as cause, no hang")
        void sourceFaultPropagates() {
            for (ShutdownMode mode : ShutdownMode.values()) {
                AtomicInteger calls = new AtomicInteger();
                Source<Integer> flaky = () -> {
                    int n = calls.incrementAndGet();
                    if (n == 5) throw new IllegalStateException("source broke");
                    return Optional.of(n);
                };
                TransferManager<Integer> manager = new TransferManager<>(config(2, 2, 2, mode));

                TransferException e = assertThrows(TransferException.class, () -> manager.transfer(flaky, new ListSink<>()));
                assertFalse(e instanceof TransferTimeoutException, mode.name());
                assertTrue(e.getCause() instanceof IllegalStateException, mode.name());
                assertEquals("source broke", e.getCause().getMessage());
            }
        }

        @Test
        @DisplayName("sink fault -> TransferException")
        void sinkFaultPropagates() {
            Sink<Integer> broken = item -> { throw new IllegalStateException("disk full"); };
            TransferManager<Integer> manager = new TransferManager<>(config(2, 1, 1, ShutdownMode.BROADCAST));

            TransferException e = assertThrows(TransferException.class,
                    () -> manager.transfer(new ListSource<>(range(0, 10)), broken));
            assertEquals("disk full", e.getCause().getMessage());
        }

        @Test
        @DisplayName("workers stuck past the join timeout -> TransferTimeoutException, not success")
        void stuckWorkersTimeOut() throws Exception {
            CountDownLatch release = new CountDownLatch(1);
            Sink<Integer> stuck = item -> {
                try {
                    release.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            };
            TransferConfig cfg = TransferConfig.builder()
                    .capacity(1)
                    .joinTimeout(Duration.ofMillis(300))
                    .build();
            TransferManager<Integer> manager = new TransferManager<>(cfg);

            try {
                TransferTimeoutException e = assertThrows(TransferTimeoutException.class,
                        () -> manager.transfer(new ListSource<>(range(0, 10)), stuck));
                assertTrue(e.getMessage().contains("consumer-1"), e.getMessage());
            } finally {
                release.countDown();
            }
        }

        @Test
        @DisplayName("null source or sink -> IllegalArgumentException")
        void nullCollaborators() {
            TransferManager<Integer> manager = new TransferManager<>(TransferConfig.defaults());
            assertThrows(IllegalArgumentException.class, () -> manager.transfer(null, new ListSink<>()));
            assertThrows(IllegalArgumentException.class, () -> manager.transfer(new ListSource<>(List.of(1)), null));
            assertThrows(IllegalArgumentException.class, () -> new TransferManager<Integer>(null));
        }
    }

    @Test
    @DisplayName("demo run moves every item")
    void demoRun() throws Exception {
        assertTrue(HandoffDemo.run(config(2, 2, 3, ShutdownMode.BROADCAST), 25));
    }

    // ------------------------------------- helpers -------------------------------------

    private static TransferConfig config(int capacity, int producers, int consumers, ShutdownMode mode) {
        return TransferConfig.builder()
                .capacity(capacity)
                .producers(producers)
                .consumers(consumers)
                .shutdownMode(mode)
                .joinTimeout(Duration.ofSeconds(10))
                .build();
    }

    private static <T> ListSink<T> run(List<T> data, TransferConfig cfg) throws Exception {
        ListSink<T> sink = new ListSink<>();
        TransferResult result = new TransferManager<T>(cfg).transfer(new ListSource<>(data), sink);
        assertTrue(result.isBalanced(), result.toString());
        assertEquals(data.size(), result.produced());
        return sink;
    }

    private static List<Integer> range(int fromInclusive, int toExclusive) {
        List<Integer> out = new ArrayList<>();
        for (int i = fromInclusive; i < toExclusive; i++) out.add(i);
        return out;
    }

    private static void assertPermutation(List<Integer> expected, List<Integer> actual) {
        assertEquals(expected.size(), actual.size(), "item count");
        List<Integer> sorted = new ArrayList<>(actual);
        sorted.sort(null);
        assertEquals(expected, sorted, "items mismatch or duplicates");
    }
}
