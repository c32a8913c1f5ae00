package com.ordoAetheris.handoff;

import com.ordoAetheris.handoff.container.ListSink;
import com.ordoAetheris.handoff.container.ListSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Moves the integers 1..N from a source list to a sink list through the bounded buffer.
 *
 * Pipeline shape comes from {@link TransferConfig#load()}; N from {@code -Dhandoff.demo.items} (default 25).
 * Run with {@code -Dorg.slf4j.simpleLogger.defaultLogLevel=debug} to trace every put/get.
 */
public class HandoffDemo {

    private static final Logger log = LoggerFactory.getLogger(HandoffDemo.class);

    public static void main(String[] args) throws Exception {
        if (!run(TransferConfig.load(), Integer.getInteger("handoff.demo.items", 25))) {
            System.exit(1);
        }
    }

    public static boolean run(TransferConfig config, int items) throws InterruptedException {
        List<Integer> data = new ArrayList<>(items);
        for (int i = 1; i <= items; i++) data.add(i);

        ListSource<Integer> source = new ListSource<>(data);
        ListSink<Integer> sink = new ListSink<>();
        try {
            TransferResult result = new TransferManager<Integer>(config).transfer(source, sink);
            boolean complete = result.isBalanced() && sink.size() == items;
            if (complete) {
                log.info("All {} items transferred: {}", items, sink.items());
            } else {
                log.error("Item count mismatch: produced={} consumed={} stored={}",
                        result.produced(), result.consumed(), sink.size());
            }
            return complete;
        } catch (TransferTimeoutException e) {
            log.error("Transfer deadlocked: {}", e.getMessage());
            return false;
        } catch (TransferException e) {
            log.error("Transfer failed", e);
            return false;
        }
    }
}
