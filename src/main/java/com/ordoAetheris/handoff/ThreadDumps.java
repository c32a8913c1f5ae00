package com.ordoAetheris.handoff;

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadInfo;
import java.lang.management.ThreadMXBean;

/**
 * Thread dump text for timeout diagnostics.
 */
final class ThreadDumps {

    private ThreadDumps() {
    }

    static String dump() {
        ThreadMXBean mx = ManagementFactory.getThreadMXBean();
        StringBuilder out = new StringBuilder();
        for (ThreadInfo ti : mx.dumpAllThreads(true, true)) {
            out.append(ti);
        }
        long[] dead = mx.findDeadlockedThreads();
        if (dead != null && dead.length > 0) {
            out.append("=== DEADLOCK DETECTED ===").append(System.lineSeparator());
            for (ThreadInfo ti : mx.getThreadInfo(dead, true, true)) out.append(ti);
        }
        return out.toString();
    }
}
