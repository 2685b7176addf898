package com.wildfire.resolution.core;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Thread pools used to time-box stage work. Threads are daemons so an abandoned
 * attempt never keeps the JVM alive.
 */
public final class DaemonThreads {

    private DaemonThreads() {
    }

    public static ExecutorService newCachedPool(String namePrefix) {
        return Executors.newCachedThreadPool(factory(namePrefix));
    }

    public static ThreadFactory factory(String namePrefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, namePrefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    /**
     * Stops accepting work and waits briefly for running tasks before forcing shutdown.
     */
    public static void shutdown(ExecutorService executor) {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(1, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
