package com.spiderstream.crawl.util;

/**
 * Counts in-flight units of work and lets a thread wait until none are left.
 */
public class IdleTracker {
    private int inflight;

    public synchronized void started() {
        inflight++;
    }

    public synchronized void finished() {
        inflight--;
        if (inflight < 0) {
            throw new IllegalStateException("finished() called more often than started()");
        }
        if (inflight == 0) {
            notifyAll();
        }
    }

    public synchronized boolean isIdle() {
        return inflight == 0;
    }

    public synchronized void waitUntilIdle() throws InterruptedException {
        while (inflight > 0) {
            wait();
        }
    }
}
