package com.spiderstream.crawl.stream;

import com.spiderstream.crawl.error.CrawlException;
import com.spiderstream.crawl.model.SpiderReport;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Handle on one running crawl. Records and errors arrive on two independent channels; both are closed together
 * when the session ends, which is the only completion signal. Consumers must keep reading both.
 */
public class CrawlSession {
    private static final Duration DRAIN_POLL = Duration.ofMillis(25);

    private final String id;
    private final ReportChannel<SpiderReport> reports;
    private final ReportChannel<CrawlException> errors;
    private final AtomicReference<SessionState> state = new AtomicReference<>(SessionState.PROVISIONING);
    private final CountDownLatch closed = new CountDownLatch(1);
    private volatile boolean cancelled;

    public CrawlSession(String id, int reportCapacity, int errorCapacity) {
        this.id = id;
        this.reports = new ReportChannel<>(reportCapacity);
        this.errors = new ReportChannel<>(errorCapacity);
    }

    public String id() {
        return id;
    }

    public ReportChannel<SpiderReport> reports() {
        return reports;
    }

    public ReportChannel<CrawlException> errors() {
        return errors;
    }

    public SessionState state() {
        return state.get();
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Stops the session: no new request is sent and no new record is produced. Requests already on the wire
     * finish, then both channels close. No effect once the session is closed.
     */
    public void cancel() {
        cancelled = true;
        state.getAndUpdate(current -> current == SessionState.CLOSED ? SessionState.CLOSED : SessionState.CANCELLED);
    }

    public boolean isClosed() {
        return closed.getCount() == 0;
    }

    public boolean awaitClosed(Duration timeout) throws InterruptedException {
        return closed.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    /**
     * Reads both channels on the calling thread until the session is closed and everything was consumed.
     */
    public void drain(Consumer<SpiderReport> reportConsumer, Consumer<CrawlException> errorConsumer)
        throws InterruptedException {
        while (true) {
            SpiderReport report = reports.poll(DRAIN_POLL);
            if (report != null) {
                reportConsumer.accept(report);
            }
            CrawlException error;
            while ((error = errors.poll(Duration.ZERO)) != null) {
                errorConsumer.accept(error);
            }
            if (reports.isDrained() && errors.isDrained()) {
                return;
            }
        }
    }

    /**
     * Orchestrator side: provisioning succeeded.
     */
    public void markRunning() {
        state.compareAndSet(SessionState.PROVISIONING, SessionState.RUNNING);
    }

    /**
     * Orchestrator side: no more frontier input.
     */
    public void markDraining() {
        state.compareAndSet(SessionState.RUNNING, SessionState.DRAINING);
    }

    /**
     * Orchestrator side: closes both channels. A cancelled session keeps reporting {@link SessionState#CANCELLED}.
     */
    public void close() {
        state.getAndUpdate(current -> current == SessionState.CANCELLED ? SessionState.CANCELLED : SessionState.CLOSED);
        reports.close();
        errors.close();
        closed.countDown();
    }
}
