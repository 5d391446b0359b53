package com.spiderstream.crawl.stream;

/**
 * PROVISIONING, RUNNING, DRAINING and CLOSED follow each other in order. CANCELLED replaces whichever of the first
 * three was current when the session was cancelled and is kept after the streams close.
 */
public enum SessionState {
    PROVISIONING,
    RUNNING,
    DRAINING,
    CANCELLED,
    CLOSED
}
