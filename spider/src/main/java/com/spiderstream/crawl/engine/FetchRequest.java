package com.spiderstream.crawl.engine;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * An outbound request about to be sent. Request hooks may change its headers or abort it; an aborted request
 * never reaches the network.
 */
public final class FetchRequest {
    private final URI uri;
    private final int depth;
    private final Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
    private volatile boolean aborted;

    public FetchRequest(URI uri, int depth) {
        this.uri = uri;
        this.depth = depth;
    }

    public URI uri() {
        return uri;
    }

    public String url() {
        return uri.toString();
    }

    /**
     * 1 for seeds, parent depth + 1 for everything submitted from a hook.
     */
    public int depth() {
        return depth;
    }

    public synchronized void setHeader(String name, String value) {
        List<String> values = new ArrayList<>();
        values.add(value);
        headers.put(name, values);
    }

    public synchronized void addHeader(String name, String value) {
        headers.computeIfAbsent(name, ignored -> new ArrayList<>()).add(value);
    }

    public synchronized String header(String name) {
        List<String> values = headers.get(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

    public synchronized Map<String, List<String>> headers() {
        Map<String, List<String>> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        headers.forEach((name, values) -> copy.put(name, List.copyOf(values)));
        return Collections.unmodifiableMap(copy);
    }

    public void abort() {
        aborted = true;
    }

    public boolean isAborted() {
        return aborted;
    }

    @Override
    public String toString() {
        return "FetchRequest[" + uri + ", depth=" + depth + "]";
    }
}
