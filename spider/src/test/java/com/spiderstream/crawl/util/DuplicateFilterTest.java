package com.spiderstream.crawl.util;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class DuplicateFilterTest {

    @Test
    void secondInsertOfSameKeyReportsDuplicate() {
        DuplicateFilter filter = new DuplicateFilter();

        assertThat(filter.testAndInsert("https://x.test/a")).isFalse();
        assertThat(filter.testAndInsert("https://x.test/a")).isTrue();
        assertThat(filter.testAndInsert("https://x.test/b")).isFalse();
        assertThat(filter.size()).isEqualTo(2);
        assertThat(filter.contains("https://x.test/b")).isTrue();
    }

    @Test
    void exactlyOneConcurrentCallerWinsEachKey() throws Exception {
        DuplicateFilter filter = new DuplicateFilter();
        int threads = 8;
        int keys = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Integer>> results = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                Callable<Integer> worker = () -> {
                    start.await();
                    int inserted = 0;
                    for (int k = 0; k < keys; k++) {
                        if (!filter.testAndInsert("key-" + k)) {
                            inserted++;
                        }
                    }
                    return inserted;
                };
                results.add(executor.submit(worker));
            }
            start.countDown();

            int total = 0;
            for (Future<Integer> result : results) {
                total += result.get();
            }
            assertThat(total).isEqualTo(keys);
            assertThat(filter.size()).isEqualTo(keys);
        } finally {
            executor.shutdownNow();
        }
    }
}
