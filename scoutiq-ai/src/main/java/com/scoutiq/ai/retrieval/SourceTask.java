package com.scoutiq.ai.retrieval;

import com.scoutiq.ai.model.RawResult;

import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A source query that records when a pool thread picked it up, so its timeout can be measured from
 * the start of execution rather than from submission.
 */
final class SourceTask implements Callable<List<RawResult>> {

    private final Callable<List<RawResult>> query;
    private final CountDownLatch started = new CountDownLatch(1);
    private volatile long startedAtNanos;

    SourceTask(Callable<List<RawResult>> query) {
        this.query = query;
    }

    @Override
    public List<RawResult> call() throws Exception {
        startedAtNanos = System.nanoTime();
        started.countDown();
        return query.call();
    }

    /**
     * @return false if the task was still queued when the wait ran out
     */
    boolean awaitStart(long timeout, TimeUnit unit) throws InterruptedException {
        return started.await(timeout, unit);
    }

    long startedAtNanos() {
        return startedAtNanos;
    }
}
