package com.linkchex.cli;

import com.linkchex.core.model.Classification;
import com.linkchex.core.model.LinkResult;
import com.linkchex.core.util.ProgressListener;

import java.io.PrintStream;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** stderr 한 줄 진행률. 출력 빈도는 100ms당 한 번으로 제한. */
final class ProgressPrinter implements ProgressListener {
    private static final long MIN_INTERVAL_NANOS = 100_000_000L;

    private final PrintStream err;
    private final AtomicInteger broken = new AtomicInteger(0);
    private final AtomicLong lastPrint = new AtomicLong(0);

    ProgressPrinter(PrintStream err) {
        this.err = err;
    }

    @Override
    public void onResult(LinkResult result, long linksDone, int pagesDone, int pagesTotal) {
        if (result.getClassification() == Classification.BROKEN) broken.incrementAndGet();
        long now = System.nanoTime();
        long prev = lastPrint.get();
        if (now - prev < MIN_INTERVAL_NANOS || !lastPrint.compareAndSet(prev, now)) return;
        synchronized (err) {
            err.printf("\rPages %d/%d  links %d  broken %d", pagesDone, pagesTotal, linksDone, broken.get());
            err.flush();
        }
    }

    void finish(long linksDone, int pagesTotal) {
        synchronized (err) {
            err.printf("\rPages %d/%d  links %d  broken %d%n", pagesTotal, pagesTotal, linksDone, broken.get());
            err.flush();
        }
    }
}
