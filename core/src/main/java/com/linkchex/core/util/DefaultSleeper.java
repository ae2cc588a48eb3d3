package com.linkchex.core.util;

import java.time.Duration;

public final class DefaultSleeper implements Sleeper {
    @Override public boolean sleep(Duration d, RunSignal signal) throws InterruptedException {
        if (d == null || d.isZero() || d.isNegative()) return !signal.isCancelled();
        return signal.sleep(d);
    }
}
