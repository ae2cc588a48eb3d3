package com.linkchex.core.util;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 실행 단위 취소 신호: 명시적 cancel() 또는 선택적 기한(deadline).
 * 레이트리미터 대기, 슬롯 대기, 네트워크 호출, 백오프 대기가 모두 이 신호를 본다.
 */
public final class RunSignal {

    /** 블로킹 대기를 쪼개는 단위. 취소 반응 시간의 상한이 된다. */
    public static final long SLICE_MS = 25;

    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final boolean hasDeadline;
    private final long deadlineNanos;
    private final RunSignal parent;            // 부모가 취소되면 함께 취소된 것으로 본다

    private RunSignal(Duration timeout, RunSignal parent) {
        this.parent = parent;
        this.hasDeadline = (timeout != null);
        this.deadlineNanos = hasDeadline ? System.nanoTime() + timeout.toNanos() : 0L;
    }

    /** 기한 없는 신호(cancel()로만 취소) */
    public static RunSignal create() { return new RunSignal(null, null); }

    /** timeout이 null이면 기한 없음 */
    public static RunSignal withTimeout(Duration timeout) { return new RunSignal(timeout, null); }

    /** 이 신호에 묶인 하위 신호. 자기 기한(null이면 없음)과 부모 취소를 모두 본다. */
    public RunSignal child(Duration timeout) { return new RunSignal(timeout, this); }

    public void cancel() { cancelled.set(true); }

    public boolean isCancelled() {
        return cancelled.get()
                || (hasDeadline && System.nanoTime() - deadlineNanos >= 0)
                || (parent != null && parent.isCancelled());
    }

    /** 남은 시간. 기한이 없으면 null */
    public Duration remaining() {
        Duration own = hasDeadline ? Duration.ofNanos(Math.max(0L, deadlineNanos - System.nanoTime())) : null;
        Duration up = (parent != null) ? parent.remaining() : null;
        if (own == null) return up;
        if (up == null) return own;
        return own.compareTo(up) <= 0 ? own : up;
    }

    /** d와 남은 시간 중 짧은 쪽(최소 1ms) */
    public Duration cap(Duration d) {
        Duration left = remaining();
        if (left == null || left.compareTo(d) >= 0) return d;
        return left.isZero() ? Duration.ofMillis(1) : left;
    }

    /**
     * 최대 d만큼 잔다. 취소되면 즉시 false를 반환한다.
     * @return 끝까지 잤으면 true
     */
    public boolean sleep(Duration d) throws InterruptedException {
        long end = System.nanoTime() + Math.max(0L, d.toNanos());
        while (true) {
            if (isCancelled()) return false;
            long leftMs = (end - System.nanoTime()) / 1_000_000L;
            if (leftMs <= 0) return true;
            Thread.sleep(Math.min(leftMs, SLICE_MS));
        }
    }
}
