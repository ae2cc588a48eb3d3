package com.linkchex.core.util;

import java.time.Duration;

/** 재시도 백오프 대기 훅(테스트에서 가짜 구현 주입). */
@FunctionalInterface
public interface Sleeper {
    /** @return 끝까지 대기했으면 true, 취소로 중단됐으면 false */
    boolean sleep(Duration d, RunSignal signal) throws InterruptedException;
}
