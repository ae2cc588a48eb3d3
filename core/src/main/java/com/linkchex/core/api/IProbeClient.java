package com.linkchex.core.api;

import com.linkchex.core.model.ProbeOutcome;
import com.linkchex.core.util.RunSignal;

/** HTTP 프로브 최소 계약: 예외를 던지지 않고 항상 결과 레코드를 돌려준다. */
public interface IProbeClient extends AutoCloseable {

    /** 페이지 수집용(본문 포함) */
    ProbeOutcome get(String url, RunSignal signal);

    /** 참조 검증용(본문 없음) */
    ProbeOutcome head(String url, RunSignal signal);

    default ProbeOutcome get(String url) { return get(url, RunSignal.create()); }

    default ProbeOutcome head(String url) { return head(url, RunSignal.create()); }

    @Override default void close() {}
}
