package com.linkchex.core.util;

import com.linkchex.core.model.LinkResult;

/**
 * 결과 1건이 만들어질 때마다 호출되는 관찰자. 스케줄링 로직과 분리된 진행률/UI 훅.
 * 여러 워커 스레드에서 동시에 호출될 수 있다.
 */
@FunctionalInterface
public interface ProgressListener {
    /**
     * @param result     방금 만들어진 결과
     * @param linksDone  지금까지 만들어진 결과 수
     * @param pagesDone  완료된 페이지 수
     * @param pagesTotal 전체 페이지 수
     */
    void onResult(LinkResult result, long linksDone, int pagesDone, int pagesTotal);

    ProgressListener NONE = (r, l, d, t) -> {};
}
