package com.linkchex.core.api;

import com.linkchex.core.model.Reference;

import java.nio.charset.Charset;
import java.util.List;

/** HTML 한 페이지 → 문서 순서대로의 참조 목록. */
public interface IReferenceExtractor {
    /**
     * @param html    페이지 본문
     * @param charset Content-Type에서 얻은 문자셋(null이면 파서가 판단)
     * @param pageUrl 상대 경로 해석 기준
     * @throws IllegalArgumentException 파싱 불가
     */
    List<Reference> extract(byte[] html, Charset charset, String pageUrl);
}
