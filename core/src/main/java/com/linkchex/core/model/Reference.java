package com.linkchex.core.model;

import java.util.Objects;

/**
 * 페이지에서 추출된 참조 1건 (발견 위치마다 하나, 불변).
 *
 * @param url      절대 URL
 * @param kind     태그 종류
 * @param text     앵커 텍스트(a 태그 외에는 빈 문자열)
 * @param external 페이지와 다른 호스트를 가리키면 true
 */
public record Reference(String url, ReferenceKind kind, String text, boolean external) {
    public Reference {
        Objects.requireNonNull(url, "url");
        Objects.requireNonNull(kind, "kind");
        text = (text == null) ? "" : text;
    }

    public static Reference internal(String url, ReferenceKind kind) {
        return new Reference(url, kind, "", false);
    }
}
