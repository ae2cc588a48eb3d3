package com.linkchex.core.model;

import java.util.Locale;

/** 참조가 발견된 HTML 태그 종류. tag()는 리포트 표기용 원본 태그명. */
public enum ReferenceKind {
    ANCHOR("a"),
    IMAGE("img"),
    STYLESHEET("link"),
    SCRIPT("script");

    private final String tag;

    ReferenceKind(String tag) { this.tag = tag; }

    public String tag() { return tag; }

    /** "a" / "img" / "link" / "script" 또는 enum 이름 모두 허용 */
    public static ReferenceKind fromTag(String s) {
        if (s == null) throw new IllegalArgumentException("tag is null");
        String v = s.trim().toLowerCase(Locale.ROOT);
        for (ReferenceKind k : values()) {
            if (k.tag.equals(v) || k.name().equalsIgnoreCase(v)) return k;
        }
        throw new IllegalArgumentException("unknown reference tag: " + s);
    }
}
