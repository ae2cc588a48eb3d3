package com.linkchex.core.extract;

import com.linkchex.core.model.Reference;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/** 페이지 단위 참조 정리: URL 중복 제거(첫 등장 우선) + 외부 링크 제외(옵션). */
public final class ReferenceFilter {
    private ReferenceFilter() {}

    public static List<Reference> apply(List<Reference> refs, boolean checkExternal) {
        List<Reference> out = new ArrayList<>();
        if (refs == null) return out;
        Set<String> seen = new HashSet<>();
        for (Reference r : refs) {
            if (!seen.add(r.url())) continue;
            if (!checkExternal && r.external()) continue;
            if (isNonNavigable(r.url())) continue;
            out.add(r);
        }
        return out;
    }

    private static boolean isNonNavigable(String url) {
        String u = url.toLowerCase(Locale.ROOT);
        return u.startsWith("javascript:") || u.startsWith("mailto:") || u.startsWith("tel:") || u.startsWith("#");
    }
}
