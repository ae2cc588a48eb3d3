package com.linkchex.core.util;

/** 최소 JSON 문자열 조립 유틸(구조화 로그/JSON 리포트 공용). */
public final class Json {
    private Json() {}

    /** 따옴표 포함 문자열 리터럴. null → null */
    public static String str(String s) {
        if (s == null) return "null";
        StringBuilder sb = new StringBuilder(s.length() + 16);
        sb.append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"': sb.append("\\\""); break;
                case '\\': sb.append("\\\\"); break;
                case '\n': sb.append("\\n"); break;
                case '\r': sb.append("\\r"); break;
                case '\t': sb.append("\\t"); break;
                default:
                    if (c < 0x20) sb.append(String.format("\\u%04x", (int) c));
                    else sb.append(c);
            }
        }
        sb.append('"');
        return sb.toString();
    }

    /** 숫자/불리언은 그대로, 나머지는 문자열 */
    public static String value(Object v) {
        if (v == null) return "null";
        if (v instanceof Number || v instanceof Boolean) return String.valueOf(v);
        return str(String.valueOf(v));
    }

    public static String kv(String k, Object v) {
        return str(k) + ":" + value(v);
    }
}
