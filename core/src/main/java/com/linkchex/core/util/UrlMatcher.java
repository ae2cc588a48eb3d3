package com.linkchex.core.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * include/exclude 패턴으로 검증 대상 URL을 거른다.
 * <ul>
 *   <li>정규식: {@code "^"}로 시작하면 그대로 컴파일, 부분 매치({@code find})</li>
 *   <li>glob: 그 외. {@code '*'} → {@code ".*"}, {@code '?'} → {@code "."}, URL 전체에 앵커</li>
 * </ul>
 * include가 하나라도 있으면 그중 하나에 맞아야 하고, exclude에 하나라도 맞으면 제외.
 * 잘못된 패턴은 생성 시점에 IllegalArgumentException (워커 시작 전 실패).
 */
public final class UrlMatcher {

    private final List<Rule> excludes;
    private final List<Rule> includes;

    private UrlMatcher(List<Rule> excludes, List<Rule> includes) {
        this.excludes = List.copyOf(excludes);
        this.includes = List.copyOf(includes);
    }

    public static UrlMatcher of(List<String> excludePatterns, List<String> includePatterns) {
        return new UrlMatcher(compileAll(excludePatterns), compileAll(includePatterns));
    }

    public static UrlMatcher excluding(List<String> excludePatterns) {
        return of(excludePatterns, List.of());
    }

    /** 흔히 검증할 필요가 없는 경로(아카이브, 관리자/로그인) */
    public static List<String> defaultExcludes() {
        return List.of(
                "*.pdf",
                "*.zip",
                "*.tar.gz",
                "*.exe",
                "*.dmg",
                "*/admin/*",
                "*/wp-admin/*",
                "*/wp-login.php",
                "*/login",
                "*/logout",
                "*/signin",
                "*/signout"
        );
    }

    public boolean shouldCheck(String url) {
        if (url == null) return false;
        if (!includes.isEmpty()) {
            boolean matched = false;
            for (Rule r : includes) {
                if (r.matches(url)) { matched = true; break; }
            }
            if (!matched) return false;
        }
        for (Rule r : excludes) {
            if (r.matches(url)) return false;
        }
        return true;
    }

    public int size() { return excludes.size() + includes.size(); }

    // ------------ compile ------------
    private static List<Rule> compileAll(List<String> patterns) {
        List<Rule> out = new ArrayList<>();
        if (patterns == null) return out;
        for (String p : patterns) {
            if (p == null || p.isBlank()) continue;
            out.add(compile(p.trim()));
        }
        return out;
    }

    static Rule compile(String pattern) {
        try {
            if (pattern.startsWith("^")) {
                return new Rule(Pattern.compile(pattern), false);
            }
            return new Rule(Pattern.compile(globToRegex(pattern)), true);
        } catch (PatternSyntaxException e) {
            throw new IllegalArgumentException("invalid pattern '" + pattern + "': " + e.getDescription(), e);
        }
    }

    private static String globToRegex(String glob) {
        StringBuilder r = new StringBuilder(glob.length() + 8);
        StringBuilder literal = new StringBuilder();
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '*' || c == '?') {
                if (literal.length() > 0) { r.append(Pattern.quote(literal.toString())); literal.setLength(0); }
                r.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) r.append(Pattern.quote(literal.toString()));
        return r.toString();
    }

    private record Rule(Pattern pattern, boolean whole) {
        boolean matches(String url) {
            return whole ? pattern.matcher(url).matches() : pattern.matcher(url).find();
        }
    }
}
