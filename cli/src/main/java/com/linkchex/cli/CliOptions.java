package com.linkchex.cli;

import com.linkchex.core.model.CheckConfig;
import com.linkchex.core.model.CheckConfig.OutputFormat;
import com.linkchex.core.util.YamlConfigLoader;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * 명령행 플래그. 값이 주어진 것만 기록해 두었다가 설정 파일 위에 덮어쓴다.
 * "--flag value", "--flag=value", "-flag value" 모두 허용.
 */
final class CliOptions {

    /** 사용법 오류(종료 코드 2) */
    static final class UsageException extends IllegalArgumentException {
        UsageException(String message) { super(message); }
        UsageException(String message, Throwable cause) { super(message, cause); }
    }

    boolean help;
    boolean version;
    Path configFile;

    String url;
    String sitemap;
    Integer concurrency;
    Integer pageConcurrency;
    Integer timeoutSeconds;
    Integer retries;
    Double rateLimit;
    Integer deadlineSeconds;
    final List<String> excludes = new ArrayList<>();
    final List<String> includes = new ArrayList<>();
    boolean defaultExcludes;
    boolean checkExternal;
    boolean skipResources;
    String format;
    Path output;
    boolean listOnly;
    boolean progress;
    boolean verbose;

    static CliOptions parse(String[] args) {
        CliOptions o = new CliOptions();
        for (int i = 0; i < args.length; i++) {
            String a = args[i];
            if (!a.startsWith("-") || a.equals("-") || a.equals("--")) {
                throw new UsageException("unexpected argument: " + a);
            }
            String name = a.startsWith("--") ? a.substring(2) : a.substring(1);
            String inline = null;
            int eq = name.indexOf('=');
            if (eq >= 0) {
                inline = name.substring(eq + 1);
                name = name.substring(0, eq);
            }

            switch (name) {
                // ---- 불리언 ----
                case "help", "h" -> o.help = flag(name, inline);
                case "version" -> o.version = flag(name, inline);
                case "default-excludes" -> o.defaultExcludes = flag(name, inline);
                case "check-external" -> o.checkExternal = flag(name, inline);
                case "skip-resources" -> o.skipResources = flag(name, inline);
                case "list-only" -> o.listOnly = flag(name, inline);
                case "progress" -> o.progress = flag(name, inline);
                case "verbose", "v" -> o.verbose = flag(name, inline);
                default -> {
                    // ---- 값 ----
                    String v;
                    if (inline != null) {
                        v = inline;
                    } else {
                        if (i + 1 >= args.length) throw new UsageException("flag needs an argument: -" + name);
                        v = args[++i];
                    }
                    o.value(name, v);
                }
            }
        }
        return o;
    }

    private void value(String name, String v) {
        switch (name) {
            case "url" -> url = v;
            case "sitemap" -> sitemap = v;
            case "config" -> configFile = Path.of(v);
            case "concurrency" -> concurrency = intArg(name, v);
            case "page-concurrency" -> pageConcurrency = intArg(name, v);
            case "timeout" -> timeoutSeconds = intArg(name, v);
            case "retries" -> retries = intArg(name, v);
            case "rate-limit" -> rateLimit = doubleArg(name, v);
            case "deadline" -> deadlineSeconds = intArg(name, v);
            case "exclude" -> excludes.add(v);
            case "include" -> includes.add(v);
            case "format" -> format = v;
            case "output", "o" -> output = Path.of(v);
            default -> throw new UsageException("flag provided but not defined: -" + name);
        }
    }

    /** 설정 파일(있으면) 위에 플래그를 덮어쓴 최종 설정. 검증은 호출자가. */
    CheckConfig toConfig() throws IOException {
        CheckConfig cfg = (configFile != null) ? YamlConfigLoader.load(configFile) : CheckConfig.defaults();

        if (url != null) { cfg.setUrl(url); if (sitemap == null) cfg.setSitemap(null); }
        if (sitemap != null) { cfg.setSitemap(sitemap); if (url == null) cfg.setUrl(null); }
        if (concurrency != null) cfg.setLinkConcurrency(concurrency);
        if (pageConcurrency != null) cfg.setPageConcurrency(pageConcurrency);
        if (timeoutSeconds != null) cfg.setTimeout(positiveSeconds("timeout", timeoutSeconds));
        if (retries != null) cfg.setMaxRetries(retries);
        if (rateLimit != null) cfg.setRateLimit(rateLimit);
        if (deadlineSeconds != null) cfg.setRunTimeout(positiveSeconds("deadline", deadlineSeconds));
        if (!excludes.isEmpty()) cfg.setExcludePatterns(concat(cfg.getExcludePatterns(), excludes));
        if (!includes.isEmpty()) cfg.setIncludePatterns(concat(cfg.getIncludePatterns(), includes));
        if (defaultExcludes) cfg.setDefaultExcludes(true);
        if (checkExternal) cfg.setCheckExternal(true);
        if (skipResources) cfg.setSkipResources(true);
        if (format != null) cfg.setOutputFormat(OutputFormat.parse(format));
        if (output != null) cfg.setOutput(output);
        if (listOnly) cfg.setListOnly(true);
        if (progress) cfg.setProgress(true);
        if (verbose) cfg.setVerbose(true);
        return cfg;
    }

    // ------------ helpers ------------
    private static boolean flag(String name, String inline) {
        if (inline == null) return true;
        String v = inline.trim();
        if (v.equalsIgnoreCase("true") || v.equals("1")) return true;
        if (v.equalsIgnoreCase("false") || v.equals("0")) return false;
        throw new UsageException("invalid boolean value \"" + inline + "\" for -" + name);
    }

    private static int intArg(String name, String v) {
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new UsageException("invalid value \"" + v + "\" for -" + name + ": not an integer", e);
        }
    }

    private static double doubleArg(String name, String v) {
        try {
            return Double.parseDouble(v.trim());
        } catch (NumberFormatException e) {
            throw new UsageException("invalid value \"" + v + "\" for -" + name + ": not a number", e);
        }
    }

    private static Duration positiveSeconds(String name, int seconds) {
        if (seconds <= 0) throw new UsageException("-" + name + " must be > 0");
        return Duration.ofSeconds(seconds);
    }

    private static List<String> concat(List<String> a, List<String> b) {
        List<String> out = new ArrayList<>(a);
        out.addAll(b);
        return out;
    }

    static String usage() {
        return """
        Usage: linkchex (--url <base-url> | --sitemap <url-or-file>) [options]

        Input:
          --url <url>               Base URL to discover sitemap from
          --sitemap <url|path>      Direct URL or path to sitemap file
          --config <file>           YAML config (flags override file values)

        Validation:
          --concurrency <n>         Concurrent link checks (default 200)
          --page-concurrency <n>    Concurrent page fetches (default 10)
          --timeout <seconds>       Request timeout (default 10)
          --retries <n>             Retries for failed requests (default 1)
          --rate-limit <rps>        Requests per second, 0 = unlimited (default 0)
          --deadline <seconds>      Cancel the run after this long
          --check-external          Check external links (default: internal only)
          --skip-resources          Skip <link> and <script> references
          --exclude <pattern>       Exclude URLs (glob with * and ?, or regex starting with ^); repeatable
          --include <pattern>       Only check matching URLs; repeatable
          --default-excludes        Add built-in excludes (archives, admin and login pages)

        Output:
          --format <fmt>            text, json, csv, html, pdf (default text)
          --output <file>           Output file (default stdout; required for pdf)
          --list-only               Only list URLs from sitemap
          --progress                Show progress on stderr
          --verbose                 Verbose logging on stderr
          --version                 Show version information
          --help                    Show this help

        Exit codes: 0 = no broken links, 1 = broken links or fatal error, 2 = usage error
        """;
    }
}
