package com.linkchex.core.util;

import com.linkchex.core.model.CheckConfig;
import com.linkchex.core.model.CheckConfig.OutputFormat;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.DoubleConsumer;
import java.util.function.IntConsumer;

/**
 * linkchex.yml을 읽어 CheckConfig로 변환.
 *
 * 예상 YAML 키:
 * url: "https://example.com"          # 또는 sitemap
 * sitemap: "https://example.com/sitemap.xml"
 * timeoutMs: 10000
 * retries: 1
 * retryDelayMs: 1000
 * concurrency: 200
 * pageConcurrency: 10
 * rateLimit: 5.0
 * runTimeoutMs: 600000
 * checkExternal: false
 * skipResources: false
 * defaultExcludes: true
 * exclude: ["*.pdf", "^https://example\\.com/private/"]
 * include: []
 * userAgent: "Linkchex/0.1.1 (Link Validator)"
 * output:
 *   format: "json"
 *   path: "report.json"
 *
 * 소스(url/sitemap) 검증은 CLI 병합 이후에 하므로 여기서는 validate()만 부른다.
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static CheckConfig load(Path yamlPath) throws IOException {
        return load(yamlPath, CheckConfig.defaults());
    }

    /** base 위에 YAML 값을 덮어쓴다(없는 키는 base 유지). */
    public static CheckConfig load(Path yamlPath, CheckConfig base) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        Objects.requireNonNull(base, "base");
        if (!Files.exists(yamlPath)) {
            throw new IOException("config not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            Object root = yaml.load(in);

            CheckConfig cfg = base;
            if (!(root instanceof Map<?, ?> map)) {
                // 비어있거나 단순 스칼라면 base 유지
                cfg.validate();
                return cfg;
            }

            // 1) 평면 키
            setString(map, "url", cfg::setUrl);
            setString(map, "sitemap", cfg::setSitemap);
            setDurationMs(map, "timeoutMs", cfg::setTimeout);
            setInt(map, "retries", cfg::setMaxRetries);
            setDurationMs(map, "retryDelayMs", cfg::setRetryDelay);
            setInt(map, "concurrency", cfg::setLinkConcurrency);
            setInt(map, "pageConcurrency", cfg::setPageConcurrency);
            setDouble(map, "rateLimit", cfg::setRateLimit);
            setDurationMs(map, "runTimeoutMs", cfg::setRunTimeout);
            setBoolean(map, "checkExternal", cfg::setCheckExternal);
            setBoolean(map, "skipResources", cfg::setSkipResources);
            setBoolean(map, "defaultExcludes", cfg::setDefaultExcludes);
            setStringList(map, "exclude", cfg::setExcludePatterns);
            setStringList(map, "include", cfg::setIncludePatterns);
            setString(map, "userAgent", cfg::setUserAgent);

            // 2) output.format / output.path
            Map<String, Object> output = getMap(map, "output");
            if (output != null) {
                setString(output, "format", s -> cfg.setOutputFormat(OutputFormat.parse(s)));
                setString(output, "path", s -> cfg.setOutput(Path.of(s)));
            }

            cfg.validate();
            return cfg;
        }
    }

    // ------------ helpers ------------
    @SuppressWarnings("unchecked")
    private static Map<String, Object> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        if (v instanceof Map<?, ?> m) return (Map<String, Object>) m;
        return null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null) out.add(String.valueOf(o));
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).trim().split("\\s*,\\s*")) if (!p.isEmpty()) out.add(p);
        }
        setter.accept(List.copyOf(out));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v == null) return;
        try {
            setter.accept((v instanceof Number n) ? n.intValue() : Integer.parseInt(String.valueOf(v).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be an integer: " + v, e);
        }
    }

    private static void setDouble(Map<?, ?> map, String key, DoubleConsumer setter) {
        Object v = map.get(key);
        if (v == null) return;
        try {
            setter.accept((v instanceof Number n) ? n.doubleValue() : Double.parseDouble(String.valueOf(v).trim()));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number: " + v, e);
        }
    }

    private static void setDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms;
        try {
            ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be milliseconds: " + v, e);
        }
        setter.accept(Duration.ofMillis(ms));
    }
}
