package com.webdiag.core.util;

import com.webdiag.core.model.DiagnosisConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * diagnosis.yml을 읽어 DiagnosisConfig로 변환.
 *
 * 예상 YAML 키:
 * timeoutMs: 30000
 * tlsTimeoutMs: 10000
 * followRedirects: true
 * userAgent: "Mozilla/5.0 ..."
 * parallelAnalyzers: true
 * maxRecommendations: 10
 * retry:
 *   maxAttempts: 3
 *   baseDelayMs: 250
 * output:
 *   dir: "out"
 *   json: true
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "diagnosis.yml";

    private YamlConfigLoader() {}

    /** 작업 디렉터리의 diagnosis.yml. 없으면 기본값. */
    public static DiagnosisConfig loadDefault() throws IOException {
        Path p = Path.of(DEFAULT_FILE);
        if (!Files.exists(p)) {
            DiagnosisConfig cfg = DiagnosisConfig.defaults();
            cfg.validate();
            return cfg;
        }
        return load(p);
    }

    public static DiagnosisConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("diagnosis.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static DiagnosisConfig load(InputStream in) {
        Objects.requireNonNull(in, "in");
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        DiagnosisConfig cfg = DiagnosisConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setLongAsDurationMs(map, "timeoutMs", cfg::setTimeout);
        setLongAsDurationMs(map, "tlsTimeoutMs", cfg::setTlsTimeout);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setString(map, "userAgent", cfg::setUserAgent);
        setBoolean(map, "parallelAnalyzers", cfg::setParallelAnalyzers);
        setInt(map, "maxRecommendations", cfg::setMaxRecommendations);

        // 2) retry.*
        Map<?, ?> retry = getMap(map, "retry");
        if (retry != null) {
            var r = cfg.getRetry();
            setInt(retry, "maxAttempts", r::setMaxAttempts);
            setLong(retry, "baseDelayMs", r::setBaseDelayMs);
        }

        // 3) output.dir / output.json
        Map<?, ?> output = getMap(map, "output");
        if (output != null) {
            setString(output, "dir", s -> cfg.setOutputDir(Path.of(s)));
            setBoolean(output, "json", cfg::setWriteJson);
        }

        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        return (v instanceof Map<?, ?> m) ? m : null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v).trim()));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static void setLongAsDurationMs(Map<?, ?> map, String key, Consumer<Duration> setter) {
        Object v = map.get(key);
        if (v == null) return;
        long ms = (v instanceof Number n) ? n.longValue() : Long.parseLong(String.valueOf(v).trim());
        // 0 이하 값은 validate()에서 걸리도록 그대로 넘긴다
        setter.accept(Duration.ofMillis(ms));
    }
}
