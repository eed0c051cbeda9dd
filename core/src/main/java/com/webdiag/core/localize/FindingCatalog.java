package com.webdiag.core.localize;

import com.webdiag.core.model.Explanation;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 문구 표(phrases)와 설명 카탈로그(explanations)를 담는 불변 데이터.
 * 기본 데이터는 클래스패스의 webdiag/findings.yml.
 */
public final class FindingCatalog {

    public static final String DEFAULT_RESOURCE = "webdiag/findings.yml";

    /** 원문 조각(ja) → 영문 용어(en), 선택적 설명 키 */
    public record Phrase(String ja, String en, String explanationKey) {
        public Phrase {
            Objects.requireNonNull(ja, "ja");
            Objects.requireNonNull(en, "en");
            if (ja.isEmpty()) throw new IllegalArgumentException("phrase ja must not be empty");
        }
    }

    private final List<Phrase> phrases;
    private final Map<String, Explanation> explanations;

    public FindingCatalog(List<Phrase> phrases, Map<String, Explanation> explanations) {
        this.phrases = List.copyOf(phrases);
        this.explanations = Collections.unmodifiableMap(new LinkedHashMap<>(explanations));
    }

    private static final class Holder {
        static final FindingCatalog DEFAULT = fromClasspath(DEFAULT_RESOURCE);
    }

    /** 기본 카탈로그(지연 로딩, 공유) */
    public static FindingCatalog defaultCatalog() {
        return Holder.DEFAULT;
    }

    public static FindingCatalog fromClasspath(String resource) {
        ClassLoader cl = FindingCatalog.class.getClassLoader();
        try (InputStream in = cl.getResourceAsStream(resource)) {
            if (in == null) throw new IllegalStateException("catalog resource not found: " + resource);
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read catalog resource " + resource, e);
        }
    }

    public static FindingCatalog load(InputStream in) {
        Objects.requireNonNull(in, "in");
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);
        if (!(root instanceof Map<?, ?> map)) {
            return new FindingCatalog(List.of(), Map.of());
        }

        List<Phrase> phrases = new ArrayList<>();
        if (map.get("phrases") instanceof List<?> list) {
            for (Object o : list) {
                if (!(o instanceof Map<?, ?> m)) continue;
                String ja = str(m.get("ja"));
                String en = str(m.get("en"));
                if (ja == null || ja.isEmpty() || en == null) {
                    throw new IllegalArgumentException("phrase needs ja and en: " + m);
                }
                phrases.add(new Phrase(ja, en, str(m.get("explanation"))));
            }
        }

        // SnakeYAML 기본 Map은 LinkedHashMap이라 순서 유지
        Map<String, Explanation> explanations = new LinkedHashMap<>();
        if (map.get("explanations") instanceof Map<?, ?> ex) {
            for (var e : ex.entrySet()) {
                if (!(e.getValue() instanceof Map<?, ?> v)) continue;
                explanations.put(String.valueOf(e.getKey()), new Explanation(
                        req(v, "what", e.getKey()), req(v, "why", e.getKey()), req(v, "how", e.getKey()),
                        str(v.get("risk"))));
            }
        }

        for (Phrase p : phrases) {
            if (p.explanationKey() != null && !explanations.containsKey(p.explanationKey())) {
                throw new IllegalArgumentException("unknown explanation key: " + p.explanationKey());
            }
        }
        return new FindingCatalog(phrases, explanations);
    }

    public List<Phrase> phrases() { return phrases; }

    public Map<String, Explanation> explanations() { return explanations; }

    public Optional<Explanation> explanation(String key) {
        return key == null ? Optional.empty() : Optional.ofNullable(explanations.get(key));
    }

    private static String req(Map<?, ?> m, String k, Object owner) {
        String v = str(m.get(k));
        if (v == null) throw new IllegalArgumentException("explanation " + owner + " needs '" + k + "'");
        return v;
    }

    private static String str(Object o) {
        return o == null ? null : String.valueOf(o);
    }
}
