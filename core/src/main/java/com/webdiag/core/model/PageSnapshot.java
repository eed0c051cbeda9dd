package com.webdiag.core.model;

import com.webdiag.core.util.UrlHosts;

import java.net.URI;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * 한 번 가져온 페이지의 불변 캡처. 네 분석기 모두 같은 인스턴스를 본다.
 * 헤더 조회는 대소문자 무시.
 * url은 요청한 주소(도메인 판정 기준), finalUrl은 리다이렉트를 따라간 뒤의 주소.
 */
public final class PageSnapshot {
    private final URI url;
    private final URI finalUrl;
    private final int retries;
    private final double fetchSeconds;
    private final long byteSize;
    private final int statusCode;
    private final Map<String, List<String>> headers;
    private final PageDocument document;

    private PageSnapshot(Builder b) {
        this.url = b.url;
        this.finalUrl = b.finalUrl == null ? b.url : b.finalUrl;
        this.retries = b.retries;
        this.fetchSeconds = b.fetchSeconds;
        this.byteSize = b.byteSize;
        this.statusCode = b.statusCode;
        TreeMap<String, List<String>> h = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        if (b.headers != null) {
            for (var e : b.headers.entrySet()) {
                if (e.getKey() == null || e.getValue() == null) continue; // HTTP/1 status line 등
                h.merge(e.getKey(), List.copyOf(e.getValue()), (a, c) -> {
                    List<String> all = new ArrayList<>(a);
                    all.addAll(c);
                    return List.copyOf(all);
                });
            }
        }
        this.headers = Collections.unmodifiableMap(h);
        this.document = b.document;
    }

    public URI getUrl() { return url; }
    public URI getFinalUrl() { return finalUrl; }
    public boolean isRedirected() { return !finalUrl.equals(url); }
    /** 성공하기까지 재시도한 횟수 */
    public int getRetries() { return retries; }
    public String getScheme() { return url.getScheme() == null ? "" : url.getScheme().toLowerCase(Locale.ROOT); }
    /** 호스트 (포트 제외) */
    public String getDomain() { return UrlHosts.hostOf(url); }
    public boolean isHttps() { return "https".equals(getScheme()); }
    public double getFetchSeconds() { return fetchSeconds; }
    public long getByteSize() { return byteSize; }
    public int getStatusCode() { return statusCode; }
    public Map<String, List<String>> getHeaders() { return headers; }
    public PageDocument getDocument() { return document; }

    /** 첫 번째 헤더 값(대소문자 무시). 없으면 null. */
    public String header(String name) {
        if (name == null) return null;
        List<String> vs = headers.get(name);
        return (vs == null || vs.isEmpty()) ? null : vs.get(0);
    }

    /** 값이 비어 있지 않은 헤더가 있는지 */
    public boolean hasHeader(String name) {
        String v = header(name);
        return v != null && !v.isBlank();
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private URI url;
        private URI finalUrl;
        private int retries;
        private double fetchSeconds;
        private long byteSize;
        private int statusCode = 200;
        private Map<String, List<String>> headers;
        private PageDocument document;

        public Builder url(URI url) { this.url = url; return this; }
        public Builder url(String url) { this.url = URI.create(url); return this; }
        public Builder finalUrl(URI finalUrl) { this.finalUrl = finalUrl; return this; }
        public Builder retries(int retries) { this.retries = retries; return this; }
        public Builder fetchSeconds(double fetchSeconds) { this.fetchSeconds = fetchSeconds; return this; }
        public Builder byteSize(long byteSize) { this.byteSize = byteSize; return this; }
        public Builder statusCode(int statusCode) { this.statusCode = statusCode; return this; }
        public Builder headers(Map<String, List<String>> headers) { this.headers = headers; return this; }
        public Builder document(PageDocument document) { this.document = document; return this; }

        public PageSnapshot build() {
            Objects.requireNonNull(url, "url");
            Objects.requireNonNull(document, "document");
            if (fetchSeconds < 0) throw new IllegalArgumentException("fetchSeconds must be >= 0");
            if (byteSize < 0) throw new IllegalArgumentException("byteSize must be >= 0");
            if (retries < 0) throw new IllegalArgumentException("retries must be >= 0");
            return new PageSnapshot(this);
        }
    }
}
