package com.webdiag.core.model;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * 진단 설정 (diagnosis.yml 매핑 대상). 순수 설정 보관용.
 * 카테고리 가중치는 고정 상수라 여기 두지 않는다.
 */
public final class DiagnosisConfig {

    /** 브라우저형 기본 UA */
    public static final String DEFAULT_USER_AGENT =
            "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";

    /** 재시도 하위 설정: YAML의 `retry:` 섹션 */
    public static final class RetryCfg {
        private int maxAttempts = 3;
        private long baseDelayMs = 250;

        public int getMaxAttempts() { return maxAttempts; }
        public RetryCfg setMaxAttempts(int v) { this.maxAttempts = v; return this; }

        public long getBaseDelayMs() { return baseDelayMs; }
        public RetryCfg setBaseDelayMs(long v) { this.baseDelayMs = v; return this; }
    }

    private Duration timeout = Duration.ofSeconds(30);    // 페이지 fetch 타임아웃
    private Duration tlsTimeout = Duration.ofSeconds(10); // 인증서 핸드셰이크 타임아웃
    private boolean followRedirects = true;
    private String userAgent = DEFAULT_USER_AGENT;
    private boolean parallelAnalyzers = true;
    private int maxRecommendations = 10;
    private Path outputDir = Path.of("out");
    private boolean writeJson = true;
    private RetryCfg retry = new RetryCfg();

    // ---------- getters ----------
    public Duration getTimeout() { return timeout; }
    public Duration getTlsTimeout() { return tlsTimeout; }
    public boolean isFollowRedirects() { return followRedirects; }
    public String getUserAgent() { return userAgent; }
    public boolean isParallelAnalyzers() { return parallelAnalyzers; }
    public int getMaxRecommendations() { return maxRecommendations; }
    public Path getOutputDir() { return outputDir; }
    public boolean isWriteJson() { return writeJson; }
    public RetryCfg getRetry() { return retry; }

    // ---------- fluent setters ----------
    public DiagnosisConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public DiagnosisConfig setTlsTimeout(Duration tlsTimeout) { this.tlsTimeout = tlsTimeout; return this; }
    public DiagnosisConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public DiagnosisConfig setUserAgent(String userAgent) {
        this.userAgent = (userAgent == null || userAgent.isBlank()) ? DEFAULT_USER_AGENT : userAgent.trim();
        return this;
    }
    public DiagnosisConfig setParallelAnalyzers(boolean v) { this.parallelAnalyzers = v; return this; }
    public DiagnosisConfig setMaxRecommendations(int n) { this.maxRecommendations = n; return this; }
    public DiagnosisConfig setOutputDir(Path outputDir) { this.outputDir = outputDir; return this; }
    public DiagnosisConfig setWriteJson(boolean v) { this.writeJson = v; return this; }
    public DiagnosisConfig setRetry(RetryCfg retry) { this.retry = (retry != null ? retry : new RetryCfg()); return this; }

    // ---------- validate ----------
    public void validate() {
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new IllegalArgumentException("timeout must be > 0");
        if (tlsTimeout == null || tlsTimeout.isNegative() || tlsTimeout.isZero())
            throw new IllegalArgumentException("tlsTimeout must be > 0");
        if (maxRecommendations < 1)
            throw new IllegalArgumentException("maxRecommendations must be >= 1");
        Objects.requireNonNull(outputDir, "outputDir");
        Objects.requireNonNull(retry, "retry");
        if (retry.getMaxAttempts() < 1)
            throw new IllegalArgumentException("retry.maxAttempts must be >= 1");
        if (retry.getBaseDelayMs() < 0)
            throw new IllegalArgumentException("retry.baseDelayMs must be >= 0");
    }

    // ---------- helpers ----------
    public static DiagnosisConfig defaults() { return new DiagnosisConfig(); }
}
