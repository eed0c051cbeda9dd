package com.webdiag.core.service;

import com.webdiag.core.analyzer.AccessibilityAnalyzer;
import com.webdiag.core.analyzer.PerformanceAnalyzer;
import com.webdiag.core.analyzer.SecurityAnalyzer;
import com.webdiag.core.analyzer.SeoAnalyzer;
import com.webdiag.core.api.ICategoryAnalyzer;
import com.webdiag.core.api.IPageSnapshotProvider;
import com.webdiag.core.http.FetchException;
import com.webdiag.core.http.HttpPageFetcher;
import com.webdiag.core.model.Category;
import com.webdiag.core.model.CategoryResult;
import com.webdiag.core.model.DiagnosisConfig;
import com.webdiag.core.model.DiagnosisResult;
import com.webdiag.core.model.PageSnapshot;
import com.webdiag.core.tls.SocketTlsCertificateInspector;
import com.webdiag.core.util.ProgressListener;
import com.webdiag.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 진단 오케스트레이터:
 *  - URL 정리 → 스냅샷 1회 캡처 → 4개 분석기(병렬/순차) → 집계
 *  - 밖으로 나가는 실패는 FetchException 뿐. 분석기 예외는 프로그래밍 오류로 보고 중단.
 *  - 기본 생성자는 HttpPageFetcher + 소켓 TLS 인스펙터, DI 생성자는 테스트용
 */
public final class DiagnosisService implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DiagnosisService.class);
    private static final StructuredLog SLOG = StructuredLog.get(DiagnosisService.class);

    private final DiagnosisConfig config;
    private final IPageSnapshotProvider provider;
    private final List<ICategoryAnalyzer> analyzers;
    private final ScoreAggregator aggregator;

    /** 기본 구성 */
    public DiagnosisService(DiagnosisConfig config) {
        this(config, new HttpPageFetcher(config), defaultAnalyzers(config), new ScoreAggregator());
    }

    /** DI/테스트용 */
    public DiagnosisService(DiagnosisConfig config, IPageSnapshotProvider provider,
                            List<ICategoryAnalyzer> analyzers, ScoreAggregator aggregator) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.provider = Objects.requireNonNull(provider, "provider");
        this.analyzers = List.copyOf(analyzers);
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");

        Set<Category> seen = EnumSet.noneOf(Category.class);
        for (ICategoryAnalyzer a : this.analyzers) {
            if (!seen.add(a.category())) {
                throw new IllegalArgumentException("duplicate analyzer for " + a.category().key());
            }
        }
        if (seen.size() != Category.values().length) {
            throw new IllegalArgumentException("analyzers must cover every category, got " + seen);
        }
    }

    public static List<ICategoryAnalyzer> defaultAnalyzers(DiagnosisConfig config) {
        return List.of(
                new SeoAnalyzer(),
                new SecurityAnalyzer(new SocketTlsCertificateInspector(config.getTlsTimeout())),
                new PerformanceAnalyzer(),
                new AccessibilityAnalyzer());
    }

    public DiagnosisResult diagnose(String url) throws FetchException {
        return diagnose(url, ProgressListener.NONE);
    }

    public DiagnosisResult diagnose(String url, ProgressListener listener) throws FetchException {
        final ProgressListener pl = (listener != null) ? listener : ProgressListener.NONE;
        URI target = UrlNormalizer.normalize(url);

        LOG.info("Diagnosis start: url={}, parallel={}", target, config.isParallelAnalyzers());
        SLOG.info("diagnosis-start", "url", target.toString(), "parallel", config.isParallelAnalyzers());

        // ---- 1) 스냅샷 (한 번만) ----
        progress(pl, 0.0, "fetch", 0, 1);
        PageSnapshot snapshot = provider.capture(target);
        SLOG.info("snapshot-captured",
                "url", snapshot.getUrl().toString(),
                "final_url", snapshot.getFinalUrl().toString(),
                "status", snapshot.getStatusCode(),
                "retries", snapshot.getRetries(),
                "bytes", snapshot.getByteSize(),
                "seconds", snapshot.getFetchSeconds());
        progress(pl, 0.2, "fetch", 1, 1);

        // ---- 2) 분석 ----
        List<CategoryResult> results = config.isParallelAnalyzers()
                ? analyzeParallel(snapshot, pl)
                : analyzeSequential(snapshot, pl);

        // ---- 3) 집계 ----
        progress(pl, 0.9, "aggregate", 0, 1);
        DiagnosisResult result = aggregator.aggregate(snapshot.getUrl().toString(), results);
        progress(pl, 1.0, "aggregate", 1, 1);

        LOG.info("Diagnosis done: url={}, overall={}, scores={}", result.getUrl(), result.getOverallScore(), result.getScores());
        SLOG.info("diagnosis-done", "url", result.getUrl(), "overall", result.getOverallScore());
        return result;
    }

    private List<CategoryResult> analyzeSequential(PageSnapshot snapshot, ProgressListener pl) {
        List<CategoryResult> out = new ArrayList<>(analyzers.size());
        for (ICategoryAnalyzer a : analyzers) {
            CategoryResult r;
            try {
                r = a.analyze(snapshot);
            } catch (RuntimeException e) {
                throw analyzerFailure(a, e);
            }
            out.add(scored(r));
            progress(pl, analyzeProgress(out.size()), "analyze", out.size(), analyzers.size());
        }
        return out;
    }

    private List<CategoryResult> analyzeParallel(PageSnapshot snapshot, ProgressListener pl) {
        int n = analyzers.size();
        ExecutorService exec = new ThreadPoolExecutor(
                n, n,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                new NamedThreadFactory("diag-analyzer"));
        try {
            List<Future<CategoryResult>> futures = new ArrayList<>(n);
            for (ICategoryAnalyzer a : analyzers) {
                Callable<CategoryResult> task = () -> a.analyze(snapshot);
                futures.add(exec.submit(task));
            }
            // 제출 순서대로 수거 → 결과 순서는 실행 순서와 무관
            List<CategoryResult> out = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                try {
                    out.add(scored(futures.get(i).get()));
                } catch (ExecutionException e) {
                    throw analyzerFailure(analyzers.get(i), e.getCause());
                }
                progress(pl, analyzeProgress(out.size()), "analyze", out.size(), n);
            }
            return out;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while analyzing", ie);
        } finally {
            exec.shutdownNow();
        }
    }

    private CategoryResult scored(CategoryResult r) {
        LOG.debug("{} score={} issues={} success={}", r.category().key(), r.score(), r.issues().size(), r.success().size());
        SLOG.info("category-scored", "category", r.category().key(), "score", r.score(), "issues", r.issues().size());
        return r;
    }

    private static IllegalStateException analyzerFailure(ICategoryAnalyzer a, Throwable cause) {
        LOG.error("Analyzer {} failed", a.category().key(), cause);
        return new IllegalStateException("analyzer failed: " + a.category().key(), cause);
    }

    private double analyzeProgress(int done) {
        return 0.2 + 0.7 * done / Math.max(1, analyzers.size());
    }

    /** 리스너 예외로 진단이 깨지지 않게 */
    private static void progress(ProgressListener pl, double p, String phase, long done, long total) {
        try {
            pl.onProgress(Math.max(0.0, Math.min(1.0, p)), phase, done, total);
        } catch (RuntimeException e) {
            LOG.debug("progress listener failed: {}", e.toString());
        }
    }

    @Override
    public void close() throws Exception {
        provider.close();
    }

    static final class NamedThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger seq = new AtomicInteger(1);
        NamedThreadFactory(String prefix) { this.prefix = prefix; }
        @Override public Thread newThread(Runnable r) {
            Thread t = new Thread(r, prefix + "-" + seq.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
