package com.webdiag.app;

import com.webdiag.app.logging.LogSetup;
import com.webdiag.core.export.JsonDiagnosisExporter;
import com.webdiag.core.export.TextReportRenderer;
import com.webdiag.core.http.FetchException;
import com.webdiag.core.localize.FindingLocalizer;
import com.webdiag.core.model.DiagnosisConfig;
import com.webdiag.core.model.DiagnosisResult;
import com.webdiag.core.rank.RecommendationRanker;
import com.webdiag.core.rank.RecommendationReport;
import com.webdiag.core.service.DiagnosisService;
import com.webdiag.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;

/** 단일 URL 진단 CLI. 종료 코드: 0 성공, 1 페이지 취득 실패, 2 인자/설정 오류 */
public final class App {
    private static final Logger LOG = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FETCH_FAILED = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        System.exit(run(args, new PrintStream(System.out, true, StandardCharsets.UTF_8),
                new PrintStream(System.err, true, StandardCharsets.UTF_8)));
    }

    static int run(String[] args, PrintStream out, PrintStream err) {
        AppArgs a;
        DiagnosisConfig cfg;
        try {
            a = AppArgs.parse(args);
            cfg = loadConfig(a);
        } catch (IllegalArgumentException | IOException e) {
            err.println(e.getMessage());
            err.println(AppArgs.USAGE);
            return EXIT_USAGE;
        }

        LogSetup.configure(cfg.getOutputDir());
        Thread.setDefaultUncaughtExceptionHandler((t, e) ->
                LOG.error("Uncaught exception in {}", t.getName(), e));

        try (DiagnosisService service = new DiagnosisService(cfg)) {
            out.println("Diagnosing / 診断中: " + a.url());
            DiagnosisResult result = service.diagnose(a.url(),
                    (p, phase, d, t) -> LOG.debug("progress {} {}%", phase, Math.round(p * 100)));

            RecommendationReport recs = new RecommendationRanker(cfg.getMaxRecommendations()).rank(result);
            out.print(new TextReportRenderer(new FindingLocalizer()).render(result, recs));

            if (cfg.isWriteJson()) {
                Path json = new JsonDiagnosisExporter().export(cfg.getOutputDir(), result);
                out.println("JSON: " + json.toAbsolutePath());
            }
            return EXIT_OK;
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            return EXIT_USAGE;
        } catch (FetchException e) {
            LOG.warn("Fetch failed: {}", e.getMessage());
            err.println("Cannot fetch page / ページを取得できません: " + e.getMessage());
            return EXIT_FETCH_FAILED;
        } catch (Exception e) {
            // 결과 파일 쓰기 실패 등
            LOG.error("Diagnosis failed", e);
            err.println("Diagnosis failed: " + e.getMessage());
            return EXIT_FETCH_FAILED;
        }
    }

    static DiagnosisConfig loadConfig(AppArgs a) throws IOException {
        DiagnosisConfig cfg = (a.configFile() != null)
                ? YamlConfigLoader.load(a.configFile())
                : YamlConfigLoader.loadDefault();
        if (a.outDir() != null) cfg.setOutputDir(a.outDir());
        if (a.noJson()) cfg.setWriteJson(false);
        if (a.sequential()) cfg.setParallelAnalyzers(false);
        cfg.validate();
        return cfg;
    }
}
