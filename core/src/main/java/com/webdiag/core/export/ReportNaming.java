package com.webdiag.core.export;

import com.webdiag.core.util.UrlHosts;

import java.net.URI;
import java.nio.file.Path;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** 결과 파일 위치: <outDir>/reports/<host>/diagnosis_result_yyyyMMdd_HHmmss.json */
public final class ReportNaming {
    private ReportNaming() {}

    public static final DateTimeFormatter TS_FMT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");
    public static final String FILE_PREFIX = "diagnosis_result_";

    public static Path reportsDir(Path baseDir, String url) {
        Path out = (baseDir == null ? Path.of("out") : baseDir);
        return out.resolve("reports").resolve(hostDir(url));
    }

    public static Path jsonPath(Path baseDir, String url, OffsetDateTime timestamp) {
        return reportsDir(baseDir, url).resolve(FILE_PREFIX + TS_FMT.format(timestamp) + ".json");
    }

    /** 파일 시스템에 안전한 호스트 이름 (없거나 잘못된 URL이면 unknown-host) */
    static String hostDir(String url) {
        if (url == null || url.isBlank()) return "unknown-host";
        try {
            String h = UrlHosts.hostOf(URI.create(url));
            return (h.isEmpty() ? "unknown-host" : h.toLowerCase(Locale.ROOT)).replaceAll("[^a-z0-9._-]", "-");
        } catch (IllegalArgumentException e) {
            return "unknown-host";
        }
    }
}
