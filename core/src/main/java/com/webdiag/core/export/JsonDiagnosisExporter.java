package com.webdiag.core.export;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.webdiag.core.model.DiagnosisResult;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * DiagnosisResult → JSON 파일 (UTF-8, pretty, ISO-8601 날짜, 비ASCII 그대로).
 * 다운스트림(리포트 등)은 read()로 트리를 다시 읽는다.
 */
public final class JsonDiagnosisExporter {

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /** baseDir/reports/<host>/diagnosis_result_*.json 에 쓰고 경로를 돌려준다 */
    public Path export(Path baseDir, DiagnosisResult result) throws IOException {
        Objects.requireNonNull(result, "result");
        Path out = ReportNaming.jsonPath(baseDir, result.getUrl(), result.getTimestamp());
        Files.createDirectories(out.getParent());
        try (Writer w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            om.writerWithDefaultPrettyPrinter().writeValue(w, result);
        }
        return out;
    }

    public String toJson(DiagnosisResult result) throws IOException {
        return om.writerWithDefaultPrettyPrinter().writeValueAsString(Objects.requireNonNull(result, "result"));
    }

    public JsonNode read(Path file) throws IOException {
        return om.readTree(file.toFile());
    }
}
