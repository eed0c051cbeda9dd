package com.webdiag.core;

import com.webdiag.core.model.PageSnapshot;
import com.webdiag.core.snapshot.JsoupPageDocumentExtractor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** 테스트 픽스처: HTML 문자열을 실제 추출기로 파싱해 스냅샷 생성 */
public final class Snapshots {
    private Snapshots() {}

    private static final JsoupPageDocumentExtractor EXTRACTOR = new JsoupPageDocumentExtractor();

    public static PageSnapshot.Builder builder(String url, String html) {
        return PageSnapshot.builder()
                .url(url)
                .fetchSeconds(0.2)
                .byteSize(html.length())
                .document(EXTRACTOR.extract(html, url));
    }

    public static PageSnapshot of(String url, String html) {
        return builder(url, html).build();
    }

    public static PageSnapshot of(String url, String html, Map<String, String> headers) {
        Map<String, List<String>> multi = new LinkedHashMap<>();
        headers.forEach((k, v) -> multi.put(k, List.of(v)));
        return builder(url, html).headers(multi).build();
    }

    /** <html><head>{head}</head><body>{body}</body></html> */
    public static String page(String head, String body) {
        return "<!doctype html><html><head>" + head + "</head><body>" + body + "</body></html>";
    }

    public static String images(int withAlt, int withoutAlt) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < withAlt; i++) sb.append("<img src=\"/a").append(i).append(".png\" alt=\"photo ").append(i).append("\">");
        for (int i = 0; i < withoutAlt; i++) sb.append("<img src=\"/b").append(i).append(".png\">");
        return sb.toString();
    }
}
