package com.webdiag.core.snapshot;

import com.webdiag.core.model.PageDocument;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Locale;

/** jsoup 기반 추출기: HTML → 분석기용 PageDocument */
public final class JsoupPageDocumentExtractor {

    /** 원시 바이트 파싱. charset이 null이면 jsoup이 BOM/meta로 판별(기본 UTF-8). */
    public PageDocument extract(byte[] body, String charset, String baseUri) {
        byte[] bytes = (body == null) ? new byte[0] : body;
        try {
            Document doc = Jsoup.parse(new ByteArrayInputStream(bytes), charset, baseUri == null ? "" : baseUri);
            return extract(doc);
        } catch (IOException e) {
            // 메모리 스트림이라 실제로는 charset 오류 정도만 해당
            throw new UncheckedIOException("Cannot parse HTML body", e);
        }
    }

    public PageDocument extract(String html, String baseUri) {
        return extract(Jsoup.parse(html == null ? "" : html, baseUri == null ? "" : baseUri));
    }

    public PageDocument extract(Document doc) {
        PageDocument.Builder b = PageDocument.builder();

        Element html = doc.selectFirst("html");
        b.lang(html == null ? null : attrOrNull(html, "lang"));

        Element title = doc.selectFirst("title");
        if (title != null) {
            String t = title.text();
            b.title(t.isEmpty() ? null : t);
        }

        for (Element m : doc.select("meta")) {
            b.meta(attrOrNull(m, "name"), attrOrNull(m, "property"), attrOrNull(m, "content"));
        }

        // select()는 문서 순서를 유지한다
        for (Element h : doc.select("h1, h2, h3, h4, h5, h6")) {
            int level = h.normalName().charAt(1) - '0';
            b.heading(level, h.text());
        }

        for (Element img : doc.select("img")) {
            b.image(attrOrNull(img, "src"), attrOrNull(img, "alt"));
        }

        for (Element a : doc.select("a")) {
            b.link(attrOrNull(a, "href"), a.text(), attrOrNull(a, "aria-label"));
        }

        for (Element c : doc.select("input, textarea, select")) {
            b.formControl(c.normalName(), attrOrNull(c, "id"), attrOrNull(c, "aria-label"));
        }
        for (Element label : doc.select("label[for]")) {
            b.labelTarget(label.attr("for"));
        }

        b.roleElementCount(doc.select("[role]").size());
        b.ariaLabelElementCount(doc.select("[aria-label]").size());
        b.negativeTabindexCount(countNegativeTabindex(doc));
        b.inlineStyleCount(doc.select("[style]").size());

        for (String tag : PageDocument.LANDMARK_TAGS) {
            b.landmark(tag, doc.select(tag).size());
        }

        int stylesheets = 0;
        boolean canonicalSeen = false;
        for (Element link : doc.select("link[rel]")) {
            if (hasRelToken(link, "stylesheet")) stylesheets++;
            if (!canonicalSeen && hasRelToken(link, "canonical")) {
                canonicalSeen = true;
                b.canonicalHref(link.attr("href")); // href 없는 canonical도 "존재"로 취급
            }
        }
        b.stylesheetCount(stylesheets);
        b.scriptCount(doc.select("script").size());
        b.iframeCount(doc.select("iframe").size());

        for (Element s : doc.select("script[type=application/ld+json]")) {
            b.jsonLd(s.data());
        }
        return b.build();
    }

    // ----- helpers -----

    private static int countNegativeTabindex(Document doc) {
        int n = 0;
        for (Element e : doc.select("[tabindex]")) {
            try {
                if (Integer.parseInt(e.attr("tabindex").trim()) < 0) n++;
            } catch (NumberFormatException ignore) {
                // 숫자가 아닌 tabindex는 브라우저도 무시
            }
        }
        return n;
    }

    private static boolean hasRelToken(Element link, String token) {
        for (String t : link.attr("rel").trim().split("\\s+")) {
            if (t.toLowerCase(Locale.ROOT).equals(token)) return true;
        }
        return false;
    }

    /** jsoup attr()는 없는 속성에 ""를 돌려주므로 부재를 null로 구분 */
    private static String attrOrNull(Element e, String name) {
        return e.hasAttr(name) ? e.attr(name) : null;
    }
}
