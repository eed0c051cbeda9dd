package com.webdiag.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * 파싱된 HTML 문서에서 분석기들이 필요로 하는 요소 그룹만 뽑아 둔 불변 뷰.
 * 생성은 {@link com.webdiag.core.snapshot.JsoupPageDocumentExtractor} 또는 테스트용 빌더로.
 */
public final class PageDocument {

    /** 랜드마크로 취급하는 태그 (카운트 대상) */
    public static final List<String> LANDMARK_TAGS =
            List.of("header", "nav", "main", "footer", "aside", "section", "article");

    public record MetaTag(String name, String property, String content) {}
    public record Heading(int level, String text) {}
    public record ImageRef(String src, String alt) {
        /** alt 속성이 있고 빈 문자열이 아님 */
        public boolean hasAlt() { return alt != null && !alt.isEmpty(); }
    }
    public record LinkRef(String href, String text, String ariaLabel) {
        /** 보이는 텍스트 또는 aria-label 이 있음 */
        public boolean hasAccessibleName() {
            return (text != null && !text.isBlank()) || (ariaLabel != null && !ariaLabel.isEmpty());
        }
    }
    public record FormControl(String tag, String id, String ariaLabel) {}

    private final String lang;
    private final String title;
    private final List<MetaTag> metaTags;
    private final List<Heading> headings;
    private final List<ImageRef> images;
    private final List<LinkRef> links;
    private final List<FormControl> formControls;
    private final Set<String> labelTargets;
    private final int roleElementCount;
    private final int ariaLabelElementCount;
    private final int negativeTabindexCount;
    private final int inlineStyleCount;
    private final Map<String, Integer> landmarkCounts;
    private final String canonicalHref;
    private final int scriptCount;
    private final int stylesheetCount;
    private final int iframeCount;
    private final List<String> jsonLdBlocks;

    private PageDocument(Builder b) {
        this.lang = b.lang;
        this.title = b.title;
        this.metaTags = List.copyOf(b.metaTags);
        this.headings = List.copyOf(b.headings);
        this.images = List.copyOf(b.images);
        this.links = List.copyOf(b.links);
        this.formControls = List.copyOf(b.formControls);
        this.labelTargets = Set.copyOf(b.labelTargets);
        this.roleElementCount = b.roleElementCount;
        this.ariaLabelElementCount = b.ariaLabelElementCount;
        this.negativeTabindexCount = b.negativeTabindexCount;
        this.inlineStyleCount = b.inlineStyleCount;
        Map<String, Integer> lm = new LinkedHashMap<>();
        for (String tag : LANDMARK_TAGS) lm.put(tag, b.landmarkCounts.getOrDefault(tag, 0));
        this.landmarkCounts = Collections.unmodifiableMap(lm);
        this.canonicalHref = b.canonicalHref;
        this.scriptCount = b.scriptCount;
        this.stylesheetCount = b.stylesheetCount;
        this.iframeCount = b.iframeCount;
        this.jsonLdBlocks = List.copyOf(b.jsonLdBlocks);
    }

    // ----- 게터 -----
    public String getLang() { return lang; }
    public String getTitle() { return title; }
    public List<MetaTag> getMetaTags() { return metaTags; }
    public List<Heading> getHeadings() { return headings; }
    public List<ImageRef> getImages() { return images; }
    public List<LinkRef> getLinks() { return links; }
    public List<FormControl> getFormControls() { return formControls; }
    public Set<String> getLabelTargets() { return labelTargets; }
    public int getRoleElementCount() { return roleElementCount; }
    public int getAriaLabelElementCount() { return ariaLabelElementCount; }
    public int getNegativeTabindexCount() { return negativeTabindexCount; }
    public int getInlineStyleCount() { return inlineStyleCount; }
    public Map<String, Integer> getLandmarkCounts() { return landmarkCounts; }
    public String getCanonicalHref() { return canonicalHref; }
    public int getScriptCount() { return scriptCount; }
    public int getStylesheetCount() { return stylesheetCount; }
    public int getIframeCount() { return iframeCount; }
    public List<String> getJsonLdBlocks() { return jsonLdBlocks; }

    // ----- 헬퍼 -----

    /** meta[name=description] 의 content (trim). 없거나 비어 있으면 null. */
    public String metaDescription() {
        for (MetaTag m : metaTags) {
            if (m.name() != null && m.name().equalsIgnoreCase("description")) {
                String c = m.content();
                if (c == null || c.isEmpty()) return null;
                return c.strip();
            }
        }
        return null;
    }

    /** og:* property → content (문서 순서) */
    public Map<String, String> openGraph() {
        return prefixed(true, "og:");
    }

    /** twitter:* name → content (문서 순서) */
    public Map<String, String> twitterCard() {
        return prefixed(false, "twitter:");
    }

    private Map<String, String> prefixed(boolean byProperty, String prefix) {
        Map<String, String> out = new LinkedHashMap<>();
        for (MetaTag m : metaTags) {
            String key = byProperty ? m.property() : m.name();
            if (key != null && key.toLowerCase(Locale.ROOT).startsWith(prefix)) {
                out.put(key, m.content());
            }
        }
        return out;
    }

    /** 레벨별 제목 텍스트 (문서 순서) */
    public List<String> headingTexts(int level) {
        List<String> out = new ArrayList<>();
        for (Heading h : headings) if (h.level() == level) out.add(h.text());
        return out;
    }

    public int landmarkCount(String tag) {
        return landmarkCounts.getOrDefault(tag.toLowerCase(Locale.ROOT), 0);
    }

    /** script + stylesheet + img + iframe */
    public int totalResourceCount() {
        return scriptCount + stylesheetCount + images.size() + iframeCount;
    }

    public static Builder builder() { return new Builder(); }

    public static final class Builder {
        private String lang;
        private String title;
        private final List<MetaTag> metaTags = new ArrayList<>();
        private final List<Heading> headings = new ArrayList<>();
        private final List<ImageRef> images = new ArrayList<>();
        private final List<LinkRef> links = new ArrayList<>();
        private final List<FormControl> formControls = new ArrayList<>();
        private final List<String> labelTargets = new ArrayList<>();
        private int roleElementCount;
        private int ariaLabelElementCount;
        private int negativeTabindexCount;
        private int inlineStyleCount;
        private final Map<String, Integer> landmarkCounts = new LinkedHashMap<>();
        private String canonicalHref;
        private int scriptCount;
        private int stylesheetCount;
        private int iframeCount;
        private final List<String> jsonLdBlocks = new ArrayList<>();

        public Builder lang(String lang) { this.lang = lang; return this; }
        public Builder title(String title) { this.title = title; return this; }
        public Builder meta(String name, String property, String content) { metaTags.add(new MetaTag(name, property, content)); return this; }
        public Builder heading(int level, String text) {
            if (level < 1 || level > 6) throw new IllegalArgumentException("heading level must be 1..6: " + level);
            headings.add(new Heading(level, text == null ? "" : text));
            return this;
        }
        public Builder image(String src, String alt) { images.add(new ImageRef(src, alt)); return this; }
        public Builder link(String href, String text, String ariaLabel) { links.add(new LinkRef(href, text, ariaLabel)); return this; }
        public Builder formControl(String tag, String id, String ariaLabel) { formControls.add(new FormControl(tag, id, ariaLabel)); return this; }
        public Builder labelTarget(String forId) { if (forId != null && !forId.isEmpty()) labelTargets.add(forId); return this; }
        public Builder roleElementCount(int n) { this.roleElementCount = Math.max(0, n); return this; }
        public Builder ariaLabelElementCount(int n) { this.ariaLabelElementCount = Math.max(0, n); return this; }
        public Builder negativeTabindexCount(int n) { this.negativeTabindexCount = Math.max(0, n); return this; }
        public Builder inlineStyleCount(int n) { this.inlineStyleCount = Math.max(0, n); return this; }
        public Builder landmark(String tag, int count) { landmarkCounts.put(tag.toLowerCase(Locale.ROOT), Math.max(0, count)); return this; }
        public Builder canonicalHref(String href) { this.canonicalHref = href; return this; }
        public Builder scriptCount(int n) { this.scriptCount = Math.max(0, n); return this; }
        public Builder stylesheetCount(int n) { this.stylesheetCount = Math.max(0, n); return this; }
        public Builder iframeCount(int n) { this.iframeCount = Math.max(0, n); return this; }
        public Builder jsonLd(String body) { jsonLdBlocks.add(body == null ? "" : body); return this; }

        public PageDocument build() { return new PageDocument(this); }
    }
}
