package com.webdiag.core.localize;

import com.webdiag.core.localize.FindingCatalog.Phrase;
import com.webdiag.core.model.Explanation;

import java.util.Objects;

/**
 * 진단 문구 → 영문 용어 + 설명. 순수 표시용 조회이며 점수에는 관여하지 않는다.
 * 1) 정확 일치 2) 표 순서대로 첫 부분 일치(해당 조각만 치환, 나머지 접미사 유지) 3) 원문 그대로.
 */
public final class FindingLocalizer {

    private final FindingCatalog catalog;

    public FindingLocalizer() {
        this(FindingCatalog.defaultCatalog());
    }

    public FindingLocalizer(FindingCatalog catalog) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
    }

    public LocalizedFinding localize(String text) {
        if (text == null || text.isEmpty()) {
            return new LocalizedFinding(text == null ? "" : text, text == null ? "" : text, null);
        }
        for (Phrase p : catalog.phrases()) {
            if (p.ja().equals(text)) {
                return new LocalizedFinding(text, p.en(), explanationOf(p));
            }
        }
        for (Phrase p : catalog.phrases()) {
            int at = text.indexOf(p.ja());
            if (at >= 0) {
                String localized = text.substring(0, at) + p.en() + text.substring(at + p.ja().length());
                return new LocalizedFinding(text, localized, explanationOf(p));
            }
        }
        return new LocalizedFinding(text, text, null);
    }

    private Explanation explanationOf(Phrase p) {
        return catalog.explanation(p.explanationKey()).orElse(null);
    }

    public FindingCatalog catalog() { return catalog; }
}
