// ICategoryAnalyzer.java
package com.webdiag.core.api;

import com.webdiag.core.model.Category;
import com.webdiag.core.model.CategoryResult;
import com.webdiag.core.model.PageSnapshot;

/** 카테고리 분석기 최소 계약: 스냅샷을 받아 결과를 돌려준다. 부작용 없음. */
public interface ICategoryAnalyzer {
    Category category();
    CategoryResult analyze(PageSnapshot snapshot);
}
