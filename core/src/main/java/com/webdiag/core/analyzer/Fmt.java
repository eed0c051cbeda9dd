package com.webdiag.core.analyzer;

import java.math.BigDecimal;
import java.math.RoundingMode;

/** 문구 접미사용 숫자 포맷 (불필요한 0 제거: 1.50 → 1.5) */
final class Fmt {
    private Fmt() {}

    static String round(double v, int scale) {
        BigDecimal bd = BigDecimal.valueOf(v).setScale(scale, RoundingMode.HALF_EVEN).stripTrailingZeros();
        if (bd.scale() < 0) bd = bd.setScale(0);
        return bd.toPlainString();
    }

    static double roundToDouble(double v, int scale) {
        return BigDecimal.valueOf(v).setScale(scale, RoundingMode.HALF_EVEN).doubleValue();
    }
}
