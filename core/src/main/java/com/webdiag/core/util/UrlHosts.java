package com.webdiag.core.util;

import java.net.URI;

/**
 * URI에서 호스트 꺼내기. '_'가 들어간 호스트처럼 java.net.URI가 registry 기반 authority로
 * 파싱하면 getHost()가 null이므로 raw authority에서 userinfo와 포트를 떼어 낸다.
 */
public final class UrlHosts {
    private UrlHosts() {}

    /** 호스트(포트 제외). 없으면 빈 문자열. */
    public static String hostOf(URI uri) {
        if (uri == null) return "";
        if (uri.getHost() != null) return uri.getHost();
        String auth = uri.getRawAuthority();
        if (auth == null) return "";
        int at = auth.lastIndexOf('@');
        if (at >= 0) auth = auth.substring(at + 1);
        if (auth.startsWith("[")) {
            int close = auth.indexOf(']');
            return close < 0 ? "" : auth.substring(0, close + 1);
        }
        int colon = auth.lastIndexOf(':');
        if (colon >= 0 && auth.substring(colon + 1).chars().allMatch(Character::isDigit)) {
            auth = auth.substring(0, colon);
        }
        return auth;
    }
}
