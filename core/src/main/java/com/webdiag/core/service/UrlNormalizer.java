package com.webdiag.core.service;

import com.webdiag.core.util.UrlHosts;

import java.net.IDN;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

/**
 * 입력 URL 정리: 스킴이 없으면 https:// 를 붙이고, http(s) + 호스트가 아니면 거부.
 * 국제화 도메인은 punycode(IDN.toASCII)로 바꾼다.
 */
public final class UrlNormalizer {
    private UrlNormalizer() {}

    public static URI normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("URL must not be blank");
        }
        String s = raw.strip();
        if (!s.toLowerCase(Locale.ROOT).matches("^[a-z][a-z0-9+.-]*://.*")) {
            s = "https://" + s;
        }
        URI uri = parse(s, raw);
        String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!scheme.equals("http") && !scheme.equals("https")) {
            throw new IllegalArgumentException("Unsupported scheme: " + raw);
        }
        String host = UrlHosts.hostOf(uri);
        if (host.isBlank()) {
            throw new IllegalArgumentException("URL has no host: " + raw);
        }
        String ascii;
        try {
            ascii = host.startsWith("[") ? host : IDN.toASCII(host, IDN.ALLOW_UNASSIGNED);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid host in URL: " + raw, e);
        }
        return ascii.equals(host) ? uri : parse(withHost(uri, host, ascii), raw);
    }

    private static URI parse(String s, String raw) {
        try {
            return new URI(s);
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Malformed URL: " + raw, e);
        }
    }

    /** authority 안의 호스트 부분만 바꾼다 (userinfo, 포트 유지) */
    private static String withHost(URI uri, String host, String ascii) {
        String auth = uri.getRawAuthority();
        int at = auth.lastIndexOf(host);
        if (at < 0) throw new IllegalArgumentException("Invalid host in URL: " + uri);
        StringBuilder sb = new StringBuilder(uri.getScheme()).append("://")
                .append(auth, 0, at).append(ascii).append(auth.substring(at + host.length()));
        if (uri.getRawPath() != null) sb.append(uri.getRawPath());
        if (uri.getRawQuery() != null) sb.append('?').append(uri.getRawQuery());
        if (uri.getRawFragment() != null) sb.append('#').append(uri.getRawFragment());
        return sb.toString();
    }
}
