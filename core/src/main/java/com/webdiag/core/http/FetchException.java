package com.webdiag.core.http;

import java.net.URI;

/** 페이지 스냅샷을 얻지 못함 (네트워크 실패, 타임아웃, 2xx 아님). 진단 전체 중단 사유. */
public class FetchException extends Exception {
    private final URI url;
    private final int statusCode; // 응답을 못 받았으면 -1

    public FetchException(URI url, int statusCode, String message) {
        super(message);
        this.url = url;
        this.statusCode = statusCode;
    }

    public FetchException(URI url, String message, Throwable cause) {
        super(message, cause);
        this.url = url;
        this.statusCode = -1;
    }

    public URI getUrl() { return url; }
    public int getStatusCode() { return statusCode; }
    public boolean hasStatus() { return statusCode > 0; }
}
