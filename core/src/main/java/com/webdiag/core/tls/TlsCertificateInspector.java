package com.webdiag.core.tls;

import com.webdiag.core.model.TlsCertificateInfo;

import java.io.IOException;

/** 호스트와 TLS 핸드셰이크를 하고 서버 인증서 요약을 돌려준다. 타임아웃은 구현이 보장. */
@FunctionalInterface
public interface TlsCertificateInspector {
    TlsCertificateInfo inspect(String host, int port) throws IOException;
}
