package com.webdiag.core.tls;

import com.webdiag.core.model.TlsCertificateInfo;

import javax.net.ssl.SNIHostName;
import javax.net.ssl.SSLParameters;
import javax.net.ssl.SSLPeerUnverifiedException;
import javax.net.ssl.SSLSession;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * 소켓 기반 인스펙터: 연결 → SNI + 호스트명 검증(HTTPS) 핸드셰이크 → 첫 번째 인증서 요약.
 * 연결과 읽기 모두 같은 타임아웃을 쓴다.
 */
public final class SocketTlsCertificateInspector implements TlsCertificateInspector {

    private final SSLSocketFactory factory;
    private final Duration timeout;

    public SocketTlsCertificateInspector(Duration timeout) {
        this((SSLSocketFactory) SSLSocketFactory.getDefault(), timeout);
    }

    /** 테스트용: 신뢰 저장소를 바꾼 팩토리 주입 */
    public SocketTlsCertificateInspector(SSLSocketFactory factory, Duration timeout) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        if (timeout.isZero() || timeout.isNegative()) throw new IllegalArgumentException("timeout must be > 0");
    }

    @Override
    public TlsCertificateInfo inspect(String host, int port) throws IOException {
        Objects.requireNonNull(host, "host");
        int ms = (int) Math.min(Integer.MAX_VALUE, timeout.toMillis());

        try (Socket raw = new Socket()) {
            raw.connect(new InetSocketAddress(host, port), ms);
            raw.setSoTimeout(ms);
            try (SSLSocket ssl = (SSLSocket) factory.createSocket(raw, host, port, false)) {
                SSLParameters params = ssl.getSSLParameters();
                params.setEndpointIdentificationAlgorithm("HTTPS");
                if (!isIpLiteral(host)) params.setServerNames(List.of(new SNIHostName(host)));
                ssl.setSSLParameters(params);
                ssl.startHandshake();

                SSLSession session = ssl.getSession();
                Certificate[] chain = session.getPeerCertificates();
                if (chain.length == 0 || !(chain[0] instanceof X509Certificate leaf)) {
                    throw new SSLPeerUnverifiedException("no X.509 peer certificate");
                }
                return new TlsCertificateInfo(
                        leaf.getSubjectX500Principal().getName(),
                        leaf.getIssuerX500Principal().getName(),
                        leaf.getNotBefore().toInstant(),
                        leaf.getNotAfter().toInstant(),
                        session.getProtocol());
            }
        }
    }

    private static boolean isIpLiteral(String host) {
        return host.indexOf(':') >= 0 || host.matches("\\d{1,3}(\\.\\d{1,3}){3}");
    }
}
