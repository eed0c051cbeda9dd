package com.webdiag.core.tls;

import com.webdiag.core.model.TlsCertificateInfo;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLServerSocket;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.math.BigInteger;
import java.net.ServerSocket;
import java.net.Socket;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Date;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/** 로컬 자체 서명 TLS 서버로 핸드셰이크/검증 경로 확인 */
class SocketTlsCertificateInspectorTest {

    private static final char[] PASSWORD = "changeit".toCharArray();
    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private SSLServerSocket server;
    private Thread acceptor;

    @AfterEach
    void stop() throws Exception {
        if (server != null) server.close();
        if (acceptor != null) acceptor.join(2000);
    }

    @Test
    void trustedCertificate_isSummarized() throws Exception {
        KeyPair kp = keyPair();
        X509Certificate cert = selfSigned("localhost", "localhost", kp);
        int port = startServer(cert, kp);

        TlsCertificateInfo info = new SocketTlsCertificateInspector(trusting(cert), TIMEOUT).inspect("localhost", port);

        assertThat(info.subject()).isEqualTo("CN=localhost");
        assertThat(info.issuer()).isEqualTo("CN=localhost");
        assertThat(info.validFrom()).isEqualTo(cert.getNotBefore().toInstant());
        assertThat(info.validUntil()).isEqualTo(cert.getNotAfter().toInstant());
        assertThat(info.protocol()).startsWith("TLS");
    }

    @Test
    void untrustedCertificate_failsHandshake() throws Exception {
        KeyPair kp = keyPair();
        X509Certificate cert = selfSigned("localhost", "localhost", kp);
        int port = startServer(cert, kp);
        X509Certificate stranger = selfSigned("other", "other.test", keyPair());

        assertThatThrownBy(() -> new SocketTlsCertificateInspector(trusting(stranger), TIMEOUT).inspect("localhost", port))
                .isInstanceOf(SSLException.class);
    }

    @Test
    void hostnameMismatch_failsHandshake() throws Exception {
        KeyPair kp = keyPair();
        X509Certificate cert = selfSigned("other.test", "other.test", kp);
        int port = startServer(cert, kp);

        assertThatThrownBy(() -> new SocketTlsCertificateInspector(trusting(cert), TIMEOUT).inspect("localhost", port))
                .isInstanceOf(SSLException.class);
    }

    @Test
    void closedPort_isIOException() throws Exception {
        int port;
        try (ServerSocket ss = new ServerSocket(0)) { port = ss.getLocalPort(); }

        assertThatThrownBy(() -> new SocketTlsCertificateInspector(TIMEOUT).inspect("127.0.0.1", port))
                .isInstanceOf(IOException.class);
    }

    @Test
    void nonPositiveTimeout_isRejected() {
        assertThatThrownBy(() -> new SocketTlsCertificateInspector(Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ---- helpers ----

    private int startServer(X509Certificate cert, KeyPair kp) throws Exception {
        KeyStore ks = KeyStore.getInstance("PKCS12");
        ks.load(null, null);
        ks.setKeyEntry("server", kp.getPrivate(), PASSWORD, new Certificate[]{cert});
        KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
        kmf.init(ks, PASSWORD);
        SSLContext ctx = SSLContext.getInstance("TLS");
        ctx.init(kmf.getKeyManagers(), null, new SecureRandom());

        server = (SSLServerSocket) ctx.getServerSocketFactory().createServerSocket(0);
        acceptor = new Thread(() -> {
            while (!server.isClosed()) {
                try (Socket s = server.accept()) {
                    ((SSLSocket) s).startHandshake();
                } catch (IOException e) {
                    // 실패 경로 테스트에서는 핸드셰이크가 깨지는 게 정상
                }
            }
        }, "tls-test-server");
        acceptor.setDaemon(true);
        acceptor.start();
        return server.getLocalPort();
    }

    private static SSLSocketFactory trusting(X509Certificate cert) throws Exception {
        KeyStore ts = KeyStore.getInstance("PKCS12");
        ts.load(null, null);
        ts.setCertificateEntry("trusted", cert);
        TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        tmf.init(ts);
        SSLContext ctx = SSLContext.getInstance("TLS");
        ctx.init(null, tmf.getTrustManagers(), new SecureRandom());
        return ctx.getSocketFactory();
    }

    private static KeyPair keyPair() throws Exception {
        KeyPairGenerator kpg = KeyPairGenerator.getInstance("RSA");
        kpg.initialize(2048);
        return kpg.generateKeyPair();
    }

    private static X509Certificate selfSigned(String cn, String dnsName, KeyPair kp) throws Exception {
        X500Name subject = new X500Name("CN=" + cn);
        BigInteger serial = new BigInteger(64, new SecureRandom());
        Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
        Date notBefore = Date.from(now.minus(1, ChronoUnit.DAYS));
        Date notAfter = Date.from(now.plus(365, ChronoUnit.DAYS));

        JcaX509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
                subject, serial, notBefore, notAfter, subject, kp.getPublic());
        builder.addExtension(Extension.basicConstraints, true, new BasicConstraints(false));
        builder.addExtension(Extension.subjectAlternativeName, false,
                new GeneralNames(new GeneralName(GeneralName.dNSName, dnsName)));
        builder.addExtension(Extension.keyUsage, true,
                new KeyUsage(KeyUsage.digitalSignature | KeyUsage.keyEncipherment));

        ContentSigner signer = new JcaContentSignerBuilder("SHA256withRSA").build(kp.getPrivate());
        return new JcaX509CertificateConverter().getCertificate(builder.build(signer));
    }
}
