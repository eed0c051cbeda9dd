package com.webdiag.core.http;

import com.webdiag.core.api.IPageSnapshotProvider;
import com.webdiag.core.model.DiagnosisConfig;
import com.webdiag.core.model.PageDocument;
import com.webdiag.core.model.PageSnapshot;
import com.webdiag.core.snapshot.JsoupPageDocumentExtractor;
import com.webdiag.core.util.DefaultSleeper;
import com.webdiag.core.util.Sleeper;
import com.webdiag.core.util.StructuredLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpHeaders;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.UnsupportedCharsetException;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.zip.GZIPInputStream;
import java.util.zip.Inflater;
import java.util.zip.InflaterInputStream;

/**
 * 대상 URL에 GET 한 번(재시도 포함)을 보내 PageSnapshot으로 만든다.
 * fetchSeconds는 요청 전송부터 본문 수신 완료까지, byteSize는 압축 해제 후 본문 길이.
 */
public class HttpPageFetcher implements IPageSnapshotProvider {
    private static final Logger LOG = LoggerFactory.getLogger(HttpPageFetcher.class);
    private static final StructuredLog SLOG = StructuredLog.get(HttpPageFetcher.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<byte[]> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final DiagnosisConfig config;
    private final HttpSender sender;
    private final RetryPolicy retryPolicy;
    private final Sleeper sleeper;
    private final JsoupPageDocumentExtractor extractor = new JsoupPageDocumentExtractor();

    public HttpPageFetcher(DiagnosisConfig config) {
        this(config, defaultSender(config),
                new DefaultRetryPolicy(config.getRetry().getMaxAttempts(), config.getRetry().getBaseDelayMs()),
                new DefaultSleeper());
    }

    /** 테스트용 생성자(송신 훅/정책/슬리퍼 주입) */
    public HttpPageFetcher(DiagnosisConfig config, HttpSender sender, RetryPolicy retryPolicy, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.sender = Objects.requireNonNull(sender, "sender");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    private static HttpSender defaultSender(DiagnosisConfig config) {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
        return req -> client.send(req, HttpResponse.BodyHandlers.ofByteArray());
    }

    @Override
    public PageSnapshot capture(URI url) throws FetchException {
        Objects.requireNonNull(url, "url");
        HttpRequest req = request(url);
        CountingRetryPolicy retries = new CountingRetryPolicy(retryPolicy);
        int attempt = 1;
        while (true) {
            Attempt a = attemptOnce(req);
            int status = (a.response == null) ? -1 : a.response.statusCode();

            if (a.response != null && status >= 200 && status < 300) {
                PageSnapshot s = toSnapshot(url, a, retries.getRetryCount());
                SLOG.debug("fetch-done", "url", url.toString(), "final_url", s.getFinalUrl().toString(),
                        "status", status, "retries", s.getRetries());
                return s;
            }
            if (!retries.shouldRetry(status, attempt)) {
                throw fail(url, status, a.error, retries.getRetryCount());
            }
            Duration delay = resolveRetryAfterOr(retries.nextDelay(attempt), a.response);
            LOG.debug("retrying {} after {}ms (attempt {}, status {})", url, delay.toMillis(), attempt, status);
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
                throw new FetchException(url, "Interrupted while waiting to retry " + url, ie);
            }
            attempt++;
        }
    }

    private HttpRequest request(URI url) throws FetchException {
        try {
            return HttpRequest.newBuilder(url)
                    .timeout(config.getTimeout())
                    .header("User-Agent", config.getUserAgent())
                    .header("Accept-Encoding", "gzip, deflate")
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            // java.net.http는 '_' 호스트 같은 registry authority를 받지 않는다
            throw new FetchException(url, "Cannot fetch " + url + ": " + describe(e), e);
        }
    }

    private Attempt attemptOnce(HttpRequest req) {
        long start = System.nanoTime();
        try {
            HttpResponse<byte[]> resp = sender.send(req);
            double seconds = (System.nanoTime() - start) / 1_000_000_000.0;
            return new Attempt(resp, seconds, null);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return new Attempt(null, 0, ie);
        } catch (IOException e) {
            // HttpTimeoutException 포함
            return new Attempt(null, 0, e);
        }
    }

    /** url은 요청 주소 그대로, 리다이렉트 후 주소는 finalUrl로 따로 담는다. 링크 해석 기준은 finalUrl. */
    private PageSnapshot toSnapshot(URI requested, Attempt a, int retries) throws FetchException {
        HttpResponse<byte[]> resp = a.response;
        HttpHeaders hh = resp.headers();
        byte[] body;
        try {
            body = decode(resp.body(), hh.firstValue("Content-Encoding").orElse(null));
        } catch (IOException e) {
            throw new FetchException(requested, "Cannot decode response body of " + requested, e);
        }
        URI finalUri = resp.uri() == null ? requested : resp.uri();
        PageDocument doc = extractor.extract(body, charsetOf(hh.firstValue("Content-Type").orElse(null)),
                finalUri.toString());
        return PageSnapshot.builder()
                .url(requested)
                .finalUrl(finalUri)
                .retries(retries)
                .fetchSeconds(a.seconds)
                .byteSize(body.length)
                .statusCode(resp.statusCode())
                .headers(hh.map())
                .document(doc)
                .build();
    }

    private FetchException fail(URI url, int status, Exception cause, int retries) {
        SLOG.warn("fetch-failed", "url", url.toString(), "status", status, "retries", retries,
                "error", cause == null ? null : cause.getClass().getSimpleName());
        if (cause != null) {
            return new FetchException(url, "Cannot fetch " + url + ": " + describe(cause), cause);
        }
        return new FetchException(url, status, "Cannot fetch " + url + ": HTTP " + status);
    }

    private static String describe(Exception e) {
        String m = e.getMessage();
        return (m == null || m.isBlank()) ? e.getClass().getSimpleName() : m;
    }

    /** gzip/deflate만 풀고 나머지(br 등)는 그대로 둔다 */
    static byte[] decode(byte[] raw, String contentEncoding) throws IOException {
        if (raw == null) return new byte[0];
        if (contentEncoding == null) return raw;
        String enc = contentEncoding.trim().toLowerCase(Locale.ROOT);
        if (enc.equals("gzip") || enc.equals("x-gzip")) {
            try (InputStream in = new GZIPInputStream(new ByteArrayInputStream(raw))) {
                return readAll(in);
            }
        }
        if (enc.equals("deflate")) {
            try {
                return inflate(raw, false);
            } catch (IOException zlibFailed) {
                // 일부 서버는 zlib 헤더 없는 raw deflate를 보낸다
                return inflate(raw, true);
            }
        }
        return raw;
    }

    private static byte[] inflate(byte[] raw, boolean nowrap) throws IOException {
        try (InputStream in = new InflaterInputStream(new ByteArrayInputStream(raw), new Inflater(nowrap))) {
            return readAll(in);
        }
    }

    private static byte[] readAll(InputStream in) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        in.transferTo(out);
        return out.toByteArray();
    }

    /** Content-Type의 charset 파라미터. 없거나 모르는 이름이면 null(jsoup 판별에 맡김). */
    static String charsetOf(String contentType) {
        if (contentType == null) return null;
        for (String part : contentType.split(";")) {
            String p = part.trim();
            if (p.toLowerCase(Locale.ROOT).startsWith("charset=")) {
                String cs = p.substring(8).trim().replace("\"", "");
                try {
                    return Charset.isSupported(cs) ? cs : null;
                } catch (IllegalCharsetNameException | UnsupportedCharsetException e) {
                    return null;
                }
            }
        }
        return null;
    }

    /** Retry-After(초)를 존중하되 30초로 상한 */
    private static Duration resolveRetryAfterOr(Duration fallback, HttpResponse<byte[]> resp) {
        if (resp == null) return fallback;
        String v = resp.headers().firstValue("Retry-After").orElse(null);
        if (v == null) return fallback;
        try {
            long sec = Long.parseLong(v.trim());
            return Duration.ofSeconds(Math.max(0, Math.min(sec, 30)));
        } catch (NumberFormatException notSeconds) {
            // HTTP-date 형태는 fallback 사용
            return fallback;
        }
    }

    private record Attempt(HttpResponse<byte[]> response, double seconds, Exception error) {}
}
