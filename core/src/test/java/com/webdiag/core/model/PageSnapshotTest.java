package com.webdiag.core.model;

import com.webdiag.core.Snapshots;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PageSnapshotTest {

    private static final String URL = "https://example.com/";

    @Test
    void headersDifferingOnlyInCase_areMergedInOrder() {
        Map<String, List<String>> headers = new LinkedHashMap<>();
        headers.put("Set-Cookie", List.of("a=1"));
        headers.put("set-cookie", List.of("b=2", "c=3"));
        headers.put(null, List.of("HTTP/1.1 200 OK"));

        PageSnapshot s = Snapshots.builder(URL, Snapshots.page("", "")).headers(headers).build();

        assertThat(s.getHeaders()).hasSize(1);
        assertThat(s.getHeaders().get("SET-COOKIE")).containsExactly("a=1", "b=2", "c=3");
        assertThat(s.header("set-cookie")).isEqualTo("a=1");
    }

    @Test
    void finalUrl_defaultsToRequestedUrl() {
        PageSnapshot s = Snapshots.of(URL, Snapshots.page("", ""));

        assertThat(s.getFinalUrl()).isEqualTo(URI.create(URL));
        assertThat(s.isRedirected()).isFalse();
        assertThat(s.getRetries()).isZero();
    }

    @Test
    void underscoreHost_isStillTheDomain() {
        PageSnapshot s = Snapshots.of("https://my_host.example.com/", Snapshots.page("", ""));

        assertThat(s.getDomain()).isEqualTo("my_host.example.com");
    }

    @Test
    void negativeRetries_areRejected() {
        assertThatThrownBy(() -> Snapshots.builder(URL, Snapshots.page("", "")).retries(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
