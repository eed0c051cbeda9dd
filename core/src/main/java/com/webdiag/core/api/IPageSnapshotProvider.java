// IPageSnapshotProvider.java
package com.webdiag.core.api;

import com.webdiag.core.http.FetchException;
import com.webdiag.core.model.PageSnapshot;

import java.net.URI;

/** 스냅샷 제공 최소 계약: URL을 한 번 가져와 불변 스냅샷을 돌려준다. */
public interface IPageSnapshotProvider extends AutoCloseable {
    PageSnapshot capture(URI url) throws FetchException;
    @Override default void close() throws Exception {}
}
