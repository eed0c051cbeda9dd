package com.webdiag.core.util;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * JSON 한 줄 이벤트 로거. SLF4J 위에서 동작하므로 바인딩(jdk14 등)이 출력 위치를 정한다.
 * 예: {"ts":"...","lvl":"INFO","comp":"DiagnosisService","event":"diagnosis-done","overall":72.5}
 */
public final class StructuredLog {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Logger log;
    private final String comp;

    private StructuredLog(Class<?> cls) {
        this.log = LoggerFactory.getLogger(cls);
        this.comp = cls.getSimpleName();
    }

    public static StructuredLog get(Class<?> cls) {
        return new StructuredLog(cls);
    }

    public void debug(String event, Object... kvs) {
        if (log.isDebugEnabled()) log.debug(line("DEBUG", event, null, kvs));
    }

    public void info(String event, Object... kvs) {
        if (log.isInfoEnabled()) log.info(line("INFO", event, null, kvs));
    }

    public void warn(String event, Object... kvs) {
        if (log.isWarnEnabled()) log.warn(line("WARN", event, null, kvs));
    }

    public void error(String event, Throwable t, Object... kvs) {
        if (log.isErrorEnabled()) log.error(line("ERROR", event, t, kvs), t);
    }

    /** 테스트에서 형식 확인용 */
    String line(String lvl, String event, Throwable t, Object... kvs) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("ts", Instant.now().toString());
        n.put("lvl", lvl);
        n.put("comp", comp);
        n.put("thread", Thread.currentThread().getName());
        n.put("event", event);
        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                put(n, String.valueOf(kvs[i]), kvs[i + 1]);
            }
            if (kvs.length % 2 == 1) n.put("_kv_mismatch", true);
        }
        if (t != null) {
            n.put("error", t.getClass().getSimpleName());
            n.put("message", String.valueOf(t.getMessage()));
        }
        return n.toString();
    }

    private static void put(ObjectNode n, String k, Object v) {
        if (v == null) n.putNull(k);
        else if (v instanceof Integer i) n.put(k, i);
        else if (v instanceof Long l) n.put(k, l);
        else if (v instanceof Double d) n.put(k, d);
        else if (v instanceof Number num) n.put(k, num.doubleValue());
        else if (v instanceof Boolean b) n.put(k, b);
        else n.put(k, String.valueOf(v));
    }
}
