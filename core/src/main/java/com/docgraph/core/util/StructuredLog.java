package com.docgraph.core.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;

/**
 * 탐색 이벤트용 JSON 한 줄 로거. 사람이 읽는 로그와 같은 SLF4J 로거로 나간다.
 * 예: {"ts":"...","lvl":"INFO","comp":"TraversalEngine","thread":"main","event":"crawl-start","root":"..."}
 * kvs는 key, value 쌍으로 넘긴다. 짝이 안 맞으면 "_kv_mismatch":true 가 붙는다.
 */
public final class StructuredLog {

    private static final ObjectMapper OM = new ObjectMapper();

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
        if (log.isDebugEnabled()) log.debug(buildJson("DEBUG", comp, event, null, kvs));
    }

    public void info(String event, Object... kvs) {
        if (log.isInfoEnabled()) log.info(buildJson("INFO", comp, event, null, kvs));
    }

    public void warn(String event, Object... kvs) {
        if (log.isWarnEnabled()) log.warn(buildJson("WARN", comp, event, null, kvs));
    }

    /** 스택은 남기지 않는다. 필요하면 호출하는 쪽 일반 로거로 따로 찍는다. */
    public void error(String event, Throwable t, Object... kvs) {
        if (log.isErrorEnabled()) log.error(buildJson("ERROR", comp, event, t, kvs));
    }

    static String buildJson(String lvl, String comp, String event, Throwable t, Object... kvs) {
        ObjectNode n = OM.createObjectNode();
        n.put("ts", Instant.now().toString());
        n.put("lvl", lvl);
        n.put("comp", comp);
        n.put("thread", Thread.currentThread().getName());
        n.put("event", event);

        if (kvs != null) {
            for (int i = 0; i + 1 < kvs.length; i += 2) {
                String k = String.valueOf(kvs[i]);
                Object v = kvs[i + 1];
                if (v == null) n.putNull(k);
                else if (v instanceof Integer x) n.put(k, x);
                else if (v instanceof Long x) n.put(k, x);
                else if (v instanceof Double x) n.put(k, x);
                else if (v instanceof Boolean x) n.put(k, x);
                else n.put(k, String.valueOf(v));
            }
            if (kvs.length % 2 == 1) n.put("_kv_mismatch", true);
        }
        if (t != null) {
            n.put("error", t.getClass().getSimpleName());
            n.put("message", t.getMessage());
        }
        try {
            return OM.writeValueAsString(n);
        } catch (JsonProcessingException e) {
            // 직렬화 실패 시 최소 필드만
            return "{\"event\":\"" + event + "\",\"_serialize_error\":true}";
        }
    }
}
