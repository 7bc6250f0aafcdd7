package com.codeguard.engine.trace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static net.logstash.logback.argument.StructuredArguments.kv;

/**
 * Writes each event on the {@code codeguard.trace} logger as key/value
 * structured arguments: {@code key=value} pairs in the plain-text layout,
 * top-level JSON fields under the logstash encoder. Traces can be routed or
 * silenced through the logging config alone.
 */
@Component
public class LoggingTraceSink implements TraceSink {

    private static final Logger trace = LoggerFactory.getLogger("codeguard.trace");

    @Override
    public void record(TraceEvent event) {
        if (!trace.isInfoEnabled()) {
            return;
        }
        List<Object> fields = new ArrayList<>();
        add(fields, "event", event.event());
        add(fields, "tool", event.tool());
        add(fields, "callId", event.callId());
        add(fields, "sessionId", event.sessionId());
        add(fields, "snippetPreview", event.snippetPreview());
        add(fields, "resultPreview", event.resultPreview());
        add(fields, "status", event.status());
        add(fields, "timestamp", event.timestamp() == null ? null : event.timestamp().toString());
        trace.info(String.join(" ", Collections.nCopies(fields.size(), "{}")), fields.toArray());
    }

    private static void add(List<Object> fields, String key, Object value) {
        if (value != null) {
            fields.add(kv(key, value));
        }
    }
}
