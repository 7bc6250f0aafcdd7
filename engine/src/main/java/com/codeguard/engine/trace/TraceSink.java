package com.codeguard.engine.trace;

/** Receives tool-call trace events. Implementations must not throw. */
public interface TraceSink {

    void record(TraceEvent event);
}
