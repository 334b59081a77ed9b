package com.bko.gateway.stream;

/**
 * Receives the events of one generation turn, in production order.
 */
@FunctionalInterface
public interface EventSink {

    void emit(String payload);
}
