package com.bko.gateway.jobs;

import com.bko.gateway.stream.EventSink;

/**
 * The asynchronous body of a background job.
 */
@FunctionalInterface
public interface JobWork {

    void run(EventSink sink) throws Exception;
}
