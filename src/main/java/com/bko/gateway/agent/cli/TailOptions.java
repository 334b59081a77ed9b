package com.bko.gateway.agent.cli;

import com.bko.gateway.cancel.CancellationToken;
import org.springframework.lang.Nullable;

/**
 * @param fromEnd      skip whatever the file already holds when tailing starts
 * @param cancellation stops tailing immediately; nothing is emitted after it fires
 * @param completion   asks the tailer to read what is left and then return
 */
public record TailOptions(boolean fromEnd, CancellationToken cancellation, @Nullable CancellationToken completion) {

    public static TailOptions appendedOnly(CancellationToken cancellation, CancellationToken completion) {
        return new TailOptions(true, cancellation, completion);
    }

    public static TailOptions wholeFile(CancellationToken cancellation) {
        return new TailOptions(false, cancellation, null);
    }

    boolean completionRequested() {
        return completion != null && completion.isCancelled();
    }
}
