package com.github.stormino.transcoder.service.external;

import java.util.concurrent.CompletableFuture;

/**
 * Handle on a running transcoder.
 */
public interface TranscoderProcess {

    boolean isAlive();

    /**
     * @return Future completed with the exit code once the process has exited
     */
    CompletableFuture<Integer> onExit();

    /**
     * Request termination without waiting for the process to exit.
     */
    void terminate();
}
