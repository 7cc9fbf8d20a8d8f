package com.github.stormino.transcoder.service.external;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import java.util.concurrent.CompletableFuture;

/**
 * {@link TranscoderProcess} backed by an operating-system process.
 */
@RequiredArgsConstructor
public class LocalTranscoderProcess implements TranscoderProcess {

    @NonNull
    private final Process process;

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }

    @Override
    public CompletableFuture<Integer> onExit() {
        return process.onExit().thenApply(Process::exitValue);
    }

    @Override
    public void terminate() {
        process.descendants().forEach(ProcessHandle::destroy);
        process.destroy();
    }

    public long pid() {
        return process.pid();
    }
}
