package com.github.stormino.transcoder.model;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * A sample read from the transcoder's progress stream: either the number of
 * media seconds processed so far, or the end-of-stream marker.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ProgressSample {

    private static final ProgressSample END = new ProgressSample(true, 0);

    boolean end;
    double secondsProcessed;

    public static ProgressSample elapsed(double secondsProcessed) {
        return new ProgressSample(false, secondsProcessed);
    }

    public static ProgressSample end() {
        return END;
    }
}
