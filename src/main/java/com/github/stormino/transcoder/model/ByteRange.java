package com.github.stormino.transcoder.model;

import lombok.Value;

/**
 * Inclusive byte range of a file.
 */
@Value
public class ByteRange {
    long start;
    long end;

    public long length() {
        return end - start + 1;
    }
}
