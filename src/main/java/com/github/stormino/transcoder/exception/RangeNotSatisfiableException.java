package com.github.stormino.transcoder.exception;

/**
 * Exception thrown when a Range header is malformed or out of the file's bounds.
 */
public class RangeNotSatisfiableException extends TranscodeException {

    private final String rangeHeader;
    private final long fileSize;

    public RangeNotSatisfiableException(String rangeHeader, long fileSize) {
        super(String.format("Invalid request range (Range:'%s')", rangeHeader));
        this.rangeHeader = rangeHeader;
        this.fileSize = fileSize;
    }

    public String getRangeHeader() {
        return rangeHeader;
    }

    public long getFileSize() {
        return fileSize;
    }
}
