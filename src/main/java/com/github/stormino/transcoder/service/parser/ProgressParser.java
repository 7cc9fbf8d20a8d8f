package com.github.stormino.transcoder.service.parser;

import com.github.stormino.transcoder.model.ProgressSample;

/**
 * Interface for parsing progress information from a transcoder's progress stream.
 * Allows for different implementations for various conversion tools.
 */
public interface ProgressParser {

    /**
     * Parse a single complete line of the progress stream.
     *
     * @param line Line to parse, without its terminator
     * @return ProgressSample if the line carries a usable sample, null otherwise
     */
    ProgressSample parseLine(String line);
}
