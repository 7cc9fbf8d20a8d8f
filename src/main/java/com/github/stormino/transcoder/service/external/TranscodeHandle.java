package com.github.stormino.transcoder.service.external;

import lombok.Value;

@Value
public class TranscodeHandle {
    TranscoderProcess process;
    double totalDurationSeconds;
}
