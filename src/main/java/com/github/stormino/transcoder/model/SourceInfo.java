package com.github.stormino.transcoder.model;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SourceInfo {
    private String sourceUrl;
    private String imageUrl;
}
