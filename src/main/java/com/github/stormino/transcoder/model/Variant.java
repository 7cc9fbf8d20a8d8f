package com.github.stormino.transcoder.model;

import lombok.Builder;
import lombok.Data;

/**
 * One quality option of a master playlist.
 */
@Data
@Builder
public class Variant {
    private String url;
    private int width;
    private int height;

    public String getResolution() {
        return width + "x" + height;
    }
}
