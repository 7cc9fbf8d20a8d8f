package com.github.stormino.transcoder.model;

import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * Working files of one job, all namespaced by the job id inside the workspace.
 */
@Value
public class JobFiles {
    Path output;
    Path progress;
    Path manifest;

    public List<Path> all() {
        return List.of(output, progress, manifest);
    }
}
