package com.github.stormino.transcoder.service.external;

import com.github.stormino.transcoder.model.JobFiles;

/**
 * Launches the external conversion of one variant into the job's output file.
 * The transcoder appends key=value progress samples to {@link JobFiles#getProgress()}.
 */
public interface Transcoder {

    /**
     * @param variantUrl Media playlist of the chosen variant
     * @param files Working files of the job
     * @return Handle of the running process and the media duration in seconds
     * @throws com.github.stormino.transcoder.exception.TranscoderLaunchException if the
     *         process could not be started
     */
    TranscodeHandle start(String variantUrl, JobFiles files);
}
