package com.github.stormino.transcoder.service.command;

import com.github.stormino.transcoder.config.TranscoderProperties;
import com.github.stormino.transcoder.model.JobFiles;
import com.github.stormino.transcoder.util.DownloadConstants;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Builder for constructing ffmpeg command-line arguments.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FfmpegCommandBuilder {

    private final TranscoderProperties properties;

    /**
     * Build the command remuxing a job's local manifest into its MP4 output,
     * writing key=value progress samples to the job's progress file.
     *
     * @param files Working files of the job
     * @return ffmpeg command arguments
     */
    public List<String> buildRemuxCommand(@NonNull JobFiles files) {
        TranscoderProperties.Ffmpeg ffmpeg = properties.getFfmpeg();

        List<String> command = new ArrayList<>();
        command.add(ffmpeg.getBinary());
        command.add("-progress");
        command.add(files.getProgress().toString());
        command.add("-y");
        command.add("-protocol_whitelist");
        command.add(ffmpeg.getProtocolWhitelist());
        command.add("-i");
        command.add(files.getManifest().toString());
        command.add("-bsf:a");
        command.add(DownloadConstants.FFMPEG_AAC_BSF);
        command.add("-c");
        command.add("copy");
        command.add("-vcodec");
        command.add("copy");
        command.add(files.getOutput().toString());

        log.debug("Built remux command: {}", String.join(" ", command));
        return command;
    }
}
