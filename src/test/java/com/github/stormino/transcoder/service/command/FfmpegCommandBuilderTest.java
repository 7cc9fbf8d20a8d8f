package com.github.stormino.transcoder.service.command;

import com.github.stormino.transcoder.config.TranscoderProperties;
import com.github.stormino.transcoder.model.JobFiles;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FfmpegCommandBuilder")
class FfmpegCommandBuilderTest {

    private final JobFiles files = new JobFiles(
            Path.of("/work/abc.mp4"), Path.of("/work/abc-progress.txt"), Path.of("/work/abc.m3u8"));

    @Test
    @DisplayName("should remux the manifest with progress reporting")
    void shouldBuildRemuxCommand() {
        FfmpegCommandBuilder builder = new FfmpegCommandBuilder(new TranscoderProperties());

        List<String> command = builder.buildRemuxCommand(files);

        assertEquals(List.of(
                "ffmpeg",
                "-progress", "/work/abc-progress.txt",
                "-y",
                "-protocol_whitelist", "file,http,https,tcp,tls,crypto",
                "-i", "/work/abc.m3u8",
                "-bsf:a", "aac_adtstoasc",
                "-c", "copy",
                "-vcodec", "copy",
                "/work/abc.mp4"), command);
    }

    @Test
    @DisplayName("should use the configured binary")
    void shouldUseConfiguredBinary() {
        TranscoderProperties properties = new TranscoderProperties();
        properties.getFfmpeg().setBinary("/opt/ffmpeg/bin/ffmpeg");

        List<String> command = new FfmpegCommandBuilder(properties).buildRemuxCommand(files);

        assertEquals("/opt/ffmpeg/bin/ffmpeg", command.get(0));
    }
}
