package com.github.stormino.transcoder.util;

/**
 * Constants used throughout the transcoding service.
 */
public final class DownloadConstants {

    private DownloadConstants() {
        // Utility class, no instantiation
    }

    // ========== Job Files ==========

    /**
     * Extension of the converted artifact.
     */
    public static final String VIDEO_EXTENSION = ".mp4";

    /**
     * Extension of the local copy of the variant's media playlist.
     */
    public static final String MANIFEST_EXTENSION = ".m3u8";

    /**
     * Suffix of the file ffmpeg writes its -progress samples to.
     */
    public static final String PROGRESS_FILE_SUFFIX = "-progress.txt";

    /**
     * Content type of the converted artifact.
     */
    public static final String VIDEO_CONTENT_TYPE = "video/mp4";

    // ========== FFmpeg Progress ==========

    /**
     * Key of the processed media time, in microseconds despite its name.
     */
    public static final String PROGRESS_OUT_TIME_KEY = "out_time_ms";

    /**
     * Key of the progress state, "continue" or "end".
     */
    public static final String PROGRESS_STATE_KEY = "progress";

    /**
     * Progress state written once as the last sample of the stream.
     */
    public static final String PROGRESS_STATE_END = "end";

    /**
     * FFmpeg AAC bitstream filter for MP4 compatibility.
     */
    public static final String FFMPEG_AAC_BSF = "aac_adtstoasc";

    // ========== Streaming ==========

    /**
     * Default chunk size when streaming a file to a client.
     */
    public static final int DEFAULT_CHUNK_SIZE = 1024 * 1024;

    // ========== Binary Size Units ==========

    /**
     * Bytes in one kibibyte (1024 bytes).
     */
    public static final long BYTES_PER_KIB = 1024L;

    /**
     * Bytes in one mebibyte.
     */
    public static final long BYTES_PER_MIB = 1024L * 1024;

    /**
     * Bytes in one gibibyte.
     */
    public static final long BYTES_PER_GIB = 1024L * 1024 * 1024;

    // ========== HTTP ==========

    /**
     * Headers a cross-origin video player needs to read.
     */
    public static final String EXPOSED_VIDEO_HEADERS =
            "content-type, accept-ranges, content-length, content-range, content-encoding";

    /**
     * Path of the status page of a job, followed by its id.
     */
    public static final String RESULT_PATH = "/result/";

    /**
     * Path of the video of a job, followed by its id.
     */
    public static final String RESULT_VIDEO_PATH = "/result/video/";
}
