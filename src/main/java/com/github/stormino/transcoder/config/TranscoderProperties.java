package com.github.stormino.transcoder.config;

import com.github.stormino.transcoder.util.DownloadConstants;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "transcoder")
public class TranscoderProperties {

    private Cache cache = new Cache();
    private Workspace workspace = new Workspace();
    private Streaming streaming = new Streaming();
    private Progress progress = new Progress();
    private Catalogue catalogue = new Catalogue();
    private Ffmpeg ffmpeg = new Ffmpeg();

    @Data
    public static class Cache {
        @Min(1)
        private int maxElements = 40;

        @Min(1)
        private long maxSizeGib = 15;

        @NotNull
        private Duration expireAfterAccess = Duration.ofHours(12);

        /**
         * Upper bound of the reclaimer's sleep, also used when the cache is empty.
         */
        @NotNull
        private Duration reclaimInterval = Duration.ofSeconds(10);

        public long getMaxSizeBytes() {
            return maxSizeGib * DownloadConstants.BYTES_PER_GIB;
        }
    }

    @Data
    public static class Workspace {
        @NotBlank
        private String directory = "./tmp";
    }

    @Data
    public static class Streaming {
        @Min(1024)
        private int chunkSize = DownloadConstants.DEFAULT_CHUNK_SIZE;
    }

    @Data
    public static class Progress {
        @NotNull
        private Duration pollInterval = Duration.ofSeconds(1);

        @Min(1)
        private int schedulerPoolSize = 4;
    }

    @Data
    public static class Catalogue {
        @NotBlank
        private String baseUrl = "https://api.gazes.fr";

        @Min(1)
        private int timeoutSeconds = 30;

        @NotBlank
        private String userAgent = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36";

        @Min(1)
        private int maxRetries = 3;

        @Min(100)
        private long retryDelayMs = 1000;
    }

    @Data
    public static class Ffmpeg {
        @NotBlank
        private String binary = "ffmpeg";

        @NotBlank
        private String protocolWhitelist = "file,http,https,tcp,tls,crypto";
    }
}
