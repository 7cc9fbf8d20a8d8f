package com.github.stormino.transcoder.service;

import com.github.stormino.transcoder.config.TranscoderProperties;
import com.github.stormino.transcoder.exception.ConfigurationException;
import com.github.stormino.transcoder.model.JobFiles;
import com.github.stormino.transcoder.util.DownloadConstants;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Scratch directory holding the working files of every job.
 * Nothing in it survives a restart: the directory is emptied at startup.
 */
@Slf4j
@Component
public class JobWorkspace {

    private final Path directory;

    @Autowired
    public JobWorkspace(TranscoderProperties properties) {
        this(Paths.get(properties.getWorkspace().getDirectory()));
    }

    public JobWorkspace(Path directory) {
        this.directory = directory.toAbsolutePath().normalize();
    }

    @PostConstruct
    public void initialize() {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot create workspace directory", e,
                    "transcoder.workspace.directory", directory.toString());
        }
        int deleted = wipe();
        log.info("Workspace ready at {} ({} stale entries removed)", directory, deleted);
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * Paths of a job's working files. Nothing is created on disk.
     */
    public JobFiles filesFor(String jobId) {
        return new JobFiles(
                directory.resolve(jobId + DownloadConstants.VIDEO_EXTENSION),
                directory.resolve(jobId + DownloadConstants.PROGRESS_FILE_SUFFIX),
                directory.resolve(jobId + DownloadConstants.MANIFEST_EXTENSION));
    }

    /**
     * Delete every working file of a job. Missing files are fine.
     *
     * @return true if nothing is left on disk
     */
    public boolean deleteJobFiles(JobFiles files) {
        boolean clean = true;
        for (Path file : files.all()) {
            clean &= deleteFile(file);
        }
        return clean;
    }

    /**
     * Remove everything inside the workspace, keeping the directory itself.
     *
     * @return Number of entries deleted
     */
    int wipe() {
        List<Path> entries;
        try (Stream<Path> walk = Files.walk(directory)) {
            entries = walk
                    .filter(path -> !path.equals(directory))
                    .sorted(Comparator.reverseOrder())
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ConfigurationException("Cannot list workspace directory", e,
                    "transcoder.workspace.directory", directory.toString());
        }

        int deleted = 0;
        for (Path entry : entries) {
            if (deleteFile(entry)) {
                deleted++;
            }
        }
        return deleted;
    }

    private boolean deleteFile(Path file) {
        try {
            Files.deleteIfExists(file);
            log.trace("Deleted {}", file);
            return true;
        } catch (IOException e) {
            log.warn("Failed to delete {}: {}", file, e.getMessage());
            return false;
        }
    }
}
