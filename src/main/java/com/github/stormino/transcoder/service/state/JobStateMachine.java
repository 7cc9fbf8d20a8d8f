package com.github.stormino.transcoder.service.state;

import com.github.stormino.transcoder.model.JobStatus;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;

/**
 * Legal status changes of a job.
 *
 * <pre>
 * STARTED → IN_PROGRESS → DONE
 *    ↓           ↓
 *  ERROR       ERROR
 * </pre>
 * A job may also go from STARTED to DONE when its transcoder exits before the
 * first progress sample was read. DONE and ERROR are final.
 */
@Component
@Slf4j
public class JobStateMachine {

    private final Map<JobStatus, Set<JobStatus>> successors = new EnumMap<>(JobStatus.class);

    public JobStateMachine() {
        successors.put(JobStatus.STARTED, EnumSet.of(JobStatus.IN_PROGRESS, JobStatus.DONE, JobStatus.ERROR));
        successors.put(JobStatus.IN_PROGRESS, EnumSet.of(JobStatus.DONE, JobStatus.ERROR));
        successors.put(JobStatus.DONE, EnumSet.noneOf(JobStatus.class));
        successors.put(JobStatus.ERROR, EnumSet.noneOf(JobStatus.class));
    }

    /**
     * @return true if a job in {@code from} may move to {@code to}; staying put is always allowed
     */
    public boolean isValidTransition(@NonNull JobStatus from, @NonNull JobStatus to) {
        return from == to || successors.get(from).contains(to);
    }

    /**
     * Apply a status change if it is legal.
     *
     * @param jobId Job being updated, for logging
     * @return {@code to} when the change is legal, otherwise {@code from} unchanged
     */
    public JobStatus transition(@NonNull String jobId, @NonNull JobStatus from, @NonNull JobStatus to) {
        if (!isValidTransition(from, to)) {
            log.warn("Job {}: rejected status change {} → {}", jobId, from, to);
            return from;
        }
        if (from != to) {
            log.debug("Job {}: {} → {}", jobId, from, to);
        }
        return to;
    }
}
