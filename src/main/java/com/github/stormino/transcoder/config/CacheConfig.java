package com.github.stormino.transcoder.config;

import com.github.stormino.transcoder.service.JobWorkspace;
import com.github.stormino.transcoder.service.cache.JobCache;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class CacheConfig {

    private final TranscoderProperties properties;

    @Bean
    public JobCache jobCache(JobWorkspace workspace) {
        TranscoderProperties.Cache cache = properties.getCache();
        log.info("Job cache limits: {} jobs, {} GiB, idle expiration {}",
                cache.getMaxElements(), cache.getMaxSizeGib(), cache.getExpireAfterAccess());
        return new JobCache(workspace, cache, Clock.systemUTC());
    }
}
