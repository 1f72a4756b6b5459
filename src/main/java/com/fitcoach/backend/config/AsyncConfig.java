package com.fitcoach.backend.config;

import com.fitcoach.backend.resolution.engine.AssignmentConflictPolicy;
import com.fitcoach.backend.resolution.service.ProgramResolutionProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class AsyncConfig {

    /** 五個讀取（assignments + 4 種 plan）同時發出；pool 大小由設定決定 */
    @Bean("planFetchExecutor")
    public ThreadPoolTaskExecutor planFetchExecutor(ProgramResolutionProperties props) {
        ThreadPoolTaskExecutor ex = new ThreadPoolTaskExecutor();
        ex.setCorePoolSize(props.getFetchPoolSize());
        ex.setMaxPoolSize(props.getFetchPoolSize());
        ex.setQueueCapacity(props.getFetchQueueCapacity());
        ex.setThreadNamePrefix("plan-fetch-");
        ex.setWaitForTasksToCompleteOnShutdown(true);
        ex.initialize();
        return ex;
    }

    @Bean
    public AssignmentConflictPolicy assignmentConflictPolicy() {
        return AssignmentConflictPolicy.pickMostRecentlyAssigned();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
