package com.formflow.formflow_engine.config;

import com.formflow.formflow_engine.engine.ConditionEvaluator;
import com.formflow.formflow_engine.engine.SpelConditionEvaluator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Slf4j
@Configuration
public class LoopEngineConfig {

    @Value("${app.loop.deadline-scheduler-threads:1}")
    private int deadlineSchedulerThreads;

    @Bean
    public ConditionEvaluator conditionEvaluator() {
        return new SpelConditionEvaluator();
    }

    // Only fires per-iteration deadlines; loop bodies never run on these threads
    @Bean(name = "loopDeadlineScheduler")
    public ThreadPoolTaskScheduler loopDeadlineScheduler() {
        int threads = Math.min(8, Math.max(1, deadlineSchedulerThreads));
        log.info("[LOOP] Iteration deadline scheduler with {} thread(s)", threads);
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(threads);
        scheduler.setThreadNamePrefix("loop-deadline-");
        scheduler.setDaemon(true);
        scheduler.setRemoveOnCancelPolicy(true);
        return scheduler;
    }
}
