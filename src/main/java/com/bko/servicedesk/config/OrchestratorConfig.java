package com.bko.servicedesk.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class OrchestratorConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs agent calls that carry a deadline. The dispatcher waits for each call before the next one, so a
     * cached pool only matters when a cancelled call has not stopped yet: the next call gets its own thread
     * instead of queueing behind it.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService agentExecutor() {
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "specialist-agent");
            thread.setDaemon(true);
            return thread;
        });
    }
}
