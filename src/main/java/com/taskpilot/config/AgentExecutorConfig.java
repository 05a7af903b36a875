package com.taskpilot.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class AgentExecutorConfig {

    /**
     * One worker per running task; a task blocks its worker while waiting for approvals.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService agentExecutor() {
        return Executors.newCachedThreadPool();
    }
}
