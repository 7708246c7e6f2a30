package com.agentvm.execution;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ExecutionConfig {

    @Bean
    public AgentExecutor agentExecutor(ExecutionProperties properties) {
        return new AgentExecutor(properties.getDefaultTimeout(), properties.getMaxTimeout());
    }
}
