package com.filter.config;

import com.filter.core.config.FilterProperties;
import com.filter.core.lock.LockManager;
import com.filter.core.logging.AuditSink;
import com.filter.core.logging.LoggingAuditSink;
import com.filter.git.GitRepositoryManager;
import com.filter.workspace.ScaffoldRenderer;
import com.filter.workspace.StoryBriefRenderer;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Beans for the core components that carry no Spring annotations themselves.
 */
@Configuration
public class FilterConfig {

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public LockManager lockManager() {
        return new LockManager();
    }

    @Bean
    @ConditionalOnMissingBean
    public AuditSink auditSink() {
        return new LoggingAuditSink();
    }

    @Bean
    public GitRepositoryManager gitRepositoryManager(FilterProperties properties) {
        return new GitRepositoryManager(properties.getGit().getExecutable());
    }

    @Bean
    @ConditionalOnMissingBean
    public ScaffoldRenderer scaffoldRenderer() {
        return new StoryBriefRenderer();
    }
}
