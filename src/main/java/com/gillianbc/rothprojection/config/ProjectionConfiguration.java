package com.gillianbc.rothprojection.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.gillianbc.rothprojection.reference.ReferenceTableLoader;
import com.gillianbc.rothprojection.reference.ReferenceTables;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Slf4j
@Configuration
@EnableConfigurationProperties(ProjectionProperties.class)
public class ProjectionConfiguration {

    @Bean
    public ReferenceTables referenceTables(ObjectMapper objectMapper,
                                           ResourceLoader resourceLoader,
                                           ProjectionProperties properties) {
        ReferenceTables tables = new ReferenceTableLoader(objectMapper, resourceLoader)
                .load(properties.getReferenceTables());
        log.info("Reference tables available for tax years {} to {}", tables.earliestTaxYear(), tables.latestTaxYear());
        return tables;
    }

    /**
     * Runs plan projections. Each task owns its own ledger and MAGI history, so the pool needs no
     * more threads than there are plans in an analysis.
     */
    @Bean
    public ThreadPoolTaskExecutor projectionExecutor(ProjectionProperties properties) {
        if (properties.getPlanParallelism() <= 0) {
            throw new IllegalArgumentException("projection.plan-parallelism must be positive");
        }
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getPlanParallelism());
        executor.setMaxPoolSize(properties.getPlanParallelism());
        executor.setThreadNamePrefix("projection-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
