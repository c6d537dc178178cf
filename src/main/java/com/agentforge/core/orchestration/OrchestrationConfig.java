package com.agentforge.core.orchestration;

import com.agentforge.core.config.AgentforgeProperties;
import com.agentforge.core.metrics.OrchestrationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class OrchestrationConfig {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationConfig.class);

    /**
     * Runs stream producers and agent invocations. Unbounded; per-run parallelism is capped
     * by {@code agentforge.orchestration.max-parallel}.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService orchestrationExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "orchestration-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public OrchestrationRuntime orchestrationRuntime(ExecutorService orchestrationExecutor,
                                                     AgentforgeProperties properties,
                                                     @Autowired(required = false) OrchestrationMetrics metrics) {
        log.info("Orchestration runtime: invocationTimeout={}, maxParallel={}, streamBufferSize={}",
                properties.getInvocationTimeout(), properties.getMaxParallel(), properties.getStreamBufferSize());
        return new OrchestrationRuntime(orchestrationExecutor, properties.getInvocationTimeout(),
                properties.getMaxParallel(), properties.getStreamBufferSize(), metrics);
    }

    @Bean
    public PatternSelector patternSelector() {
        return new MetadataPatternSelector();
    }
}
