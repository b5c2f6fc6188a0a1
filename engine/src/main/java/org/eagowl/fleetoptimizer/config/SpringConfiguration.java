package org.eagowl.fleetoptimizer.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class SpringConfiguration {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService executorService(OptimizerConfiguration optimizerConfig) {
        return Executors.newFixedThreadPool(optimizerConfig.getWorkerThreads());
    }
}
