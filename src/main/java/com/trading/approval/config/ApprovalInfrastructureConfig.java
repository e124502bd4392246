package com.trading.approval.config;

import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class ApprovalInfrastructureConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs signature verifications so callers can bound them with a timeout.
     * Submissions beyond the queue capacity are rejected.
     */
    @Bean(name = "signatureVerificationExecutor")
    public ThreadPoolTaskExecutor signatureVerificationExecutor(ApprovalGatewayConfig config) {
        ApprovalGatewayConfig.Security security = config.getSecurity();
        return verifierExecutor(security.getVerifierThreads(), security.getVerifierQueueCapacity());
    }

    public static ThreadPoolTaskExecutor verifierExecutor(int threads, int queueCapacity) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("signature-verify-");
        executor.setDaemon(true);
        executor.initialize();
        return executor;
    }

    @Bean
    public ObservedAspect observedAspect(ObservationRegistry observationRegistry) {
        return new ObservedAspect(observationRegistry);
    }
}
