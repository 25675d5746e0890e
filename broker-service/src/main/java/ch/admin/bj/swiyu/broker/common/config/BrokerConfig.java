/*
 * SPDX-FileCopyrightText: 2025 Swiss Confederation
 *
 * SPDX-License-Identifier: MIT
 */

package ch.admin.bj.swiyu.broker.common.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

@Configuration
public class BrokerConfig {

    /**
     * Wall clock all expiry decisions are taken against.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Executor fanning out the result polls of a batch verification session.
     */
    @Bean
    public ThreadPoolTaskExecutor batchPollExecutor(ApplicationProperties applicationProperties) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(applicationProperties.getBatchPollPoolSize());
        executor.setMaxPoolSize(applicationProperties.getBatchPollPoolSize());
        executor.setThreadNamePrefix("batch-poll-");
        executor.initialize();
        return executor;
    }
}
