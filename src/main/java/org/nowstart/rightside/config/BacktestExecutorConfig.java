package org.nowstart.rightside.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.nowstart.rightside.data.property.BacktestProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class BacktestExecutorConfig {

    /**
     * Symbol-level pool for suite runs. Bars of a symbol stay in memory for the whole pass, so the
     * pool never grows past {@code rightside.backtest.parallelism}; overflow runs on the caller.
     */
    @Bean(name = "backtestExecutor", destroyMethod = "shutdown")
    public ThreadPoolTaskExecutor backtestExecutor(BacktestProperties backtestProperties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(backtestProperties.parallelism());
        executor.setMaxPoolSize(backtestProperties.parallelism());
        executor.setQueueCapacity(backtestProperties.parallelism() * 4);
        executor.setThreadNamePrefix("backtest-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }
}
