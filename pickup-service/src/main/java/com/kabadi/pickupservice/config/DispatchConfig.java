package com.kabadi.pickupservice.config;

import com.kabadi.pickupservice.dispatch.DispatchLauncher;
import com.kabadi.pickupservice.dispatch.DispatchStateTable;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(DispatchProperties.class)
public class DispatchConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    // Bounded pool for background dispatch tasks; each task blocks at most send-timeout
    @Bean(name = "dispatchExecutor")
    public ThreadPoolTaskExecutor dispatchExecutor(DispatchProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getExecutorPoolSize());
        executor.setMaxPoolSize(properties.getExecutorPoolSize());
        executor.setQueueCapacity(500);
        executor.setThreadNamePrefix("dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(15);
        executor.initialize();
        return executor;
    }

    // Offer expiry timers only fire callbacks; the work is handed to dispatchExecutor.
    // Delays are measured on the same clock the expiry checks use.
    @Bean(name = "offerTimerScheduler")
    public ThreadPoolTaskScheduler offerTimerScheduler(DispatchProperties properties, Clock clock) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setClock(clock);
        scheduler.setPoolSize(properties.getTimerPoolSize());
        scheduler.setThreadNamePrefix("offer-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public DispatchStateTable dispatchStateTable(@Qualifier("offerTimerScheduler") TaskScheduler offerTimerScheduler) {
        return new DispatchStateTable(offerTimerScheduler);
    }

    @Bean
    public DispatchLauncher dispatchLauncher(@Qualifier("dispatchExecutor") ThreadPoolTaskExecutor dispatchExecutor) {
        return new DispatchLauncher(dispatchExecutor);
    }
}
