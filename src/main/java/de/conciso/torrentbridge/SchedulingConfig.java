package de.conciso.torrentbridge;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class SchedulingConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulingConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Runs the watcher scan, reconciliation and device-login polling. */
    @Bean
    public ThreadPoolTaskScheduler taskScheduler(@Value("${torrentbridge.scheduler.pool-size:3}") int poolSize) {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(poolSize);
        scheduler.setThreadNamePrefix("torrentbridge-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.setErrorHandler(t -> log.error("Scheduled task failed", t));
        return scheduler;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService fetchExecutor(@Value("${torrentbridge.sync.fetch-threads:2}") int threads) {
        log.info("Configuring fetch executor with {} thread(s)", threads);
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread thread = new Thread(r, "fetch-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }
}
