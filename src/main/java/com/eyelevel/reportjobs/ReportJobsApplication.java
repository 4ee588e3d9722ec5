package com.eyelevel.reportjobs;

import com.eyelevel.reportjobs.config.ReportJobsProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Report Jobs Spring Boot application.
 * <p>
 * This class bootstraps the application context and enables key Spring features:
 * <ul>
 *     <li>{@link EnableConfigurationProperties}: Binds the "app.reports" properties to the immutable
 *     {@link ReportJobsProperties} record.</li>
 *     <li>{@link EnableScheduling}: Activates the stale job and retention sweepers.</li>
 *     <li>{@link EnableRetry}: Enables retried terminal writes and PDF rendering.</li>
 * </ul>
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(value = ReportJobsProperties.class)
@EnableRetry
public class ReportJobsApplication {

    public static void main(final String[] args) {
        log.info("🚀 Starting ReportJobsApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(ReportJobsApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "ReportJobs"));
        log.info("Access URLs:");
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Dispatch:   {}", env.getProperty("app.reports.dispatch.backend", "local"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
