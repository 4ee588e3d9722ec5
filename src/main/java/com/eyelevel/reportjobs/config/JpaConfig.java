package com.eyelevel.reportjobs.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.transaction.annotation.EnableTransactionManagement;

/**
 * Enables the job store repositories. Kept off the application class: web test slices start without a
 * persistence unit.
 */
@Configuration
@EnableTransactionManagement
@EnableJpaRepositories(basePackages = "com.eyelevel.reportjobs.repository")
public class JpaConfig {
}
