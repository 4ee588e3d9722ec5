package com.eyelevel.reportjobs.config;

import lombok.RequiredArgsConstructor;
import org.hibernate.boot.model.naming.CamelCaseToUnderscoresNamingStrategy;
import org.hibernate.boot.model.naming.Identifier;
import org.hibernate.engine.jdbc.env.spi.JdbcEnvironment;
import org.springframework.stereotype.Component;

/**
 * Maps the job and artifact tables onto the configured table name, so several deployments can share one
 * database. Index and constraint names follow through {@link JobConstraintNamingStrategy}. Every other
 * identifier keeps Spring Boot's default snake_case naming.
 */
@Component
@RequiredArgsConstructor
public class JobTableNamingStrategy extends CamelCaseToUnderscoresNamingStrategy {

    public static final String JOB_TABLE = "report_job";
    public static final String ARTIFACT_TABLE = "report_job_artifact";

    private final ReportJobsProperties properties;

    @Override
    public Identifier toPhysicalTableName(final Identifier logicalName, final JdbcEnvironment jdbcEnvironment) {
        final Identifier physical = super.toPhysicalTableName(logicalName, jdbcEnvironment);
        if (physical == null) {
            return null;
        }
        final String tableName = properties.store().tableName();
        if (JOB_TABLE.equalsIgnoreCase(physical.getText())) {
            return Identifier.toIdentifier(tableName, physical.isQuoted());
        }
        if (ARTIFACT_TABLE.equalsIgnoreCase(physical.getText())) {
            return Identifier.toIdentifier(tableName + "_artifact", physical.isQuoted());
        }
        return physical;
    }
}
