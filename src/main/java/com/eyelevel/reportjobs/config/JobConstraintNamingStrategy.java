package com.eyelevel.reportjobs.config;

import lombok.RequiredArgsConstructor;
import org.hibernate.boot.model.naming.Identifier;
import org.hibernate.boot.model.naming.ImplicitIndexNameSource;
import org.hibernate.boot.model.naming.ImplicitUniqueKeyNameSource;
import org.springframework.boot.orm.jpa.hibernate.SpringImplicitNamingStrategy;
import org.springframework.stereotype.Component;

/**
 * Rewrites index and unique key names declared against the canonical job table so they follow the configured
 * table name. Index names are schema-wide in PostgreSQL; two deployments with different table names in one
 * schema must not declare the same index.
 */
@Component
@RequiredArgsConstructor
public class JobConstraintNamingStrategy extends SpringImplicitNamingStrategy {

    private final ReportJobsProperties properties;

    @Override
    public Identifier determineIndexName(final ImplicitIndexNameSource source) {
        return rename(super.determineIndexName(source));
    }

    @Override
    public Identifier determineUniqueKeyName(final ImplicitUniqueKeyNameSource source) {
        return rename(super.determineUniqueKeyName(source));
    }

    Identifier rename(final Identifier name) {
        if (name == null || !name.getText().contains(JobTableNamingStrategy.JOB_TABLE)) {
            return name;
        }
        final String renamed = name.getText().replace(JobTableNamingStrategy.JOB_TABLE, properties.store().tableName());
        return Identifier.toIdentifier(renamed, name.isQuoted());
    }
}
