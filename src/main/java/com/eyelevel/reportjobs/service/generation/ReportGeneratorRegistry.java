package com.eyelevel.reportjobs.service.generation;

import com.eyelevel.reportjobs.model.ArtifactType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Looks up the {@link ReportGenerator} registered for an artifact type.
 */
@Slf4j
@Service
public class ReportGeneratorRegistry {

    private final Map<ArtifactType, ReportGenerator> generators = new EnumMap<>(ArtifactType.class);

    public ReportGeneratorRegistry(final List<ReportGenerator> generators) {
        for (final ReportGenerator generator : generators) {
            final ReportGenerator previous = this.generators.put(generator.type(), generator);
            if (previous != null) {
                throw new IllegalStateException("Two report generators registered for " + generator.type() + ": "
                                                        + previous.getClass().getSimpleName() + " and "
                                                        + generator.getClass().getSimpleName());
            }
        }
        log.info("ReportGeneratorRegistry initialized with generators for {}.", this.generators.keySet());
    }

    public Optional<ReportGenerator> getGenerator(final ArtifactType type) {
        return Optional.ofNullable(generators.get(type));
    }
}
