package com.eyelevel.reportjobs.service.generation.impl;

import com.eyelevel.reportjobs.model.ArtifactType;
import com.eyelevel.reportjobs.service.generation.AssessmentProfile;
import com.eyelevel.reportjobs.service.generation.render.HtmlToPdfRenderer;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class TechnicalReportGenerator extends AbstractPdfReportGenerator {

    public TechnicalReportGenerator(final HtmlToPdfRenderer renderer) {
        super(renderer);
    }

    @Override
    public ArtifactType type() {
        return ArtifactType.TECHNICAL;
    }

    @Override
    protected String title(final AssessmentProfile profile) {
        return "Technical Architecture Report: " + profile.companyName();
    }

    @Override
    protected List<Section> sections(final AssessmentProfile profile) {
        return List.of(
                new Section("Current State", List.of(
                        "Assessment type: " + profile.assessmentType() + ".",
                        "Stated problem: " + orDefault(profile.businessProblem(), "not provided") + ".")),
                new Section("Reference Architecture", List.of(
                        "The recommended architecture separates retrieval, orchestration and model access so each "
                                + "layer can be scaled and secured on its own."),
                            List.of("Ingestion pipeline with document chunking and embedding",
                                    "Vector index for retrieval-augmented generation",
                                    "Managed foundation model access behind an internal API",
                                    "Prompt and response logging to an encrypted audit store")),
                new Section("Data Readiness", List.of(
                        "Source systems need an owner, a classification and a refresh schedule before they feed the "
                                + "retrieval index. Restricted data stays out of prompts unless it is tokenised.")),
                new Section("Security Controls", List.of(),
                            List.of("Least-privilege IAM roles per workload",
                                    "Encryption at rest with managed keys and TLS in transit",
                                    "Private network endpoints for model and storage access",
                                    "Automated configuration and threat monitoring")),
                new Section("Implementation Roadmap", List.of(
                        "Phase 1 builds the pilot on a single use case. Phase 2 hardens operations and observability. "
                                + "Phase 3 extends the platform to further " + profile.industry() + " use cases.")));
    }
}
