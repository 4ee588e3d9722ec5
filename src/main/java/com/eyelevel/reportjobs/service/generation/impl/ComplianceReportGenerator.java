package com.eyelevel.reportjobs.service.generation.impl;

import com.eyelevel.reportjobs.model.ArtifactType;
import com.eyelevel.reportjobs.service.generation.AssessmentProfile;
import com.eyelevel.reportjobs.service.generation.render.HtmlToPdfRenderer;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Regulatory gap analysis. The applicable frameworks follow from the inferred industry; GDPR always applies.
 */
@Component
public class ComplianceReportGenerator extends AbstractPdfReportGenerator {

    public ComplianceReportGenerator(final HtmlToPdfRenderer renderer) {
        super(renderer);
    }

    @Override
    public ArtifactType type() {
        return ArtifactType.COMPLIANCE;
    }

    static List<String> regulationsFor(final String industry) {
        return switch (industry) {
            case AssessmentProfile.FINANCIAL -> List.of("SOX (Sarbanes-Oxley)", "PCI-DSS (Payment Card Industry)",
                                                        "GLBA (Gramm-Leach-Bliley)", "GDPR");
            case AssessmentProfile.HEALTHCARE -> List.of("HIPAA (Health Insurance Portability)", "HITECH Act", "GDPR");
            default -> List.of("GDPR", "ISO 27001");
        };
    }

    @Override
    protected String title(final AssessmentProfile profile) {
        return "Compliance Assessment Report: " + profile.companyName();
    }

    @Override
    protected List<Section> sections(final AssessmentProfile profile) {
        final String company = profile.companyName();
        return List.of(
                new Section("Regulatory Landscape", List.of(
                        company + ", operating in the " + profile.industry() + " sector, must meet the following "
                                + "frameworks when deploying Generative AI:"),
                            regulationsFor(profile.industry())),
                new Section("Gap Analysis", List.of(
                        "Existing controls provide a foundation, but audit trail coverage, automated compliance "
                                + "monitoring and documented data handling procedures need attention before "
                                + "production use."),
                            List.of("Formal data classification scheme",
                                    "Complete, tamper-evident audit logging with regulated retention",
                                    "Encryption of all data at rest and in transit",
                                    "Documented incident response procedures")),
                new Section("Data Governance", List.of(
                        "Every data source used for AI processing needs a recorded legal basis, a retention period "
                                + "and an owner accountable for access reviews.")),
                new Section("Regulatory Roadmap", List.of(
                        "Months 1 to 3 establish the compliance programme and gap assessment. Months 4 to 9 deploy "
                                + "monitoring and remediate high-risk gaps. Months 10 to 12 prepare for external "
                                + "audit and continuous compliance.")));
    }
}
