package com.eyelevel.reportjobs.service.generation.impl;

import com.eyelevel.reportjobs.model.ArtifactType;
import com.eyelevel.reportjobs.service.generation.AssessmentProfile;
import com.eyelevel.reportjobs.service.generation.render.HtmlToPdfRenderer;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;

/**
 * Board-level summary: the problem, the proposed direction and the investment it needs.
 */
@Component
public class ExecutiveReportGenerator extends AbstractPdfReportGenerator {

    public ExecutiveReportGenerator(final HtmlToPdfRenderer renderer) {
        super(renderer);
    }

    @Override
    public ArtifactType type() {
        return ArtifactType.EXECUTIVE;
    }

    @Override
    protected String title(final AssessmentProfile profile) {
        return "Executive Assessment Report: " + profile.companyName();
    }

    @Override
    protected List<Section> sections(final AssessmentProfile profile) {
        final String company = profile.companyName();
        return List.of(
                new Section("Executive Summary", List.of(
                        company + " completed a " + profile.assessmentType().toLowerCase(Locale.ROOT) + " Generative AI readiness "
                                + "assessment on " + profile.assessmentDate() + ". This report summarises the business "
                                + "case, the recommended approach and the expected return for leadership review.",
                        "Operating in the " + profile.industry() + " sector, " + company + " can use Generative AI "
                                + "to reduce manual effort, shorten decision cycles and improve customer experience, "
                                + "provided governance and data readiness keep pace with adoption.")),
                new Section("Business Challenge", List.of(
                        orDefault(profile.businessProblem(),
                                  "No specific business problem was provided with the assessment."))),
                new Section("Strategic Objectives", List.of(
                        "Primary goal: " + orDefault(profile.primaryGoal(), "not stated") + ".",
                        "Urgency: " + orDefault(profile.urgency(), "not stated") + "."),
                            List.of("Validate value with a narrowly scoped pilot within 90 days",
                                    "Establish responsible AI guardrails before scaling",
                                    "Measure outcomes against an agreed baseline")),
                new Section("Financial Investment Analysis", List.of(
                        "Indicated budget range: " + orDefault(profile.budgetRange(), "to be confirmed") + ".",
                        "Investment is phased so that each stage is funded on the evidence of the previous one, "
                                + "limiting exposure while the organisation builds capability.")),
                new Section("Recommended Next Steps", List.of(
                        "Leadership sponsorship and a cross-functional working group are the first dependencies."),
                            List.of("Confirm pilot scope and success criteria",
                                    "Complete the data readiness review in the technical report",
                                    "Review the compliance obligations listed in the compliance report")));
    }
}
