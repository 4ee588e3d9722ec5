package com.eyelevel.reportjobs.service.generation;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;

/**
 * The facts every report is written around, derived once per job from the submitted assessment.
 *
 * @param companyName      Text before the first comma of {@code responses.business-owner}, else
 *                         {@code responses.company-name}, else "Valued Customer".
 * @param industry         Inferred from keywords in {@code responses.business-problems}.
 * @param assessmentDate   First ten characters of {@code exportDate}, else today's date.
 * @param businessProblem  {@code responses.business-problems}, possibly empty.
 * @param primaryGoal      {@code responses.primary-goal}, possibly empty.
 * @param budgetRange      {@code responses.budget-range}, possibly empty.
 * @param urgency          {@code responses.urgency}, possibly empty.
 * @param assessmentType   {@code responses.current-state}, defaulting to "Exploratory".
 */
public record AssessmentProfile(String companyName,
                                String industry,
                                String assessmentDate,
                                String businessProblem,
                                String primaryGoal,
                                String budgetRange,
                                String urgency,
                                String assessmentType) {

    public static final String DEFAULT_COMPANY = "Valued Customer";
    public static final String HEALTHCARE = "Healthcare Technology";
    public static final String FINANCIAL = "Financial Technology";
    public static final String MANUFACTURING = "Manufacturing & Automotive";
    public static final String TECHNOLOGY = "Technology";

    private static final List<String> HEALTHCARE_WORDS = List.of("clinical", "physician", "patient", "healthcare",
                                                                 "medical");
    private static final List<String> FINANCIAL_WORDS = List.of("financial", "banking", "fintech", "payment",
                                                                "trading", "market");
    private static final List<String> MANUFACTURING_WORDS = List.of("vehicle", "manufacturing", "automotive");

    public static AssessmentProfile from(final JsonNode input, final Clock clock) {
        final JsonNode responses = input.path("responses");
        final String problem = text(responses, "business-problems");
        final String exportDate = text(input, "exportDate");
        final String assessmentDate = exportDate.length() >= 10
                ? exportDate.substring(0, 10)
                : LocalDate.now(clock).toString();
        final String currentState = text(responses, "current-state");

        return new AssessmentProfile(companyName(responses),
                                     inferIndustry(problem),
                                     assessmentDate,
                                     problem,
                                     text(responses, "primary-goal"),
                                     text(responses, "budget-range"),
                                     text(responses, "urgency"),
                                     StringUtils.hasText(currentState) ? currentState : "Exploratory");
    }

    static String companyName(final JsonNode responses) {
        final String owner = text(responses, "business-owner");
        if (owner.contains(",")) {
            final String beforeComma = owner.substring(0, owner.indexOf(',')).trim();
            if (StringUtils.hasText(beforeComma)) {
                return beforeComma;
            }
        }
        final String company = text(responses, "company-name").trim();
        return StringUtils.hasText(company) ? company : DEFAULT_COMPANY;
    }

    static String inferIndustry(final String problem) {
        final String lower = problem.toLowerCase(Locale.ROOT);
        if (HEALTHCARE_WORDS.stream().anyMatch(lower::contains)) {
            return HEALTHCARE;
        }
        if (FINANCIAL_WORDS.stream().anyMatch(lower::contains)) {
            return FINANCIAL;
        }
        if (MANUFACTURING_WORDS.stream().anyMatch(lower::contains)) {
            return MANUFACTURING;
        }
        return TECHNOLOGY;
    }

    private static String text(final JsonNode node, final String field) {
        final JsonNode value = node.path(field);
        return value.isValueNode() && !value.isNull() ? value.asText() : "";
    }
}
