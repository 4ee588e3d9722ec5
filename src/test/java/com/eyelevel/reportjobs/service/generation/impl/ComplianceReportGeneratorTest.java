package com.eyelevel.reportjobs.service.generation.impl;

import com.eyelevel.reportjobs.model.ArtifactType;
import com.eyelevel.reportjobs.service.generation.AssessmentProfile;
import com.eyelevel.reportjobs.service.generation.GeneratedReport;
import com.eyelevel.reportjobs.service.generation.render.HtmlToPdfRenderer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ComplianceReportGeneratorTest {

    private static final AssessmentProfile PROFILE = new AssessmentProfile(
            "Mercy <General> & Partners", AssessmentProfile.HEALTHCARE, "2025-05-30",
            "Clinical documentation backlog", "Reduce charting time", "$50k", "High", "Pilot");

    @Mock
    private HtmlToPdfRenderer renderer;

    @Test
    @DisplayName("Frameworks follow the inferred industry")
    void regulationsFollowIndustry() {
        assertThat(ComplianceReportGenerator.regulationsFor(AssessmentProfile.FINANCIAL))
                .contains("GDPR").anyMatch(r -> r.startsWith("SOX")).anyMatch(r -> r.startsWith("PCI-DSS"));
        assertThat(ComplianceReportGenerator.regulationsFor(AssessmentProfile.HEALTHCARE))
                .anyMatch(r -> r.startsWith("HIPAA")).contains("HITECH Act", "GDPR");
        assertThat(ComplianceReportGenerator.regulationsFor(AssessmentProfile.TECHNOLOGY))
                .containsExactly("GDPR", "ISO 27001");
    }

    @Test
    @DisplayName("Renders escaped XHTML and describes the result in metadata")
    void generatesPdf() throws Exception {
        // given
        when(renderer.render(anyString(), anyString())).thenReturn("%PDF-1.4 test".getBytes());
        final ComplianceReportGenerator generator = new ComplianceReportGenerator(renderer);

        // when
        final GeneratedReport report = generator.generate("job-7", PROFILE);

        // then
        final ArgumentCaptor<String> xhtml = ArgumentCaptor.forClass(String.class);
        verify(renderer).render(xhtml.capture(), eq("Job job-7/compliance"));
        assertThat(xhtml.getValue()).contains("Mercy &lt;General&gt; &amp; Partners")
                                    .doesNotContain("<General>")
                                    .contains("HITECH Act");

        assertThat(generator.type()).isEqualTo(ArtifactType.COMPLIANCE);
        assertThat(report.contentType()).isEqualTo("application/pdf");
        assertThat(report.metadata()).containsEntry("company_name", "Mercy <General> & Partners")
                                     .containsEntry("industry", AssessmentProfile.HEALTHCARE)
                                     .containsEntry("content_length", report.content().length);
    }
}
