package com.eyelevel.reportjobs.service.generation.impl;

import com.eyelevel.reportjobs.exception.ReportGenerationException;
import com.eyelevel.reportjobs.service.generation.AssessmentProfile;
import com.eyelevel.reportjobs.service.generation.GeneratedReport;
import com.eyelevel.reportjobs.service.generation.ReportGenerator;
import com.eyelevel.reportjobs.service.generation.render.HtmlToPdfRenderer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.util.HtmlUtils;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared page layout for the PDF reports. Subclasses supply the title and the sections; this class escapes
 * every piece of text, lays out the XHTML and hands it to the renderer.
 */
@Slf4j
@RequiredArgsConstructor
public abstract class AbstractPdfReportGenerator implements ReportGenerator {

    private static final String STYLES = """
            @page { size: A4; margin: 2cm; }
            body { font-family: Helvetica, sans-serif; font-size: 10.5pt; color: #1f2937; }
            h1 { font-size: 20pt; color: #0f3d7a; margin-bottom: 4pt; }
            h2 { font-size: 13pt; color: #0f3d7a; border-bottom: 1px solid #cbd5e1; margin-top: 16pt; }
            .meta { color: #64748b; font-size: 9pt; margin-bottom: 14pt; }
            li { margin-bottom: 3pt; }
            """;

    private final HtmlToPdfRenderer renderer;

    /**
     * A titled block of paragraphs, optionally followed by a bullet list.
     */
    protected record Section(String heading, List<String> paragraphs, List<String> bullets) {

        public Section(final String heading, final List<String> paragraphs) {
            this(heading, paragraphs, List.of());
        }
    }

    protected abstract String title(AssessmentProfile profile);

    protected abstract List<Section> sections(AssessmentProfile profile);

    @Override
    public GeneratedReport generate(final String jobId, final AssessmentProfile profile) {
        final String contextInfo = "Job " + jobId + "/" + type().wireName();
        final String title = title(profile);
        final byte[] pdf;
        try {
            pdf = renderer.render(toXhtml(title, profile, sections(profile)), contextInfo);
        } catch (IOException e) {
            throw new ReportGenerationException("Failed to render the " + type().wireName() + " report.", e);
        }
        log.info("[{}] Rendered '{}' ({} bytes).", contextInfo, title, pdf.length);

        final Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("title", title);
        metadata.put("company_name", profile.companyName());
        metadata.put("industry", profile.industry());
        metadata.put("assessment_date", profile.assessmentDate());
        metadata.put("content_type", MediaType.APPLICATION_PDF_VALUE);
        metadata.put("content_length", pdf.length);
        return new GeneratedReport(pdf, MediaType.APPLICATION_PDF_VALUE, metadata);
    }

    String toXhtml(final String title, final AssessmentProfile profile, final List<Section> sections) {
        final StringBuilder html = new StringBuilder(4096);
        html.append("<!DOCTYPE html>\n<html xmlns=\"http://www.w3.org/1999/xhtml\"><head><meta charset=\"UTF-8\"/>")
            .append("<title>").append(escape(title)).append("</title>")
            .append("<style>").append(STYLES).append("</style></head><body>")
            .append("<h1>").append(escape(title)).append("</h1>")
            .append("<div class=\"meta\">").append(escape(profile.companyName())).append(" | ")
            .append(escape(profile.industry())).append(" | Assessment date ")
            .append(escape(profile.assessmentDate())).append("</div>");
        for (final Section section : sections) {
            html.append("<h2>").append(escape(section.heading())).append("</h2>");
            section.paragraphs().forEach(p -> html.append("<p>").append(escape(p)).append("</p>"));
            if (!section.bullets().isEmpty()) {
                html.append("<ul>");
                section.bullets().forEach(b -> html.append("<li>").append(escape(b)).append("</li>"));
                html.append("</ul>");
            }
        }
        return html.append("</body></html>").toString();
    }

    protected static String orDefault(final String value, final String fallback) {
        return value == null || value.isBlank() ? fallback : value;
    }

    private static String escape(final String text) {
        return HtmlUtils.htmlEscape(text == null ? "" : text, "UTF-8");
    }
}
