package com.eyelevel.reportjobs.service.generation.render;

import com.eyelevel.reportjobs.exception.ReportGenerationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;
import org.xhtmlrenderer.pdf.ITextRenderer;
import org.xhtmlrenderer.util.XRRuntimeException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Renders well-formed XHTML into PDF bytes with Flying Saucer.
 */
@Slf4j
@Service
public class HtmlToPdfRenderer {

    /**
     * Markup errors and empty output fail at once with {@link ReportGenerationException}. Anything else, such as
     * resource exhaustion under load, is retried with backoff.
     *
     * @param xhtml       The document to render.
     * @param contextInfo A string for logging.
     */
    @Retryable(retryFor = {Exception.class, OutOfMemoryError.class}, noRetryFor = {ReportGenerationException.class},
               maxAttemptsExpression = "#{${app.reports.rendering.retry.attempts:2} + 1}",
               backoff = @Backoff(delayExpression = "#{${app.reports.rendering.retry.delay-ms:500}}",
                                  multiplierExpression = "#{${app.reports.rendering.retry.multiplier:2.0}}"),
               listeners = {"htmlToPdfRetryListener"})
    public byte[] render(final String xhtml, final String contextInfo) throws IOException {
        log.debug("[{}] Rendering {} characters of XHTML to PDF.", contextInfo, xhtml.length());
        try (ByteArrayOutputStream os = new ByteArrayOutputStream()) {
            final ITextRenderer renderer = new ITextRenderer();
            try {
                renderer.setDocumentFromString(xhtml);
            } catch (XRRuntimeException e) {
                throw new ReportGenerationException("Report markup could not be parsed: " + e.getMessage(), e);
            }
            renderer.layout();
            renderer.createPDF(os);

            final byte[] pdfBytes = os.toByteArray();
            if (pdfBytes.length == 0) {
                throw new ReportGenerationException("Renderer produced an empty 0-byte PDF.");
            }
            return pdfBytes;
        }
    }

    @Recover
    public byte[] recover(final ReportGenerationException e, final String xhtml, final String contextInfo) {
        throw e;
    }

    /**
     * Called by Spring Retry once every attempt has failed for a retryable reason.
     */
    @Recover
    public byte[] recover(final Throwable e, final String xhtml, final String contextInfo) {
        final String errorMessage = "PDF rendering failed after all retry attempts: " + e.getMessage();
        log.error("[{}] {}", contextInfo, errorMessage, e);
        throw new ReportGenerationException(errorMessage, e);
    }
}
