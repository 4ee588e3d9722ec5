package com.eyelevel.reportjobs.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.Optional;

@Configuration
@Profile("!prod")
@RequiredArgsConstructor
public class OpenApiConfig {

    private final Optional<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        final String version = buildProperties.map(BuildProperties::getVersion).orElse("<NOT_FOUND>");
        final String appName = buildProperties.map(BuildProperties::getName).orElse("Report Jobs API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                Submits assessment payloads for report generation and reports on their progress.
                                
                                * **Submit:** `POST /` with the assessment JSON returns a job id immediately.
                                * **Poll:** `GET /?job_id=...` returns the job status. Once the job is COMPLETED or
                                  PARTIAL, every produced report comes with a time-limited download link that is
                                  freshly issued on each call.
                                """)
                        .contact(new Contact()
                                .name("EyeLevel.ai Support")
                                .url("https://www.eyelevel.ai")));
    }
}
