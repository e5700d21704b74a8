package com.eyelevel.ocrprocessor.config;

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
        String version = buildProperties.map(BuildProperties::getVersion).orElse("<NOT_FOUND>");
        String appName = buildProperties.map(BuildProperties::getName).orElse("OCR Processor API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                This API extracts text, tables and images from uploaded documents.
                                Images are OCR'd, PDFs are text-extracted and page-rasterized, and slide decks
                                are parsed for text, tables and embedded pictures.
                                
                                Key features include:
                                * **Asynchronous Processing:** Every upload becomes a job that runs in the background.
                                * **Job Polling:** Clients poll job status and fetch the result once the job completes.
                                * **Bounded Retention:** Jobs and results expire after a configurable retention window.
                                """)
                        .contact(new Contact()
                                .name("EyeLevel.ai Support")
                                .url("https://www.eyelevel.ai")));
    }
}
