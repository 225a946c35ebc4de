package com.jreinhal.assay.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import java.util.List;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Interactive API documentation at /swagger-ui.html.
 */
@Configuration
public class OpenApiConfig {

    @Value("${spring.application.name:assay}")
    private String appName;

    @Bean
    public OpenAPI assayOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Assay Answering API")
                        .version("0.1.0")
                        .description("""
                                Evidence-grounded answers over experimental lab knowledge.

                                Every numeric value in an answer is checked against recorded
                                measurements and cited sources before it is returned.
                                """))
                .servers(List.of(new Server().url("/").description("Current Server")))
                .tags(List.of(new Tag().name("Answer").description("Grounded question answering for " + appName)));
    }
}
