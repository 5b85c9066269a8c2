package com.sommerph.skillbackend.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI skillBackendOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Skill Credential Ledger API")
                        .version("1.0.0")
                        .description("API for publishing escrowed challenges, submitting and verifying solution proofs, and querying skill credentials."));
    }

    @Bean
    public GroupedOpenApi challengeGroup() {
        return GroupedOpenApi.builder()
                .group("challenges")
                .pathsToMatch("/api/challenges/**")
                .build();
    }

    @Bean
    public GroupedOpenApi proofGroup() {
        return GroupedOpenApi.builder()
                .group("proofs")
                .pathsToMatch("/api/proofs/**")
                .build();
    }

    @Bean
    public GroupedOpenApi credentialGroup() {
        return GroupedOpenApi.builder()
                .group("credentials")
                .pathsToMatch("/api/credentials/**")
                .build();
    }

}
