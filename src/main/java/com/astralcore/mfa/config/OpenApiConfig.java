// ==============================================================================
// OpenAPI/Swagger Configuration
// File: src/main/java/com/astralcore/mfa/config/OpenApiConfig.java
// ==============================================================================

package com.astralcore.mfa.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import io.swagger.v3.oas.models.servers.Server;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

@Configuration
public class OpenApiConfig {

    @Value("${server.port:8080}")
    private String serverPort;

    @Bean
    public OpenAPI astralMfaOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Astral Core MFA API")
                        .description("""
                                Multi-factor authentication for clinical and administrative staff.

                                ## Features
                                - TOTP enrolment with QR provisioning
                                - SMS and email challenge codes
                                - Single-use backup codes
                                - Lockout after repeated failures
                                - Remembered devices via signed trust tokens

                                ## Authentication
                                All endpoints require a Bearer token issued by the primary login service.
                                """)
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Astral Core Security Team")))
                .servers(List.of(
                        new Server()
                                .url("http://localhost:" + serverPort)
                                .description("Local Development Server")))
                .addSecurityItem(new SecurityRequirement().addList("Bearer Authentication"))
                .components(new Components()
                        .addSecuritySchemes("Bearer Authentication",
                                new SecurityScheme()
                                        .type(SecurityScheme.Type.HTTP)
                                        .scheme("bearer")
                                        .bearerFormat("JWT")
                                        .description("Enter JWT Bearer token")));
    }
}
