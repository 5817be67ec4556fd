package com.astralcore.mfa.config;

import com.astralcore.mfa.infrastructure.jpa.SpringUserRepository;
import com.astralcore.mfa.infrastructure.jpa.UserEntity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.UUID;

/**
 * Seeds one SUPER_ADMIN into the user directory so a fresh install has someone who can unlock or disable MFA
 * for staff in MFA-required roles.
 */
@Configuration
public class BootstrapAdminRunner {

    private static final Logger log = LoggerFactory.getLogger(BootstrapAdminRunner.class);

    @Bean
    ApplicationRunner seedFirstAdmin(
            SpringUserRepository users,
            @Value("${bootstrap.admin.email:}") String adminEmail,
            @Value("${bootstrap.admin.id:}") String adminId
    ) {
        return args -> {
            if (adminEmail == null || adminEmail.isBlank()) {
                log.warn("Bootstrap admin not created - set bootstrap.admin.email");
                return;
            }

            String email = adminEmail.toLowerCase();
            if (users.existsByEmail(email)) {
                log.info("Bootstrap admin exists: {}", email);
                return;
            }

            String id = adminId == null || adminId.isBlank() ? UUID.randomUUID().toString() : adminId;
            users.save(new UserEntity(id, email, "SUPER_ADMIN"));

            log.info("Bootstrap admin created: {} (id={})", email, id);
        };
    }
}
