package com.astralcore.mfa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.domain.EntityScan;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "com.astralcore.mfa")
@EnableScheduling
@EnableJpaRepositories(basePackages = "com.astralcore.mfa.infrastructure.jpa")
@EntityScan(basePackages = "com.astralcore.mfa.infrastructure.jpa")
public class AstralMfaApplication {
	public static void main(String[] args) {
		SpringApplication.run(AstralMfaApplication.class, args);
	}
}
