package com.astralcore.mfa.config;

import com.astralcore.mfa.domain.mfa.LockoutPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class MfaConfig {

    private static final Logger log = LoggerFactory.getLogger(MfaConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public LockoutPolicy lockoutPolicy(MfaProperties properties) {
        MfaProperties.Lockout lockout = properties.getLockout();
        log.info("Lockout policy - MaxAttempts: {}, Cooldown: {}s", lockout.getMaxAttempts(), lockout.getCooldownSeconds());
        return new LockoutPolicy(lockout.getMaxAttempts(), Duration.ofSeconds(lockout.getCooldownSeconds()));
    }
}
