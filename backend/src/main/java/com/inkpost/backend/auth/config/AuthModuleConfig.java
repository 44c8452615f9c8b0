package com.inkpost.backend.auth.config;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.ZoneId;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

@Configuration
@EnableConfigurationProperties(AuthProperties.class)
public class AuthModuleConfig {

    private static final ZoneId KST = ZoneId.of("Asia/Seoul");

    @Bean
    public Clock clock() {
        return Clock.system(KST);
    }

    @Bean
    public SecureRandom secureRandom() {
        // getInstanceStrong()는 환경에 따라 느리거나 블로킹될 수 있어서 보통 new SecureRandom()이 낫다
        return new SecureRandom();
    }

    @Bean
    public PasswordEncoder passwordEncoder(AuthProperties props, SecureRandom secureRandom) {
        // cost factor는 설정값으로만 조절한다 (app.auth.password.bcrypt-strength)
        return new BCryptPasswordEncoder(props.password().bcryptStrength(), secureRandom);
    }
}
