package com.inkpost.backend.auth.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;


/**
 * @ConfigurationProperties(prefix = "app.auth"):
 * application.yml 의 app.auth.* 값을 타입 안정성 있게 바인딩해준다.
 */
@Validated
@ConfigurationProperties(prefix = "app.auth")
public record AuthProperties(
        @Valid @NotNull Jwt jwt,
        @Valid @NotNull Password password
) {

    /**
     * JWT 관련 설정 (referenced by JwtService)
     * - issuer: 토큰 발급자 식별자 (inkpost)
     * - secret: HS256 서명을 위한 비밀키 문자열 (단일 공유 비밀키, 키 로테이션 없음)
     * - accessTtlSeconds: Access Token 수명(초 단위, 기본 300)
     * - refreshTtlSeconds: Refresh Token 수명(초 단위, 기본 3600)
     */
    public record Jwt(
            @NotBlank String issuer,
            @NotBlank @Size(min = 32) String secret,
            @Min(1) long accessTtlSeconds,
            @Min(1) long refreshTtlSeconds
    ) {}

    /**
     * 비밀번호 해시 설정 (referenced by AuthModuleConfig, PasswordHasher)
     * - bcryptStrength: BCrypt cost factor (2^strength 라운드). 테스트에선 4로 낮춰서 빠르게.
     */
    public record Password(
            @Min(4) @Max(31) int bcryptStrength
    ) {}
}
