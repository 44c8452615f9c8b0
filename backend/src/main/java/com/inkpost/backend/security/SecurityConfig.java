package com.inkpost.backend.security;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import lombok.RequiredArgsConstructor;

/**
 * Spring Security 전역 보안 설정
 *
 * - 모든 HTTP 요청은 @Controller에 도달하기 전에 "Security Filter Chain"을 먼저 통과함
 * - 세션 없음(STATELESS): 로그인 상태는 서버가 아니라 JWT 안에만 있다.
 * - Basic 로그인은 Spring의 httpBasic이 아니라 /auth/login/email 컨트롤러가 직접 파싱한다.
 */
@Configuration
@RequiredArgsConstructor
public class SecurityConfig {

    private final JwtService jwtService;
    private final AuthorizationHeaderParser headerParser;
    private final SecurityErrorWriter errorWriter;

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        return http
                .csrf(csrf -> csrf.disable()) // 쿠키/세션 인증을 쓰지 않기 때문에 필요 없음
                .httpBasic(b -> b.disable())
                .formLogin(f -> f.disable())
                .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))

                // 인증이 안 된 상태로 보호된 리소스 접근 시 어떻게 응답할지
                .exceptionHandling(eh -> eh
                        .authenticationEntryPoint(new RestAuthEntryPoint(errorWriter))
                )

                // JWT 필터: UsernamePasswordAuthenticationFilter 전에 실행
                .addFilterBefore(
                        new JwtAuthenticationFilter(jwtService, headerParser, errorWriter),
                        UsernamePasswordAuthenticationFilter.class
                )

                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/error").permitAll()

                        // 공개 auth 엔드포인트 (각자 Authorization 헤더를 직접 검증)
                        .requestMatchers(HttpMethod.POST, "/auth/register/**").permitAll()
                        .requestMatchers(HttpMethod.POST, "/auth/login/**").permitAll()
                        .requestMatchers(HttpMethod.POST, "/auth/token/**").permitAll()

                        // 조회 전용 API는 비로그인 허용
                        .requestMatchers(HttpMethod.GET, "/posts/**", "/posts").permitAll()

                        // 나머지는 인증 필요 (/auth/me, 게시글 작성/수정/삭제)
                        .anyRequest().authenticated()
                )
                .build();
    }
}
