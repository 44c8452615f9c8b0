package com.inkpost.backend;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.security.servlet.UserDetailsServiceAutoConfiguration;
import org.springframework.context.annotation.Import;

import com.inkpost.backend.auth.config.AuthModuleConfig;

/*
# 회원가입 201
curl -i -X POST "http://localhost:8080/auth/register/email" \
  -H "Content-Type: application/json" \
  -d '{"email":"anna@inkpost.dev","nickname":"Anna","password":"pw1234!"}'

# 로그인 200 (Basic base64(email:password))
curl -i -X POST "http://localhost:8080/auth/login/email" \
  -H "Authorization: Basic $(printf 'anna@inkpost.dev:pw1234!' | base64)"

# access 재발급 201 (refresh 토큰으로만 가능)
curl -i -X POST "http://localhost:8080/auth/token/access" \
  -H "Authorization: Bearer <refreshToken>"

# refresh 재발급 201
curl -i -X POST "http://localhost:8080/auth/token/refresh" \
  -H "Authorization: Bearer <refreshToken>"

# 내 정보
curl -i "http://localhost:8080/auth/me" -H "Authorization: Bearer <accessToken>"

# 게시글 작성 / 목록(커서) / 목록(페이지)
curl -i -X POST "http://localhost:8080/posts" \
  -H "Authorization: Bearer <accessToken>" -H "Content-Type: application/json" \
  -d '{"title":"hello","content":"first post"}'
curl -i "http://localhost:8080/posts?order__createdAt=DESC&take=10"
curl -i "http://localhost:8080/posts?page=2&take=10"
*/

/**
 * 설정 값 주입 흐름: 환경변수 -> application.yml(${ENV:default}) -> @ConfigurationProperties(AuthProperties)
 *
 * - AuthProperties는 @Validated라서 secret 길이/TTL 같은 조건이 깨지면 부팅 자체가 실패한다. (Fail-fast)
 * - JWT 방식이라 UserDetailsService 자동설정(기본 인메모리 유저 생성)은 꺼둔다.
 */
@Import(AuthModuleConfig.class)
@SpringBootApplication(exclude = {UserDetailsServiceAutoConfiguration.class})
public class BackendApplication {
    public static void main(String[] args) {
        SpringApplication.run(BackendApplication.class, args);
    }
}
