package com.inkpost.backend;

import java.time.Duration;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.MySQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import com.inkpost.backend.auth.AbstractAuthIntegrationTest;
import com.inkpost.backend.global.ErrorCode;
import com.inkpost.backend.support.AuthFlowSupport;
import com.inkpost.backend.support.AuthHttpSupport;
import com.inkpost.backend.support.AuthHttpSupport.Tokens;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 운영과 같은 MySQL 8 위에서 돌리는 통합 테스트
 * - 기본 스위트는 H2(MySQL 모드)라서, 여기서 Flyway 스크립트 + ddl-auto=validate 를 실제 MySQL로 한 번 더 확인한다.
 * - Docker가 없는 환경에서는 통째로 skip
 */
@Testcontainers(disabledWithoutDocker = true)
@DisplayName("[MySQL] Testcontainers 기반 통합 테스트")
class MySqlIntegrationTest extends AbstractAuthIntegrationTest {

    @Container
    static final MySQLContainer<?> MYSQL = new MySQLContainer<>("mysql:8.0.36")
            .withDatabaseName("inkpost_test")
            .withUsername("inkpost")
            .withPassword("inkpost")
            .withStartupAttempts(3)
            .withStartupTimeout(Duration.ofMinutes(2));

    @DynamicPropertySource
    static void overrideProps(DynamicPropertyRegistry r) {
        r.add("spring.datasource.url", MYSQL::getJdbcUrl);
        r.add("spring.datasource.username", MYSQL::getUsername);
        r.add("spring.datasource.password", MYSQL::getPassword);
        r.add("spring.datasource.driver-class-name", () -> "com.mysql.cj.jdbc.Driver");

        r.add("spring.datasource.hikari.connection-timeout", () -> "30000");
    }

    @Test
    @DisplayName("Flyway 마이그레이션 후 엔티티 매핑 검증(validate)까지 통과하고, 시드 유저가 저장된다")
    void schemaMatchesEntities() {
        assertThat(jdbc.queryForObject("select count(*) from users", Integer.class)).isEqualTo(1);
        assertThat(userRepository.findByEmail(EMAIL)).isPresent();
    }

    @Test
    @DisplayName("가입 -> 로그인 -> 글 작성 -> 목록 조회가 MySQL에서도 그대로 동작")
    void registerLoginAndPost() throws Exception {
        AuthFlowSupport.registerOk(mvc, "my@sql.dev", "Dolphin", "가".repeat(24));
        Tokens tokens = AuthFlowSupport.loginOk(mvc, "MY@sql.dev", "가".repeat(24));

        mvc.perform(post("/posts")
                        .header("Authorization", AuthHttpSupport.bearer(tokens.accessToken()))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"title":"첫 글","content":"본문"}
                                """))
                .andExpect(status().isCreated());

        mvc.perform(get("/posts?page=1&take=10"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total").value(1))
                .andExpect(jsonPath("$.data[0].title").value("첫 글"));
    }

    @Test
    @DisplayName("users 유니크 제약은 MySQL에서도 중복 이메일을 막는다")
    void duplicateEmail() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performRegister(mvc, EMAIL, "Other", "pw"),
                ErrorCode.EMAIL_ALREADY_EXISTS
        );
    }
}
