package com.inkpost.backend.security;

import java.time.Instant;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.inkpost.backend.support.TestJwt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("[Security] JwtService 발급/검증")
class JwtServiceTest {

    private final JwtService jwtService = TestJwt.jwtService();

    @Nested
    @DisplayName("sign / verify")
    class SignAndVerify {

        @Test
        @DisplayName("발급한 토큰을 검증하면 userId/email/kind/만료시간이 복원된다")
        void roundTrip() {
            String token = jwtService.sign(7L, "a@b.com", TokenKind.REFRESH, 120);

            TokenPayload payload = jwtService.verify(token);

            assertThat(payload.userId()).isEqualTo(7L);
            assertThat(payload.email()).isEqualTo("a@b.com");
            assertThat(payload.kind()).isEqualTo(TokenKind.REFRESH);
            assertThat(payload.issuedAt()).isEqualTo(TestJwt.NOW);
            assertThat(payload.expiresAt()).isEqualTo(TestJwt.NOW.plusSeconds(120));
        }

        @Test
        @DisplayName("issue는 kind별 설정 TTL을 사용한다")
        void issueUsesConfiguredTtl() {
            TokenPayload access = jwtService.verify(jwtService.issue(1L, "a@b.com", TokenKind.ACCESS));
            TokenPayload refresh = jwtService.verify(jwtService.issue(1L, "a@b.com", TokenKind.REFRESH));

            assertThat(access.expiresAt()).isEqualTo(TestJwt.NOW.plusSeconds(TestJwt.ACCESS_TTL));
            assertThat(refresh.expiresAt()).isEqualTo(TestJwt.NOW.plusSeconds(TestJwt.REFRESH_TTL));
        }

        @Test
        @DisplayName("잘못된 입력으로는 서명하지 않는다")
        void rejectsBadInput() {
            assertThatThrownBy(() -> jwtService.sign(null, "a@b.com", TokenKind.ACCESS, 10))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> jwtService.sign(1L, " ", TokenKind.ACCESS, 10))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> jwtService.sign(1L, "a@b.com", TokenKind.ACCESS, 0))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("검증 실패")
    class VerifyFailures {

        @Test
        @DisplayName("exp가 지난 토큰 -> ExpiredTokenException")
        void expired() {
            String token = jwtService.issue(1L, "a@b.com", TokenKind.ACCESS);

            Instant later = TestJwt.NOW.plusSeconds(TestJwt.ACCESS_TTL + 1);
            JwtService afterExpiry = TestJwt.jwtService(TestJwt.clockAt(later));

            assertThatThrownBy(() -> afterExpiry.verify(token))
                    .isInstanceOf(ExpiredTokenException.class);
        }

        @Test
        @DisplayName("다른 secret으로 서명된 토큰 -> InvalidTokenException")
        void differentSecret() {
            JwtService other = new JwtService(
                    TestJwt.props("another-secret-another-secret-another-secret"),
                    TestJwt.clockAt(TestJwt.NOW));
            String foreign = other.issue(1L, "a@b.com", TokenKind.ACCESS);

            assertThatThrownBy(() -> jwtService.verify(foreign))
                    .isExactlyInstanceOf(InvalidTokenException.class);
        }

        @Test
        @DisplayName("서명 부분이 변조된 토큰 -> InvalidTokenException")
        void tampered() {
            String token = jwtService.issue(1L, "a@b.com", TokenKind.ACCESS);
            String tampered = token.substring(0, token.length() - 2)
                    + (token.endsWith("AA") ? "BB" : "AA");

            assertThatThrownBy(() -> jwtService.verify(tampered))
                    .isInstanceOf(InvalidTokenException.class);
        }

        @Test
        @DisplayName("JWT 형식이 아닌 문자열/빈 값 -> InvalidTokenException")
        void garbage() {
            assertThatThrownBy(() -> jwtService.verify("not-a-jwt"))
                    .isInstanceOf(InvalidTokenException.class);
            assertThatThrownBy(() -> jwtService.verify(""))
                    .isInstanceOf(InvalidTokenException.class);
            assertThatThrownBy(() -> jwtService.verify(null))
                    .isInstanceOf(InvalidTokenException.class);
        }

        @Test
        @DisplayName("32바이트 미만 secret은 생성 시점에 실패")
        void shortSecretFailsFast() {
            assertThatThrownBy(() -> new JwtService(TestJwt.props("too-short"), TestJwt.clockAt(TestJwt.NOW)))
                    .isInstanceOf(IllegalStateException.class);
        }
    }

    @Nested
    @DisplayName("verifyAccessToken")
    class VerifyAccessToken {

        @Test
        @DisplayName("access 토큰 -> AuthPrincipal")
        void acceptsAccess() {
            AuthPrincipal principal = jwtService.verifyAccessToken(
                    jwtService.issue(3L, "c@d.com", TokenKind.ACCESS));

            assertThat(principal).isEqualTo(new AuthPrincipal(3L, "c@d.com"));
        }

        @Test
        @DisplayName("refresh 토큰 -> WrongTokenKindException")
        void rejectsRefresh() {
            String refresh = jwtService.issue(3L, "c@d.com", TokenKind.REFRESH);

            assertThatThrownBy(() -> jwtService.verifyAccessToken(refresh))
                    .isInstanceOfSatisfying(WrongTokenKindException.class, ex -> {
                        assertThat(ex.getExpected()).isEqualTo(TokenKind.ACCESS);
                        assertThat(ex.getActual()).isEqualTo(TokenKind.REFRESH);
                    });
        }
    }
}
