package com.inkpost.backend.auth.token;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.web.servlet.MvcResult;

import com.inkpost.backend.auth.AbstractAuthIntegrationTest;
import com.inkpost.backend.auth.config.AuthProperties;
import com.inkpost.backend.global.ErrorCode;
import com.inkpost.backend.security.JwtService;
import com.inkpost.backend.security.TokenKind;
import com.inkpost.backend.security.TokenPayload;
import com.inkpost.backend.support.AuthFlowSupport;
import com.inkpost.backend.support.AuthHttpSupport;
import com.inkpost.backend.support.AuthHttpSupport.Tokens;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@DisplayName("[Auth][Token] 토큰 재발급(/auth/token/**) 통합 테스트")
class AuthTokenIntegrationTest extends AbstractAuthIntegrationTest {

    @Autowired JwtService jwtService;
    @Autowired AuthProperties authProperties;

    @Test
    @DisplayName("token/access: refresh 토큰 -> 201 + 새 access, 그 access로 /auth/me 가능")
    void reissue_access() throws Exception {
        Tokens login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        MvcResult res = AuthHttpSupport.performReissue(mvc, "access", AuthHttpSupport.bearer(login.refreshToken()))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.accessToken").isNotEmpty())
                .andExpect(jsonPath("$.refreshToken").doesNotExist())
                .andReturn();

        String access = AuthHttpSupport.readJson(res).get("accessToken").asText();
        TokenPayload payload = jwtService.verify(access);
        assertThat(payload.kind()).isEqualTo(TokenKind.ACCESS);
        assertThat(payload.userId()).isEqualTo(seededUserId);

        AuthHttpSupport.performMe(mvc, AuthHttpSupport.bearer(access))
                .andExpect(status().isOk());
    }

    @Test
    @DisplayName("token/refresh: refresh 토큰 -> 201 + 새 refresh")
    void reissue_refresh() throws Exception {
        Tokens login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        MvcResult res = AuthHttpSupport.performReissue(mvc, "refresh", AuthHttpSupport.bearer(login.refreshToken()))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.refreshToken").isNotEmpty())
                .andExpect(jsonPath("$.accessToken").doesNotExist())
                .andReturn();

        String refresh = AuthHttpSupport.readJson(res).get("refreshToken").asText();
        assertThat(jwtService.verify(refresh).kind()).isEqualTo(TokenKind.REFRESH);
    }

    @Test
    @DisplayName("token/access: access 토큰으로 재발급 시도 -> 401 TOKEN_KIND_MISMATCH")
    void reissue_with_access_token() throws Exception {
        Tokens login = AuthFlowSupport.loginOk(mvc, EMAIL, PASSWORD);

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performReissue(mvc, "access", AuthHttpSupport.bearer(login.accessToken())),
                ErrorCode.TOKEN_KIND_MISMATCH
        );
    }

    @Test
    @DisplayName("token/refresh: 만료된 refresh 토큰 -> 401 TOKEN_EXPIRED")
    void reissue_with_expired_token() throws Exception {
        // 두 시간 전 시각으로 서명한 refresh 토큰 (TTL 1시간 -> 이미 만료)
        JwtService past = new JwtService(authProperties,
                Clock.fixed(Instant.now().minusSeconds(7200), ZoneId.of("Asia/Seoul")));
        String expired = past.issue(seededUserId, EMAIL, TokenKind.REFRESH);

        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performReissue(mvc, "refresh", AuthHttpSupport.bearer(expired)),
                ErrorCode.TOKEN_EXPIRED
        );
    }

    @Test
    @DisplayName("token/access: 서명 불량 토큰 -> 401 TOKEN_INVALID")
    void reissue_with_garbage() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performReissue(mvc, "access", AuthHttpSupport.bearer("not-a-jwt")),
                ErrorCode.TOKEN_INVALID
        );
    }

    @Test
    @DisplayName("token/access: 헤더 없음 / Bearer 아님 -> 401 MALFORMED_AUTH_HEADER")
    void reissue_with_malformed_header() throws Exception {
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performReissue(mvc, "access", null),
                ErrorCode.MALFORMED_AUTH_HEADER
        );
        AuthHttpSupport.expectErrorWithCode(
                AuthHttpSupport.performReissue(mvc, "refresh", "Basic abc"),
                ErrorCode.MALFORMED_AUTH_HEADER
        );
    }
}
