package com.inkpost.backend.auth.identity.login.service;

import org.springframework.stereotype.Service;

import com.inkpost.backend.auth.domain.User;
import com.inkpost.backend.auth.token.dto.TokenPair;
import com.inkpost.backend.auth.token.service.SessionIssuer;
import com.inkpost.backend.security.BasicCredential;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * 로그인 유스케이스
 *  : 인증 (CredentialAuthenticator) + 토큰 발급 (SessionIssuer)
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LoginService {

    private final CredentialAuthenticator credentialAuthenticator;
    private final SessionIssuer sessionIssuer;

    public TokenPair login(BasicCredential credential) {
        User user = credentialAuthenticator.authenticate(credential.email(), credential.password());
        TokenPair tokens = sessionIssuer.issueSession(user);

        log.info("Login succeeded: userId={}", user.getId());
        return tokens;
    }
}
