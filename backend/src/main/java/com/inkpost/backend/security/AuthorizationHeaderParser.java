package com.inkpost.backend.security;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

import org.springframework.stereotype.Component;

/**
 * Authorization 헤더 파서
 *
 * {authorization: 'Basic {base64(email:password)}'} -> 로그인
 * {authorization: 'Bearer {token}'}                 -> 보호 리소스 / 토큰 재발급
 *
 * 형식이 하나라도 어긋나면 MalformedHeaderException. (HTTP는 모른다)
 */
@Component
public class AuthorizationHeaderParser {

    public static final String BEARER = "Bearer";
    public static final String BASIC = "Basic";

    /**
     * "scheme token" 에서 token만 꺼낸다.
     * - 공백 한 칸 기준으로 정확히 두 덩어리여야 하고
     * - 첫 덩어리가 기대한 scheme과 같아야 한다. (대소문자 구분)
     */
    public String extractToken(String header, boolean expectBearer) {
        if (header == null) {
            throw new MalformedHeaderException("authorization header is missing");
        }

        String prefix = expectBearer ? BEARER : BASIC;

        // limit -1: "Bearer " 처럼 끝이 빈 덩어리도 버리지 않고 개수에 포함
        String[] split = header.split(" ", -1);
        if (split.length != 2 || !prefix.equals(split[0])) {
            throw new MalformedHeaderException("expected '" + prefix + " <token>'");
        }

        String token = split[1];
        if (token.isEmpty()) {
            throw new MalformedHeaderException("token part is empty");
        }
        return token;
    }

    /**
     * Basic 페이로드 디코딩
     * 1) base64 -> "email:password" (UTF-8)
     * 2) 첫 번째 ':' 기준으로 나눈다. (비밀번호에는 ':'가 들어갈 수 있음)
     */
    public BasicCredential decodeBasicCredential(String base64Payload) {
        if (base64Payload == null) {
            throw new MalformedHeaderException("basic credential is missing");
        }

        String decoded;
        try {
            decoded = new String(Base64.getDecoder().decode(base64Payload), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException e) {
            throw new MalformedHeaderException("basic credential is not valid base64", e);
        }

        String[] split = decoded.split(":", 2);
        if (split.length != 2) {
            throw new MalformedHeaderException("basic credential must be 'email:password'");
        }
        return new BasicCredential(split[0], split[1]);
    }
}
