package com.inkpost.backend.security;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

import javax.crypto.SecretKey;

import org.springframework.stereotype.Service;

import com.inkpost.backend.auth.config.AuthProperties;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;

/**
 * Access/Refresh Token(JWT) 발급/검증 서비스
 * - 서버가 DB를 조회하지 않고도(Stateless) 서명 검증만으로 "내가 발급한 토큰"인지 확인 가능
 * - 토큰 상태는 전부 서명된 문자열 안에 있다. (세션 저장소/폐기 목록 없음)
 *
 * JWT 구조: header.payload.signature
 * - header: 알고리즘/타입 정보 (HS256, JWT)
 * - payload: iss / sub(userId) / email / type(access|refresh) / iat / exp
 * - signature: header.payload를 서버 비밀키로 서명한 값(HMAC-SHA256)
 *
 * 발급: sign(userId, email, kind, ttl) / issue(userId, email, kind) - 설정된 TTL 사용
 * 검증: verify(token) - 서명/만료/issuer 검증 후 TokenPayload로 복원
 *       verifyAccessToken(token) - verify + type=access 강제 후 AuthPrincipal로 변환
 */
@Service
public class JwtService {

    private static final int MIN_SECRET_BYTES = 32;
    private static final String EMAIL_CLAIM = "email";
    private static final String TYPE_CLAIM = "type";

    private final AuthProperties.Jwt jwtProps;
    private final Clock clock;
    private final SecretKey key;
    private final JwtParser jwtParser;

    public JwtService(AuthProperties props, Clock clock) {
        this.jwtProps = props.jwt();
        this.clock = clock;

        byte[] secretBytes = jwtProps.secret().getBytes(StandardCharsets.UTF_8);
        if (secretBytes.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException("JWT secret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }
        this.key = Keys.hmacShaKeyFor(secretBytes);

        /*
         * parseClaimsJws(token) 한 번으로
         * - 서명 검증
         * - 만료(exp) 체크 (주입된 Clock 기준)
         * - issuer가 맞는지 확인
         */
        this.jwtParser = Jwts.parserBuilder()
                .requireIssuer(jwtProps.issuer())
                .setSigningKey(this.key)
                .setClock(() -> Date.from(clock.instant()))
                .build();
    }

    /** 설정된 TTL(access/refresh)로 토큰 발급 */
    public String issue(Long userId, String email, TokenKind kind) {
        return sign(userId, email, kind, ttlSecondsOf(kind));
    }

    public String sign(Long userId, String email, TokenKind kind, long expiresInSeconds) {
        if (userId == null) throw new IllegalArgumentException("userId must not be null");
        if (email == null || email.isBlank()) throw new IllegalArgumentException("email must not be blank");
        if (kind == null) throw new IllegalArgumentException("kind must not be null");
        if (expiresInSeconds <= 0) throw new IllegalArgumentException("expiresInSeconds must be positive");

        Instant now = clock.instant();
        Instant exp = now.plusSeconds(expiresInSeconds);

        return Jwts.builder()
                .setIssuer(jwtProps.issuer())           // iss
                .setSubject(String.valueOf(userId))     // sub
                .claim(EMAIL_CLAIM, email)              // email
                .claim(TYPE_CLAIM, kind.claimValue())   // type
                .setIssuedAt(Date.from(now))            // iat
                .setExpiration(Date.from(exp))          // exp
                .signWith(key, SignatureAlgorithm.HS256)
                .compact();
    }

    /**
     * 토큰 검증 후 TokenPayload 리턴 (kind는 검사하지 않음)
     *
     * @throws ExpiredTokenException exp가 지난 토큰
     * @throws InvalidTokenException 그 밖의 모든 검증 실패
     */
    public TokenPayload verify(String token) {
        if (token == null || token.isBlank()) {
            throw new InvalidTokenException("token is null or blank");
        }

        try {
            Claims claims = jwtParser.parseClaimsJws(token).getBody();

            Long userId = parseUserId(claims);
            String email = claims.get(EMAIL_CLAIM, String.class);
            if (email == null || email.isBlank()) {
                throw new InvalidTokenException("email claim missing");
            }
            TokenKind kind = TokenKind.fromClaim(claims.get(TYPE_CLAIM, String.class));

            return new TokenPayload(
                    userId,
                    email,
                    kind,
                    toInstant(claims.getIssuedAt()),
                    toInstant(claims.getExpiration()));
        } catch (ExpiredJwtException e) {
            throw new ExpiredTokenException("token expired", e);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("invalid token", e);
        }
    }

    /** 보호 리소스 접근용: refresh 토큰은 여기서 거절된다. */
    public AuthPrincipal verifyAccessToken(String token) {
        TokenPayload payload = verify(token);
        if (!payload.isKind(TokenKind.ACCESS)) {
            throw new WrongTokenKindException(TokenKind.ACCESS, payload.kind(), "access token required");
        }
        return new AuthPrincipal(payload.userId(), payload.email());
    }

    public long ttlSecondsOf(TokenKind kind) {
        return kind == TokenKind.REFRESH
                ? jwtProps.refreshTtlSeconds()
                : jwtProps.accessTtlSeconds();
    }

    // subject:userId -> Long userId 파싱
    private static Long parseUserId(Claims claims) {
        String sub = claims.getSubject();
        if (sub == null || sub.isBlank())
            throw new InvalidTokenException("subject (userId) is missing");

        try {
            return Long.valueOf(sub);
        } catch (NumberFormatException ex) {
            throw new InvalidTokenException("subject is not a valid Long: " + sub, ex);
        }
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }
}
