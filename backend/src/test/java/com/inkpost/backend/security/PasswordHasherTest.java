package com.inkpost.backend.security;

import java.security.SecureRandom;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("[Security] PasswordHasher")
class PasswordHasherTest {

    private final SecureRandom random = new SecureRandom();
    private final PasswordHasher hasher = new PasswordHasher(new BCryptPasswordEncoder(4, random), random);

    @Nested
    @DisplayName("hash")
    class Hash {

        @Test
        @DisplayName("평문이 그대로 남지 않고 BCrypt 형식으로 저장된다")
        void producesBcryptHash() {
            String hash = hasher.hash("pw1234!");

            assertThat(hash).isNotEqualTo("pw1234!");
            assertThat(hash).startsWith("$2a$04$");
        }

        @Test
        @DisplayName("같은 평문이라도 salt 때문에 매번 다른 해시")
        void saltedPerCall() {
            assertThat(hasher.hash("same")).isNotEqualTo(hasher.hash("same"));
        }

        @Test
        @DisplayName("cost factor를 직접 지정할 수 있다")
        void explicitCostFactor() {
            String hash = hasher.hash("pw", 5);

            assertThat(hash).startsWith("$2a$05$");
            assertThat(hasher.matches("pw", hash)).isTrue();
        }

        @Test
        @DisplayName("빈 문자열도 해싱/비교된다, null은 거절")
        void emptyStringRoundTrips() {
            String hash = hasher.hash("");

            assertThat(hasher.matches("", hash)).isTrue();
            assertThat(hasher.matches(" ", hash)).isFalse();
            assertThatThrownBy(() -> hasher.hash(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("UTF-8 72바이트 초과는 글자 수가 적어도 거절 (한글 25자 = 75바이트)")
        void rejectsOverByteLimit() {
            String korean75Bytes = "가".repeat(24) + "A";

            assertThat(korean75Bytes).hasSize(25);
            assertThatThrownBy(() -> hasher.hash(korean75Bytes))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> hasher.hash(korean75Bytes, 4))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("정확히 72바이트는 허용")
        void acceptsExactlyByteLimit() {
            String korean72Bytes = "가".repeat(24);

            String hash = hasher.hash(korean72Bytes);

            assertThat(hasher.matches(korean72Bytes, hash)).isTrue();
        }
    }

    @Nested
    @DisplayName("matches")
    class Matches {

        @Test
        @DisplayName("같은 평문 -> true, 다른 평문 -> false")
        void matchesOnlySamePlaintext() {
            String hash = hasher.hash("correct horse");

            assertThat(hasher.matches("correct horse", hash)).isTrue();
            assertThat(hasher.matches("battery staple", hash)).isFalse();
        }

        @Test
        @DisplayName("깨진 해시/빈 값은 예외 없이 false")
        void neverThrows() {
            assertThat(hasher.matches("pw", "not-a-bcrypt-hash")).isFalse();
            assertThat(hasher.matches("pw", "")).isFalse();
            assertThat(hasher.matches("pw", null)).isFalse();
            assertThat(hasher.matches(null, hasher.hash("pw"))).isFalse();
        }

        @Test
        @DisplayName("앞 72바이트가 같아도 더 긴 평문은 false (BCrypt 잘림으로 통과하지 않는다)")
        void longerPlaintextWithSamePrefixDoesNotMatch() {
            String korean72Bytes = "가".repeat(24);
            String hash = hasher.hash(korean72Bytes);

            assertThat(hasher.matches(korean72Bytes + "TOTALLY-DIFFERENT", hash)).isFalse();
            assertThat(hasher.matches(korean72Bytes + "A", hash)).isFalse();
        }
    }
}
