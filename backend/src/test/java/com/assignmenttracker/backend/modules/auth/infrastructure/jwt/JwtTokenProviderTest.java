package com.assignmenttracker.backend.modules.auth.infrastructure.jwt;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Base64;

import io.jsonwebtoken.Jwts.SIG;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class JwtTokenProviderTest {

    @Test
    void rejectsMissingOrBlankSecret() {
        assertThatThrownBy(() -> new JwtTokenProvider(null))
                .isInstanceOf(SigningKeyInvalidException.class);
        assertThatThrownBy(() -> new JwtTokenProvider(""))
                .isInstanceOf(SigningKeyInvalidException.class);
        assertThatThrownBy(() -> new JwtTokenProvider("   "))
                .isInstanceOf(SigningKeyInvalidException.class);
    }

    @Test
    void rejectsSecretShorterThanMinimum() {
        assertThatThrownBy(() -> new JwtTokenProvider("a".repeat(31)))
                .isInstanceOf(SigningKeyInvalidException.class)
                .hasMessageContaining("at least 32 bytes");
    }

    @Test
    void measuresKeyLengthInUtf8Bytes() {
        // 16 two-byte characters
        JwtTokenProvider provider = new JwtTokenProvider("é".repeat(16));

        assertThat(provider.getSecretKey().getEncoded()).hasSize(32);
    }

    @Test
    void selectsHmacStrengthFromKeyLength() {
        assertThat(new JwtTokenProvider("k".repeat(32)).getAlgorithm()).isEqualTo(SIG.HS256);
        assertThat(new JwtTokenProvider("k".repeat(48)).getAlgorithm()).isEqualTo(SIG.HS384);
        assertThat(new JwtTokenProvider("k".repeat(64)).getAlgorithm()).isEqualTo(SIG.HS512);
        assertThat(new JwtTokenProvider("k".repeat(100)).getAlgorithm()).isEqualTo(SIG.HS512);
    }

    @Test
    void keyIsUsedAsIsWithoutPadding() {
        JwtTokenProvider provider = new JwtTokenProvider("k".repeat(40));

        assertThat(provider.getSecretKey().getEncoded()).hasSize(40);
    }

    @Test
    void decodesBase64PrefixedSecret() {
        byte[] raw = new byte[64];
        for (int i = 0; i < raw.length; i++) {
            raw[i] = (byte) i;
        }
        JwtTokenProvider provider = new JwtTokenProvider("base64:" + Base64.getEncoder().encodeToString(raw));

        assertThat(provider.getSecretKey().getEncoded()).isEqualTo(raw);
        assertThat(provider.getAlgorithm()).isEqualTo(SIG.HS512);
    }

    @Test
    void rejectsInvalidOrShortBase64Secret() {
        assertThatThrownBy(() -> new JwtTokenProvider("base64:not*base64!"))
                .isInstanceOf(SigningKeyInvalidException.class);
        assertThatThrownBy(() -> new JwtTokenProvider("base64:" + Base64.getEncoder().encodeToString(new byte[16])))
                .isInstanceOf(SigningKeyInvalidException.class);
    }

    @Test
    void shortConfiguredSecretPreventsContextStartup() {
        new ApplicationContextRunner()
                .withPropertyValues("jwt.secret=too-short")
                .withUserConfiguration(JwtTokenProvider.class)
                .run(context -> {
                    assertThat(context).hasFailed();
                    assertThat(context.getStartupFailure()).hasRootCauseInstanceOf(SigningKeyInvalidException.class);
                });
    }
}
