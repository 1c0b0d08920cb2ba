package com.demo.tokenauth;

import static com.demo.tokenauth.TestTokens.NOW;
import static com.demo.tokenauth.TestTokens.OTHER_SECRET;
import static com.demo.tokenauth.TestTokens.clockAt;
import static com.demo.tokenauth.TestTokens.config;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.demo.tokenauth.exception.TokenAuthConfigException;
import com.demo.tokenauth.security.TokenVerificationException;
import com.demo.tokenauth.security.VerificationFailure;
import com.demo.tokenauth.spi.AuthUser;
import com.demo.tokenauth.spi.BasicTokenSerializer;
import com.demo.tokenauth.spi.TokenSerializationException;
import com.demo.tokenauth.store.InMemoryRevocationStore;
import com.demo.tokenauth.store.RevocationStoreException;
import com.demo.tokenauth.token.TokenDefaults;
import com.demo.tokenauth.token.TokenIdStrategy;
import com.demo.tokenauth.token.TokenOptions;
import com.demo.tokenauth.token.TokenRequest;
import com.demo.tokenauth.token.Ttl;
import java.util.List;
import org.junit.jupiter.api.Test;

class TokenAuthTest {

    @Test
    void issueAndVerify() {
        var tokenAuth = new TokenAuth(config().build());
        var claims = tokenAuth.token(TokenRequest.builder().subject(1).scopes("admin/read").build());

        var result = tokenAuth.verify(tokenAuth.sign(claims));

        assertThat(result.isValid()).isTrue();
        assertThat(result.getClaims()).isEqualTo(claims);
    }

    @Test
    void verifyOrThrow_carriesFailure() {
        var tokenAuth = new TokenAuth(config().build());
        var token = tokenAuth.sign(tokenAuth.token(null, TokenOptions.atTime(NOW).ttlSeconds(-1)));

        assertThatThrownBy(() -> tokenAuth.verifyOrThrow(token))
                .isInstanceOf(TokenVerificationException.class)
                .satisfies(e -> assertThat(((TokenVerificationException) e).getFailure())
                        .isEqualTo(VerificationFailure.EXPIRED));
    }

    @Test
    void resourceRoundTrip() {
        var tokenAuth = new TokenAuth(config().serializer(new BasicTokenSerializer()).build());

        String token = tokenAuth.forToken(AuthUser.of(42, "admin/read", "user/write"));
        AuthUser user = tokenAuth.fromToken(token);

        assertThat(user).isEqualTo(AuthUser.of(42, "admin/read", "user/write"));
    }

    @Test
    void fromToken_rejectsInvalidTokenBeforeSerializer() {
        var tokenAuth = new TokenAuth(config().serializer(new BasicTokenSerializer()).build());

        assertThatThrownBy(() -> tokenAuth.fromToken("garbage"))
                .isInstanceOf(TokenVerificationException.class);
    }

    @Test
    void serializerFailureIsPropagated() {
        var tokenAuth = new TokenAuth(config().serializer(new BasicTokenSerializer()).build());
        var token = tokenAuth.sign(tokenAuth.token());

        assertThatThrownBy(() -> tokenAuth.fromToken(token))
                .isInstanceOf(TokenSerializationException.class)
                .hasMessageContaining("subject");
        assertThatThrownBy(() -> tokenAuth.forToken(new AuthUser(null, List.of())))
                .isInstanceOf(TokenSerializationException.class);
    }

    @Test
    void missingSerializer_isReported() {
        var tokenAuth = new TokenAuth(config().build());

        assertThatThrownBy(() -> tokenAuth.forToken(AuthUser.of(1)))
                .isInstanceOf(TokenSerializationException.class)
                .hasMessage("no serializer configured");
    }

    @Test
    void blacklistRevokesSingleToken() {
        var tokenAuth = new TokenAuth(config().blacklist(new InMemoryRevocationStore()).build());
        var first = tokenAuth.token(TokenRequest.forSubject("1"));
        var second = tokenAuth.token(TokenRequest.forSubject("1"));

        tokenAuth.blacklist(first);

        assertThat(tokenAuth.isBlacklisted(first)).isTrue();
        assertThat(tokenAuth.verify(tokenAuth.sign(first)).getFailure()).isEqualTo(VerificationFailure.BLACKLISTED);
        assertThat(tokenAuth.verify(tokenAuth.sign(second)).isValid()).isTrue();

        tokenAuth.unblacklist(first.tokenId());

        assertThat(tokenAuth.isBlacklisted(first.tokenId())).isFalse();
        assertThat(tokenAuth.verify(tokenAuth.sign(first)).isValid()).isTrue();
    }

    @Test
    void banRevokesEveryTokenOfSubject() {
        var tokenAuth = new TokenAuth(config().banlist(new InMemoryRevocationStore()).build());
        var first = tokenAuth.token(TokenRequest.forSubject("1"));
        var other = tokenAuth.token(TokenRequest.forSubject("2"));

        tokenAuth.ban("1");

        assertThat(tokenAuth.isBanned(first)).isTrue();
        assertThat(tokenAuth.verify(tokenAuth.sign(first)).getFailure()).isEqualTo(VerificationFailure.BANNED);
        assertThat(tokenAuth.verify(tokenAuth.sign(other)).isValid()).isTrue();

        tokenAuth.unban(first);

        assertThat(tokenAuth.verify(tokenAuth.sign(first)).isValid()).isTrue();
    }

    @Test
    void disabledStore_rejectsRevocationCalls() {
        var tokenAuth = new TokenAuth(config().build());

        assertThatThrownBy(() -> tokenAuth.blacklist("jti"))
                .isInstanceOf(RevocationStoreException.class)
                .hasMessage("blacklist is disabled");
        assertThatThrownBy(() -> tokenAuth.isBanned("1"))
                .isInstanceOf(RevocationStoreException.class)
                .hasMessage("banlist is disabled");
    }

    @Test
    void revocationKeyMustNotBeBlank() {
        var tokenAuth = new TokenAuth(config().blacklist(new InMemoryRevocationStore()).build());
        var claims = tokenAuth.token(TokenRequest.builder().withoutTokenId().build());

        assertThatThrownBy(() -> tokenAuth.blacklist(claims)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reconfigure_appliesToLaterCalls() {
        var tokenAuth = new TokenAuth(config().build());
        var before = tokenAuth.sign(tokenAuth.token());

        tokenAuth.reconfigure(c -> c.toBuilder()
                .secret(OTHER_SECRET)
                .defaults(new TokenDefaults("auth", null, List.of(), TokenIdStrategy.disabled(), Ttl.ofSeconds(60)))
                .build());

        assertThat(tokenAuth.verify(before).getFailure()).isEqualTo(VerificationFailure.BAD_TOKEN);
        var claims = tokenAuth.token();
        assertThat(claims.issuer()).isEqualTo("auth");
        assertThat(claims.tokenId()).isNull();
        assertThat(tokenAuth.verify(tokenAuth.sign(claims)).isValid()).isTrue();
    }

    @Test
    void reconfigure_keepsPreviousConfigWhenInvalid() {
        var tokenAuth = new TokenAuth(config().build());
        var original = tokenAuth.getConfig();

        assertThatThrownBy(() -> tokenAuth.reconfigure(c -> c.toBuilder().secret("short").build()))
                .isInstanceOf(TokenAuthConfigException.class);

        assertThat(tokenAuth.getConfig()).isSameAs(original);
    }

    @Test
    void reconfigure_clockMovesVerification() {
        var tokenAuth = new TokenAuth(config().build());
        var token = tokenAuth.sign(tokenAuth.token(null, TokenOptions.withTtl(Ttl.ofSeconds(10))));

        tokenAuth.reconfigure(c -> c.toBuilder().clock(clockAt(NOW + 10)).build());

        assertThat(tokenAuth.verify(token).getFailure()).isEqualTo(VerificationFailure.EXPIRED);
    }

    @Test
    void invalidInitialConfigFails() {
        assertThatThrownBy(() -> new TokenAuth(config().secret(null).build()))
                .isInstanceOf(TokenAuthConfigException.class);
    }

    @Test
    void toStringOmitsSecret() {
        assertThat(config().build().toString()).doesNotContain(TestTokens.SECRET);
    }
}
