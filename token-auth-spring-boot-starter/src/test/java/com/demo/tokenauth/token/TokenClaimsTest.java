package com.demo.tokenauth.token;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class TokenClaimsTest {

    @Test
    void findScope_returnsFirstCandidatePresent() {
        var claims = TokenClaims.builder().scopes(List.of("page/read", "admin/read")).build();

        assertThat(claims.findScope(List.of("page/write", "admin/read", "page/read"))).isEqualTo("admin/read");
        assertThat(claims.findScope(List.of("page/write", "page/delete"))).isNull();
        assertThat(claims.findScope(List.of())).isNull();
    }

    @Test
    void isImmutable() {
        var scopes = new ArrayList<>(List.of("a/read"));
        var claims = TokenClaims.builder().scopes(scopes).build();
        scopes.add("b/read");

        assertThat(claims.scopes()).containsExactly("a/read");
        assertThatThrownBy(() -> claims.scopes().add("c/read")).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> claims.metadata().put("k", "v")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void toBuilder_derivesNewValue() {
        var original = TokenClaims.builder().subject("1").tokenId("jti-1").scope("a/read").build();
        var derived = original.toBuilder().tokenId("jti-2").build();

        assertThat(original.tokenId()).isEqualTo("jti-1");
        assertThat(derived.tokenId()).isEqualTo("jti-2");
        assertThat(derived.subject()).isEqualTo("1");
        assertThat(derived.scopes()).containsExactly("a/read");
        assertThat(original.toBuilder().build()).isEqualTo(original);
    }

    @Test
    void metadataValuesTakeJsonTypes() {
        var claims = TokenClaims.builder()
                .metadata("count", 5L)
                .metadata("ratio", 1.5f)
                .metadata("flag", true)
                .metadata("missing", null)
                .build();

        assertThat(claims.metadata().get("count")).isEqualTo(5);
        assertThat(claims.metadata().get("ratio")).isEqualTo(1.5);
        assertThat(claims.metadata()).containsEntry("flag", true).containsEntry("missing", null);
        assertThat(claims).isEqualTo(TokenClaims.builder().metadata("count", 5).metadata("ratio", 1.5)
                .metadata("flag", true).metadata("missing", null).build());
    }

    @Test
    void metadataMustBeJsonSerializable() {
        var builder = TokenClaims.builder().metadata("self", new Object());

        assertThatThrownBy(builder::build).isInstanceOf(IllegalArgumentException.class);
    }
}
