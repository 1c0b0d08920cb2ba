package com.demo.tokenauth.token;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 签发 token 时调用方显式给出的 claim（部分）。
 * <p>
 * 为 null 的字段使用 {@link TokenDefaults} 中的默认值；非 null 的字段覆盖默认值。
 */
public record TokenRequest(String subject,
                           String issuer,
                           String audience,
                           List<String> scopes,
                           TokenIdStrategy tokenId,
                           Map<String, Object> metadata) {

    private static final TokenRequest EMPTY = new TokenRequest(null, null, null, null, null, null);

    public TokenRequest {
        scopes = scopes == null ? null : List.copyOf(scopes);
        metadata = metadata == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static TokenRequest empty() {
        return EMPTY;
    }

    public static TokenRequest forSubject(String subject) {
        return builder().subject(subject).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private String subject;
        private String issuer;
        private String audience;
        private List<String> scopes;
        private TokenIdStrategy tokenId;
        private Map<String, Object> metadata;

        private Builder() {
        }

        public Builder subject(String subject) {
            this.subject = subject;
            return this;
        }

        public Builder subject(long subject) {
            this.subject = String.valueOf(subject);
            return this;
        }

        public Builder issuer(String issuer) {
            this.issuer = issuer;
            return this;
        }

        public Builder audience(String audience) {
            this.audience = audience;
            return this;
        }

        public Builder scopes(List<String> scopes) {
            this.scopes = scopes;
            return this;
        }

        public Builder scopes(String... scopes) {
            this.scopes = List.of(scopes);
            return this;
        }

        /**
         * 显式 jti（字符串原样使用）。
         */
        public Builder tokenId(String tokenId) {
            this.tokenId = TokenIdStrategy.literal(tokenId);
            return this;
        }

        public Builder tokenId(TokenIdStrategy tokenId) {
            this.tokenId = tokenId;
            return this;
        }

        /**
         * 本 token 不写 jti。
         */
        public Builder withoutTokenId() {
            this.tokenId = TokenIdStrategy.disabled();
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public TokenRequest build() {
            return new TokenRequest(subject, issuer, audience, scopes, tokenId, metadata);
        }
    }
}
