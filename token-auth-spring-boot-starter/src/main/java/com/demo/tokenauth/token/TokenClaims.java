package com.demo.tokenauth.token;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Token 的 claim 集合（不可变）。
 * <p>
 * 字段：
 * - sub = 主体（用户 id 等，数字 id 以十进制字符串表示）
 * - iss = 签发者
 * - aud = 接收方
 * - iat / nbf / exp = Unix 时间戳（秒），exp 为 null 表示永不过期
 * - jti = token 唯一标识（用于黑名单），null 表示不可按 jti 吊销
 * - scopes = 权限标签，形如 "admin/read"
 * - metadata = 业务自定义数据，本组件不解释
 * <p>
 * 约定：scopes / metadata 永不为 null；缺省为空集合。metadata 的值按 JSON 类型规整（如 5L -> 5）。
 */
public record TokenClaims(String subject,
                          String issuer,
                          String audience,
                          Long issuedAt,
                          Long notBefore,
                          Long expiresAt,
                          String tokenId,
                          List<String> scopes,
                          Map<String, Object> metadata) {

    public TokenClaims {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
        metadata = MetadataValues.normalize(metadata);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .subject(subject)
                .issuer(issuer)
                .audience(audience)
                .issuedAt(issuedAt)
                .notBefore(notBefore)
                .expiresAt(expiresAt)
                .tokenId(tokenId)
                .scopes(scopes)
                .metadata(metadata);
    }

    /**
     * token 的 scopes 中是否包含 candidates 之一。
     *
     * @return 第一个命中的 candidate（按 candidates 顺序），未命中返回 null
     */
    public String findScope(Collection<String> candidates) {
        if (candidates == null || candidates.isEmpty() || scopes.isEmpty()) return null;
        for (String c : candidates) {
            if (c != null && scopes.contains(c)) {
                return c;
            }
        }
        return null;
    }

    public boolean isRevocable() {
        return tokenId != null && !tokenId.isBlank();
    }

    public boolean isExpiring() {
        return expiresAt != null;
    }

    public static final class Builder {

        private String subject;
        private String issuer;
        private String audience;
        private Long issuedAt;
        private Long notBefore;
        private Long expiresAt;
        private String tokenId;
        private List<String> scopes = new ArrayList<>();
        private Map<String, Object> metadata = new LinkedHashMap<>();

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

        public Builder issuedAt(Long issuedAt) {
            this.issuedAt = issuedAt;
            return this;
        }

        public Builder notBefore(Long notBefore) {
            this.notBefore = notBefore;
            return this;
        }

        public Builder expiresAt(Long expiresAt) {
            this.expiresAt = expiresAt;
            return this;
        }

        public Builder tokenId(String tokenId) {
            this.tokenId = tokenId;
            return this;
        }

        public Builder scopes(Collection<String> scopes) {
            this.scopes = scopes == null ? new ArrayList<>() : new ArrayList<>(scopes);
            return this;
        }

        public Builder scope(String scope) {
            this.scopes.add(Objects.requireNonNull(scope, "scope must not be null"));
            return this;
        }

        public Builder metadata(Map<String, ?> metadata) {
            this.metadata = metadata == null ? new LinkedHashMap<>() : new LinkedHashMap<>(metadata);
            return this;
        }

        public Builder metadata(String key, Object value) {
            this.metadata.put(Objects.requireNonNull(key, "metadata key must not be null"), value);
            return this;
        }

        public TokenClaims build() {
            return new TokenClaims(subject, issuer, audience, issuedAt, notBefore, expiresAt,
                    tokenId, scopes, metadata);
        }
    }
}
