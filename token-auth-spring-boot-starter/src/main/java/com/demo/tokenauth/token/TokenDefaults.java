package com.demo.tokenauth.token;

import java.util.List;
import java.util.Objects;

/**
 * 签发 token 时的默认 claim 与默认有效期，来自外部配置。
 */
public record TokenDefaults(String issuer,
                            String audience,
                            List<String> scopes,
                            TokenIdStrategy tokenId,
                            Ttl ttl) {

    public static final long DEFAULT_TTL_SECONDS = 3600;

    public TokenDefaults {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
        tokenId = tokenId == null ? TokenIdStrategy.uuid() : tokenId;
        ttl = Objects.requireNonNull(ttl, "ttl must not be null");
    }

    /**
     * 无 iss/aud、无默认 scope、UUID jti、一小时有效期。
     */
    public static TokenDefaults standard() {
        return new TokenDefaults(null, null, List.of(), TokenIdStrategy.uuid(), Ttl.ofSeconds(DEFAULT_TTL_SECONDS));
    }
}
