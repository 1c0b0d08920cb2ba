package com.demo.tokenauth.security;

import com.demo.tokenauth.token.TokenClaims;
import io.jsonwebtoken.Jwts;

import javax.crypto.SecretKey;
import java.util.Objects;

/**
 * 将 {@link TokenClaims} 签名为紧凑 JWT（header.payload.signature）。
 * <p>
 * 构造即校验密钥与算法，签名本身无副作用、可并发调用。
 */
public class JwtSigner {

    private final JwtAlgorithm algorithm;
    private final SecretKey key;

    public JwtSigner(String secret, JwtAlgorithm algorithm) {
        this.key = HmacKeys.of(secret, algorithm);
        this.algorithm = algorithm;
    }

    public String sign(TokenClaims claims) {
        Objects.requireNonNull(claims, "claims must not be null");
        return JwtClaimsMapper.write(Jwts.builder(), claims)
                .signWith(key, algorithm.macAlgorithm())
                .compact();
    }

    public JwtAlgorithm getAlgorithm() {
        return algorithm;
    }
}
