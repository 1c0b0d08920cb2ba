package com.demo.tokenauth.security;

import com.demo.tokenauth.exception.TokenAuthConfigException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.MacAlgorithm;

import java.util.Locale;

/**
 * 支持的签名算法（仅 HMAC）。
 * <p>
 * minKeyBytes：JJWT 要求 HMAC 密钥长度不小于摘要长度，不足会在签名时抛 WeakKeyException，
 * 因此在构造 signer/verifier 时提前校验。
 */
public enum JwtAlgorithm {

    HS256(Jwts.SIG.HS256, "HmacSHA256", 32),
    HS384(Jwts.SIG.HS384, "HmacSHA384", 48),
    HS512(Jwts.SIG.HS512, "HmacSHA512", 64);

    private final MacAlgorithm macAlgorithm;
    private final String jcaName;
    private final int minKeyBytes;

    JwtAlgorithm(MacAlgorithm macAlgorithm, String jcaName, int minKeyBytes) {
        this.macAlgorithm = macAlgorithm;
        this.jcaName = jcaName;
        this.minKeyBytes = minKeyBytes;
    }

    /**
     * "HS256" / "hs256" -> HS256；其他值一律拒绝。
     */
    public static JwtAlgorithm parse(String name) {
        if (name == null || name.isBlank()) {
            throw new TokenAuthConfigException("token-auth.algorithm must not be blank");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new TokenAuthConfigException("Unsupported algorithm: " + name + " (expected HS256, HS384 or HS512)");
        }
    }

    MacAlgorithm macAlgorithm() {
        return macAlgorithm;
    }

    String jcaName() {
        return jcaName;
    }

    public int minKeyBytes() {
        return minKeyBytes;
    }
}
