package com.demo.tokenauth.security;

import com.demo.tokenauth.exception.TokenAuthConfigException;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;

/**
 * 由配置的密钥字符串构造 HMAC 密钥。
 */
final class HmacKeys {

    private HmacKeys() {
    }

    static SecretKey of(String secret, JwtAlgorithm algorithm) {
        if (algorithm == null) {
            throw new TokenAuthConfigException("token-auth.algorithm must not be null");
        }
        if (secret == null || secret.isEmpty()) {
            throw new TokenAuthConfigException("token-auth.secret must not be empty");
        }
        byte[] bytes = secret.getBytes(StandardCharsets.UTF_8);
        if (bytes.length < algorithm.minKeyBytes()) {
            throw new TokenAuthConfigException("token-auth.secret length must be at least "
                    + algorithm.minKeyBytes() + " bytes for " + algorithm.name());
        }
        return new SecretKeySpec(bytes, algorithm.jcaName());
    }
}
