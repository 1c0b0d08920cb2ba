package com.demo.tokenauth.token;

import java.util.Objects;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * jti 的生成方式。
 * <p>
 * - literal：直接使用给定字符串
 * - generated：每次签发时调用 supplier 生成
 * - disabled：不写 jti（该 token 无法按 jti 拉黑）
 */
public final class TokenIdStrategy {

    private static final TokenIdStrategy DISABLED = new TokenIdStrategy(() -> null, false);
    private static final TokenIdStrategy UUID_HEX = generated(() -> UUID.randomUUID().toString().replace("-", ""));

    private final Supplier<String> supplier;
    private final boolean generated;

    private TokenIdStrategy(Supplier<String> supplier, boolean generated) {
        this.supplier = supplier;
        this.generated = generated;
    }

    /**
     * 字符串原样写入 jti，包括空串；空白 jti 的 token 在启用 blacklist 时校验为 jti_unverified。
     */
    public static TokenIdStrategy literal(String tokenId) {
        Objects.requireNonNull(tokenId, "tokenId must not be null");
        return new TokenIdStrategy(() -> tokenId, false);
    }

    public static TokenIdStrategy generated(Supplier<String> supplier) {
        Objects.requireNonNull(supplier, "supplier must not be null");
        return new TokenIdStrategy(supplier, true);
    }

    /**
     * 默认策略：32 位十六进制 UUID。
     */
    public static TokenIdStrategy uuid() {
        return UUID_HEX;
    }

    public static TokenIdStrategy disabled() {
        return DISABLED;
    }

    public boolean isDisabled() {
        return this == DISABLED;
    }

    /**
     * 解析出本次签发使用的 jti；disabled 返回 null。
     */
    public String resolve() {
        if (isDisabled()) {
            return null;
        }
        String id = supplier.get();
        if (generated && (id == null || id.isBlank())) {
            throw new IllegalStateException("token id generator returned a blank id");
        }
        return id;
    }
}
