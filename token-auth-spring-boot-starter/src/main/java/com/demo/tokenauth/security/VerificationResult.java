package com.demo.tokenauth.security;

import com.demo.tokenauth.token.TokenClaims;

import java.util.Objects;

/**
 * 校验结果：成功时携带 claims，失败时携带唯一的失败原因。
 */
public final class VerificationResult {

    private final TokenClaims claims;
    private final VerificationFailure failure;

    private VerificationResult(TokenClaims claims, VerificationFailure failure) {
        this.claims = claims;
        this.failure = failure;
    }

    public static VerificationResult success(TokenClaims claims) {
        return new VerificationResult(Objects.requireNonNull(claims, "claims must not be null"), null);
    }

    public static VerificationResult failure(VerificationFailure failure) {
        return new VerificationResult(null, Objects.requireNonNull(failure, "failure must not be null"));
    }

    public boolean isValid() {
        return failure == null;
    }

    /**
     * @throws IllegalStateException 校验失败时
     */
    public TokenClaims getClaims() {
        if (failure != null) {
            throw new IllegalStateException("verification failed: " + failure.reason());
        }
        return claims;
    }

    /**
     * 失败原因；成功时为 null。
     */
    public VerificationFailure getFailure() {
        return failure;
    }

    /**
     * 成功返回 claims，失败抛 {@link TokenVerificationException}。
     */
    public TokenClaims orElseThrow() {
        if (failure != null) {
            throw new TokenVerificationException(failure);
        }
        return claims;
    }

    @Override
    public String toString() {
        return failure == null ? "VerificationResult[valid]" : "VerificationResult[" + failure.reason() + "]";
    }
}
