package com.demo.tokenauth.security;

import java.util.Objects;

/**
 * 以异常形式表达的校验失败，供需要抛出异常的调用方使用。
 */
public class TokenVerificationException extends RuntimeException {

    private final VerificationFailure failure;

    public TokenVerificationException(VerificationFailure failure) {
        super("Token verification failed: " + Objects.requireNonNull(failure, "failure must not be null").reason());
        this.failure = failure;
    }

    public VerificationFailure getFailure() {
        return failure;
    }
}
