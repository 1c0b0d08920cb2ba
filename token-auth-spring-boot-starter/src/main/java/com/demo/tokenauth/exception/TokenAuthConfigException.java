package com.demo.tokenauth.exception;

/**
 * 配置错误（空密钥、不支持的算法、密钥过短等）。
 * <p>
 * 只在构造阶段抛出，不会延迟到 sign/verify 时。
 */
public class TokenAuthConfigException extends IllegalArgumentException {

    public TokenAuthConfigException(String message) {
        super(message);
    }
}
