package com.demo.tokenauth.spi;

/**
 * 资源与 claims 相互转换失败。
 */
public class TokenSerializationException extends RuntimeException {

    public TokenSerializationException(String message) {
        super(message);
    }

    public TokenSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
