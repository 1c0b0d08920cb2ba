package com.demo.tokenauth.store;

/**
 * 吊销名单存储访问失败。
 */
public class RevocationStoreException extends RuntimeException {

    public RevocationStoreException(String message) {
        super(message);
    }

    public RevocationStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
