package com.demo.tokenauth.token;

/**
 * Token payload 中使用的 claim 名称。
 */
public final class ClaimNames {

    public static final String SUBJECT = "sub";
    public static final String ISSUER = "iss";
    public static final String AUDIENCE = "aud";
    public static final String ISSUED_AT = "iat";
    public static final String NOT_BEFORE = "nbf";
    public static final String EXPIRES_AT = "exp";
    public static final String TOKEN_ID = "jti";
    public static final String SCOPES = "scopes";
    public static final String METADATA = "metadata";

    private ClaimNames() {
    }
}
