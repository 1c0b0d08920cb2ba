package com.demo.tokenauth.exception;

/**
 * 认证/授权失败时写入 request attribute 的错误码与属性名。
 * <p>
 * 401xx：认证失败（token 校验不通过），与 VerificationFailure 一一对应
 * 403xx：授权失败
 */
public final class AuthErrorCodes {

    /**
     * 认证失败错误码（Integer）
     */
    public static final String REQ_ATTR_AUTH_ERROR_CODE = "token-auth.error-code";

    /**
     * 认证失败原因（VerificationFailure#reason，如 "expired"）
     */
    public static final String REQ_ATTR_AUTH_ERROR_REASON = "token-auth.error-reason";

    /**
     * 校验通过的 TokenClaims
     */
    public static final String REQ_ATTR_TOKEN = "token-auth.token";

    /**
     * 授权命中的 scope（如 "admin/read"）
     */
    public static final String REQ_ATTR_CURRENT_SCOPE = "token-auth.current-scope";

    public static final int CODE_UNAUTHORIZED = 40100;
    public static final int CODE_TOKEN_INVALID = 40101;
    public static final int CODE_TOKEN_NOT_READY = 40102;
    public static final int CODE_TOKEN_EXPIRED = 40103;
    public static final int CODE_TOKEN_BLACKLISTED = 40104;
    public static final int CODE_BLACKLIST_ERROR = 40105;
    public static final int CODE_JTI_UNVERIFIED = 40106;
    public static final int CODE_SUBJECT_BANNED = 40107;
    public static final int CODE_BANLIST_ERROR = 40108;
    public static final int CODE_SUB_UNVERIFIED = 40109;
    public static final int CODE_USER_UNRESOLVED = 40110;

    public static final int CODE_FORBIDDEN = 40300;

    private AuthErrorCodes() {
    }
}
