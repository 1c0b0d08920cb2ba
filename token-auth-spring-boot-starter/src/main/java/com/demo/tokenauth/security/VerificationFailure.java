package com.demo.tokenauth.security;

import com.demo.tokenauth.exception.AuthErrorCodes;

/**
 * token 校验失败原因。这是校验流程会产生的全部失败原因。
 */
public enum VerificationFailure {

    /** 签名错误、结构错误、算法不符 */
    BAD_TOKEN("bad_token", AuthErrorCodes.CODE_TOKEN_INVALID),
    /** 未到 nbf */
    NOT_READY("not_ready", AuthErrorCodes.CODE_TOKEN_NOT_READY),
    /** 已过 exp */
    EXPIRED("expired", AuthErrorCodes.CODE_TOKEN_EXPIRED),
    BLACKLISTED("blacklisted", AuthErrorCodes.CODE_TOKEN_BLACKLISTED),
    BLACKLIST_ERROR("blacklist_error", AuthErrorCodes.CODE_BLACKLIST_ERROR),
    /** 启用了 blacklist 但 token 没有 jti */
    JTI_UNVERIFIED("jti_unverified", AuthErrorCodes.CODE_JTI_UNVERIFIED),
    BANNED("banned", AuthErrorCodes.CODE_SUBJECT_BANNED),
    BANLIST_ERROR("banlist_error", AuthErrorCodes.CODE_BANLIST_ERROR),
    /** 启用了 banlist 但 token 没有 sub */
    SUB_UNVERIFIED("sub_unverified", AuthErrorCodes.CODE_SUB_UNVERIFIED);

    private final String reason;
    private final int code;

    VerificationFailure(String reason, int code) {
        this.reason = reason;
        this.code = code;
    }

    /**
     * 稳定的原因字符串，如 "expired"。
     */
    public String reason() {
        return reason;
    }

    public int code() {
        return code;
    }
}
