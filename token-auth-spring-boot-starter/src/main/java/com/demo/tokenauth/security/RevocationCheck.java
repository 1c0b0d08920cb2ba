package com.demo.tokenauth.security;

import com.demo.tokenauth.store.RevocationStore;
import com.demo.tokenauth.token.TokenClaims;

import java.util.Objects;
import java.util.function.Function;

/**
 * 校验流程中的一个吊销检查阶段：从 claims 中取 key，查询对应名单。
 * <p>
 * - key 缺失：unverified（无法确认是否已吊销，按已吊销处理）
 * - 名单中存在：revoked
 * - 名单存储异常：error（fail closed）
 */
public record RevocationCheck(String name,
                              RevocationStore store,
                              Function<TokenClaims, String> keyExtractor,
                              VerificationFailure revoked,
                              VerificationFailure unverified,
                              VerificationFailure error) {

    public RevocationCheck {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(store, "store must not be null");
        Objects.requireNonNull(keyExtractor, "keyExtractor must not be null");
        Objects.requireNonNull(revoked, "revoked must not be null");
        Objects.requireNonNull(unverified, "unverified must not be null");
        Objects.requireNonNull(error, "error must not be null");
    }

    /**
     * 按 jti 检查。
     */
    public static RevocationCheck blacklist(RevocationStore store) {
        return new RevocationCheck("blacklist", store, TokenClaims::tokenId,
                VerificationFailure.BLACKLISTED,
                VerificationFailure.JTI_UNVERIFIED,
                VerificationFailure.BLACKLIST_ERROR);
    }

    /**
     * 按 sub 检查。
     */
    public static RevocationCheck banlist(RevocationStore store) {
        return new RevocationCheck("banlist", store, TokenClaims::subject,
                VerificationFailure.BANNED,
                VerificationFailure.SUB_UNVERIFIED,
                VerificationFailure.BANLIST_ERROR);
    }
}
