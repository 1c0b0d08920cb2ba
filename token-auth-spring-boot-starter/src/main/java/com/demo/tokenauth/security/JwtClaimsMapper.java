package com.demo.tokenauth.security;

import com.demo.tokenauth.token.ClaimNames;
import com.demo.tokenauth.token.TokenClaims;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtBuilder;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * TokenClaims 与 JJWT Claims 之间的转换。
 * <p>
 * 写入时跳过为 null 的字段（payload 中不出现 null claim）；
 * 读取时缺失的字段保持为 null，不会变成 0 或空串。
 */
final class JwtClaimsMapper {

    private JwtClaimsMapper() {
    }

    static JwtBuilder write(JwtBuilder builder, TokenClaims claims) {
        if (claims.subject() != null) builder.subject(claims.subject());
        if (claims.issuer() != null) builder.issuer(claims.issuer());
        // aud 以单个字符串写入
        if (claims.audience() != null) builder.audience().single(claims.audience());
        if (claims.issuedAt() != null) builder.issuedAt(toDate(claims.issuedAt()));
        if (claims.notBefore() != null) builder.notBefore(toDate(claims.notBefore()));
        if (claims.expiresAt() != null) builder.expiration(toDate(claims.expiresAt()));
        if (claims.tokenId() != null) builder.id(claims.tokenId());
        if (!claims.scopes().isEmpty()) builder.claim(ClaimNames.SCOPES, new ArrayList<>(claims.scopes()));
        if (!claims.metadata().isEmpty()) builder.claim(ClaimNames.METADATA, new LinkedHashMap<>(claims.metadata()));
        return builder;
    }

    static TokenClaims read(Claims claims) {
        return TokenClaims.builder()
                .subject(claims.getSubject())
                .issuer(claims.getIssuer())
                .audience(firstAudience(claims.getAudience()))
                .issuedAt(toSeconds(claims.getIssuedAt()))
                .notBefore(toSeconds(claims.getNotBefore()))
                .expiresAt(toSeconds(claims.getExpiration()))
                .tokenId(claims.getId())
                .scopes(readScopes(claims.get(ClaimNames.SCOPES)))
                .metadata(readMetadata(claims.get(ClaimNames.METADATA)))
                .build();
    }

    private static Date toDate(long seconds) {
        return new Date(seconds * 1000L);
    }

    private static Long toSeconds(Date date) {
        return date == null ? null : Math.floorDiv(date.getTime(), 1000L);
    }

    private static String firstAudience(Set<String> aud) {
        if (aud == null || aud.isEmpty()) return null;
        return aud.iterator().next();
    }

    private static List<String> readScopes(Object value) {
        if (value == null) return List.of();
        if (value instanceof String s) {
            return List.of(s);
        }
        if (value instanceof Collection<?> c) {
            List<String> list = new ArrayList<>(c.size());
            for (Object x : c) {
                if (x != null) list.add(String.valueOf(x));
            }
            return list;
        }
        return List.of();
    }

    private static Map<String, Object> readMetadata(Object value) {
        if (!(value instanceof Map<?, ?> m) || m.isEmpty()) return Map.of();
        Map<String, Object> res = new LinkedHashMap<>();
        m.forEach((k, v) -> res.put(String.valueOf(k), v));
        return res;
    }
}
