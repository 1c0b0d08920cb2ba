package com.demo.tokenauth.security;

import com.demo.tokenauth.token.TokenClaims;
import com.demo.tokenauth.token.TokenFactory;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.Header;
import io.jsonwebtoken.Jws;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.PrematureJwtException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.util.Base64;
import java.util.Date;
import java.util.List;
import java.util.Objects;

/**
 * 校验紧凑 JWT。
 * <p>
 * 各阶段严格按顺序执行，任一阶段失败立即返回对应原因：
 * 1) 签名：只接受配置的算法（header alg 必须一致），否则 bad_token
 * 2) nbf：存在时要求 now &gt; nbf，否则 not_ready
 * 3) exp：存在时要求 now &lt; exp，否则 expired
 * 4) 吊销检查：按配置顺序执行（blacklist 按 jti，banlist 按 sub）
 * <p>
 * 时间取自注入的 {@link Clock}；JJWT 自带的 exp/nbf 判断不作为结论，统一由本类按上述规则判断。
 */
public class JwtVerifier {

    private static final Logger log = LoggerFactory.getLogger(JwtVerifier.class);

    private final JwtAlgorithm algorithm;
    private final SecretKey key;
    private final Clock clock;
    private final List<RevocationCheck> revocationChecks;

    public JwtVerifier(String secret, JwtAlgorithm algorithm, Clock clock, List<RevocationCheck> revocationChecks) {
        this.key = HmacKeys.of(secret, algorithm);
        this.algorithm = algorithm;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.revocationChecks = revocationChecks == null ? List.of() : List.copyOf(revocationChecks);
    }

    public JwtVerifier(String secret, JwtAlgorithm algorithm, Clock clock) {
        this(secret, algorithm, clock, List.of());
    }

    public VerificationResult verify(String compact) {
        long now = TokenFactory.epochSeconds(clock);

        // 1) 签名
        TokenClaims claims = checkSignature(compact, now);
        if (claims == null) {
            return reject(VerificationFailure.BAD_TOKEN);
        }

        // 2) nbf
        if (claims.notBefore() != null && now <= claims.notBefore()) {
            return reject(VerificationFailure.NOT_READY);
        }

        // 3) exp
        if (claims.expiresAt() != null && now >= claims.expiresAt()) {
            return reject(VerificationFailure.EXPIRED);
        }

        // 4) 吊销
        for (RevocationCheck check : revocationChecks) {
            VerificationFailure failure = checkRevocation(check, claims);
            if (failure != null) {
                return reject(failure);
            }
        }

        return VerificationResult.success(claims);
    }

    public JwtAlgorithm getAlgorithm() {
        return algorithm;
    }

    public List<RevocationCheck> getRevocationChecks() {
        return revocationChecks;
    }

    /**
     * @return 签名通过时的 claims；否则 null
     */
    private TokenClaims checkSignature(String compact, long now) {
        if (compact == null || compact.isBlank()) {
            return null;
        }
        if (!hasCanonicalSignature(compact)) {
            log.debug("JWT rejected: signature segment is not canonical base64url");
            return null;
        }
        JwtParser parser = Jwts.parser()
                .verifyWith(key)
                .clock(() -> new Date(now * 1000L))
                .build();

        Header header;
        Claims payload;
        try {
            Jws<Claims> jws = parser.parseSignedClaims(compact);
            header = jws.getHeader();
            payload = jws.getPayload();
        } catch (ExpiredJwtException | PrematureJwtException e) {
            // JJWT 在签名校验通过之后才判断时间，这里的 claims 已经是可信的
            header = e.getHeader();
            payload = e.getClaims();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("JWT rejected by parser: {}", e.getMessage());
            return null;
        }

        if (header == null || !algorithm.name().equals(header.getAlgorithm())) {
            log.debug("JWT rejected: alg {} does not match configured {}",
                    header == null ? null : header.getAlgorithm(), algorithm);
            return null;
        }
        return JwtClaimsMapper.read(payload);
    }

    /**
     * 签名段末位字符含填充位，解码时会被忽略；要求重新编码后与原文一致，
     * 否则改动末位字符的 token 会解出同一个 MAC。
     */
    private static boolean hasCanonicalSignature(String compact) {
        int dot = compact.lastIndexOf('.');
        if (dot < 0) {
            return false;
        }
        String signature = compact.substring(dot + 1);
        try {
            byte[] mac = Base64.getUrlDecoder().decode(signature);
            return Base64.getUrlEncoder().withoutPadding().encodeToString(mac).equals(signature);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private static VerificationFailure checkRevocation(RevocationCheck check, TokenClaims claims) {
        String key = check.keyExtractor().apply(claims);
        if (key == null || key.isBlank()) {
            return check.unverified();
        }
        try {
            return check.store().exists(key) ? check.revoked() : null;
        } catch (RuntimeException e) {
            log.warn("{} lookup failed, rejecting token", check.name(), e);
            return check.error();
        }
    }

    private static VerificationResult reject(VerificationFailure failure) {
        log.debug("JWT verification failed: {}", failure.reason());
        return VerificationResult.failure(failure);
    }
}
