package com.demo.tokenauth.token;

import java.time.Clock;
import java.util.Objects;

/**
 * 构造 {@link TokenClaims}。
 * <p>
 * 规则：
 * 1) 显式参数优先于默认值
 * 2) iat = time
 * 3) nbf = time - 1（容忍同一秒内签发后立即校验）
 * 4) exp = time + ttl；ttl 为 infinite 时不写 exp
 */
public class TokenFactory {

    private final TokenDefaults defaults;
    private final Clock clock;

    public TokenFactory(TokenDefaults defaults, Clock clock) {
        this.defaults = Objects.requireNonNull(defaults, "defaults must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public TokenClaims create(TokenRequest request, TokenOptions options) {
        TokenRequest req = request == null ? TokenRequest.empty() : request;
        TokenOptions opts = options == null ? TokenOptions.defaults() : options;

        long time = opts.time() != null ? opts.time() : epochSeconds(clock);
        Ttl ttl = opts.ttl() != null ? opts.ttl() : defaults.ttl();
        TokenIdStrategy jti = req.tokenId() != null ? req.tokenId() : defaults.tokenId();

        return TokenClaims.builder()
                .subject(req.subject())
                .issuer(firstNonNull(req.issuer(), defaults.issuer()))
                .audience(firstNonNull(req.audience(), defaults.audience()))
                .scopes(firstNonNull(req.scopes(), defaults.scopes()))
                .metadata(req.metadata())
                .tokenId(jti.resolve())
                .issuedAt(time)
                .notBefore(time - 1)
                .expiresAt(ttl.expiresAt(time))
                .build();
    }

    public TokenDefaults getDefaults() {
        return defaults;
    }

    /**
     * 时钟当前时间（秒）。
     */
    public static long epochSeconds(Clock clock) {
        return clock.instant().getEpochSecond();
    }

    private static <T> T firstNonNull(T explicit, T fallback) {
        return explicit != null ? explicit : fallback;
    }
}
