package com.demo.tokenauth;

import com.demo.tokenauth.security.JwtAlgorithm;
import com.demo.tokenauth.security.RevocationCheck;
import com.demo.tokenauth.spi.TokenSerializer;
import com.demo.tokenauth.store.RevocationStore;
import com.demo.tokenauth.token.TokenDefaults;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * TokenAuth 的完整配置快照（不可变）。
 * <p>
 * 修改配置只能通过 {@link #toBuilder()} 生成新快照，再由 {@link TokenAuth#reconfigure} 整体替换。
 * <p>
 * blacklist / banlist 为 empty 表示未启用：校验时跳过对应阶段，且不会访问存储。
 */
public final class TokenAuthConfig {

    private final String secret;
    private final JwtAlgorithm algorithm;
    private final TokenDefaults defaults;
    private final Clock clock;
    private final RevocationStore blacklist;
    private final RevocationStore banlist;
    private final TokenSerializer<?> serializer;

    private TokenAuthConfig(Builder b) {
        this.secret = b.secret;
        this.algorithm = Objects.requireNonNull(b.algorithm, "algorithm must not be null");
        this.defaults = Objects.requireNonNull(b.defaults, "defaults must not be null");
        this.clock = Objects.requireNonNull(b.clock, "clock must not be null");
        this.blacklist = b.blacklist;
        this.banlist = b.banlist;
        this.serializer = b.serializer;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .secret(secret)
                .algorithm(algorithm)
                .defaults(defaults)
                .clock(clock)
                .blacklist(blacklist)
                .banlist(banlist)
                .serializer(serializer);
    }

    public String getSecret() {
        return secret;
    }

    public JwtAlgorithm getAlgorithm() {
        return algorithm;
    }

    public TokenDefaults getDefaults() {
        return defaults;
    }

    public Clock getClock() {
        return clock;
    }

    public Optional<RevocationStore> getBlacklist() {
        return Optional.ofNullable(blacklist);
    }

    public Optional<RevocationStore> getBanlist() {
        return Optional.ofNullable(banlist);
    }

    public Optional<TokenSerializer<?>> getSerializer() {
        return Optional.ofNullable(serializer);
    }

    /**
     * 已启用名单对应的校验阶段：先 blacklist 后 banlist。
     */
    public List<RevocationCheck> revocationChecks() {
        List<RevocationCheck> checks = new ArrayList<>(2);
        getBlacklist().map(RevocationCheck::blacklist).ifPresent(checks::add);
        getBanlist().map(RevocationCheck::banlist).ifPresent(checks::add);
        return checks;
    }

    @Override
    public String toString() {
        // 不输出 secret
        return "TokenAuthConfig{algorithm=" + algorithm
                + ", defaults=" + defaults
                + ", blacklist=" + (blacklist != null)
                + ", banlist=" + (banlist != null)
                + ", serializer=" + (serializer == null ? null : serializer.getClass().getSimpleName())
                + '}';
    }

    public static final class Builder {

        private String secret;
        private JwtAlgorithm algorithm = JwtAlgorithm.HS256;
        private TokenDefaults defaults = TokenDefaults.standard();
        private Clock clock = Clock.systemUTC();
        private RevocationStore blacklist;
        private RevocationStore banlist;
        private TokenSerializer<?> serializer;

        private Builder() {
        }

        public Builder secret(String secret) {
            this.secret = secret;
            return this;
        }

        public Builder algorithm(JwtAlgorithm algorithm) {
            this.algorithm = algorithm;
            return this;
        }

        public Builder defaults(TokenDefaults defaults) {
            this.defaults = defaults;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        /**
         * @param blacklist null 表示不启用
         */
        public Builder blacklist(RevocationStore blacklist) {
            this.blacklist = blacklist;
            return this;
        }

        /**
         * @param banlist null 表示不启用
         */
        public Builder banlist(RevocationStore banlist) {
            this.banlist = banlist;
            return this;
        }

        public Builder serializer(TokenSerializer<?> serializer) {
            this.serializer = serializer;
            return this;
        }

        public TokenAuthConfig build() {
            return new TokenAuthConfig(this);
        }
    }
}
