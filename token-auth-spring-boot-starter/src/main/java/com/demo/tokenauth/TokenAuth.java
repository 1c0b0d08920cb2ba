package com.demo.tokenauth;

import com.demo.tokenauth.security.JwtSigner;
import com.demo.tokenauth.security.JwtVerifier;
import com.demo.tokenauth.security.VerificationResult;
import com.demo.tokenauth.spi.TokenSerializationException;
import com.demo.tokenauth.spi.TokenSerializer;
import com.demo.tokenauth.store.RevocationStore;
import com.demo.tokenauth.store.RevocationStoreException;
import com.demo.tokenauth.token.TokenClaims;
import com.demo.tokenauth.token.TokenFactory;
import com.demo.tokenauth.token.TokenOptions;
import com.demo.tokenauth.token.TokenRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Token 签发 / 校验 / 吊销的统一入口。
 * <p>
 * 流程：
 * 1) {@link #token} 构造 claims（显式参数优先于默认值）
 * 2) {@link #sign} 签名为紧凑 JWT
 * 3) {@link #verify} 依次校验签名、nbf、exp、blacklist、banlist
 * 4) {@link #forToken} / {@link #fromToken} 通过 {@link TokenSerializer} 与业务资源互转
 * <p>
 * 配置以不可变快照保存在 {@link AtomicReference} 中；每次调用只读取一次快照，
 * 并发调用不会看到“改了一半”的配置。
 */
public class TokenAuth {

    private static final Logger log = LoggerFactory.getLogger(TokenAuth.class);

    private final AtomicReference<Snapshot> snapshot;

    public TokenAuth(TokenAuthConfig config) {
        this.snapshot = new AtomicReference<>(Snapshot.of(config));
    }

    // =========================
    // 签发
    // =========================

    public TokenClaims token() {
        return token(TokenRequest.empty(), TokenOptions.defaults());
    }

    public TokenClaims token(TokenRequest request) {
        return token(request, TokenOptions.defaults());
    }

    public TokenClaims token(TokenRequest request, TokenOptions options) {
        return snapshot.get().factory().create(request, options);
    }

    public String sign(TokenClaims claims) {
        return snapshot.get().signer().sign(claims);
    }

    /**
     * 资源 -> claims -> 紧凑 JWT。序列化失败原样抛出。
     */
    public <R> String forToken(R resource) {
        return forToken(resource, TokenOptions.defaults());
    }

    public <R> String forToken(R resource, TokenOptions options) {
        Snapshot s = snapshot.get();
        TokenSerializer<R> serializer = serializer(s);
        TokenClaims claims = serializer.toClaims(resource, s.factory(), options);
        return s.signer().sign(claims);
    }

    // =========================
    // 校验
    // =========================

    public VerificationResult verify(String compact) {
        return snapshot.get().verifier().verify(compact);
    }

    /**
     * 校验通过返回 claims，否则抛 {@link com.demo.tokenauth.security.TokenVerificationException}。
     */
    public TokenClaims verifyOrThrow(String compact) {
        return verify(compact).orElseThrow();
    }

    /**
     * 紧凑 JWT -> 校验 -> 资源。
     *
     * @throws com.demo.tokenauth.security.TokenVerificationException 校验失败
     * @throws TokenSerializationException                           未配置序列化器或序列化器拒绝
     */
    public <R> R fromToken(String compact) {
        Snapshot s = snapshot.get();
        TokenClaims claims = s.verifier().verify(compact).orElseThrow();
        TokenSerializer<R> serializer = serializer(s);
        return serializer.fromClaims(claims);
    }

    /**
     * 已校验的 claims -> 资源。
     */
    public <R> R fromClaims(TokenClaims claims) {
        TokenSerializer<R> serializer = serializer(snapshot.get());
        return serializer.fromClaims(claims);
    }

    // =========================
    // 吊销
    // =========================

    public boolean isBlacklisted(String tokenId) {
        return blacklistStore().exists(requireKey(tokenId, "tokenId"));
    }

    public boolean isBlacklisted(TokenClaims claims) {
        return isBlacklisted(claims.tokenId());
    }

    public void blacklist(String tokenId) {
        blacklistStore().insert(requireKey(tokenId, "tokenId"));
        log.info("Token blacklisted: jti={}", tokenId);
    }

    public void blacklist(TokenClaims claims) {
        blacklist(claims.tokenId());
    }

    public void unblacklist(String tokenId) {
        blacklistStore().delete(requireKey(tokenId, "tokenId"));
        log.info("Token removed from blacklist: jti={}", tokenId);
    }

    public void unblacklist(TokenClaims claims) {
        unblacklist(claims.tokenId());
    }

    public boolean isBanned(String subject) {
        return banlistStore().exists(requireKey(subject, "subject"));
    }

    public boolean isBanned(TokenClaims claims) {
        return isBanned(claims.subject());
    }

    public void ban(String subject) {
        banlistStore().insert(requireKey(subject, "subject"));
        log.info("Subject banned: sub={}", subject);
    }

    public void ban(TokenClaims claims) {
        ban(claims.subject());
    }

    public void unban(String subject) {
        banlistStore().delete(requireKey(subject, "subject"));
        log.info("Subject unbanned: sub={}", subject);
    }

    public void unban(TokenClaims claims) {
        unban(claims.subject());
    }

    // =========================
    // 配置
    // =========================

    public TokenAuthConfig getConfig() {
        return snapshot.get().config();
    }

    public TokenFactory getTokenFactory() {
        return snapshot.get().factory();
    }

    /**
     * 基于当前配置生成新配置并整体替换。新配置非法时抛出异常，旧配置保持不变。
     */
    public TokenAuthConfig reconfigure(UnaryOperator<TokenAuthConfig> change) {
        Objects.requireNonNull(change, "change must not be null");
        Snapshot next = snapshot.updateAndGet(current -> Snapshot.of(change.apply(current.config())));
        log.info("TokenAuth reconfigured: {}", next.config());
        return next.config();
    }

    // =========================
    // 内部辅助方法
    // =========================

    @SuppressWarnings("unchecked")
    private static <R> TokenSerializer<R> serializer(Snapshot s) {
        return (TokenSerializer<R>) s.config().getSerializer()
                .orElseThrow(() -> new TokenSerializationException("no serializer configured"));
    }

    private RevocationStore blacklistStore() {
        return enabled(snapshot.get().config().getBlacklist(), "blacklist");
    }

    private RevocationStore banlistStore() {
        return enabled(snapshot.get().config().getBanlist(), "banlist");
    }

    private static RevocationStore enabled(Optional<RevocationStore> store, String name) {
        return store.orElseThrow(() -> new RevocationStoreException(name + " is disabled"));
    }

    private static String requireKey(String key, String name) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
        return key;
    }

    /**
     * 一份配置及由它构造出的 factory / signer / verifier。
     */
    private record Snapshot(TokenAuthConfig config, TokenFactory factory, JwtSigner signer, JwtVerifier verifier) {

        static Snapshot of(TokenAuthConfig config) {
            Objects.requireNonNull(config, "config must not be null");
            return new Snapshot(
                    config,
                    new TokenFactory(config.getDefaults(), config.getClock()),
                    new JwtSigner(config.getSecret(), config.getAlgorithm()),
                    new JwtVerifier(config.getSecret(), config.getAlgorithm(), config.getClock(),
                            config.revocationChecks()));
        }
    }
}
