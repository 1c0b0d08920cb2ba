package com.demo.tokenauth.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Token 配置属性
 */
@ConfigurationProperties(prefix = "token-auth")
public class TokenAuthProps {

    /**
     * 签名密钥。
     *
     * <p>要求：UTF-8 编码后长度不小于算法摘要长度（HS256 32 / HS384 48 / HS512 64 bytes）。</p>
     * <p>建议通过环境变量/配置中心注入，避免明文提交到仓库。</p>
     */
    private String secret;

    /**
     * 签名算法：HS256 / HS384 / HS512。
     */
    private String algorithm = "HS256";

    /**
     * 默认有效期（秒）；-1 表示永不过期。
     */
    private long defaultTtlSeconds = 3600;

    /**
     * 默认签发者，不配置则不写 iss。
     */
    private String issuer;

    /**
     * 默认接收方，不配置则不写 aud。
     */
    private String audience;

    /**
     * 默认 scopes。
     */
    private List<String> defaultScopes = new ArrayList<>();

    /**
     * jti 生成方式：uuid / none。
     */
    private String tokenId = "uuid";

    private final Revocation blacklist = new Revocation();

    private final Revocation banlist = new Revocation();

    private final Filter filter = new Filter();

    public String getSecret() {
        return secret;
    }

    public void setSecret(String secret) {
        this.secret = secret;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public void setAlgorithm(String algorithm) {
        this.algorithm = algorithm;
    }

    public long getDefaultTtlSeconds() {
        return defaultTtlSeconds;
    }

    public void setDefaultTtlSeconds(long defaultTtlSeconds) {
        this.defaultTtlSeconds = defaultTtlSeconds;
    }

    public String getIssuer() {
        return issuer;
    }

    public void setIssuer(String issuer) {
        this.issuer = issuer;
    }

    public String getAudience() {
        return audience;
    }

    public void setAudience(String audience) {
        this.audience = audience;
    }

    public List<String> getDefaultScopes() {
        return defaultScopes;
    }

    public void setDefaultScopes(List<String> defaultScopes) {
        this.defaultScopes = defaultScopes;
    }

    public String getTokenId() {
        return tokenId;
    }

    public void setTokenId(String tokenId) {
        this.tokenId = tokenId;
    }

    public Revocation getBlacklist() {
        return blacklist;
    }

    public Revocation getBanlist() {
        return banlist;
    }

    public Filter getFilter() {
        return filter;
    }

    /**
     * 吊销名单开关。启用后若容器中没有对应的 RevocationStore，则使用内存实现。
     */
    public static class Revocation {

        private boolean enabled = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }
    }

    public static class Filter {

        /**
         * 是否注册 TokenAuthFilter。
         */
        private boolean enabled = true;

        /**
         * 携带的 token 校验失败时是否直接返回 401；
         * false 时按匿名请求放行，由业务侧授权规则决定。
         */
        private boolean rejectInvalid = false;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isRejectInvalid() {
            return rejectInvalid;
        }

        public void setRejectInvalid(boolean rejectInvalid) {
            this.rejectInvalid = rejectInvalid;
        }
    }
}
