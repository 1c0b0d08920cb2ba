package com.demo.tokenauth.autoconfigure;

import com.demo.tokenauth.TokenAuth;
import com.demo.tokenauth.TokenAuthConfig;
import com.demo.tokenauth.aop.RequireScopeAspect;
import com.demo.tokenauth.exception.TokenAuthConfigException;
import com.demo.tokenauth.filter.TokenAuthFilter;
import com.demo.tokenauth.permission.DefaultPermissionChecker;
import com.demo.tokenauth.permission.PermissionChecker;
import com.demo.tokenauth.properties.TokenAuthProps;
import com.demo.tokenauth.security.JwtAlgorithm;
import com.demo.tokenauth.spi.BasicTokenSerializer;
import com.demo.tokenauth.spi.TokenSerializer;
import com.demo.tokenauth.store.InMemoryRevocationStore;
import com.demo.tokenauth.store.RevocationStore;
import com.demo.tokenauth.token.TokenDefaults;
import com.demo.tokenauth.token.TokenIdStrategy;
import com.demo.tokenauth.token.Ttl;
import com.demo.tokenauth.web.response.JsonResponseWriter;
import com.demo.tokenauth.web.response.TokenAccessDeniedHandler;
import com.demo.tokenauth.web.response.TokenAuthEntryPoint;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.autoconfigure.security.servlet.SecurityAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import java.time.Clock;
import java.util.Locale;

/**
 * Token 鉴权自动配置
 * <p>
 * 业务侧可通过同类型（或同名）Bean 覆盖默认实现：
 * - TokenSerializer：资源与 claims 互转
 * - RevocationStore（tokenAuthBlacklist / tokenAuthBanlist）：吊销名单存储
 * - PermissionChecker：授权判定
 * - SecurityFilterChain：安全过滤链
 */
@AutoConfiguration(before = SecurityAutoConfiguration.class)
@EnableConfigurationProperties(TokenAuthProps.class)
public class TokenAuthAutoConfiguration {

    public static final String BLACKLIST_BEAN = "tokenAuthBlacklist";
    public static final String BANLIST_BEAN = "tokenAuthBanlist";

    private static final Logger log = LoggerFactory.getLogger(TokenAuthAutoConfiguration.class);

    @Bean(BLACKLIST_BEAN)
    @ConditionalOnMissingBean(name = BLACKLIST_BEAN)
    @ConditionalOnProperty(prefix = "token-auth.blacklist", name = "enabled", havingValue = "true")
    public RevocationStore tokenAuthBlacklist() {
        return new InMemoryRevocationStore();
    }

    @Bean(BANLIST_BEAN)
    @ConditionalOnMissingBean(name = BANLIST_BEAN)
    @ConditionalOnProperty(prefix = "token-auth.banlist", name = "enabled", havingValue = "true")
    public RevocationStore tokenAuthBanlist() {
        return new InMemoryRevocationStore();
    }

    @Bean
    @ConditionalOnMissingBean(TokenSerializer.class)
    public BasicTokenSerializer basicTokenSerializer() {
        return new BasicTokenSerializer();
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenAuth tokenAuth(TokenAuthProps props,
                               ObjectProvider<TokenSerializer<?>> serializer,
                               @Qualifier(BLACKLIST_BEAN) ObjectProvider<RevocationStore> blacklist,
                               @Qualifier(BANLIST_BEAN) ObjectProvider<RevocationStore> banlist,
                               ObjectProvider<Clock> clock) {
        TokenAuthConfig config = TokenAuthConfig.builder()
                .secret(props.getSecret())
                .algorithm(JwtAlgorithm.parse(props.getAlgorithm()))
                .defaults(toDefaults(props))
                .clock(clock.getIfAvailable(Clock::systemUTC))
                .blacklist(props.getBlacklist().isEnabled() ? requireStore(blacklist, BLACKLIST_BEAN) : null)
                .banlist(props.getBanlist().isEnabled() ? requireStore(banlist, BANLIST_BEAN) : null)
                .serializer(serializer.getIfAvailable())
                .build();
        TokenAuth tokenAuth = new TokenAuth(config);
        log.info("TokenAuth initialized: {}", config);
        return tokenAuth;
    }

    @Bean
    @ConditionalOnMissingBean
    public PermissionChecker permissionChecker() {
        return new DefaultPermissionChecker();
    }

    @Bean
    @ConditionalOnMissingBean
    public RequireScopeAspect requireScopeAspect(PermissionChecker checker) {
        return new RequireScopeAspect(checker);
    }

    @Bean
    @ConditionalOnMissingBean
    public JsonResponseWriter jsonResponseWriter(ObjectProvider<ObjectMapper> objectMapper) {
        return new JsonResponseWriter(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenAuthEntryPoint tokenAuthEntryPoint(JsonResponseWriter writer) {
        return new TokenAuthEntryPoint(writer);
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenAccessDeniedHandler tokenAccessDeniedHandler(JsonResponseWriter writer) {
        return new TokenAccessDeniedHandler(writer);
    }

    @Configuration(proxyBeanMethods = false)
    @ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
    @ConditionalOnProperty(prefix = "token-auth.filter", name = "enabled", havingValue = "true", matchIfMissing = true)
    static class TokenAuthFilterConfiguration {

        @Bean
        @ConditionalOnMissingBean
        public TokenAuthFilter tokenAuthFilter(TokenAuth tokenAuth,
                                               TokenAuthEntryPoint entryPoint,
                                               TokenAuthProps props) {
            return new TokenAuthFilter(tokenAuth, entryPoint, props.getFilter().isRejectInvalid());
        }

        /**
         * 过滤器只挂在 SecurityFilterChain 中，不再注册到 Servlet 容器，避免执行两次。
         */
        @Bean
        public FilterRegistrationBean<TokenAuthFilter> tokenAuthFilterRegistration(TokenAuthFilter filter) {
            FilterRegistrationBean<TokenAuthFilter> registration = new FilterRegistrationBean<>(filter);
            registration.setEnabled(false);
            return registration;
        }

        /**
         * 默认安全链：无状态、关闭 CSRF，所有请求放行给业务侧授权规则（@RequireScope）。
         */
        @Bean
        @ConditionalOnMissingBean(SecurityFilterChain.class)
        public SecurityFilterChain tokenAuthSecurityFilterChain(HttpSecurity http,
                                                                TokenAuthFilter filter,
                                                                TokenAuthEntryPoint entryPoint,
                                                                TokenAccessDeniedHandler deniedHandler) throws Exception {
            http
                    .csrf(csrf -> csrf.disable())
                    .sessionManagement(sm -> sm.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                    .exceptionHandling(eh -> eh
                            .authenticationEntryPoint(entryPoint)
                            .accessDeniedHandler(deniedHandler))
                    .authorizeHttpRequests(auth -> auth.anyRequest().permitAll())
                    .addFilterBefore(filter, UsernamePasswordAuthenticationFilter.class);
            return http.build();
        }
    }

    // =========================
    // 内部辅助方法
    // =========================

    static TokenDefaults toDefaults(TokenAuthProps props) {
        return new TokenDefaults(
                blankToNull(props.getIssuer()),
                blankToNull(props.getAudience()),
                props.getDefaultScopes(),
                toTokenIdStrategy(props.getTokenId()),
                toTtl(props.getDefaultTtlSeconds()));
    }

    static Ttl toTtl(long seconds) {
        if (seconds == -1) {
            return Ttl.infinite();
        }
        if (seconds <= 0) {
            throw new TokenAuthConfigException("token-auth.default-ttl-seconds must be > 0, or -1 for no expiry");
        }
        return Ttl.ofSeconds(seconds);
    }

    static TokenIdStrategy toTokenIdStrategy(String mode) {
        String m = mode == null ? "uuid" : mode.trim().toLowerCase(Locale.ROOT);
        return switch (m) {
            case "uuid" -> TokenIdStrategy.uuid();
            case "none" -> TokenIdStrategy.disabled();
            default -> throw new TokenAuthConfigException("token-auth.token-id must be 'uuid' or 'none': " + mode);
        };
    }

    private static RevocationStore requireStore(ObjectProvider<RevocationStore> store, String name) {
        RevocationStore s = store.getIfAvailable();
        if (s == null) {
            throw new TokenAuthConfigException("RevocationStore bean '" + name + "' is required when enabled");
        }
        return s;
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s;
    }
}
