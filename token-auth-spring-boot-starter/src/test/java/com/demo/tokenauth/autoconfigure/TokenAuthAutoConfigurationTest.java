package com.demo.tokenauth.autoconfigure;

import static com.demo.tokenauth.TestTokens.NOW;
import static com.demo.tokenauth.TestTokens.SECRET;
import static com.demo.tokenauth.TestTokens.clockAt;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.demo.tokenauth.TokenAuth;
import com.demo.tokenauth.aop.RequireScopeAspect;
import com.demo.tokenauth.exception.TokenAuthConfigException;
import com.demo.tokenauth.filter.TokenAuthFilter;
import com.demo.tokenauth.permission.PermissionChecker;
import com.demo.tokenauth.security.JwtAlgorithm;
import com.demo.tokenauth.spi.AuthUser;
import com.demo.tokenauth.spi.BasicTokenSerializer;
import com.demo.tokenauth.store.InMemoryRevocationStore;
import com.demo.tokenauth.store.RevocationStore;
import com.demo.tokenauth.token.Ttl;
import com.demo.tokenauth.web.response.TokenAuthEntryPoint;
import java.time.Clock;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

class TokenAuthAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TokenAuthAutoConfiguration.class))
            .withPropertyValues("token-auth.secret=" + SECRET);

    @Test
    void createsDefaultBeans() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(TokenAuth.class);
            assertThat(context).hasSingleBean(BasicTokenSerializer.class);
            assertThat(context).hasSingleBean(PermissionChecker.class);
            assertThat(context).hasSingleBean(RequireScopeAspect.class);
            assertThat(context).hasSingleBean(TokenAuthEntryPoint.class);
            assertThat(context).doesNotHaveBean(RevocationStore.class);
            // 非 servlet 环境不注册过滤器
            assertThat(context).doesNotHaveBean(TokenAuthFilter.class);

            var config = context.getBean(TokenAuth.class).getConfig();
            assertThat(config.getAlgorithm()).isEqualTo(JwtAlgorithm.HS256);
            assertThat(config.getDefaults().ttl()).isEqualTo(Ttl.ofSeconds(3600));
            assertThat(config.getBlacklist()).isEmpty();
            assertThat(config.getBanlist()).isEmpty();
            assertThat(config.getSerializer()).containsInstanceOf(BasicTokenSerializer.class);
        });
    }

    @Test
    void bindsProperties() {
        runner.withPropertyValues(
                        "token-auth.algorithm=hs512",
                        "token-auth.default-ttl-seconds=-1",
                        "token-auth.issuer=auth-server",
                        "token-auth.default-scopes=user/read",
                        "token-auth.token-id=none")
                .withUserConfiguration(FixedClockConfig.class)
                .run(context -> {
                    var tokenAuth = context.getBean(TokenAuth.class);
                    var claims = tokenAuth.token();

                    assertThat(tokenAuth.getConfig().getAlgorithm()).isEqualTo(JwtAlgorithm.HS512);
                    assertThat(claims.issuer()).isEqualTo("auth-server");
                    assertThat(claims.scopes()).containsExactly("user/read");
                    assertThat(claims.tokenId()).isNull();
                    assertThat(claims.expiresAt()).isNull();
                    assertThat(claims.issuedAt()).isEqualTo(NOW);
                });
    }

    @Test
    void enabledRevocationListsUseInMemoryStores() {
        runner.withPropertyValues("token-auth.blacklist.enabled=true", "token-auth.banlist.enabled=true")
                .run(context -> {
                    assertThat(context).getBean(TokenAuthAutoConfiguration.BLACKLIST_BEAN)
                            .isInstanceOf(InMemoryRevocationStore.class);
                    assertThat(context).getBean(TokenAuthAutoConfiguration.BANLIST_BEAN)
                            .isInstanceOf(InMemoryRevocationStore.class);

                    var tokenAuth = context.getBean(TokenAuth.class);
                    var token = tokenAuth.forToken(AuthUser.of(1));
                    tokenAuth.ban("1");

                    assertThat(tokenAuth.verify(token).isValid()).isFalse();
                });
    }

    @Test
    void userStoreReplacesDefault() {
        runner.withPropertyValues("token-auth.blacklist.enabled=true")
                .withUserConfiguration(CustomStoreConfig.class)
                .run(context -> {
                    var store = context.getBean(TokenAuthAutoConfiguration.BLACKLIST_BEAN);
                    assertThat(store).isSameAs(CustomStoreConfig.STORE);
                    assertThat(context.getBean(TokenAuth.class).getConfig().getBlacklist()).containsSame(CustomStoreConfig.STORE);
                });
    }

    @Test
    void missingSecret_failsStartup() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(TokenAuthAutoConfiguration.class))
                .run(context -> assertThat(context).hasFailed()
                        .getFailure().hasRootCauseInstanceOf(TokenAuthConfigException.class));
    }

    @Test
    void unsupportedAlgorithm_failsStartup() {
        runner.withPropertyValues("token-auth.algorithm=RS256")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void ttlProperty() {
        assertThat(TokenAuthAutoConfiguration.toTtl(-1)).isEqualTo(Ttl.infinite());
        assertThat(TokenAuthAutoConfiguration.toTtl(60)).isEqualTo(Ttl.ofSeconds(60));
        assertThatThrownBy(() -> TokenAuthAutoConfiguration.toTtl(0)).isInstanceOf(TokenAuthConfigException.class);
        assertThatThrownBy(() -> TokenAuthAutoConfiguration.toTokenIdStrategy("random"))
                .isInstanceOf(TokenAuthConfigException.class);
    }

    @Configuration(proxyBeanMethods = false)
    static class FixedClockConfig {

        @Bean
        Clock clock() {
            return clockAt(NOW);
        }
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomStoreConfig {

        static final RevocationStore STORE = new InMemoryRevocationStore();

        @Bean(TokenAuthAutoConfiguration.BLACKLIST_BEAN)
        RevocationStore tokenAuthBlacklist() {
            return STORE;
        }
    }
}
