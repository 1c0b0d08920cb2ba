package com.demo.tokenauth.aop;

import com.demo.tokenauth.annotation.RequireScope;
import com.demo.tokenauth.exception.AuthErrorCodes;
import com.demo.tokenauth.permission.PermissionChecker;
import com.demo.tokenauth.security.TokenAuthentication;
import jakarta.servlet.http.HttpServletRequest;
import org.aspectj.lang.JoinPoint;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.annotation.Before;
import org.aspectj.lang.reflect.MethodSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.lang.reflect.Method;
import java.util.*;

/**
 * 拦截 @RequireScope，并在调用目标方法前做授权校验。
 * <p>
 * 1) 从当前请求取 HTTP 方法
 * 2) 从当前认证信息取 scopes
 * 3) 交给 PermissionChecker 判定；命中的 scope 写入 request attribute，未命中抛 AccessDeniedException
 */
@Aspect
public class RequireScopeAspect {

    private static final Logger log = LoggerFactory.getLogger(RequireScopeAspect.class);

    private final PermissionChecker checker;

    public RequireScopeAspect(PermissionChecker checker) {
        this.checker = Objects.requireNonNull(checker, "PermissionChecker must not be null");
    }

    /**
     * 拦截 类 + 方法上的RequireScope注解
     */
    @Before("@within(com.demo.tokenauth.annotation.RequireScope) || @annotation(com.demo.tokenauth.annotation.RequireScope)")
    public void check(JoinPoint jp) {
        // 1) 当前用户认证信息
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth == null || !auth.isAuthenticated()) {
            throw new AccessDeniedException("Forbidden");
        }

        // 2) 当前请求
        HttpServletRequest request = currentRequest();
        if (request == null) {
            throw new AccessDeniedException("Forbidden");
        }

        // 3) 合并类 + 方法上的 permits
        Method method = ((MethodSignature) jp.getSignature()).getMethod();
        List<String> permits = resolvePermits(method, jp.getTarget());
        if (permits.isEmpty()) {
            throw new IllegalArgumentException("@RequireScope must declare at least one permit");
        }

        // 4) 判定
        Optional<String> matched = checker.authorize(request.getMethod(), permits, scopesOf(auth));
        if (matched.isEmpty()) {
            log.debug("Access denied: {} {} requires one of {}", request.getMethod(), request.getRequestURI(), permits);
            throw new AccessDeniedException("Forbidden");
        }
        request.setAttribute(AuthErrorCodes.REQ_ATTR_CURRENT_SCOPE, matched.get());
    }

    /**
     * 类注解 + 方法注解合并去重（类在前）
     */
    private static List<String> resolvePermits(Method method, Object target) {
        Class<?> type = target != null ? target.getClass() : method.getDeclaringClass();
        RequireScope onClass = findOnClass(type);
        RequireScope onMethod = method.getAnnotation(RequireScope.class);

        LinkedHashSet<String> set = new LinkedHashSet<>();
        if (onClass != null) addAll(set, onClass.permits());
        if (onMethod != null) addAll(set, onMethod.permits());
        return new ArrayList<>(set);
    }

    private static RequireScope findOnClass(Class<?> type) {
        for (Class<?> c = type; c != null && c != Object.class; c = c.getSuperclass()) {
            RequireScope a = c.getAnnotation(RequireScope.class);
            if (a != null) return a;
        }
        return null;
    }

    private static void addAll(Set<String> set, String[] arr) {
        if (arr == null) return;
        for (String s : arr) {
            if (s == null) continue;
            String v = s.trim();
            if (!v.isEmpty()) set.add(v);
        }
    }

    private static Collection<String> scopesOf(Authentication auth) {
        if (auth instanceof TokenAuthentication t) {
            return t.getClaims().scopes();
        }
        Collection<? extends GrantedAuthority> authorities = auth.getAuthorities();
        if (authorities == null || authorities.isEmpty()) return List.of();
        List<String> scopes = new ArrayList<>(authorities.size());
        for (GrantedAuthority ga : authorities) {
            if (ga != null && ga.getAuthority() != null) scopes.add(ga.getAuthority());
        }
        return scopes;
    }

    private static HttpServletRequest currentRequest() {
        RequestAttributes attrs = RequestContextHolder.getRequestAttributes();
        if (attrs instanceof ServletRequestAttributes sra) {
            return sra.getRequest();
        }
        return null;
    }
}
