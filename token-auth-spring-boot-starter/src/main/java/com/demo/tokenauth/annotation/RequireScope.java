package com.demo.tokenauth.annotation;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * 声明接口接受的资源标签（permit）。
 * <p>
 * 所需 scope = permit + "/" + 由 HTTP 方法推导出的动作，token 命中其中任意一个即放行。
 * 例：permits = {"user", "admin"}，GET 请求需要 "user/read" 或 "admin/read"。
 * <p>
 * 可标注在类和方法上，两者的 permits 合并。
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.TYPE, ElementType.METHOD})
public @interface RequireScope {

    /**
     * 资源标签，如 "admin"。
     */
    String[] permits();
}
