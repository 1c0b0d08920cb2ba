package com.demo.tokenauth.web.response;

/**
 * 401 / 403 响应体。
 *
 * @param code    错误码，见 {@link com.demo.tokenauth.exception.AuthErrorCodes}
 * @param message 简短说明（如 "expired"）
 * @param path    请求路径
 */
public record ApiError(int code, String message, String path) {
}
