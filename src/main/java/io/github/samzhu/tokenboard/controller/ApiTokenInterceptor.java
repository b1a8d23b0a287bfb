package io.github.samzhu.tokenboard.controller;

import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import io.github.samzhu.tokenboard.dto.DeviceIdentity;
import io.github.samzhu.tokenboard.service.ApiTokenService;

/**
 * 提交端點的 API token 驗證。
 *
 * <p>在解析 request body 之前執行，驗證通過後將 {@link DeviceIdentity}
 * 放入 request attribute {@value #DEVICE_IDENTITY}。
 * 驗證失敗拋出的異常交由 {@link io.github.samzhu.tokenboard.exception.ApiExceptionHandler} 處理。
 */
@Component
public class ApiTokenInterceptor implements HandlerInterceptor {

    public static final String DEVICE_IDENTITY = "tokenboard.deviceIdentity";

    private final ApiTokenService apiTokenService;

    public ApiTokenInterceptor(ApiTokenService apiTokenService) {
        this.apiTokenService = apiTokenService;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        DeviceIdentity identity = apiTokenService.authenticate(request.getHeader(HttpHeaders.AUTHORIZATION));
        request.setAttribute(DEVICE_IDENTITY, identity);
        return true;
    }
}
