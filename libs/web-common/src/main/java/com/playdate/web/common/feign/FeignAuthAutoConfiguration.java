package com.playdate.web.common.feign;

import feign.RequestInterceptor;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.context.annotation.Bean;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

/**
 * Feign 调用时透传调用方的 Bearer Token。
 *
 * 取值顺序：
 * 1. 当前 HTTP 请求的 Authorization 头；
 * 2. SecurityContext 中的 JwtAuthenticationToken。
 *
 * WebSocket 消息线程与定时任务线程上两者都可能取不到，此时请求不带 Token，
 * 由下游按匿名内部调用处理。
 */
@Slf4j
@AutoConfiguration
@ConditionalOnClass(name = "org.springframework.cloud.openfeign.FeignClient")
public class FeignAuthAutoConfiguration {

    @Bean
    public RequestInterceptor feignAuthRequestInterceptor() {
        return template -> {
            String authorization = fromCurrentRequest();
            if (authorization == null) {
                authorization = fromSecurityContext();
            }
            if (authorization != null) {
                template.header("Authorization", authorization);
            } else {
                log.debug("当前线程无可透传的 Token, url={}", template.url());
            }
        };
    }

    private static String fromCurrentRequest() {
        if (!(RequestContextHolder.getRequestAttributes() instanceof ServletRequestAttributes attributes)) {
            return null;
        }
        HttpServletRequest request = attributes.getRequest();
        String header = request.getHeader("Authorization");
        return (header == null || header.isBlank()) ? null : header;
    }

    private static String fromSecurityContext() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication instanceof JwtAuthenticationToken jwtAuth) {
            String token = jwtAuth.getToken().getTokenValue();
            if (token != null && !token.isBlank()) {
                return "Bearer " + token;
            }
        }
        return null;
    }
}
