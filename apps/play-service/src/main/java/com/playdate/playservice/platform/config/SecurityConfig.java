package com.playdate.playservice.platform.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.web.SecurityFilterChain;

/**
 * 资源服务器安全配置
 * -------------------------------------------------------
 *  - 只开启 JWT 资源服务器能力，issuer-uri 由 application.yml 提供；
 *  - /ws/** 在 HTTP 层放行，握手后由 STOMP CONNECT 帧携带 Token，
 *    在 WebSocketAuthChannelInterceptor 中校验；
 *  - /actuator/** 放行，其余接口要求已认证。
 */
@Configuration
public class SecurityConfig {

    @Bean
    SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
        http
                .csrf(csrf -> csrf.disable())
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers("/actuator/**", "/ws/**").permitAll()
                        .anyRequest().authenticated()
                )
                .oauth2ResourceServer(oauth -> oauth.jwt(jwt -> { }));
        return http.build();
    }
}
