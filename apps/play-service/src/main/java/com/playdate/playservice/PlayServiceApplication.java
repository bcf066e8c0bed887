package com.playdate.playservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.cloud.openfeign.EnableFeignClients;

/**
 * play-service 启动入口。
 * 实时对局会话协调（WebSocket/STOMP）+ 会话与挑战的 HTTP 接口。
 */
@SpringBootApplication
@EnableFeignClients
public class PlayServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlayServiceApplication.class, args);
    }
}
