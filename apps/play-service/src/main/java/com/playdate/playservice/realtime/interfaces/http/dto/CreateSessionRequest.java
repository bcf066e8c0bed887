package com.playdate.playservice.realtime.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * 创建会话请求。playerName 可空，默认取调用方 JWT 中的展示名。
 */
@Data
public class CreateSessionRequest {

    @NotBlank(message = "gameType 不能为空")
    private String gameType;

    private String playerName;
}
