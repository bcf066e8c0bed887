package com.playdate.playservice.realtime.interfaces.http.dto;

import jakarta.validation.constraints.NotNull;
import lombok.Data;

/**
 * 更新会话对局数据。status 可选：completed / abandoned 时结束会话。
 */
@Data
public class UpdateStateRequest {
    @NotNull(message = "gameData 不能为空")
    private Object gameData;

    private Object playerAction;
    private String status;
}
