package com.playdate.playservice.challenge.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * 发起挑战请求
 */
@Data
public class SendChallengeRequest {

    /** 被挑战用户 ID（JWT sub） */
    @NotBlank(message = "被挑战用户ID不能为空")
    private String challengedUserId;

    @NotBlank(message = "gameType 不能为空")
    private String gameType;
}
