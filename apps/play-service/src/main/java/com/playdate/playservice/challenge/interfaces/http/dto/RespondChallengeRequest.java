package com.playdate.playservice.challenge.interfaces.http.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

/**
 * response: accept / decline
 */
@Data
public class RespondChallengeRequest {

    @NotBlank(message = "response 不能为空")
    private String response;
}
