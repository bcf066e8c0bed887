package com.playdate.playservice.application.user;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * system-service 返回的用户档案（只取会话展示需要的字段）。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserProfileView {

    /** 玩家 ID（JWT sub） */
    private String userId;
    /** 用户名 */
    private String username;
    /** 昵称 */
    private String nickname;
    /** 头像地址 */
    private String avatarUrl;

    /** 展示名：优先昵称，其次用户名，都没有返回 null */
    @JsonIgnore
    public String getDisplayName() {
        if (nickname != null && !nickname.isBlank()) {
            return nickname;
        }
        if (username != null && !username.isBlank()) {
            return username;
        }
        return null;
    }
}
