package com.playdate.playservice.realtime.domain.constants;

/**
 * 会话协议中用户可见的提示文案，统一在这里维护。
 */
public final class PlayMessages {

    private PlayMessages() {
    }

    // ========== 连接 ==========

    public static final String CONNECTED = "已连接到游戏服务器";

    /** 新连接顶替旧连接时发给旧连接的踢下线原因 */
    public static final String SUPERSEDED = "账号已在其他连接上进入对局";

    /** 心跳超时被清扫时的踢下线原因 */
    public static final String HEARTBEAT_TIMEOUT = "长时间未收到心跳，连接已断开";

    // ========== 参数校验 ==========

    public static final String MISSING_GAME_TYPE_OR_PLAYER = "缺少 gameType 或 playerId";

    public static final String MISSING_SESSION_OR_PLAYER = "缺少 sessionId 或 playerId";

    public static final String MISSING_REQUIRED_DATA = "缺少必要参数";

    public static final String MISSING_PLAYER = "缺少 playerId";

    public static final String INVALID_FINAL_STATUS = "只能将会话结束为 completed 或 abandoned";

    // ========== 会话状态 ==========

    public static final String SESSION_NOT_FOUND = "会话不存在";

    public static final String SESSION_FULL = "会话已满";

    public static final String SESSION_FINISHED = "会话已结束";

    public static final String NOT_A_MEMBER = "你不在该会话中";

    public static final String SESSION_ID_TAKEN = "会话 ID 已存在";

    /** 玩家未提供昵称且用户域查不到时的默认展示名 */
    public static final String DEFAULT_PLAYER_NAME = "Player";

    /** communication 未指定 messageType 时的默认值 */
    public static final String DEFAULT_MESSAGE_TYPE = "instruction";
}
