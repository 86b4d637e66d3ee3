package com.roomhub.roomservice.platform.transport;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * ERROR 消息的载荷。
 *
 * @param reason   拒绝码（如 NOT_YOUR_TURN），非规则错误时为 ERROR
 * @param message  提示文本
 * @param playerId 发起动作的玩家，可空
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RejectionPayload(String reason, String message, String playerId) {
}
