package com.roomhub.web.common;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.io.Serializable;

/**
 * 统一 API 响应格式
 *
 * @param <T> 响应数据类型
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
    /**
     * 响应状态码
     * 200: 成功
     * 400: 参数错误
     * 404: 房间不存在
     * 409: 冲突（房间已满、不是房间成员等）
     * 422: 动作被规则拒绝（非法走子、未轮到你等）
     * 500: 服务器错误
     */
    int code,

    /** 响应消息 */
    String message,

    /** 业务拒绝码，仅 422 时有值（例如 NOT_YOUR_TURN） */
    String reason,

    /** 响应数据 */
    T data
) implements Serializable {

    /** 规则拒绝使用的状态码 */
    public static final int REJECTED = 422;

    public static <T> ApiResponse<T> success() {
        return new ApiResponse<>(200, "success", null, null);
    }

    public static <T> ApiResponse<T> success(T data) {
        return new ApiResponse<>(200, "success", null, data);
    }

    /**
     * 动作被规则层拒绝：状态未改变，调用方可以换一个动作重试。
     * 仍然携带最新数据（通常是快照），方便前端直接重绘。
     */
    public static <T> ApiResponse<T> rejected(String reason, String message, T data) {
        return new ApiResponse<>(REJECTED, message, reason, data);
    }

    public static <T> ApiResponse<T> badRequest(String message) {
        return new ApiResponse<>(400, message, null, null);
    }

    public static <T> ApiResponse<T> notFound(String message) {
        return new ApiResponse<>(404, message, null, null);
    }

    public static <T> ApiResponse<T> conflict(String message) {
        return new ApiResponse<>(409, message, null, null);
    }

    public static <T> ApiResponse<T> serverError(String message) {
        return new ApiResponse<>(500, message, null, null);
    }

    /** 是否成功（2xx） */
    public boolean ok() {
        return code >= 200 && code < 300;
    }
}
