package com.roomhub.roomservice.common;

import com.roomhub.roomservice.platform.room.RoomNotFoundException;
import com.roomhub.web.common.ApiResponse;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

class WebExceptionAdviceTest {

    private final WebExceptionAdvice advice = new WebExceptionAdvice();

    @Test
    void missingRoomIsNotFound() {
        ResponseEntity<ApiResponse<Object>> resp = advice.notFound(new RoomNotFoundException("ABCD"));
        assertEquals(404, resp.getStatusCode().value());
        assertEquals("ROOM_NOT_FOUND: ABCD", resp.getBody().message());
    }

    @Test
    void badArgumentIsBadRequest() {
        ResponseEntity<ApiResponse<Object>> resp = advice.badRequest(new IllegalArgumentException("UNKNOWN_GAME_TYPE: chess"));
        assertEquals(400, resp.getStatusCode().value());
        assertEquals(400, resp.getBody().code());
    }

    @Test
    void stateConflictIsConflict() {
        ResponseEntity<ApiResponse<Object>> resp = advice.conflict(new IllegalStateException("ROOM_FULL: ABCD"));
        assertEquals(409, resp.getStatusCode().value());
        assertFalse(resp.getBody().ok());
    }
}
