package com.roomhub.web.common;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ApiResponseTest {

    @Test
    void success_carriesData() {
        ApiResponse<String> r = ApiResponse.success("AB12");
        assertEquals(200, r.code());
        assertEquals("AB12", r.data());
        assertNull(r.reason());
        assertTrue(r.ok());
    }

    @Test
    void rejected_keepsReasonAndData() {
        ApiResponse<Integer> r = ApiResponse.rejected("NOT_YOUR_TURN", "还没轮到你", 7);
        assertEquals(ApiResponse.REJECTED, r.code());
        assertEquals("NOT_YOUR_TURN", r.reason());
        assertEquals(7, r.data());
        assertFalse(r.ok());
    }

    @Test
    void errorFactories_useExpectedCodes() {
        assertEquals(400, ApiResponse.badRequest("x").code());
        assertEquals(404, ApiResponse.notFound("x").code());
        assertEquals(409, ApiResponse.conflict("x").code());
        assertEquals(500, ApiResponse.serverError("x").code());
    }

    @Test
    void serialization_omitsNullFields() throws Exception {
        String json = new ObjectMapper().writeValueAsString(ApiResponse.conflict("房间已满"));
        assertFalse(json.contains("reason"));
        assertFalse(json.contains("data"));
        assertTrue(json.contains("\"code\":409"));
    }
}
