package com.example.earnings.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GlobalExceptionHandlerTest {

    private final GlobalExceptionHandler handler = new GlobalExceptionHandler();

    @Test
    @DisplayName("시계열 전제조건 위반은 422 와 함께 실패한 엔티티를 본문에 담는다")
    void invalidSeriesCarriesEntity() {
        ResponseEntity<Map<String, Object>> res =
                handler.handleInvalidSeries(new InvalidSeriesException("BANK_A", "duplicate period 2024Q1"));

        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, res.getStatusCode());
        Map<String, Object> body = res.getBody();
        assertNotNull(body);
        assertEquals("BANK_A", body.get("entity"));
        assertEquals(422, body.get("status"));
        assertEquals("BANK_A: duplicate period 2024Q1", body.get("message"));
        assertNotNull(body.get("timestamp"));
    }

    @Test
    @DisplayName("잘못된 인자는 400, 엔티티 항목 없음")
    void badRequestHasNoEntity() {
        ResponseEntity<Map<String, Object>> res = handler.handleBadRequest(new IllegalArgumentException("period is required"));

        assertEquals(HttpStatus.BAD_REQUEST, res.getStatusCode());
        assertFalse(res.getBody().containsKey("entity"));
        assertEquals("period is required", res.getBody().get("message"));
    }
}
