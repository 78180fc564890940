package com.example.earnings.exception;

/**
 * 엔티티 시계열 전제조건 위반(중복/역순 기간, 라벨 형식 오류 등).
 * 해당 엔티티만 실패 처리하고 나머지는 계속 진행한다.
 */
public class InvalidSeriesException extends RuntimeException {

    private final String entity;

    public InvalidSeriesException(String entity, String message) {
        super(entity + ": " + message);
        this.entity = entity;
    }

    public InvalidSeriesException(String entity, String message, Throwable cause) {
        super(entity + ": " + message, cause);
        this.entity = entity;
    }

    public String getEntity() { return entity; }
}
