package com.example.earnings.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import io.swagger.v3.oas.annotations.media.Schema;

@Schema(description = "보고 주기")
public enum PeriodKind {
    QUARTERLY("quarterly"),
    ANNUAL("annual");

    private final String code;

    PeriodKind(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() { return code; }

    /** 대소문자 무시. 알 수 없는 값은 null */
    @JsonCreator
    public static PeriodKind from(String s) {
        if (s == null || s.isBlank()) return null;
        String t = s.trim().toLowerCase();
        for (PeriodKind v : values()) {
            if (v.code.equals(t) || v.name().equalsIgnoreCase(t)) return v;
        }
        return null;
    }
}
