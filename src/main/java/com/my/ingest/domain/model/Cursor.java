package com.my.ingest.domain.model;

import java.util.Objects;

/**
 * 왜: 플랫폼이 발급한 커서를 해석하지 않고 저장/반환만 하도록 불투명 값으로 고정하기 위함.
 */
public record Cursor(String value) {

    public Cursor {
        Objects.requireNonNull(value, "value");
        if (value.isEmpty()) {
            throw new IllegalArgumentException("cursor는 비어 있을 수 없습니다.");
        }
    }
}
