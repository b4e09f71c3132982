package com.userservice.common.controller;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

/**
 * 성공 응답 생성을 위한 헬퍼 클래스
 * Controller에서 반복되는 ResponseEntity 생성 패턴을 간소화합니다.
 */
public class ResponseHelper {

    private ResponseHelper() {
    }

    /**
     * 본문과 함께 201 Created 응답을 생성합니다.
     *
     * @param body 생성된 리소스
     */
    public static <T> ResponseEntity<T> created(T body) {
        return ResponseEntity.status(HttpStatus.CREATED).body(body);
    }

    /**
     * 본문과 함께 200 OK 응답을 생성합니다.
     *
     * @param body 응답 본문
     */
    public static <T> ResponseEntity<T> ok(T body) {
        return ResponseEntity.ok(body);
    }

    /**
     * 본문 없는 204 No Content 응답을 생성합니다.
     */
    public static ResponseEntity<Void> noContent() {
        return ResponseEntity.noContent().build();
    }
}
