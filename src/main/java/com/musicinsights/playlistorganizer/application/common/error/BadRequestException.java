package com.musicinsights.playlistorganizer.application.common.error;

import org.springframework.http.HttpStatus;

/**
 * 잘못된 요청(필터 누락, 인가 코드 누락 등)을 표현하는 400 예외.
 */
public class BadRequestException extends ApiException {

    public BadRequestException(String message, String code) {
        super(message, code);
    }

    public BadRequestException(String message, String code, Throwable cause) {
        super(message, code, cause);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.BAD_REQUEST;
    }
}
