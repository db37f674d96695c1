package com.musicinsights.playlistorganizer.application.common.error;

import org.springframework.http.HttpStatus;

/**
 * HTTP 상태와 애플리케이션 에러 코드를 함께 가지는 예외의 공통 부모.
 *
 * <p>{@link GlobalExceptionHandler}가 status/code를 그대로 {@link ErrorResponse}로 옮긴다.</p>
 */
public abstract class ApiException extends RuntimeException {
    private final String code;

    protected ApiException(String message, String code) {
        super(message);
        this.code = code;
    }

    protected ApiException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    /**
     * 에러 코드를 반환한다.
     *
     * @return 에러 코드
     */
    public String code() {
        return code;
    }

    /**
     * 응답으로 내려갈 HTTP 상태를 반환한다.
     *
     * @return HTTP 상태
     */
    public abstract HttpStatus status();
}
