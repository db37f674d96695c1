package com.musicinsights.playlistorganizer.application.common.error;

import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;

import java.time.Instant;

/**
 * 공통 에러 응답 DTO.
 *
 * @param timestamp 에러 발생 시각
 * @param status    HTTP 상태 코드
 * @param error     HTTP 상태 메시지
 * @param message   에러 메시지
 * @param path      요청 경로
 * @param code      애플리케이션 에러 코드
 */
public record ErrorResponse(
        Instant timestamp,
        int status,
        String error,
        String message,
        String path,
        String code
) {
    /**
     * 상태 코드로부터 reason phrase를 채워 응답을 만든다.
     *
     * @param status  HTTP 상태
     * @param message 에러 메시지
     * @param path    요청 경로
     * @param code    애플리케이션 에러 코드
     * @return 에러 응답
     */
    public static ErrorResponse of(HttpStatusCode status, String message, String path, String code) {
        HttpStatus resolved = HttpStatus.resolve(status.value());
        String reason = resolved == null ? "Error" : resolved.getReasonPhrase();
        return new ErrorResponse(Instant.now(), status.value(), reason, message, path, code);
    }
}
