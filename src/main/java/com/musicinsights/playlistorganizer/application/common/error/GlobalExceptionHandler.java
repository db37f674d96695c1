package com.musicinsights.playlistorganizer.application.common.error;

import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;

/**
 * 전역 예외 처리기.
 *
 * <p>애플리케이션 전반의 예외를 {@link ErrorResponse} 형태로 변환하여 반환한다.
 * Spotify 호출 실패는 upstream 오류(502)로, 재인증 필요 상황은 401로 내려간다.</p>
 */
@Order(-2)
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    /**
     * {@link ApiException} 계열(400/401/404)을 예외가 가진 상태와 코드로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return ErrorResponse
     */
    @ExceptionHandler(ApiException.class)
    public ResponseEntity<ErrorResponse> handleApi(ApiException e, ServerWebExchange ex) {
        String path = ex.getRequest().getPath().value();
        return ResponseEntity.status(e.status())
                .body(ErrorResponse.of(e.status(), e.getMessage(), path, e.code()));
    }

    /**
     * Spotify Web API가 돌려준 오류 응답을 변환한다.
     *
     * <p>refresh 후 재시도에서도 401이면 재인증이 필요하고, 404는 그대로 404,
     * 나머지는 502(UPSTREAM_ERROR)로 내려간다.</p>
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return ErrorResponse
     */
    @ExceptionHandler(WebClientResponseException.class)
    public ResponseEntity<ErrorResponse> handleUpstream(WebClientResponseException e, ServerWebExchange ex) {
        String path = ex.getRequest().getPath().value();
        int upstream = e.getStatusCode().value();

        if (upstream == 401) {
            return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                    .body(ErrorResponse.of(HttpStatus.UNAUTHORIZED, "Spotify rejected the credentials",
                            path, ReauthenticationRequiredException.CODE));
        }
        if (upstream == 404) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ErrorResponse.of(HttpStatus.NOT_FOUND, "Spotify resource not found", path, "NOT_FOUND"));
        }

        log.warn("Spotify call failed with status {}: {}", upstream, e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ErrorResponse.of(HttpStatus.BAD_GATEWAY, "Spotify request failed (" + upstream + ")",
                        path, "UPSTREAM_ERROR"));
    }

    /**
     * Spotify 연결 자체가 실패한 경우(타임아웃, DNS 등)를 502로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 502 ErrorResponse(UPSTREAM_UNAVAILABLE)
     */
    @ExceptionHandler(WebClientRequestException.class)
    public ResponseEntity<ErrorResponse> handleUpstreamUnavailable(WebClientRequestException e, ServerWebExchange ex) {
        String path = ex.getRequest().getPath().value();
        log.warn("Spotify is unreachable: {}", e.getMessage());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY)
                .body(ErrorResponse.of(HttpStatus.BAD_GATEWAY, "Spotify is unreachable", path, "UPSTREAM_UNAVAILABLE"));
    }

    /**
     * 검증(ConstraintViolation) 실패를 400 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 400 ErrorResponse(VALIDATION_ERROR)
     */
    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException e, ServerWebExchange ex) {
        String path = ex.getRequest().getPath().value();

        String msg = e.getConstraintViolations().stream()
                .findFirst()
                .map(v -> v.getPropertyPath() + ": " + v.getMessage())
                .orElse("Validation failed");

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(HttpStatus.BAD_REQUEST, msg, path, "VALIDATION_ERROR"));
    }

    /**
     * 요청 바디 바인딩/검증(WebExchangeBind) 실패를 400 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 400 ErrorResponse(VALIDATION_ERROR)
     */
    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleWebExchangeBind(WebExchangeBindException e, ServerWebExchange ex) {
        String path = ex.getRequest().getPath().value();

        String msg = e.getFieldErrors().stream()
                .findFirst()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .orElse("Validation failed");

        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(ErrorResponse.of(HttpStatus.BAD_REQUEST, msg, path, "VALIDATION_ERROR"));
    }

    /**
     * 프레임워크가 상태를 지정한 예외(파라미터 누락, 타입 불일치 등)를 해당 상태로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return ErrorResponse(REQUEST_ERROR)
     */
    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException e, ServerWebExchange ex) {
        String path = ex.getRequest().getPath().value();
        String msg = e.getReason() == null ? "Request failed" : e.getReason();
        return ResponseEntity.status(e.getStatusCode())
                .body(ErrorResponse.of(e.getStatusCode(), msg, path, "REQUEST_ERROR"));
    }

    /**
     * 처리되지 않은 예외를 500 응답으로 변환한다.
     *
     * @param e  예외
     * @param ex 요청 컨텍스트
     * @return 500 ErrorResponse(INTERNAL_ERROR)
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception e, ServerWebExchange ex) {
        String path = ex.getRequest().getPath().value();
        log.error("Unhandled error on {}", path, e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ErrorResponse.of(HttpStatus.INTERNAL_SERVER_ERROR, "Unexpected error", path, "INTERNAL_ERROR"));
    }
}
