package com.musicinsights.playlistorganizer.application.common.error;

import org.springframework.http.HttpStatus;

/**
 * 저장된 Spotify 자격 증명으로 더 이상 호출할 수 없을 때 발생하는 예외.
 *
 * <p>refresh token이 없거나 토큰 갱신 자체가 실패한 경우로, 사용자가 다시 로그인해야 한다.
 * enrichment 계층에서 부분 결과로 흡수하지 않고 호출자까지 그대로 전파된다.</p>
 */
public class ReauthenticationRequiredException extends ApiException {

    public static final String CODE = "REAUTH_REQUIRED";

    public ReauthenticationRequiredException(String message) {
        super(message, CODE);
    }

    public ReauthenticationRequiredException(String message, Throwable cause) {
        super(message, CODE, cause);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.UNAUTHORIZED;
    }
}
