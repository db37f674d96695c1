package com.musicinsights.playlistorganizer.infrastructure.spotify.auth;

/**
 * 한 세션의 Spotify 자격 증명.
 *
 * <p>불변 값이며, 토큰 갱신 시에는 새 인스턴스를 만들어 저장소의 값을 교체한다.</p>
 *
 * @param accessToken  Bearer 헤더에 실을 access token
 * @param refreshToken access token 재발급에 쓰는 refresh token(없을 수 있음)
 */
public record SpotifyCredential(String accessToken, String refreshToken) {

    /**
     * refresh token은 유지하고 access token만 바꾼 자격 증명을 만든다.
     *
     * <p>토큰 엔드포인트가 새 refresh token을 내려준 경우에만 refresh token도 교체한다.</p>
     *
     * @param newAccessToken  새 access token
     * @param newRefreshToken 새 refresh token(없으면 null)
     * @return 갱신된 자격 증명
     */
    public SpotifyCredential refreshed(String newAccessToken, String newRefreshToken) {
        String rt = (newRefreshToken == null || newRefreshToken.isBlank()) ? refreshToken : newRefreshToken;
        return new SpotifyCredential(newAccessToken, rt);
    }

    public boolean hasRefreshToken() {
        return refreshToken != null && !refreshToken.isBlank();
    }
}
