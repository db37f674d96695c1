package com.musicinsights.playlistorganizer.application.track.model;

/**
 * 트랙이 수록된 앨범.
 *
 * @param id          Spotify 앨범 ID
 * @param name        이름
 * @param imageUrl    커버 이미지 URL(없으면 빈 문자열)
 * @param releaseDate 발매일 문자열(YYYY[-MM[-DD]])
 */
public record Album(String id, String name, String imageUrl, String releaseDate) {}
