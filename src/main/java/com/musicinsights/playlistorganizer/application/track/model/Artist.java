package com.musicinsights.playlistorganizer.application.track.model;

/**
 * 트랙에 참여한 아티스트.
 *
 * @param id   Spotify 아티스트 ID
 * @param name 이름
 */
public record Artist(String id, String name) {}
