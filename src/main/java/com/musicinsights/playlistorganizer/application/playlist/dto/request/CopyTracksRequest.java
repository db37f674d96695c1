package com.musicinsights.playlistorganizer.application.playlist.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;

import java.util.Set;

/**
 * 필터링된 트랙을 다른 플레이리스트로 복사하는 요청.
 *
 * <p>genre, 연도 범위, trackIds 중 하나 이상을 지정해야 하며 지정된 조건은 모두 AND로 결합된다.
 * trackIds는 외부(AI 등)에서 미리 평가한 결과를 그대로 받는다.</p>
 *
 * @param name              대상 플레이리스트 이름(없으면 필터의 제안 이름)
 * @param description       대상 플레이리스트 설명
 * @param genre             장르 조건
 * @param minYear           최소 발매 연도
 * @param maxYear           최대 발매 연도
 * @param trackIds          미리 선택된 트랙 ID
 * @param selectionLabel    trackIds를 고른 기준 설명(예: 자연어 질의)
 * @param suggestedName     trackIds와 함께 받은 제안 이름
 */
public record CopyTracksRequest(
        @Size(max = 100) String name,
        @Size(max = 300) String description,
        @Size(max = 100) String genre,
        @Min(1900) @Max(2100) Integer minYear,
        @Min(1900) @Max(2100) Integer maxYear,
        @Size(max = 10000) Set<String> trackIds,
        @Size(max = 300) String selectionLabel,
        @Size(max = 100) String suggestedName
) {}
