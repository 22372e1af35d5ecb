package org.scriptonbasestar.memo.core.strategy;

import org.scriptonbasestar.memo.core.exception.SBMemoConfigurationException;

import java.util.Locale;

/**
 * 캐시 저장소 종류
 *
 * <ul>
 *   <li>SINGLE_SLOT: 항목 하나만 보관 - 인자 없는 함수용, 키를 무시</li>
 *   <li>MAP: 인자 키 → 항목 매핑 - 여러 캐시가 공유 가능</li>
 * </ul>
 *
 * <p>생성 시점에 결정되며 이후 바뀌지 않습니다.</p>
 *
 * @author archmagece
 * @since 2025-01
 */
public enum StorageKind {
	/**
	 * 단일 슬롯
	 * <p>인자와 관계없이 최근 결과 하나만 저장합니다.</p>
	 */
	SINGLE_SLOT,

	/**
	 * 맵 저장소
	 * <p>정규화된 인자를 키로 결과를 저장합니다. ConcurrentHashMap 기반.</p>
	 */
	MAP;

	/**
	 * 설정 문자열로부터 storage kind를 찾습니다.
	 * 대소문자, '-' 와 '_' 구분 없이 "single-slot", "SINGLE_SLOT", "map" 모두 허용합니다.
	 *
	 * @param value 설정 값
	 * @return 해당 StorageKind
	 * @throws SBMemoConfigurationException 알 수 없는 값일 때
	 */
	public static StorageKind fromString(String value) {
		if (value == null || value.trim().isEmpty()) {
			throw new SBMemoConfigurationException("Storage kind must not be null or empty");
		}
		String normalized = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
		for (StorageKind kind : values()) {
			if (kind.name().equals(normalized)) {
				return kind;
			}
		}
		throw new SBMemoConfigurationException("Unknown storage kind: " + value);
	}
}
