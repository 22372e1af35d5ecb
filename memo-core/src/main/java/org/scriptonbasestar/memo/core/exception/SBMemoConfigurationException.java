package org.scriptonbasestar.memo.core.exception;

/**
 * 캐시 생성 시점의 설정 오류.
 * 알 수 없는 storage kind, 중복 식별자 등은 호출 시점이 아니라 생성 시점에 즉시 보고됩니다.
 *
 * @author archmagece
 * @since 2025-01
 */
public class SBMemoConfigurationException extends RuntimeException {

	public SBMemoConfigurationException(String message) {
		super(message);
	}

	public SBMemoConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
