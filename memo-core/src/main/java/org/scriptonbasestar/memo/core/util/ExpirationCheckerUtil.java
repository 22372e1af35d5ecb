package org.scriptonbasestar.memo.core.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;

/**
 * 캐시 항목 만료 판정.
 * 상태가 없고 락을 잡지 않습니다.
 *
 * @author archmagece
 * @since 2025-01
 */
@Slf4j
@UtilityClass
public class ExpirationCheckerUtil {

	/**
	 * 항목이 만료되었는지 확인합니다.
	 *
	 * <ul>
	 *   <li>timeout이 null이면 만료되지 않음</li>
	 *   <li>timestamp가 null(항목 없음)이면 만료로 취급</li>
	 *   <li>그 외에는 now &gt; timestamp + timeout 일 때 만료</li>
	 * </ul>
	 *
	 * @param timeout 타임아웃, null이면 무기한
	 * @param timestampMillis 마지막 기록 시각 (milliseconds), 항목이 없으면 null
	 * @param nowMillis 현재 시각 (milliseconds)
	 * @return 만료되었으면 true
	 */
	public static boolean isExpired(Duration timeout, Long timestampMillis, long nowMillis) {
		if (timeout == null) {
			return false;
		}
		if (timestampMillis == null) {
			return true;
		}
		long elapsedMillis = nowMillis - timestampMillis;
		long timeoutMillis = toMillisSaturated(timeout);

		if (log.isTraceEnabled()) {
			log.trace("isExpired 비교 - now : {}, timestamp : {}, elapsed : {}ms, timeout : {}",
				Instant.ofEpochMilli(nowMillis), Instant.ofEpochMilli(timestampMillis), elapsedMillis, timeout);
		}

		return elapsedMillis > timeoutMillis;
	}

	/**
	 * long 범위를 넘는 Duration 은 Long.MAX_VALUE 로 취급합니다.
	 */
	static long toMillisSaturated(Duration timeout) {
		if (timeout.getSeconds() >= Long.MAX_VALUE / 1000) {
			return Long.MAX_VALUE;
		}
		return timeout.toMillis();
	}

	/**
	 * 현재 시스템 시각 기준으로 만료 여부를 확인합니다.
	 *
	 * @param timeout 타임아웃, null이면 무기한
	 * @param timestampMillis 마지막 기록 시각 (milliseconds), 항목이 없으면 null
	 * @return 만료되었으면 true
	 */
	public static boolean isExpired(Duration timeout, Long timestampMillis) {
		return isExpired(timeout, timestampMillis, System.currentTimeMillis());
	}
}
