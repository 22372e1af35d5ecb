package org.scriptonbasestar.memo.engine.storage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 저장된 결과 하나.
 * 함수 호출 한 번의 전체 결과 목록과 기록 시각을 함께 보관합니다. 불변 객체입니다.
 *
 * @author archmagece
 * @since 2025-01
 */
public final class CacheEntry {

	private final List<Object> values;
	private final long timestamp;

	public CacheEntry(List<Object> values, long timestamp) {
		// null 원소를 허용해야 하므로 List.copyOf 대신 복사 후 unmodifiable
		this.values = Collections.unmodifiableList(new ArrayList<>(values));
		this.timestamp = timestamp;
	}

	/**
	 * @return 결과 목록 (수정 불가)
	 */
	public List<Object> values() {
		return values;
	}

	/**
	 * @return 기록 시각 (epoch milliseconds)
	 */
	public long timestamp() {
		return timestamp;
	}

	@Override
	public String toString() {
		return "CacheEntry{values=" + values + ", timestamp=" + timestamp + '}';
	}
}
