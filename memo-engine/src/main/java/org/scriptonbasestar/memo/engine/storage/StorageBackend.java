package org.scriptonbasestar.memo.engine.storage;

import java.util.List;

/**
 * 캐시 저장소.
 * <p>
 * 구현체는 {@link SingleSlotStore} 와 {@link MapStore} 두 가지이며 캐시 생성 시점에 결정됩니다.
 * 모든 연산은 여러 스레드에서 동시에 호출될 수 있습니다.
 * </p>
 *
 * @author archmagece
 * @since 2025-01
 */
public interface StorageBackend {

	/**
	 * 항목을 조회합니다.
	 *
	 * @param key 파생된 키 (SingleSlotStore는 무시)
	 * @return 저장된 항목, 없으면 null
	 */
	CacheEntry get(Object key);

	/**
	 * 현재 시각으로 새 항목을 기록합니다. 기존 항목은 덮어씁니다.
	 *
	 * @param key 파생된 키 (SingleSlotStore는 무시)
	 * @param values 결과 목록
	 * @return 기록 시각 (epoch milliseconds)
	 */
	long set(Object key, List<Object> values);

	/**
	 * 항목 하나를 제거합니다. 없는 키는 무시합니다.
	 *
	 * @param key 파생된 키 (SingleSlotStore는 무시)
	 * @return 제거된 항목이 있었으면 true
	 */
	boolean remove(Object key);

	/**
	 * 저장소 전체를 비웁니다.
	 *
	 * @return 제거된 항목 수
	 */
	int removeAll();

	/**
	 * @return 저장된 항목 수
	 */
	int size();
}
