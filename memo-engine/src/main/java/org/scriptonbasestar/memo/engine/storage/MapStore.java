package org.scriptonbasestar.memo.engine.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 키 → 항목 맵 저장소.
 * <p>
 * ConcurrentMap 기반으로 get/set/remove 가 동시에 호출되어도 안전합니다.
 * 여러 MapMemoCache 가 하나의 MapStore 를 공유할 수 있으며, 이 경우 키에 캐시 식별자가 붙습니다.
 * </p>
 *
 * <h3>초기화 실패:</h3>
 * <p>
 * 맵 팩토리가 실패하면 저장소는 materialize 되지 않은 상태로 남습니다.
 * 이 상태에서는 모든 조회가 miss 이고 기록은 건너뜁니다. 값은 항상 계산되지만 캐시되지 않습니다.
 * </p>
 *
 * @author archmagece
 * @since 2025-01
 */
public class MapStore implements StorageBackend {

	private static final Logger log = LoggerFactory.getLogger(MapStore.class);

	private final ConcurrentMap<Object, CacheEntry> data;  // null이면 초기화 실패
	private final Clock clock;

	public MapStore() {
		this(Clock.systemUTC());
	}

	public MapStore(Clock clock) {
		this(ConcurrentHashMap::new, clock);
	}

	/**
	 * 맵 구현을 지정하는 생성자
	 *
	 * @param mapFactory 내부 맵 팩토리
	 * @param clock 기록 시각용 clock
	 */
	public MapStore(Supplier<? extends ConcurrentMap<Object, CacheEntry>> mapFactory, Clock clock) {
		this.clock = clock;
		this.data = materialize(mapFactory);
	}

	private static ConcurrentMap<Object, CacheEntry> materialize(
			Supplier<? extends ConcurrentMap<Object, CacheEntry>> mapFactory) {
		try {
			ConcurrentMap<Object, CacheEntry> map = mapFactory.get();
			if (map == null) {
				log.warn("Map store factory returned null, results will be computed but never cached");
			}
			return map;
		} catch (RuntimeException e) {
			log.warn("Map store failed to initialize, results will be computed but never cached", e);
			return null;
		}
	}

	/**
	 * @return 항목 기록 시각에 쓰이는 clock
	 */
	public Clock clock() {
		return clock;
	}

	/**
	 * @return 내부 맵이 정상적으로 생성되었으면 true
	 */
	public boolean isMaterialized() {
		return data != null;
	}

	@Override
	public CacheEntry get(Object key) {
		if (data == null) {
			return null;
		}
		return data.get(key);
	}

	@Override
	public long set(Object key, List<Object> values) {
		long now = clock.millis();
		if (data == null) {
			log.debug("Map store not materialized, skipping write for key: {}", key);
			return now;
		}
		data.put(key, new CacheEntry(values, now));
		log.trace("set data - key : {}, values : {}, timestamp : {}", key, values, now);
		return now;
	}

	@Override
	public boolean remove(Object key) {
		if (data == null) {
			return false;
		}
		return data.remove(key) != null;
	}

	@Override
	public int removeAll() {
		if (data == null) {
			return 0;
		}
		int removed = data.size();
		data.clear();
		return removed;
	}

	/**
	 * 조건에 맞는 키를 모두 제거합니다.
	 * 순회 중 변경을 피하기 위해 대상 키를 먼저 수집한 뒤 하나씩 제거합니다.
	 * 전체 저장소에 대한 락은 잡지 않습니다.
	 *
	 * @param keyFilter 제거할 키 조건
	 * @return 제거된 항목 수
	 */
	public int removeIf(Predicate<Object> keyFilter) {
		if (data == null) {
			return 0;
		}
		List<Object> matched = new ArrayList<>();
		for (Object key : data.keySet()) {
			if (keyFilter.test(key)) {
				matched.add(key);
			}
		}

		int removed = 0;
		for (Object key : matched) {
			if (data.remove(key) != null) {
				removed++;
			}
		}
		return removed;
	}

	/**
	 * 조건에 맞는 키의 개수를 셉니다.
	 *
	 * @param keyFilter 키 조건
	 * @return 개수
	 */
	public int count(Predicate<Object> keyFilter) {
		if (data == null) {
			return 0;
		}
		int count = 0;
		for (Object key : data.keySet()) {
			if (keyFilter.test(key)) {
				count++;
			}
		}
		return count;
	}

	@Override
	public int size() {
		return data == null ? 0 : data.size();
	}

	/**
	 * @return 전체 항목의 스냅샷 (수정 불가)
	 */
	public Map<Object, CacheEntry> snapshot() {
		if (data == null) {
			return Collections.emptyMap();
		}
		return Collections.unmodifiableMap(new HashMap<>(data));
	}

	@Override
	public String toString() {
		return data == null ? "MapStore{unmaterialized}" : data.toString();
	}
}
