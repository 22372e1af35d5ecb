package org.scriptonbasestar.memo.engine.registry;

import org.scriptonbasestar.memo.core.exception.SBMemoConfigurationException;
import org.scriptonbasestar.memo.engine.cache.SBMemoCache;
import org.scriptonbasestar.memo.engine.invalidation.MemoInvalidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Predicate;

/**
 * 생성된 모든 캐시의 목록.
 *
 * <p>추가만 가능하며 등록 순서를 유지합니다. 캐시는 식별자로 조회되고,
 * 전체 또는 네임스페이스 단위 일괄 무효화를 지원합니다.</p>
 *
 * <pre>{@code
 * MemoRegistry registry = new MemoRegistry();
 * SBMemoizer memoizer = SBMemoizer.builder().registry(registry).build();
 * ...
 * registry.clearAll("billing");  // billing 네임스페이스 캐시만 무효화
 * registry.clearAll();           // 전체
 * }</pre>
 *
 * @author archmagece
 * @since 2025-01
 */
public class MemoRegistry {

	private static final Logger log = LoggerFactory.getLogger(MemoRegistry.class);

	private final List<SBMemoCache> caches = new CopyOnWriteArrayList<>();
	private final Map<String, SBMemoCache> byIdentifier = new ConcurrentHashMap<>();
	private final MemoInvalidator invalidator;

	public MemoRegistry() {
		this(new MemoInvalidator());
	}

	public MemoRegistry(MemoInvalidator invalidator) {
		this.invalidator = invalidator;
	}

	/**
	 * 캐시를 등록합니다.
	 *
	 * @param cache 캐시
	 * @throws SBMemoConfigurationException 같은 식별자가 이미 등록되어 있을 때
	 */
	public synchronized void register(SBMemoCache cache) {
		if (cache == null) {
			throw new SBMemoConfigurationException("Cache must not be null");
		}
		SBMemoCache existing = byIdentifier.putIfAbsent(cache.identifier(), cache);
		if (existing != null) {
			throw new SBMemoConfigurationException(
				"Memo cache already registered with identifier: " + cache.identifier());
		}
		caches.add(cache);
		log.trace("Registered memo cache: {}", cache.identifier());
	}

	/**
	 * @param identifier 캐시 식별자
	 * @return 캐시, 없으면 null
	 */
	public SBMemoCache find(String identifier) {
		return byIdentifier.get(identifier);
	}

	/**
	 * @return 등록 순서대로 정렬된 캐시 목록 (수정 불가)
	 */
	public List<SBMemoCache> caches() {
		return Collections.unmodifiableList(new ArrayList<>(caches));
	}

	public int size() {
		return caches.size();
	}

	/**
	 * 모든 캐시를 무효화합니다.
	 *
	 * @return 무효화된 캐시 수
	 */
	public int clearAll() {
		return clearAll(cache -> true);
	}

	/**
	 * 네임스페이스에 속한 캐시를 무효화합니다. null이면 전체를 무효화합니다.
	 *
	 * @param namespace 네임스페이스
	 * @return 무효화된 캐시 수
	 */
	public int clearAll(String namespace) {
		if (namespace == null) {
			return clearAll();
		}
		return clearAll(cache -> namespace.equals(cache.namespace()));
	}

	/**
	 * 조건에 맞는 캐시를 무효화합니다.
	 *
	 * @param filter 캐시 조건
	 * @return 무효화된 캐시 수
	 */
	public int clearAll(Predicate<SBMemoCache> filter) {
		int cleared = 0;
		int entries = 0;
		for (SBMemoCache cache : caches) {
			if (filter.test(cache)) {
				entries += invalidator.clear(cache);
				cleared++;
			}
		}
		log.info("Cleared {} memo caches ({} entries)", cleared, entries);
		return cleared;
	}
}
