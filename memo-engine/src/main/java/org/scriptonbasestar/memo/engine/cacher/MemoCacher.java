package org.scriptonbasestar.memo.engine.cacher;

import org.scriptonbasestar.memo.core.util.ExpirationCheckerUtil;
import org.scriptonbasestar.memo.engine.cache.SBMemoCache;
import org.scriptonbasestar.memo.engine.metrics.MemoMetrics;
import org.scriptonbasestar.memo.engine.storage.CacheEntry;
import org.scriptonbasestar.memo.engine.storage.StorageBackend;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 조회 → 만료 판정 → 계산/저장 흐름을 담당합니다.
 *
 * <h3>동시성:</h3>
 * <p>
 * 조회와 계산, 저장은 하나의 원자적 단계가 아닙니다. 같은 키에 대해 동시에 미스가 나면
 * 두 호출 모두 함수를 실행하고 각자 결과를 기록하며, 마지막 기록이 남습니다 (last-write-wins).
 * 함수 실행 중에는 어떤 락도 잡지 않습니다.
 * </p>
 *
 * <h3>실패:</h3>
 * <p>
 * 함수가 던진 예외는 감싸지 않고 그대로 전파되며, 저장소는 호출 전 상태 그대로 남습니다.
 * </p>
 *
 * @author archmagece
 * @since 2025-01
 */
public class MemoCacher {

	private static final Logger log = LoggerFactory.getLogger(MemoCacher.class);

	private final Clock clock;

	public MemoCacher() {
		this(Clock.systemUTC());
	}

	public MemoCacher(Clock clock) {
		this.clock = clock;
	}

	/**
	 * 캐시된 결과를 반환하거나, 없거나 만료되었으면 함수를 실행하고 저장합니다.
	 * 히트는 만료 시각을 연장하지 않습니다.
	 *
	 * @param cache 캐시
	 * @param args 인자 목록
	 * @return 결과 목록 (수정 불가)
	 */
	public List<Object> invoke(SBMemoCache cache, List<Object> args) {
		cache.checkArity(args);
		MemoMetrics metrics = cache.metrics();

		// 1. 키 파생과 조회
		Object key = cache.deriveKey(args);
		StorageBackend storage = cache.storage();
		CacheEntry entry = storage.get(key);

		// 2. 만료 판정
		if (entry != null
			&& !ExpirationCheckerUtil.isExpired(cache.timeout(), entry.timestamp(), clock.millis())) {
			log.trace("hit - cache : {}, key : {}", cache.identifier(), key);
			metrics.recordHit();
			return entry.values();
		}

		if (entry == null) {
			log.trace("miss - cache : {}, key : {}", cache.identifier(), key);
			metrics.recordMiss();
		} else {
			log.trace("expired - cache : {}, key : {}, cachedAt : {}", cache.identifier(), key, entry.timestamp());
			metrics.recordExpiration();
		}

		// 3. 계산
		List<Object> values = compute(cache, args);

		// 4. 저장
		long cachedAt = storage.set(key, values);
		log.debug("stored - cache : {}, key : {}, cachedAt : {}", cache.identifier(), key, cachedAt);
		return values;
	}

	private List<Object> compute(SBMemoCache cache, List<Object> args) {
		MemoMetrics metrics = cache.metrics();
		long computeStartTime = System.nanoTime();
		List<Object> result;
		try {
			result = Objects.requireNonNull(cache.function().compute(args),
				"Memo function of [" + cache.identifier() + "] returned null instead of a result list");
		} catch (RuntimeException | Error e) {
			metrics.recordComputeFailure();
			throw e;
		}
		metrics.recordComputeSuccess(System.nanoTime() - computeStartTime);
		return Collections.unmodifiableList(new ArrayList<>(result));
	}
}
