package org.scriptonbasestar.memo.metrics.micrometer;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.FunctionTimer;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import org.scriptonbasestar.memo.engine.cache.SBMemoCache;
import org.scriptonbasestar.memo.engine.metrics.MemoMetrics;

import java.util.concurrent.TimeUnit;

/**
 * 캐시 하나의 MemoMetrics 를 Micrometer MeterRegistry 에 노출하는 어댑터
 *
 * 모든 meter 는 MemoMetrics 의 값을 읽는 function 기반이므로 별도 동기화가 필요 없습니다.
 *
 * <p>사용 예시:</p>
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * SBMemoCache sumOf = memoizer.cache("sumOf").function(sum).create();
 *
 * new MicrometerMetricsAdapter(sumOf, registry);
 * // memo.hits{cache=sumOf}, memo.misses{cache=sumOf}, ...
 * }</pre>
 *
 * @author archmagece
 * @since 2025-01
 */
public class MicrometerMetricsAdapter {

	static final String TAG_CACHE = "cache";

	/**
	 * Micrometer 어댑터 생성
	 *
	 * @param cache 메모 캐시
	 * @param meterRegistry Micrometer 레지스트리
	 */
	public MicrometerMetricsAdapter(SBMemoCache cache, MeterRegistry meterRegistry) {
		this(cache, meterRegistry, Tags.empty());
	}

	/**
	 * Micrometer 어댑터 생성
	 *
	 * @param cache 메모 캐시
	 * @param meterRegistry Micrometer 레지스트리
	 * @param extraTags 모든 meter 에 추가할 태그
	 */
	public MicrometerMetricsAdapter(SBMemoCache cache, MeterRegistry meterRegistry, Iterable<Tag> extraTags) {
		if (cache == null) {
			throw new IllegalArgumentException("Memo cache must not be null");
		}
		if (meterRegistry == null) {
			throw new IllegalArgumentException("MeterRegistry must not be null");
		}

		MemoMetrics metrics = cache.metrics();
		Tags tags = Tags.of(TAG_CACHE, cache.identifier()).and(extraTags);

		FunctionCounter.builder("memo.hits", metrics, MemoMetrics::hitCount)
			.tags(tags)
			.description("Memo cache hit count")
			.register(meterRegistry);

		FunctionCounter.builder("memo.misses", metrics, MemoMetrics::missCount)
			.tags(tags)
			.description("Memo cache miss count, including expirations")
			.register(meterRegistry);

		FunctionCounter.builder("memo.expirations", metrics, MemoMetrics::expirationCount)
			.tags(tags)
			.description("Lookups that found a stale entry")
			.register(meterRegistry);

		FunctionCounter.builder("memo.computes", metrics, MemoMetrics::computeSuccessCount)
			.tags(tags)
			.tag("result", "success")
			.description("Memoized function executions")
			.register(meterRegistry);

		FunctionCounter.builder("memo.computes", metrics, MemoMetrics::computeFailureCount)
			.tags(tags)
			.tag("result", "failure")
			.description("Memoized function executions")
			.register(meterRegistry);

		FunctionCounter.builder("memo.invalidations", metrics, MemoMetrics::invalidationCount)
			.tags(tags)
			.description("Entries removed by invalidation")
			.register(meterRegistry);

		FunctionTimer.builder("memo.compute.duration", metrics,
				MemoMetrics::computeSuccessCount, MemoMetrics::totalComputeTime, TimeUnit.NANOSECONDS)
			.tags(tags)
			.description("Memoized function execution time")
			.register(meterRegistry);

		// Gauge (실시간 값)
		Gauge.builder("memo.entries", cache, SBMemoCache::entryCount)
			.tags(tags)
			.description("Entries owned by the memo cache")
			.register(meterRegistry);

		Gauge.builder("memo.hit.rate", metrics, MemoMetrics::hitRate)
			.tags(tags)
			.description("Memo cache hit rate")
			.register(meterRegistry);
	}
}
