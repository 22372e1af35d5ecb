package org.scriptonbasestar.memo.metrics.micrometer;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.scriptonbasestar.memo.engine.cache.SBMemoCache;
import org.scriptonbasestar.memo.engine.registry.MemoRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MemoRegistry 에 등록된 모든 캐시를 Micrometer 에 바인딩합니다.
 *
 * <p>{@link #bindTo(MeterRegistry)} 시점에 등록되어 있던 캐시만 바인딩됩니다.
 * 그 이후 생성된 캐시는 {@link MicrometerMetricsAdapter} 로 직접 바인딩합니다.</p>
 *
 * <pre>{@code
 * new MemoRegistryMetricsBinder(memoizer.registry()).bindTo(meterRegistry);
 * }</pre>
 *
 * @author archmagece
 * @since 2025-01
 */
public class MemoRegistryMetricsBinder implements MeterBinder {

	private static final Logger log = LoggerFactory.getLogger(MemoRegistryMetricsBinder.class);

	private final MemoRegistry registry;
	private final Iterable<Tag> extraTags;

	public MemoRegistryMetricsBinder(MemoRegistry registry) {
		this(registry, Tags.empty());
	}

	public MemoRegistryMetricsBinder(MemoRegistry registry, Iterable<Tag> extraTags) {
		if (registry == null) {
			throw new IllegalArgumentException("MemoRegistry must not be null");
		}
		this.registry = registry;
		this.extraTags = extraTags;
	}

	@Override
	public void bindTo(MeterRegistry meterRegistry) {
		int bound = 0;
		for (SBMemoCache cache : registry.caches()) {
			new MicrometerMetricsAdapter(cache, meterRegistry, extraTags);
			bound++;
		}
		log.debug("Bound {} memo caches to {}", bound, meterRegistry.getClass().getSimpleName());
	}
}
