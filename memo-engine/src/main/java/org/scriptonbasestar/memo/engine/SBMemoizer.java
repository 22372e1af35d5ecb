package org.scriptonbasestar.memo.engine;

import org.scriptonbasestar.memo.core.exception.SBMemoConfigurationException;
import org.scriptonbasestar.memo.core.function.MemoFunction;
import org.scriptonbasestar.memo.core.strategy.StorageKind;
import org.scriptonbasestar.memo.engine.cache.MapMemoCache;
import org.scriptonbasestar.memo.engine.cache.SBMemoCache;
import org.scriptonbasestar.memo.engine.cache.SingleSlotMemoCache;
import org.scriptonbasestar.memo.engine.cacher.MemoCacher;
import org.scriptonbasestar.memo.engine.invalidation.MemoInvalidator;
import org.scriptonbasestar.memo.engine.registry.MemoRegistry;
import org.scriptonbasestar.memo.engine.storage.MapStore;
import org.scriptonbasestar.memo.engine.storage.SingleSlotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * 메모이제이션 엔진 진입점.
 *
 * <p>캐시를 생성해 레지스트리에 등록하고, 호출과 무효화를 위임합니다.</p>
 *
 * <pre>{@code
 * SBMemoizer memoizer = SBMemoizer.builder().build();
 *
 * SBMemoCache sumOf = memoizer.cache("sumOf")
 *     .parameters("a", "b")
 *     .function(MemoFunction.single(args -> (Integer) args.get(0) + (Integer) args.get(1)))
 *     .create();
 *
 * memoizer.call(sumOf, 2, 3);  // 계산 후 저장 → [5]
 * memoizer.call(sumOf, 2, 3);  // 캐시 히트 → [5]
 * memoizer.clear(sumOf);
 *
 * // 여러 캐시가 하나의 맵을 공유
 * MapStore shared = memoizer.newMapStore();
 * SBMemoCache a = memoizer.cache("a").sharedStore(shared).function(fa).create();
 * SBMemoCache b = memoizer.cache("b").sharedStore(shared).function(fb).create();
 * memoizer.clear(a);  // a 의 항목만 제거
 * }</pre>
 *
 * @author archmagece
 * @since 2025-01
 */
public class SBMemoizer {

	private static final Logger log = LoggerFactory.getLogger(SBMemoizer.class);

	private final Clock clock;
	private final MemoRegistry registry;
	private final MemoCacher cacher;
	private final MemoInvalidator invalidator;
	private final Duration defaultTimeout;

	protected SBMemoizer(Clock clock, MemoRegistry registry, Duration defaultTimeout) {
		this.clock = clock;
		this.registry = registry;
		this.cacher = new MemoCacher(clock);
		this.invalidator = new MemoInvalidator();
		this.defaultTimeout = defaultTimeout;
	}

	/**
	 * Builder 패턴을 사용하여 SBMemoizer를 생성합니다.
	 *
	 * @return Builder 인스턴스
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * SBMemoizer Builder 클래스
	 */
	public static class Builder {
		private Clock clock = Clock.systemUTC();
		private MemoRegistry registry = null; // null이면 새로 생성
		private Duration defaultTimeout = null; // 기본값: 만료 없음

		/**
		 * 항목 기록 시각과 만료 판정에 쓰이는 clock
		 */
		public Builder clock(Clock clock) {
			this.clock = clock;
			return this;
		}

		/**
		 * 생성된 캐시를 등록할 레지스트리
		 */
		public Builder registry(MemoRegistry registry) {
			this.registry = registry;
			return this;
		}

		/**
		 * 타임아웃을 지정하지 않은 캐시에 적용할 기본 타임아웃
		 */
		public Builder defaultTimeout(Duration timeout) {
			this.defaultTimeout = timeout;
			return this;
		}

		public SBMemoizer build() {
			if (clock == null) {
				throw new SBMemoConfigurationException("Clock must not be null");
			}
			checkTimeout(defaultTimeout);
			return new SBMemoizer(clock, registry != null ? registry : new MemoRegistry(), defaultTimeout);
		}
	}

	/**
	 * 캐시 생성을 시작합니다.
	 *
	 * @param name 캐시 이름
	 * @return CacheBuilder 인스턴스
	 */
	public CacheBuilder cache(String name) {
		return new CacheBuilder(name);
	}

	/**
	 * 캐시를 생성하고 레지스트리에 등록합니다.
	 *
	 * @param name 캐시 이름
	 * @param timeout 타임아웃, null이면 만료 없음
	 * @param storageKind 저장소 종류
	 * @param shared 맵 공유 여부
	 * @param function 대상 함수
	 * @return 캐시 핸들
	 * @throws SBMemoConfigurationException 설정이 잘못되었을 때
	 */
	public SBMemoCache createCache(String name, Duration timeout, StorageKind storageKind,
								   boolean shared, MemoFunction function) {
		return cache(name)
			.timeout(timeout)
			.storageKind(storageKind)
			.shared(shared)
			.function(function)
			.create();
	}

	/**
	 * 다른 캐시와 공유할 수 있는 MapStore를 생성합니다. 이 엔진의 clock을 사용합니다.
	 *
	 * @return 새 MapStore
	 */
	public MapStore newMapStore() {
		return new MapStore(clock);
	}

	/**
	 * 캐시된 결과를 반환하거나 계산합니다.
	 *
	 * @param handle 캐시
	 * @param args 인자 목록
	 * @return 결과 목록
	 */
	public List<Object> invoke(SBMemoCache handle, List<Object> args) {
		Objects.requireNonNull(handle, "Memo cache handle must not be null");
		return cacher.invoke(handle, args);
	}

	/**
	 * 가변 인자 형태의 {@link #invoke(SBMemoCache, List)}
	 *
	 * @param handle 캐시
	 * @param args 인자
	 * @return 결과 목록
	 */
	public List<Object> call(SBMemoCache handle, Object... args) {
		return invoke(handle, new ArrayList<>(Arrays.asList(args)));
	}

	/**
	 * 캐시가 소유한 항목을 모두 제거합니다.
	 *
	 * @param handle 캐시
	 */
	public void clear(SBMemoCache handle) {
		Objects.requireNonNull(handle, "Memo cache handle must not be null");
		invalidator.clear(handle);
	}

	/**
	 * 인자에 해당하는 항목을 제거합니다.
	 *
	 * @param handle 캐시
	 * @param args 인자 목록, null이면 전체
	 */
	public void clear(SBMemoCache handle, List<Object> args) {
		Objects.requireNonNull(handle, "Memo cache handle must not be null");
		invalidator.clear(handle, args);
	}

	/**
	 * 등록된 모든 캐시를 무효화합니다.
	 */
	public void clearAll() {
		registry.clearAll();
	}

	/**
	 * 네임스페이스에 속한 캐시를 무효화합니다.
	 *
	 * @param namespace 네임스페이스, null이면 전체
	 */
	public void clearAll(String namespace) {
		registry.clearAll(namespace);
	}

	/**
	 * 조건에 맞는 캐시를 무효화합니다.
	 *
	 * @param filter 캐시 조건
	 */
	public void clearAll(Predicate<SBMemoCache> filter) {
		registry.clearAll(filter);
	}

	public MemoRegistry registry() {
		return registry;
	}

	public Clock clock() {
		return clock;
	}

	private static void checkTimeout(Duration timeout) {
		if (timeout != null && timeout.isNegative()) {
			throw new SBMemoConfigurationException("Timeout must not be negative: " + timeout);
		}
	}

	/**
	 * 캐시 생성 Builder
	 */
	public class CacheBuilder {
		private final String name;
		private String namespace = SBMemoCache.DEFAULT_NAMESPACE;
		private Duration timeout = defaultTimeout;
		private StorageKind storageKind = StorageKind.MAP; // 기본값: MAP
		private boolean shared = false;
		private MapStore sharedStore = null;
		private List<String> parameters = null; // null이면 인자 개수 검사 안 함
		private MemoFunction function;

		private CacheBuilder(String name) {
			this.name = name;
		}

		public CacheBuilder namespace(String namespace) {
			this.namespace = namespace;
			return this;
		}

		/**
		 * @param timeout 타임아웃, null이면 만료 없음
		 */
		public CacheBuilder timeout(Duration timeout) {
			this.timeout = timeout;
			return this;
		}

		/**
		 * @param timeoutSec 타임아웃(초)
		 */
		public CacheBuilder timeoutSec(int timeoutSec) {
			return timeout(Duration.ofSeconds(timeoutSec));
		}

		public CacheBuilder storageKind(StorageKind storageKind) {
			this.storageKind = storageKind;
			return this;
		}

		/**
		 * 설정 문자열로 저장소 종류를 지정합니다.
		 *
		 * @param storageKind "single-slot" 또는 "map"
		 * @throws SBMemoConfigurationException 알 수 없는 값일 때
		 */
		public CacheBuilder storageKind(String storageKind) {
			return storageKind(StorageKind.fromString(storageKind));
		}

		/**
		 * 결과 공유 여부. 공유 저장소를 지정하지 않으면 새 MapStore를 만들고,
		 * 이후 {@link MapMemoCache#mapStore()} 로 다른 캐시와 공유할 수 있습니다.
		 */
		public CacheBuilder shared(boolean shared) {
			this.shared = shared;
			return this;
		}

		/**
		 * 다른 캐시와 공유할 MapStore를 지정합니다. shared(true) 를 함께 설정합니다.
		 * 저장소의 clock 은 이 엔진의 clock 과 같아야 합니다 ({@link #newMapStore()} 참고).
		 */
		public CacheBuilder sharedStore(MapStore store) {
			this.sharedStore = store;
			this.shared = true;
			return this;
		}

		public CacheBuilder parameters(String... parameters) {
			this.parameters = new ArrayList<>(Arrays.asList(parameters));
			return this;
		}

		public CacheBuilder function(MemoFunction function) {
			this.function = function;
			return this;
		}

		/**
		 * 캐시를 생성하고 레지스트리에 등록합니다.
		 *
		 * @return 캐시 핸들
		 * @throws SBMemoConfigurationException 설정이 잘못되었을 때
		 */
		public SBMemoCache create() {
			if (name == null || name.trim().isEmpty()) {
				throw new SBMemoConfigurationException("Cache name must not be null or empty");
			}
			if (function == null) {
				throw new SBMemoConfigurationException("Memo function must not be null: " + name);
			}
			if (storageKind == null) {
				throw new SBMemoConfigurationException("Storage kind must not be null: " + name);
			}
			checkTimeout(timeout);

			SBMemoCache cache;
			switch (storageKind) {
				case SINGLE_SLOT:
					if (shared) {
						throw new SBMemoConfigurationException(
							"Single-slot cache cannot share results: " + name);
					}
					cache = new SingleSlotMemoCache(namespace, name, timeout, function, parameters,
						new SingleSlotStore(clock));
					break;
				case MAP:
					if (sharedStore != null && !shared) {
						throw new SBMemoConfigurationException(
							"Shared store given but shared results disabled: " + name);
					}
					if (sharedStore != null && !clock.equals(sharedStore.clock())) {
						throw new SBMemoConfigurationException(
							"Shared store clock differs from the memoizer clock: " + name);
					}
					MapStore store = sharedStore != null ? sharedStore : new MapStore(clock);
					cache = new MapMemoCache(namespace, name, timeout, function, parameters, store, shared);
					break;
				default:
					throw new SBMemoConfigurationException("Unsupported storage kind: " + storageKind);
			}

			registry.register(cache);
			log.info("Created memo cache: {} (kind={}, timeout={}, shared={})",
				cache.identifier(), storageKind, timeout, shared);
			return cache;
		}
	}
}
