package org.scriptonbasestar.memo.engine.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 항목을 하나만 보관하는 저장소. 키는 모두 무시합니다.
 *
 * @author archmagece
 * @since 2025-01
 */
public class SingleSlotStore implements StorageBackend {

	private static final Logger log = LoggerFactory.getLogger(SingleSlotStore.class);

	private final AtomicReference<CacheEntry> slot = new AtomicReference<>();
	private final Clock clock;

	public SingleSlotStore() {
		this(Clock.systemUTC());
	}

	public SingleSlotStore(Clock clock) {
		this.clock = clock;
	}

	@Override
	public CacheEntry get(Object key) {
		return slot.get();
	}

	@Override
	public long set(Object key, List<Object> values) {
		long now = clock.millis();
		slot.set(new CacheEntry(values, now));
		log.trace("set slot - values : {}, timestamp : {}", values, now);
		return now;
	}

	@Override
	public boolean remove(Object key) {
		return slot.getAndSet(null) != null;
	}

	@Override
	public int removeAll() {
		return remove(null) ? 1 : 0;
	}

	@Override
	public int size() {
		return slot.get() == null ? 0 : 1;
	}

	@Override
	public String toString() {
		return "SingleSlotStore{" + slot.get() + '}';
	}
}
