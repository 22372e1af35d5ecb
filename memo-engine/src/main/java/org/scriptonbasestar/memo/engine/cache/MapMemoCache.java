package org.scriptonbasestar.memo.engine.cache;

import org.scriptonbasestar.memo.core.function.MemoFunction;
import org.scriptonbasestar.memo.core.strategy.StorageKind;
import org.scriptonbasestar.memo.engine.key.KeyDerivation;
import org.scriptonbasestar.memo.engine.key.SharedKey;
import org.scriptonbasestar.memo.engine.storage.MapStore;
import org.scriptonbasestar.memo.engine.storage.StorageBackend;

import java.time.Duration;
import java.util.List;
import java.util.function.Predicate;

/**
 * 맵 저장소 캐시.
 *
 * <p>sharedResults 가 true 이면 MapStore 를 다른 캐시와 공유할 수 있으며,
 * 키는 {@link SharedKey}(식별자, 정규화된 인자) 형태로 저장됩니다.
 * false 이면 정규화된 인자 자체가 키이고 저장소는 이 캐시 전용입니다.</p>
 *
 * @author archmagece
 * @since 2025-01
 */
public class MapMemoCache extends SBMemoCache {

	private final MapStore store;
	private final boolean sharedResults;
	private final Predicate<Object> ownedKeys;

	public MapMemoCache(String namespace, String name, Duration timeout, MemoFunction function,
						List<String> parameters, MapStore store, boolean sharedResults) {
		super(namespace, name, timeout, function, parameters);
		this.store = store;
		this.sharedResults = sharedResults;
		String owner = identifier();
		this.ownedKeys = key -> key instanceof SharedKey && ((SharedKey) key).isOwnedBy(owner);
	}

	@Override
	public StorageKind storageKind() {
		return StorageKind.MAP;
	}

	@Override
	public StorageBackend storage() {
		return store;
	}

	public MapStore mapStore() {
		return store;
	}

	public boolean isSharedResults() {
		return sharedResults;
	}

	@Override
	public Object deriveKey(List<Object> args) {
		List<Object> canonical = KeyDerivation.canonicalArgs(args);
		if (sharedResults) {
			return new SharedKey(identifier(), canonical);
		}
		return canonical;
	}

	@Override
	public int removeEntry(List<Object> args) {
		return store.remove(deriveKey(args)) ? 1 : 0;
	}

	@Override
	public int removeOwnedEntries() {
		if (sharedResults) {
			return store.removeIf(ownedKeys);
		}
		return store.removeAll();
	}

	@Override
	public int entryCount() {
		if (sharedResults) {
			return store.count(ownedKeys);
		}
		return store.size();
	}
}
