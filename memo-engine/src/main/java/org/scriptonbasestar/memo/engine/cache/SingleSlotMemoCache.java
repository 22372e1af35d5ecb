package org.scriptonbasestar.memo.engine.cache;

import org.scriptonbasestar.memo.core.function.MemoFunction;
import org.scriptonbasestar.memo.core.strategy.StorageKind;
import org.scriptonbasestar.memo.engine.storage.SingleSlotStore;
import org.scriptonbasestar.memo.engine.storage.StorageBackend;

import java.time.Duration;
import java.util.List;

/**
 * 단일 슬롯 캐시. 인자와 관계없이 결과 하나만 보관합니다.
 *
 * @author archmagece
 * @since 2025-01
 */
public class SingleSlotMemoCache extends SBMemoCache {

	private final SingleSlotStore store;

	public SingleSlotMemoCache(String namespace, String name, Duration timeout,
							   MemoFunction function, List<String> parameters, SingleSlotStore store) {
		super(namespace, name, timeout, function, parameters);
		this.store = store;
	}

	@Override
	public StorageKind storageKind() {
		return StorageKind.SINGLE_SLOT;
	}

	@Override
	public StorageBackend storage() {
		return store;
	}

	@Override
	public Object deriveKey(List<Object> args) {
		// 슬롯이 하나뿐이므로 키가 필요 없음
		return null;
	}

	@Override
	public int removeEntry(List<Object> args) {
		return store.removeAll();
	}

	@Override
	public int removeOwnedEntries() {
		return store.removeAll();
	}

	@Override
	public int entryCount() {
		return store.size();
	}
}
