package org.scriptonbasestar.memo.engine.registry;

import org.junit.Before;
import org.junit.Test;
import org.scriptonbasestar.memo.core.exception.SBMemoConfigurationException;
import org.scriptonbasestar.memo.core.function.MemoFunction;
import org.scriptonbasestar.memo.engine.cache.MapMemoCache;
import org.scriptonbasestar.memo.engine.cache.SBMemoCache;
import org.scriptonbasestar.memo.engine.cache.SingleSlotMemoCache;
import org.scriptonbasestar.memo.engine.storage.CacheEntry;
import org.scriptonbasestar.memo.engine.storage.MapStore;
import org.scriptonbasestar.memo.engine.storage.SingleSlotStore;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

/**
 * MemoRegistry 테스트
 *
 * @author archmagece
 * @since 2025-01
 */
public class MemoRegistryTest {

	private static final MemoFunction IDENTITY = args -> args;

	private MemoRegistry registry;

	@Before
	public void setUp() {
		registry = new MemoRegistry();
	}

	private MapMemoCache mapCache(String namespace, String name) {
		MapMemoCache cache = new MapMemoCache(namespace, name, null, IDENTITY, null, new MapStore(), false);
		cache.storage().set(cache.deriveKey(Collections.<Object>singletonList(1)), Collections.<Object>singletonList(1));
		return cache;
	}

	@Test
	public void testRegistrationOrderIsKept() {
		// Given
		SBMemoCache a = mapCache(null, "a");
		SBMemoCache b = mapCache("billing", "b");
		SBMemoCache c = mapCache(null, "c");

		// When
		registry.register(a);
		registry.register(b);
		registry.register(c);

		// Then
		List<SBMemoCache> caches = registry.caches();
		assertEquals(Arrays.asList(a, b, c), caches);
		assertEquals(3, registry.size());
		assertSame(b, registry.find("billing/b"));
		assertNull(registry.find("b"));
	}

	@Test(expected = SBMemoConfigurationException.class)
	public void testDuplicateIdentifierIsRejected() {
		registry.register(mapCache(null, "a"));
		registry.register(mapCache(null, "a"));
	}

	@Test
	public void testSameNameInDifferentNamespaces() {
		registry.register(mapCache("x", "a"));
		registry.register(mapCache("y", "a"));

		assertEquals(2, registry.size());
	}

	@Test
	public void testClearAll() {
		// Given
		SBMemoCache a = mapCache(null, "a");
		SBMemoCache b = mapCache("billing", "b");
		SingleSlotMemoCache slot = new SingleSlotMemoCache("billing", "slot", null, IDENTITY, null,
			new SingleSlotStore());
		slot.storage().set(null, Collections.<Object>singletonList("v"));
		registry.register(a);
		registry.register(b);
		registry.register(slot);

		// When
		int cleared = registry.clearAll();

		// Then
		assertEquals(3, cleared);
		assertEquals(0, a.entryCount());
		assertEquals(0, b.entryCount());
		assertEquals(0, slot.entryCount());
	}

	@Test
	public void testClearAllByNamespace() {
		// Given
		SBMemoCache a = mapCache(null, "a");
		SBMemoCache b = mapCache("billing", "b");
		registry.register(a);
		registry.register(b);

		// When
		int cleared = registry.clearAll("billing");

		// Then
		assertEquals(1, cleared);
		assertEquals(1, a.entryCount());
		assertEquals(0, b.entryCount());
		assertEquals(0, registry.clearAll("unknown"));
	}

	@Test
	public void testClearAllWithNullNamespaceClearsEverything() {
		SBMemoCache a = mapCache(null, "a");
		SBMemoCache b = mapCache("billing", "b");
		registry.register(a);
		registry.register(b);

		assertEquals(2, registry.clearAll((String) null));
	}

	@Test
	public void testClearAllByPredicate() {
		// Given
		SBMemoCache a = mapCache(null, "alpha");
		SBMemoCache b = mapCache(null, "beta");
		registry.register(a);
		registry.register(b);

		// When
		registry.clearAll(cache -> cache.name().startsWith("al"));

		// Then
		assertEquals(0, a.entryCount());
		CacheEntry kept = b.storage().get(b.deriveKey(Collections.<Object>singletonList(1)));
		assertNotNull(kept);
	}

	@Test(expected = UnsupportedOperationException.class)
	public void testCachesSnapshotIsUnmodifiable() {
		registry.caches().add(mapCache(null, "z"));
	}
}
