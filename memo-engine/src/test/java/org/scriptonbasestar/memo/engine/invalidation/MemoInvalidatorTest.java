package org.scriptonbasestar.memo.engine.invalidation;

import org.junit.Before;
import org.junit.Test;
import org.scriptonbasestar.memo.core.function.MemoFunction;
import org.scriptonbasestar.memo.engine.MutableClock;
import org.scriptonbasestar.memo.engine.cache.MapMemoCache;
import org.scriptonbasestar.memo.engine.cache.SingleSlotMemoCache;
import org.scriptonbasestar.memo.engine.cacher.MemoCacher;
import org.scriptonbasestar.memo.engine.storage.MapStore;
import org.scriptonbasestar.memo.engine.storage.SingleSlotStore;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

/**
 * MemoInvalidator 테스트
 *
 * @author archmagece
 * @since 2025-01
 */
public class MemoInvalidatorTest {

	private MutableClock clock;
	private MemoCacher cacher;
	private MemoInvalidator invalidator;
	private AtomicInteger computeCount;
	private MemoFunction echo;

	@Before
	public void setUp() {
		clock = new MutableClock(0L);
		cacher = new MemoCacher(clock);
		invalidator = new MemoInvalidator();
		computeCount = new AtomicInteger(0);
		echo = MemoFunction.single(args -> {
			computeCount.incrementAndGet();
			return args.get(0);
		});
	}

	private static List<Object> args(Object... values) {
		return new ArrayList<>(Arrays.asList(values));
	}

	@Test
	public void testSingleKeyClear() {
		// Given
		MapMemoCache cache = new MapMemoCache(null, "echo", null, echo, null, new MapStore(clock), false);
		cacher.invoke(cache, args("a"));
		cacher.invoke(cache, args("b"));

		// When
		int removed = invalidator.clear(cache, args("a"));

		// Then
		assertEquals(1, removed);
		assertEquals(1, cache.entryCount());
		cacher.invoke(cache, args("a"));  // 재계산
		cacher.invoke(cache, args("b"));  // 히트
		assertEquals(3, computeCount.get());
	}

	@Test
	public void testClearMissingKeyIsNoop() {
		MapMemoCache cache = new MapMemoCache(null, "echo", null, echo, null, new MapStore(clock), false);

		assertEquals(0, invalidator.clear(cache, args("nothing")));
		assertEquals(0, invalidator.clear(cache));
	}

	@Test
	public void testFullClearOfPrivateMap() {
		// Given
		MapMemoCache cache = new MapMemoCache(null, "echo", null, echo, null, new MapStore(clock), false);
		for (int i = 0; i < 5; i++) {
			cacher.invoke(cache, args(i));
		}

		// When
		int removed = invalidator.clear(cache, null);

		// Then
		assertEquals(5, removed);
		assertEquals(0, cache.mapStore().size());
		for (int i = 0; i < 5; i++) {
			cacher.invoke(cache, args(i));
		}
		assertEquals(10, computeCount.get());
		assertEquals(5, cache.metrics().invalidationCount());
	}

	@Test
	public void testSharedClearRemovesOnlyOwnEntries() {
		// Given
		MapStore shared = new MapStore(clock);
		MapMemoCache first = new MapMemoCache(null, "first", null, echo, null, shared, true);
		MapMemoCache second = new MapMemoCache(null, "second", null, echo, null, shared, true);
		cacher.invoke(first, args(1));
		cacher.invoke(first, args(2));
		cacher.invoke(second, args(1));

		// When
		int removed = invalidator.clear(first);

		// Then
		assertEquals(2, removed);
		assertEquals(1, shared.size());
		assertEquals(0, first.entryCount());
		assertEquals(1, second.entryCount());
		cacher.invoke(second, args(1));
		assertEquals(3, computeCount.get());
	}

	@Test
	public void testSharedSingleKeyClear() {
		// Given
		MapStore shared = new MapStore(clock);
		MapMemoCache first = new MapMemoCache(null, "first", null, echo, null, shared, true);
		MapMemoCache second = new MapMemoCache(null, "second", null, echo, null, shared, true);
		cacher.invoke(first, args(1));
		cacher.invoke(second, args(1));

		// When
		invalidator.clear(second, args(1));

		// Then
		assertEquals(1, first.entryCount());
		assertEquals(0, second.entryCount());
	}

	@Test
	public void testSingleSlotClearIgnoresArgs() {
		// Given
		SingleSlotMemoCache cache = new SingleSlotMemoCache(null, "slot", null, echo, null,
			new SingleSlotStore(clock));
		cacher.invoke(cache, args("x"));

		// When
		int removed = invalidator.clear(cache, args("something else"));

		// Then
		assertEquals(1, removed);
		assertEquals(0, cache.entryCount());
	}
}
