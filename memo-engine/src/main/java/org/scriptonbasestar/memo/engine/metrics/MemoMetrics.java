package org.scriptonbasestar.memo.engine.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 메모 캐시 통계.
 *
 * 스레드 안전하며 오버헤드가 거의 없도록 AtomicLong을 사용합니다.
 *
 * @author archmagece
 * @since 2025-01
 */
public class MemoMetrics {

	private final AtomicLong hitCount = new AtomicLong(0);
	private final AtomicLong missCount = new AtomicLong(0);
	private final AtomicLong expirationCount = new AtomicLong(0);
	private final AtomicLong computeSuccessCount = new AtomicLong(0);
	private final AtomicLong computeFailureCount = new AtomicLong(0);
	private final AtomicLong invalidationCount = new AtomicLong(0);
	private final AtomicLong totalComputeTime = new AtomicLong(0);  // 나노초

	public void recordHit() {
		hitCount.incrementAndGet();
	}

	/**
	 * 항목이 없어서 계산한 경우
	 */
	public void recordMiss() {
		missCount.incrementAndGet();
	}

	/**
	 * 항목이 만료되어서 다시 계산한 경우. 미스로도 집계됩니다.
	 */
	public void recordExpiration() {
		expirationCount.incrementAndGet();
		missCount.incrementAndGet();
	}

	/**
	 * @param computeTimeNanos 계산에 걸린 시간 (나노초)
	 */
	public void recordComputeSuccess(long computeTimeNanos) {
		computeSuccessCount.incrementAndGet();
		totalComputeTime.addAndGet(computeTimeNanos);
	}

	public void recordComputeFailure() {
		computeFailureCount.incrementAndGet();
	}

	/**
	 * @param count 무효화된 항목 수
	 */
	public void recordInvalidation(int count) {
		invalidationCount.addAndGet(count);
	}

	public long hitCount() {
		return hitCount.get();
	}

	public long missCount() {
		return missCount.get();
	}

	public long expirationCount() {
		return expirationCount.get();
	}

	public long computeSuccessCount() {
		return computeSuccessCount.get();
	}

	public long computeFailureCount() {
		return computeFailureCount.get();
	}

	public long invalidationCount() {
		return invalidationCount.get();
	}

	/**
	 * @return 누적 계산 시간 (나노초)
	 */
	public long totalComputeTime() {
		return totalComputeTime.get();
	}

	/**
	 * 총 요청 횟수 (히트 + 미스)
	 */
	public long requestCount() {
		return hitCount.get() + missCount.get();
	}

	/**
	 * @return 히트율 (0.0 ~ 1.0), 요청이 없으면 0.0
	 */
	public double hitRate() {
		long requests = requestCount();
		return requests == 0 ? 0.0 : (double) hitCount.get() / requests;
	}

	/**
	 * @return 미스율 (0.0 ~ 1.0), 요청이 없으면 0.0
	 */
	public double missRate() {
		long requests = requestCount();
		return requests == 0 ? 0.0 : (double) missCount.get() / requests;
	}

	/**
	 * @return 평균 계산 시간 (나노초), 계산이 없으면 0.0
	 */
	public double averageComputePenalty() {
		long computes = computeSuccessCount.get();
		return computes == 0 ? 0.0 : (double) totalComputeTime.get() / computes;
	}

	public void reset() {
		hitCount.set(0);
		missCount.set(0);
		expirationCount.set(0);
		computeSuccessCount.set(0);
		computeFailureCount.set(0);
		invalidationCount.set(0);
		totalComputeTime.set(0);
	}

	@Override
	public String toString() {
		return String.format(
			"MemoMetrics{requests=%d, hits=%d, misses=%d, expirations=%d, hitRate=%.2f%%, " +
			"computeSuccess=%d, computeFailure=%d, invalidations=%d, avgComputeTime=%.2fμs}",
			requestCount(),
			hitCount(),
			missCount(),
			expirationCount(),
			hitRate() * 100,
			computeSuccessCount(),
			computeFailureCount(),
			invalidationCount(),
			averageComputePenalty() / 1000  // 나노초 → 마이크로초
		);
	}
}
