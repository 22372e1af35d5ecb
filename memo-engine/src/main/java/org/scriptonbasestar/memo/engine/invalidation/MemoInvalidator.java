package org.scriptonbasestar.memo.engine.invalidation;

import org.scriptonbasestar.memo.engine.cache.SBMemoCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * 캐시 무효화.
 *
 * <ul>
 *   <li>단일 슬롯 캐시: 인자 유무와 관계없이 슬롯을 비움</li>
 *   <li>맵 캐시 + 인자: 해당 키 하나만 제거</li>
 *   <li>전용 맵 캐시, 인자 없음: 맵 전체를 비움</li>
 *   <li>공유 맵 캐시, 인자 없음: 이 캐시 식별자가 붙은 키만 제거</li>
 * </ul>
 *
 * <p>없는 키를 지우는 것은 오류가 아닙니다.</p>
 *
 * @author archmagece
 * @since 2025-01
 */
public class MemoInvalidator {

	private static final Logger log = LoggerFactory.getLogger(MemoInvalidator.class);

	/**
	 * 캐시가 소유한 항목을 모두 제거합니다.
	 *
	 * @param cache 캐시
	 * @return 제거된 항목 수
	 */
	public int clear(SBMemoCache cache) {
		int removed = cache.removeOwnedEntries();
		cache.metrics().recordInvalidation(removed);
		log.debug("Cleared cache: {} ({} entries)", cache.identifier(), removed);
		return removed;
	}

	/**
	 * 인자에 해당하는 항목을 제거합니다. args가 null이면 {@link #clear(SBMemoCache)} 와 같습니다.
	 *
	 * @param cache 캐시
	 * @param args 인자 목록
	 * @return 제거된 항목 수
	 */
	public int clear(SBMemoCache cache, List<Object> args) {
		if (args == null) {
			return clear(cache);
		}
		int removed = cache.removeEntry(args);
		cache.metrics().recordInvalidation(removed);
		log.debug("Cleared entry - cache : {}, args : {}, removed : {}", cache.identifier(), args, removed);
		return removed;
	}
}
