package org.scriptonbasestar.memo.engine.cache;

import org.scriptonbasestar.memo.core.function.MemoFunction;
import org.scriptonbasestar.memo.core.strategy.StorageKind;
import org.scriptonbasestar.memo.engine.metrics.MemoMetrics;
import org.scriptonbasestar.memo.engine.storage.StorageBackend;

import java.time.Duration;
import java.util.Collections;
import java.util.List;

/**
 * 메모이즈된 함수 하나에 대한 캐시 핸들.
 *
 * <p>이름, 타임아웃, 대상 함수, 파라미터 시그니처와 저장소를 보관합니다.
 * 저장소 종류는 생성 시점에 정해지며 바뀌지 않습니다. 캐시 객체 자체는 교체되지 않고
 * 저장소의 내용만 변경됩니다.</p>
 *
 * <p>구현체:</p>
 * <ul>
 *   <li>{@link SingleSlotMemoCache} - 단일 슬롯, 키 파생 없음</li>
 *   <li>{@link MapMemoCache} - 맵 저장소, 공유 가능</li>
 * </ul>
 *
 * @author archmagece
 * @since 2025-01
 */
public abstract class SBMemoCache {

	/**
	 * 기본 네임스페이스
	 */
	public static final String DEFAULT_NAMESPACE = "";

	private final String namespace;
	private final String name;
	private final String identifier;
	private final Duration timeout;  // null이면 만료 없음
	private final MemoFunction function;
	private final List<String> parameters;  // null이면 시그니처 미선언
	private final MemoMetrics metrics = new MemoMetrics();

	protected SBMemoCache(String namespace, String name, Duration timeout,
						  MemoFunction function, List<String> parameters) {
		this.namespace = namespace == null ? DEFAULT_NAMESPACE : namespace;
		this.name = name;
		this.identifier = qualify(this.namespace, name);
		this.timeout = timeout;
		this.function = function;
		this.parameters = parameters == null ? null : Collections.unmodifiableList(parameters);
	}

	/**
	 * 네임스페이스와 이름으로 외부 식별자를 만듭니다.
	 *
	 * @param namespace 네임스페이스
	 * @param name 캐시 이름
	 * @return 기본 네임스페이스이면 name, 아니면 namespace/name
	 */
	public static String qualify(String namespace, String name) {
		if (namespace == null || namespace.isEmpty()) {
			return name;
		}
		return namespace + "/" + name;
	}

	public String namespace() {
		return namespace;
	}

	public String name() {
		return name;
	}

	/**
	 * @return 레지스트리와 공유 저장소 키에서 쓰이는 식별자
	 */
	public String identifier() {
		return identifier;
	}

	/**
	 * @return 타임아웃, 만료가 없으면 null
	 */
	public Duration timeout() {
		return timeout;
	}

	public MemoFunction function() {
		return function;
	}

	/**
	 * @return 선언된 파라미터 이름, 선언되지 않았으면 null
	 */
	public List<String> parameters() {
		return parameters;
	}

	public MemoMetrics metrics() {
		return metrics;
	}

	/**
	 * 선언된 시그니처와 인자 개수가 맞는지 확인합니다.
	 *
	 * @param args 인자 목록
	 * @throws IllegalArgumentException 개수가 다를 때
	 */
	public void checkArity(List<Object> args) {
		if (parameters == null) {
			return;
		}
		int given = args == null ? 0 : args.size();
		if (given != parameters.size()) {
			throw new IllegalArgumentException(
				"Memo cache [" + identifier + "] expects " + parameters.size() + " argument(s) "
					+ parameters + " but got " + given
			);
		}
	}

	public abstract StorageKind storageKind();

	public abstract StorageBackend storage();

	/**
	 * 인자 목록으로 저장소 키를 파생합니다.
	 *
	 * @param args 인자 목록
	 * @return 저장소 키
	 */
	public abstract Object deriveKey(List<Object> args);

	/**
	 * 인자 하나에 해당하는 항목을 제거합니다.
	 *
	 * @param args 인자 목록
	 * @return 제거된 항목 수
	 */
	public abstract int removeEntry(List<Object> args);

	/**
	 * 이 캐시가 소유한 항목을 모두 제거합니다.
	 * 공유 저장소의 다른 캐시 항목은 건드리지 않습니다.
	 *
	 * @return 제거된 항목 수
	 */
	public abstract int removeOwnedEntries();

	/**
	 * @return 이 캐시가 소유한 항목 수
	 */
	public abstract int entryCount();

	@Override
	public String toString() {
		return getClass().getSimpleName() + "{identifier=" + identifier + ", timeout=" + timeout + '}';
	}
}
