package org.scriptonbasestar.memo.engine.key;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 인자 정규화.
 * <p>
 * 인자 트리를 구조적으로 비교 가능한 키로 변환합니다.
 * 같은 순서, 같은 값의 인자는 객체 identity 와 관계없이 항상 같은 키가 됩니다.
 * </p>
 *
 * <ul>
 *   <li>null 또는 빈 시퀀스 → {@link #EMPTY}</li>
 *   <li>List, 배열 → 원소를 재귀적으로 정규화한 수정 불가 List (순서 유지)</li>
 *   <li>그 외 → 값 그대로 (equals/hashCode 가 안정적이어야 함)</li>
 * </ul>
 *
 * @author archmagece
 * @since 2025-01
 */
public final class KeyDerivation {

	/**
	 * 빈 값 표식
	 */
	public static final List<Object> EMPTY = Collections.emptyList();

	private KeyDerivation() {
		// Utility class
	}

	/**
	 * 값 하나를 정규화합니다.
	 *
	 * @param value 인자 값
	 * @return 정규화된 값
	 */
	public static Object canonicalize(Object value) {
		if (value == null) {
			return EMPTY;
		}
		if (value instanceof List) {
			return canonicalizeList((List<?>) value);
		}
		if (value.getClass().isArray()) {
			return canonicalizeArray(value);
		}
		return value;
	}

	/**
	 * 인자 목록 전체를 정규화합니다.
	 *
	 * @param args 인자 목록
	 * @return 정규화된 인자 목록
	 */
	public static List<Object> canonicalArgs(List<?> args) {
		if (args == null) {
			return EMPTY;
		}
		return canonicalizeList(args);
	}

	private static List<Object> canonicalizeList(List<?> list) {
		if (list.isEmpty()) {
			return EMPTY;
		}
		List<Object> canonical = new ArrayList<>(list.size());
		for (Object element : list) {
			canonical.add(canonicalize(element));
		}
		return Collections.unmodifiableList(canonical);
	}

	private static List<Object> canonicalizeArray(Object array) {
		int length = Array.getLength(array);
		if (length == 0) {
			return EMPTY;
		}
		List<Object> canonical = new ArrayList<>(length);
		for (int i = 0; i < length; i++) {
			canonical.add(canonicalize(Array.get(array, i)));
		}
		return Collections.unmodifiableList(canonical);
	}
}
