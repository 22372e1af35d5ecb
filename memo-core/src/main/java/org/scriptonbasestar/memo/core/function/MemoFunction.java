package org.scriptonbasestar.memo.core.function;

import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * 메모이제이션 대상 함수.
 *
 * <p>인자 목록을 받아 결과 목록을 반환합니다. 결과가 여러 개인 함수(multi-value return)를
 * 표현하기 위해 반환값은 항상 순서가 있는 목록입니다.</p>
 *
 * <p>예외는 감싸지 않고 호출자에게 그대로 전파됩니다.</p>
 *
 * @author archmagece
 * @since 2025-01
 */
@FunctionalInterface
public interface MemoFunction {

	/**
	 * 함수를 실행합니다.
	 *
	 * @param args 인자 목록 (순서 유지)
	 * @return 전체 결과 목록
	 */
	List<Object> compute(List<Object> args);

	/**
	 * 결과가 하나뿐인 함수를 감쌉니다.
	 *
	 * @param function 단일 결과 함수
	 * @return 결과를 한 칸짜리 목록으로 반환하는 MemoFunction
	 */
	static MemoFunction single(Function<List<Object>, Object> function) {
		return args -> Collections.singletonList(function.apply(args));
	}
}
