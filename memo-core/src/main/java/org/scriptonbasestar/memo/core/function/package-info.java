/**
 * 메모이제이션 대상 함수 인터페이스
 *
 * <ul>
 *   <li>{@link org.scriptonbasestar.memo.core.function.MemoFunction} - 인자 목록 → 결과 목록</li>
 * </ul>
 *
 * @author archmagece
 * @since 2025-01
 */
package org.scriptonbasestar.memo.core.function;
