/**
 * 캐시 저장소 전략
 *
 * <ul>
 *   <li>{@link org.scriptonbasestar.memo.core.strategy.StorageKind#SINGLE_SLOT} - 단일 슬롯</li>
 *   <li>{@link org.scriptonbasestar.memo.core.strategy.StorageKind#MAP} - 키 기반 맵</li>
 * </ul>
 *
 * @author archmagece
 * @since 2025-01
 */
package org.scriptonbasestar.memo.core.strategy;
