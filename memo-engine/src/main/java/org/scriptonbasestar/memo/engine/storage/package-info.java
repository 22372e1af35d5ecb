/**
 * 캐시 저장소
 *
 * <ul>
 *   <li>{@link org.scriptonbasestar.memo.engine.storage.SingleSlotStore} - 항목 하나, 키 무시</li>
 *   <li>{@link org.scriptonbasestar.memo.engine.storage.MapStore} - 키 → 항목, 공유 가능</li>
 * </ul>
 *
 * @author archmagece
 * @since 2025-01
 */
package org.scriptonbasestar.memo.engine.storage;
