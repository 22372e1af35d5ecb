package org.scriptonbasestar.memo.engine.key;

import java.util.List;
import java.util.Objects;

/**
 * 공유 MapStore 용 키.
 * (소유 캐시 식별자, 정규화된 인자) 쌍으로 항목을 구분하므로
 * 식별자가 다른 두 캐시는 인자가 같아도 충돌하지 않습니다.
 *
 * @author archmagece
 * @since 2025-01
 */
public final class SharedKey {

	private final String owner;
	private final List<Object> args;

	public SharedKey(String owner, List<Object> args) {
		this.owner = Objects.requireNonNull(owner, "owner");
		this.args = Objects.requireNonNull(args, "args");
	}

	public String owner() {
		return owner;
	}

	public List<Object> args() {
		return args;
	}

	/**
	 * @param identifier 캐시 식별자
	 * @return 이 키가 해당 캐시 소유이면 true
	 */
	public boolean isOwnedBy(String identifier) {
		return owner.equals(identifier);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof SharedKey)) {
			return false;
		}
		SharedKey that = (SharedKey) o;
		return owner.equals(that.owner) && args.equals(that.args);
	}

	@Override
	public int hashCode() {
		return 31 * owner.hashCode() + args.hashCode();
	}

	@Override
	public String toString() {
		return owner + args;
	}
}
