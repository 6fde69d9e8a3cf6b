package org.carwash.automata.base;

import lombok.Getter;

import java.util.Objects;

/**
 * 迁移函数中的一条迁移 δ(source, coin) = target。
 * 此类是不可变的。
 */
@Getter
public final class Transition {

    private final int source;
    private final Coin coin;
    private final int target;

    private final int hashCode;

    /**
     * @param source 源状态 (q)
     * @param coin   触发迁移的硬币 (a)
     * @param target 目标状态 (q')
     */
    public Transition(int source, Coin coin, int target) {
        this.source = source;
        this.coin = Objects.requireNonNull(coin, "Coin cannot be null.");
        this.target = target;
        this.hashCode = Objects.hash(source, coin, target);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Transition that = (Transition) o;
        return source == that.source &&
                target == that.target &&
                coin == that.coin;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return String.format("q%d --[%s]--> q%d", source, coin, target);
    }
}
