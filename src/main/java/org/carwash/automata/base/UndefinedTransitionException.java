package org.carwash.automata.base;

import lombok.Getter;

/**
 * 迁移表中不存在 (state, coin) 对应的迁移时抛出。
 * 自动机正常运行时不会出现，因为状态只可能来自迁移表本身。
 */
@Getter
public class UndefinedTransitionException extends IllegalStateException {

    private final int state;
    private final Coin coin;

    public UndefinedTransitionException(int state, Coin coin) {
        super("No transition defined for state q" + state + " and coin " + coin);
        this.state = state;
        this.coin = coin;
    }
}
