package org.carwash.automata.base;

/**
 * 状态的分类。
 */
public enum StateKind {

    OPEN,       // 未达到价格，继续投币
    ACCEPTING,  // 恰好达到价格
    REJECTING;  // 超额，退款

    /**
     * 根据接受阈值对状态分类。
     * @param state 状态编号（即累计金额）。
     * @param acceptingState 接受状态编号。
     */
    public static StateKind classify(int state, int acceptingState) {
        if (state < acceptingState) {
            return OPEN;
        }
        return state == acceptingState ? ACCEPTING : REJECTING;
    }

    public boolean isTerminal() {
        return this != OPEN;
    }
}
