package org.carwash.automata.models;

import lombok.Getter;
import org.carwash.automata.base.Coin;
import org.carwash.automata.base.StateKind;
import org.carwash.automata.base.TransitionTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * 投币洗车机的确定性有限自动机。
 * <p>
 * 保存当前状态及本次会话的状态路径（初始为 [q0]）。每次投币查询迁移表，
 * 到达终止状态后给出 Ticket 或 Refund，并立即重置回 q0，同一实例可继续下一次会话。
 * <p>
 * 非线程安全：多个并发会话应各自持有一个实例。
 */
public final class CarWashAutomaton {

    private static final Logger logger = LoggerFactory.getLogger(CarWashAutomaton.class);

    public static final int INITIAL_STATE = 0;

    @Getter
    private final TransitionTable transitionTable;
    private final List<Integer> states = new ArrayList<>();
    private final List<AutomatonListener> listeners = new CopyOnWriteArrayList<>();
    private int insertedAmount;

    public CarWashAutomaton() {
        this(TransitionTable.standard());
    }

    /**
     * @param transitionTable 共享的迁移表，构造后不再修改。
     */
    public CarWashAutomaton(TransitionTable transitionTable) {
        this.transitionTable = Objects.requireNonNull(transitionTable, "Transition table cannot be null.");
        reset();
        logger.info("创建 CarWashAutomaton，接受状态 q{}", transitionTable.getAcceptingState());
    }

    public void addListener(AutomatonListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null."));
    }

    public void removeListener(AutomatonListener listener) {
        listeners.remove(listener);
    }

    /**
     * 投入一枚硬币。
     * @param coin 硬币，已由 {@link Coin#of(int)} 校验。
     * @return 未结束时为 Continuing，否则为 Ticket 或 Refund。
     */
    public AutomatonResult insert(Coin coin) {
        Objects.requireNonNull(coin, "Coin cannot be null.");

        int nextState = transitionTable.lookup(getCurrentState(), coin);
        states.add(nextState);
        insertedAmount += coin.getFaceValue();

        StateKind kind = transitionTable.classify(nextState);
        StateChange change = new StateChange(nextState, kind, coin, states);
        logger.debug("投入 {}，当前状态 q{}，路径 {}", coin, nextState, change.getPath());

        if (!kind.isTerminal()) {
            listeners.forEach(listener -> listener.onStateChanged(change));
            return new AutomatonResult.Continuing(nextState);
        }

        AutomatonResult result = kind == StateKind.ACCEPTING
                ? AutomatonResult.Ticket.issue()
                : new AutomatonResult.Refund(nextState, insertedAmount);
        logger.info("会话结束：{}，路径 {}", result, change.getPath());
        // 观察者抛出异常时也要回到 q0
        try {
            listeners.forEach(listener -> listener.onStateChanged(change));
            listeners.forEach(listener -> listener.onRunCompleted(change, result));
        } finally {
            reset();
        }
        return result;
    }

    /**
     * 放弃当前会话，回到初始状态。
     */
    public void reset() {
        states.clear();
        states.add(INITIAL_STATE);
        insertedAmount = 0;
    }

    public int getCurrentState() {
        return states.get(states.size() - 1);
    }

    /**
     * @return 本次会话的状态路径的只读视图，最后一个元素总是当前状态。
     */
    public List<Integer> getHistory() {
        return Collections.unmodifiableList(states);
    }

    /**
     * @return 本次会话已投入的硬币总额。
     */
    public int getInsertedAmount() {
        return insertedAmount;
    }

    /**
     * @return 形如 q0→q5→q10 的状态路径。
     */
    public String getStatePath() {
        return StateChange.toPath(states);
    }

    /**
     * @return 迁移表的二维数组表示，供打印使用。
     */
    public String[][] getTransitionTableMatrix() {
        return transitionTable.asMatrix();
    }

    @Override
    public String toString() {
        return "CarWashAutomaton(state=q" + getCurrentState() + ", path=" + getStatePath() + ")";
    }
}
