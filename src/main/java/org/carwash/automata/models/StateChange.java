package org.carwash.automata.models;

import lombok.Getter;
import org.carwash.automata.base.Coin;
import org.carwash.automata.base.StateKind;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * 一次迁移之后的自动机快照：新状态、其分类、触发迁移的硬币以及本次会话至今的状态路径。
 * 此类是不可变的。
 */
@Getter
public final class StateChange {

    private final int state;
    private final StateKind kind;
    private final Coin coin;
    private final List<Integer> history;

    public StateChange(int state, StateKind kind, Coin coin, List<Integer> history) {
        this.state = state;
        this.kind = Objects.requireNonNull(kind, "State kind cannot be null.");
        this.coin = Objects.requireNonNull(coin, "Coin cannot be null.");
        this.history = List.copyOf(Objects.requireNonNull(history, "History cannot be null."));
    }

    /**
     * @return 形如 q0→q5→q10 的状态路径。
     */
    public String getPath() {
        return toPath(history);
    }

    static String toPath(List<Integer> states) {
        return states.stream()
                .map(s -> "q" + s)
                .collect(Collectors.joining("→"));
    }

    @Override
    public String toString() {
        return "StateChange(q" + state + ", " + kind + ", coin=" + coin + ", path=" + getPath() + ")";
    }
}
