package org.carwash.automata.base;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 洗车机自动机的迁移函数 δ: Q × Σ → Q。
 * <p>
 * 状态编号即累计金额。[0, acceptingState) 为普通状态，
 * acceptingState 为唯一的接受状态，acceptingState + 1 为唯一的拒绝状态。
 * 两个终止状态在所有硬币下都吸收自身。
 * <p>
 * 迁移以二维数组存储，按 (状态, 硬币序号) 直接索引。此类是不可变的。
 */
public final class TransitionTable {

    private static final Logger logger = LoggerFactory.getLogger(TransitionTable.class);

    /**
     * 迁移函数的表头符号
     */
    public static final String DELTA_CHARACTER = "δ";

    /**
     * 标准洗车价格
     */
    public static final int STANDARD_PRICE = 20;

    private static final TransitionTable STANDARD = new TransitionTable(STANDARD_PRICE);

    @Getter
    private final int acceptingState;
    @Getter
    private final int rejectingState;
    private final int[][] targets;
    @Getter
    private final List<Transition> transitions;

    private TransitionTable(int acceptingState) {
        this.acceptingState = acceptingState;
        this.rejectingState = acceptingState + 1;

        Coin[] alphabet = Coin.values();
        this.targets = new int[rejectingState + 1][alphabet.length];
        List<Transition> declared = new ArrayList<>(targets.length * alphabet.length);
        for (int state = 0; state <= rejectingState; state++) {
            for (Coin coin : alphabet) {
                int target = nextState(state, coin);
                targets[state][coin.ordinal()] = target;
                declared.add(new Transition(state, coin, target));
            }
        }
        this.transitions = Collections.unmodifiableList(declared);
        logger.info("创建迁移表：{} 个状态，{} 条迁移，接受状态 q{}，拒绝状态 q{}",
                targets.length, transitions.size(), acceptingState, rejectingState);
    }

    /**
     * 生成规则：普通状态加上面值，超过价格的一律落入拒绝状态；终止状态吸收自身。
     */
    private int nextState(int state, Coin coin) {
        if (state >= acceptingState) {
            return state;
        }
        return Math.min(state + coin.getFaceValue(), rejectingState);
    }

    /**
     * 获取全局共享的标准迁移表（价格 20）。
     * @return 标准迁移表。
     */
    public static TransitionTable standard() {
        return STANDARD;
    }

    /**
     * 查询迁移 δ(state, coin)。
     * @param state 当前状态。
     * @param coin  投入的硬币。
     * @return 下一个状态。
     * @throws UndefinedTransitionException 如果状态不在 [0, rejectingState] 内。
     */
    public int lookup(int state, Coin coin) {
        if (coin == null || state < 0 || state >= targets.length) {
            logger.warn("未定义的迁移: q{} 输入 {}", state, coin);
            throw new UndefinedTransitionException(state, coin);
        }
        int target = targets[state][coin.ordinal()];
        logger.debug("δ(q{}, {}) = q{}", state, coin, target);
        return target;
    }

    public int getStateCount() {
        return targets.length;
    }

    public StateKind classify(int state) {
        return StateKind.classify(state, acceptingState);
    }

    /**
     * 将迁移表转换为二维字符串数组，供打印使用。
     * 第一行为 δ 及各硬币面值，其余每行为一个源状态及其在各硬币下的目标状态。
     * @return 二维数组形式的迁移表。
     */
    public String[][] asMatrix() {
        int alphabetSize = Coin.values().length;
        String[][] matrix = new String[targets.length + 1][];

        String[] header = new String[alphabetSize + 1];
        header[0] = DELTA_CHARACTER;
        for (Coin coin : Coin.values()) {
            header[coin.ordinal() + 1] = coin.toString();
        }
        matrix[0] = header;

        // 按字母表大小分块，每块对应一个源状态
        for (int from = 0, row = 1; from < transitions.size(); from += alphabetSize, row++) {
            List<Transition> chunk = transitions.subList(from, from + alphabetSize);
            String[] cells = new String[alphabetSize + 1];
            cells[0] = "q" + chunk.get(0).getSource();
            for (int i = 0; i < chunk.size(); i++) {
                cells[i + 1] = "q" + chunk.get(i).getTarget();
            }
            matrix[row] = cells;
        }
        return matrix;
    }

    @Override
    public String toString() {
        return "TransitionTable(accepting=q" + acceptingState + ", rejecting=q" + rejectingState
                + ", rows=" + Arrays.deepToString(targets) + ")";
    }
}
