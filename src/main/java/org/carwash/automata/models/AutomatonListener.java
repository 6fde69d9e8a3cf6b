package org.carwash.automata.models;

/**
 * 自动机运行过程的观察者。自动机本身不做任何输出，由观察者决定如何展示。
 */
public interface AutomatonListener {

    /**
     * 每次迁移之后调用。
     * @param change 迁移后的快照。
     */
    default void onStateChanged(StateChange change) {
    }

    /**
     * 到达终止状态时、自动机重置之前调用。
     * @param change 最后一次迁移的快照，history 为完整的会话路径。
     * @param result 终止结果（Ticket 或 Refund）。
     */
    default void onRunCompleted(StateChange change, AutomatonResult result) {
    }
}
