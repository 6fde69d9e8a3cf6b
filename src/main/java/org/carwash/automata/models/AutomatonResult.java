package org.carwash.automata.models;

import lombok.Getter;

import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 一次投币后自动机给出的结果。
 * 未到达终止状态时为 {@link Continuing}；到达接受状态时为 {@link Ticket}；到达拒绝状态时为 {@link Refund}。
 */
public sealed interface AutomatonResult
        permits AutomatonResult.Continuing, AutomatonResult.Ticket, AutomatonResult.Refund {

    /**
     * @return 面向用户的描述。
     */
    String getMessage();

    /**
     * @return 会话是否已结束。
     */
    boolean isTerminal();

    /**
     * 继续投币，携带当前状态。
     */
    @Getter
    final class Continuing implements AutomatonResult {

        private final int state;

        Continuing(int state) {
            this.state = state;
        }

        @Override
        public String getMessage() {
            return "Current total value: " + state;
        }

        @Override
        public boolean isTerminal() {
            return false;
        }

        @Override
        public String toString() {
            return "Continuing(q" + state + ")";
        }
    }

    /**
     * 洗车票，携带进程内单调递增的序号和生成时间。
     */
    @Getter
    final class Ticket implements AutomatonResult {

        private static final AtomicLong NEXT_SERIAL = new AtomicLong(1);

        private final long serial;
        private final Instant timestamp;

        private Ticket(long serial, Instant timestamp) {
            this.serial = serial;
            this.timestamp = timestamp;
        }

        static Ticket issue() {
            return new Ticket(NEXT_SERIAL.getAndIncrement(), Instant.now());
        }

        @Override
        public String getMessage() {
            return "Ticket generated, timestamp: " + timestamp;
        }

        @Override
        public boolean isTerminal() {
            return true;
        }

        @Override
        public String toString() {
            return "Ticket(#" + serial + ", " + timestamp + ")";
        }
    }

    /**
     * 退款。total 为到达的拒绝状态编号，insertedAmount 为本次会话实际投入的硬币总额。
     */
    @Getter
    final class Refund implements AutomatonResult {

        private final int total;
        private final int insertedAmount;

        Refund(int total, int insertedAmount) {
            this.total = total;
            this.insertedAmount = insertedAmount;
        }

        @Override
        public String getMessage() {
            return "Full amount refunded, total: " + total;
        }

        @Override
        public boolean isTerminal() {
            return true;
        }

        @Override
        public String toString() {
            return "Refund(q" + total + ", inserted=" + insertedAmount + ")";
        }
    }
}
