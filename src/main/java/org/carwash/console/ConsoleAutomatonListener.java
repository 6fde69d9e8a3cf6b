package org.carwash.console;

import org.carwash.automata.models.AutomatonListener;
import org.carwash.automata.models.AutomatonResult;
import org.carwash.automata.models.StateChange;

import java.io.PrintStream;
import java.util.Objects;

/**
 * 把自动机的状态变化打印到控制台。
 */
public class ConsoleAutomatonListener implements AutomatonListener {

    private final PrintStream out;

    public ConsoleAutomatonListener(PrintStream out) {
        this.out = Objects.requireNonNull(out, "Output stream cannot be null.");
    }

    @Override
    public void onStateChanged(StateChange change) {
        out.println("Current automaton state: q" + change.getState()
                + ", current total value: " + change.getState());
    }

    @Override
    public void onRunCompleted(StateChange change, AutomatonResult result) {
        out.println("Final automaton state: q" + change.getState());
        out.println("Total value inserted: " + change.getState());
        out.println("State change path: " + change.getPath());
    }
}
