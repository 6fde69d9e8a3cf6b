package org.carwash.console;

import org.carwash.automata.models.AutomatonResult;
import org.carwash.automata.models.CarWashAutomaton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.io.PrintStream;
import java.util.Optional;
import java.util.Scanner;

/**
 * 控制台入口：打印迁移表，然后运行配置的投币会话次数。
 */
public class CarWashApp {

    private static final Logger logger = LoggerFactory.getLogger(CarWashApp.class);

    private final CarWashConfig config;
    private final CarWashAutomaton automaton;

    public CarWashApp(CarWashConfig config, CarWashAutomaton automaton) {
        this.config = config;
        this.automaton = automaton;
    }

    /**
     * @return 完成的会话数。
     */
    public int run(InputStream in, PrintStream out) {
        if (config.isPrintTable()) {
            out.println("Transition table:");
            TransitionTablePrinter.print(automaton.getTransitionTableMatrix(), out);
        }
        automaton.addListener(new ConsoleAutomatonListener(out));

        int completed = 0;
        try (Scanner scanner = new Scanner(in)) {
            CoinInsertionSession session = new CoinInsertionSession(automaton, scanner, out, config.getPrompt());
            while (config.getSessions() == 0 || completed < config.getSessions()) {
                Optional<AutomatonResult> result = session.run();
                if (result.isEmpty()) {
                    break;
                }
                completed++;
            }
        }
        logger.info("共完成 {} 次会话", completed);
        return completed;
    }

    public static void main(String[] args) {
        new CarWashApp(CarWashConfig.load(), new CarWashAutomaton()).run(System.in, System.out);
    }
}
