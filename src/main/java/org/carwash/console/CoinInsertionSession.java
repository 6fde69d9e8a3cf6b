package org.carwash.console;

import org.carwash.automata.base.Coin;
import org.carwash.automata.base.FaceValueNotAcceptedException;
import org.carwash.automata.models.AutomatonResult;
import org.carwash.automata.models.CarWashAutomaton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;
import java.util.Optional;
import java.util.Scanner;

/**
 * 交互式投币会话：逐个读取整数并投入自动机，直到得到终止结果。
 * <p>
 * 非整数输入被丢弃；不被接受的面值打印错误信息后重新提示。
 */
public class CoinInsertionSession {

    private static final Logger logger = LoggerFactory.getLogger(CoinInsertionSession.class);

    private final CarWashAutomaton automaton;
    private final Scanner scanner;
    private final PrintStream out;
    private final String prompt;

    public CoinInsertionSession(CarWashAutomaton automaton, Scanner scanner, PrintStream out, String prompt) {
        this.automaton = Objects.requireNonNull(automaton, "Automaton cannot be null.");
        this.scanner = Objects.requireNonNull(scanner, "Scanner cannot be null.");
        this.out = Objects.requireNonNull(out, "Output stream cannot be null.");
        this.prompt = Objects.requireNonNull(prompt, "Prompt cannot be null.");
    }

    /**
     * 运行一次会话。
     * @return 终止结果；输入在会话结束前耗尽时返回空。
     */
    public Optional<AutomatonResult> run() {
        while (true) {
            out.print(prompt);
            if (!scanner.hasNext()) {
                logger.info("输入已耗尽，会话在 {} 处中止", automaton.getStatePath());
                return Optional.empty();
            }
            if (!scanner.hasNextInt()) {
                logger.debug("丢弃非整数输入: {}", scanner.next());
                continue;
            }
            try {
                AutomatonResult result = automaton.insert(Coin.of(scanner.nextInt()));
                if (result.isTerminal()) {
                    out.println(result.getMessage());
                    return Optional.of(result);
                }
            } catch (FaceValueNotAcceptedException e) {
                out.println(e.getMessage());
            }
        }
    }
}
