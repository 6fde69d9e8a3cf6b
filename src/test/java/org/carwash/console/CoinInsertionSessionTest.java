package org.carwash.console;

import org.carwash.automata.models.AutomatonResult;
import org.carwash.automata.models.CarWashAutomaton;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.Scanner;

import static org.junit.jupiter.api.Assertions.*;

class CoinInsertionSessionTest {

    private CarWashAutomaton automaton;
    private ByteArrayOutputStream buffer;
    private PrintStream out;

    @BeforeEach
    void setUp() {
        automaton = new CarWashAutomaton();
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
        automaton.addListener(new ConsoleAutomatonListener(out));
    }

    private Optional<AutomatonResult> run(String input) {
        return new CoinInsertionSession(automaton, new Scanner(input), out, CarWashConfig.DEFAULT_PROMPT).run();
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("凑够 20 时打印票据信息并结束会话")
    void testRun_ExactPayment_ShouldPrintTicket() {
        Optional<AutomatonResult> result = run("5 5 5 5 5");

        assertTrue(result.isPresent());
        assertInstanceOf(AutomatonResult.Ticket.class, result.get());
        String output = output();
        assertAll("Console output",
                () -> assertTrue(output.contains("Current automaton state: q15, current total value: 15")),
                () -> assertTrue(output.contains("Final automaton state: q20")),
                () -> assertTrue(output.contains("Total value inserted: 20")),
                () -> assertTrue(output.contains("State change path: q0→q5→q10→q15→q20")),
                () -> assertTrue(output.contains("Ticket generated, timestamp: "))
        );
        // 第五枚硬币未被读取
        assertEquals(0, automaton.getCurrentState());
    }

    @Test
    @DisplayName("不被接受的面值打印错误并继续，非整数输入被静默丢弃")
    void testRun_InvalidInput_ShouldRePrompt() {
        Optional<AutomatonResult> result = run("3 abc 5 5 0 5 x 5");

        assertInstanceOf(AutomatonResult.Ticket.class, result.orElseThrow());
        String output = output();
        assertAll("Recovered input",
                () -> assertTrue(output.contains("Automaton doesn't accept face value of 3")),
                () -> assertTrue(output.contains("Automaton doesn't accept face value of 0")),
                () -> assertFalse(output.contains("abc")),
                () -> assertEquals(8, output.split(CarWashConfig.DEFAULT_PROMPT, -1).length - 1)
        );
    }

    @Test
    @DisplayName("超额时打印退款信息")
    void testRun_Overpay_ShouldPrintRefund() {
        Optional<AutomatonResult> result = run("5 5 5 2 5");

        AutomatonResult.Refund refund = assertInstanceOf(AutomatonResult.Refund.class, result.orElseThrow());
        assertEquals(21, refund.getTotal());
        assertTrue(output().contains("Full amount refunded, total: 21"));
    }

    @Test
    @DisplayName("输入在会话结束前耗尽时返回空，自动机保留当前状态")
    void testRun_InputExhausted_ShouldReturnEmpty() {
        Optional<AutomatonResult> result = run("5 2");

        assertTrue(result.isEmpty());
        assertEquals(7, automaton.getCurrentState());
    }
}
