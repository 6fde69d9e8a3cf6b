package org.carwash.console;

import org.carwash.automata.models.CarWashAutomaton;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class CarWashAppTest {

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();

    private int run(String input, String printTable, String sessions) {
        Properties properties = new Properties();
        properties.setProperty(CarWashConfig.PRINT_TABLE_KEY, printTable);
        properties.setProperty(CarWashConfig.SESSIONS_KEY, sessions);
        CarWashApp app = new CarWashApp(CarWashConfig.fromProperties(properties), new CarWashAutomaton());
        return app.run(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)),
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("打印迁移表后运行一次会话")
    void testRun_SingleSession() {
        int completed = run("5 5 5 5 5 5", "true", "1");

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertAll("Single session",
                () -> assertEquals(1, completed),
                () -> assertTrue(output.startsWith("Transition table:")),
                () -> assertTrue(output.contains("|  δ|  1|  2|  5|")),
                () -> assertTrue(output.contains("Ticket generated, timestamp: "))
        );
    }

    @Test
    @DisplayName("同一自动机连续运行多次会话")
    void testRun_MultipleSessions() {
        int completed = run("5 5 5 5 5 5 5 2 5 1", "false", "2");

        String output = buffer.toString(StandardCharsets.UTF_8);
        assertAll("Two sessions",
                () -> assertEquals(2, completed),
                () -> assertFalse(output.contains("Transition table:")),
                () -> assertTrue(output.contains("Ticket generated, timestamp: ")),
                () -> assertTrue(output.contains("Full amount refunded, total: 21")),
                () -> assertTrue(output.contains("State change path: q0→q5→q10→q15→q17→q21"))
        );
    }

    @Test
    @DisplayName("会话数为 0 时运行到输入耗尽")
    void testRun_UntilInputExhausted() {
        int completed = run("5 5 5 5 2 2 2 2 2 2 2 2 2 2 1", "false", "0");

        assertEquals(2, completed);
    }
}
