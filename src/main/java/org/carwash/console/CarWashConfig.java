package org.carwash.console;

import lombok.Getter;
import org.apache.commons.lang3.BooleanUtils;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

/**
 * 控制台程序的配置。
 * 先读取 classpath 上的 carwash.properties（可选），再用同名的 JVM 系统属性覆盖。
 */
@Getter
public final class CarWashConfig {

    private static final Logger logger = LoggerFactory.getLogger(CarWashConfig.class);

    public static final String RESOURCE = "/carwash.properties";

    public static final String PRINT_TABLE_KEY = "carwash.print-table";
    public static final String SESSIONS_KEY = "carwash.sessions";
    public static final String PROMPT_KEY = "carwash.prompt";

    public static final String DEFAULT_PROMPT = "Insert coin: ";

    private final boolean printTable;
    /**
     * 会话次数，0 表示直到输入耗尽
     */
    private final int sessions;
    private final String prompt;

    private CarWashConfig(boolean printTable, int sessions, String prompt) {
        Validate.isTrue(sessions >= 0, "%s must not be negative: %d", SESSIONS_KEY, sessions);
        this.printTable = printTable;
        this.sessions = sessions;
        this.prompt = prompt;
    }

    public static CarWashConfig defaults() {
        return new CarWashConfig(true, 1, DEFAULT_PROMPT);
    }

    /**
     * 从 classpath 资源和系统属性加载配置。
     */
    public static CarWashConfig load() {
        Properties properties = new Properties();
        try (InputStream input = CarWashConfig.class.getResourceAsStream(RESOURCE)) {
            if (input == null) {
                logger.debug("未找到 {}，使用默认配置", RESOURCE);
            } else {
                properties.load(input);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + RESOURCE, e);
        }
        for (String key : new String[]{PRINT_TABLE_KEY, SESSIONS_KEY, PROMPT_KEY}) {
            String override = System.getProperty(key);
            if (override != null) {
                properties.setProperty(key, override);
            }
        }
        return fromProperties(properties);
    }

    /**
     * @param properties 配置项，缺省的键使用默认值。
     * @throws IllegalArgumentException 如果某个值无法解析。
     */
    public static CarWashConfig fromProperties(Properties properties) {
        String printTableValue = properties.getProperty(PRINT_TABLE_KEY, "true").trim();
        Boolean printTable = BooleanUtils.toBooleanObject(printTableValue);
        Validate.isTrue(printTable != null, "%s is not a boolean: %s", PRINT_TABLE_KEY, printTableValue);

        String sessionsValue = properties.getProperty(SESSIONS_KEY, "1").trim();
        int sessions;
        try {
            sessions = Integer.parseInt(sessionsValue);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(SESSIONS_KEY + " is not an integer: " + sessionsValue, e);
        }

        String prompt = properties.getProperty(PROMPT_KEY, DEFAULT_PROMPT);
        CarWashConfig config = new CarWashConfig(printTable, sessions, prompt);
        logger.info("加载配置: {}", config);
        return config;
    }

    @Override
    public String toString() {
        return "CarWashConfig(printTable=" + printTable + ", sessions=" + sessions + ", prompt='" + prompt + "')";
    }
}
