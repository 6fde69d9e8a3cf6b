package org.carwash.console;

import org.apache.commons.lang3.StringUtils;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.Objects;

/**
 * 将二维数组形式的迁移表打印为带边框的文本表格。
 * 所有单元格右对齐到最宽单元格的宽度，每行上下都有 +---+ 形式的分隔线。
 */
public final class TransitionTablePrinter {

    private static final String HORIZONTAL_BORDER_KNOT = "+";
    private static final String HORIZONTAL_BORDER_PATTERN = "-";
    private static final String VERTICAL_BORDER_PATTERN = "|";

    private TransitionTablePrinter() {
    }

    /**
     * @param matrix 迁移表，第一行为表头。
     * @return 渲染后的表格，空表返回空字符串。
     */
    public static String render(String[][] matrix) {
        Objects.requireNonNull(matrix, "Matrix cannot be null.");
        if (matrix.length == 0) {
            return "";
        }
        int numberOfColumns = Arrays.stream(matrix).mapToInt(row -> row.length).max().orElse(0);
        int maxColumnWidth = Arrays.stream(matrix)
                .flatMap(Arrays::stream)
                .mapToInt(String::length)
                .max()
                .orElse(0);
        String horizontalBorder = createHorizontalBorder(numberOfColumns, maxColumnWidth);

        StringBuilder sb = new StringBuilder(horizontalBorder).append(System.lineSeparator());
        for (String[] row : matrix) {
            sb.append(rowAsString(row, maxColumnWidth)).append(System.lineSeparator());
            sb.append(horizontalBorder).append(System.lineSeparator());
        }
        return sb.toString();
    }

    public static void print(String[][] matrix, PrintStream out) {
        out.print(render(matrix));
    }

    private static String rowAsString(String[] row, int width) {
        StringBuilder sb = new StringBuilder(VERTICAL_BORDER_PATTERN);
        for (String cell : row) {
            sb.append(StringUtils.leftPad(cell, width)).append(VERTICAL_BORDER_PATTERN);
        }
        return sb.toString();
    }

    private static String createHorizontalBorder(int numberOfColumns, int width) {
        return HORIZONTAL_BORDER_KNOT
                + StringUtils.repeat(StringUtils.repeat(HORIZONTAL_BORDER_PATTERN, width) + HORIZONTAL_BORDER_KNOT, numberOfColumns);
    }
}
