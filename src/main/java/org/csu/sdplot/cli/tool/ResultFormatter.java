package org.csu.sdplot.cli.tool;

import org.csu.sdplot.engine.SamplePoint;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.ArrayList;
import java.util.List;

/**
 * 一个可重用的工具类，用于把数值和采样结果格式化为控制台输出 (带边框的表格)。
 */
public class ResultFormatter {

    private static final double SCIENTIFIC_UPPER = 1e15;
    private static final double SCIENTIFIC_LOWER = 1e-6;

    private ResultFormatter() {
    }

    /**
     * 按有效数字位数格式化一个数值，去掉多余的尾随零。
     * NaN 和 Infinity 原样输出。
     */
    public static String formatNumber(double value, int precision) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == 0) {
            return "0";
        }
        BigDecimal rounded = BigDecimal.valueOf(value)
                .round(new MathContext(precision))
                .stripTrailingZeros();
        double magnitude = Math.abs(value);
        if (magnitude >= SCIENTIFIC_UPPER || magnitude < SCIENTIFIC_LOWER) {
            return rounded.toString();
        }
        return rounded.toPlainString();
    }

    /**
     * 将 x 方向的采样结果格式化为两列表格 (x, value)。
     */
    public static String formatSamples(List<SamplePoint> samples, int precision) {
        if (samples.isEmpty()) {
            return "No points sampled.";
        }
        List<List<String>> rows = new ArrayList<>();
        for (SamplePoint point : samples) {
            rows.add(List.of(formatNumber(point.x(), precision), formatNumber(point.value(), precision)));
        }
        return format(List.of("x", "value"), rows) + "\n" + samples.size() + " points sampled.";
    }

    /**
     * 将表头和行数据格式化为字符串表格。
     *
     * @param columnNames 表头
     * @param rows        每行的单元格，长度与表头一致
     * @return 格式化后的表格字符串 (不带最后的换行)
     */
    public static String format(List<String> columnNames, List<List<String>> rows) {
        StringBuilder sb = new StringBuilder();
        List<Integer> columnWidths = new ArrayList<>();

        // 1. 计算每列的最大宽度
        for (int i = 0; i < columnNames.size(); i++) {
            int maxWidth = columnNames.get(i).length();
            for (List<String> row : rows) {
                if (i < row.size()) {
                    maxWidth = Math.max(maxWidth, row.get(i).length());
                }
            }
            columnWidths.add(maxWidth);
        }

        // 2. 打印边框和表头
        sb.append(getSeparator(columnWidths)).append("\n");
        sb.append(getRow(columnNames, columnWidths)).append("\n");
        sb.append(getSeparator(columnWidths)).append("\n");

        // 3. 打印数据行
        for (List<String> row : rows) {
            sb.append(getRow(row, columnWidths)).append("\n");
        }

        // 4. 底部边框
        sb.append(getSeparator(columnWidths));
        return sb.toString();
    }

    private static String getRow(List<String> cells, List<Integer> widths) {
        StringBuilder sb = new StringBuilder("|");
        for (int i = 0; i < cells.size(); i++) {
            sb.append(String.format(" %-" + widths.get(i) + "s |", cells.get(i)));
        }
        return sb.toString();
    }

    private static String getSeparator(List<Integer> widths) {
        StringBuilder sb = new StringBuilder("+");
        for (Integer width : widths) {
            sb.append("-".repeat(width + 2)).append("+");
        }
        return sb.toString();
    }
}
