package org.csu.sdplot.engine;

import org.csu.sdplot.common.function.Function2D;
import org.csu.sdplot.common.function.Function3D;

import java.util.ArrayList;
import java.util.List;

/**
 * 在一个区间上等距地重复求值，为绘图提供数据点。
 * 每个方向取 steps + 1 个点，包含两个端点。
 */
public class FunctionSampler {

    /** 单次采样允许的最大点数 (对网格是总点数)。 */
    public static final int MAX_POINTS = 1_000_000;

    private FunctionSampler() {
    }

    public static List<SamplePoint> sampleX(Function2D function, double from, double to, int steps) {
        checkRange(from, to, steps);
        List<SamplePoint> points = new ArrayList<>(steps + 1);
        for (int i = 0; i <= steps; i++) {
            double x = position(from, to, steps, i);
            points.add(new SamplePoint(x, Double.NaN, function.f(x)));
        }
        return points;
    }

    /**
     * 固定 x，在 y 上扫描。同一棵表达式树被反复求值，y 节点每次读到新的值。
     */
    public static List<SamplePoint> sampleY(ExpressionProcessor processor, double fixedX, double from, double to, int steps) {
        checkRange(from, to, steps);
        List<SamplePoint> points = new ArrayList<>(steps + 1);
        for (int i = 0; i <= steps; i++) {
            double y = position(from, to, steps, i);
            points.add(new SamplePoint(fixedX, y, processor.f(fixedX, y)));
        }
        return points;
    }

    /**
     * @return 按行存储的网格，第 i 行对应第 i 个 y，每行从 xFrom 扫描到 xTo
     */
    public static List<List<SamplePoint>> sampleGrid(Function3D function,
                                                     double xFrom, double xTo, int xSteps,
                                                     double yFrom, double yTo, int ySteps) {
        checkRange(xFrom, xTo, xSteps);
        checkRange(yFrom, yTo, ySteps);
        if ((long) (xSteps + 1) * (ySteps + 1) > MAX_POINTS) {
            throw new IllegalArgumentException("Grid of " + (xSteps + 1) + " x " + (ySteps + 1)
                    + " points exceeds the limit of " + MAX_POINTS + " points.");
        }
        List<List<SamplePoint>> grid = new ArrayList<>(ySteps + 1);
        for (int row = 0; row <= ySteps; row++) {
            double y = position(yFrom, yTo, ySteps, row);
            List<SamplePoint> points = new ArrayList<>(xSteps + 1);
            for (int col = 0; col <= xSteps; col++) {
                double x = position(xFrom, xTo, xSteps, col);
                points.add(new SamplePoint(x, y, function.f(x, y)));
            }
            grid.add(points);
        }
        return grid;
    }

    // 两个端点直接取区间端点，避免累计误差
    private static double position(double from, double to, int steps, int index) {
        if (index == 0) {
            return from;
        }
        if (index == steps) {
            return to;
        }
        double width = to - from;
        if (Double.isFinite(width)) {
            return from + width * index / steps;
        }
        // 区间宽度超出 double 范围时先缩放再相减
        return from + (to / steps - from / steps) * index;
    }

    private static void checkRange(double from, double to, int steps) {
        if (steps < 1) {
            throw new IllegalArgumentException("Number of steps must be at least 1, got " + steps + ".");
        }
        if (steps >= MAX_POINTS) {
            throw new IllegalArgumentException("Number of steps must be less than " + MAX_POINTS + ", got " + steps + ".");
        }
        if (!Double.isFinite(from) || !Double.isFinite(to)) {
            throw new IllegalArgumentException("Sampling range must be finite: [" + from + ", " + to + "].");
        }
    }
}
