package org.csu.sdplot.common.function;

/**
 * 单参数函数 f(x)，用于二维绘图。
 */
@FunctionalInterface
public interface Function2D {
    double f(double x);
}
