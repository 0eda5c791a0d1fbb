package org.csu.sdplot.common.function;

/**
 * 双参数函数 f(x, y)，用于三维绘图或热力图。
 */
@FunctionalInterface
public interface Function3D {
    double f(double x, double y);
}
