package org.csu.sdplot.engine;

/**
 * 一次采样的结果。一维 (只扫描 x) 的采样中 y 为 NaN。
 */
public record SamplePoint(double x, double y, double value) {

    /**
     * @return 值是否为有限数 (绘图时不连接 NaN / Infinity 的点)
     */
    public boolean isDefined() {
        return Double.isFinite(value);
    }
}
