package com.insightframe.plugin.pattern.analysis;

import java.util.Collection;
import java.util.List;
import java.util.Locale;

/**
 * 统计工具
 */
public final class Statistics {

    private Statistics() {
    }

    /**
     * 皮尔逊相关系数
     *
     * @return 长度不一致、为空或任一序列方差为 0 时返回 0.0
     */
    public static double pearson(List<Double> x, List<Double> y) {
        if (x == null || y == null || x.size() != y.size() || x.isEmpty()) {
            return 0.0;
        }
        double meanX = mean(x);
        double meanY = mean(y);

        double numerator = 0.0;
        double sumSqX = 0.0;
        double sumSqY = 0.0;
        for (int i = 0; i < x.size(); i++) {
            double dx = x.get(i) - meanX;
            double dy = y.get(i) - meanY;
            numerator += dx * dy;
            sumSqX += dx * dx;
            sumSqY += dy * dy;
        }
        double denominator = Math.sqrt(sumSqX) * Math.sqrt(sumSqY);
        if (denominator == 0.0) {
            return 0.0;
        }
        return numerator / denominator;
    }

    public static double mean(Collection<? extends Number> values) {
        if (values == null || values.isEmpty()) {
            return 0.0;
        }
        double sum = 0.0;
        for (Number value : values) {
            sum += value.doubleValue();
        }
        return sum / values.size();
    }

    static String oneDecimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
