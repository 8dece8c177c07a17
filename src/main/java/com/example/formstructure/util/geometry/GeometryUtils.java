package com.example.formstructure.util.geometry;

/**
 * 检测框几何计算工具类
 *
 * 所有方法均为纯函数，无副作用。
 *
 * <h3>重叠比例的方向</h3>
 * overlapRatio(a, b) 以第一个参数的面积为分母，不对称：
 * 小框完全落在大框内时 overlapRatio(小, 大) = 1，而 overlapRatio(大, 小) &lt; 1。
 */
public class GeometryUtils {

    private GeometryUtils() {
    }

    /**
     * 水平方向重叠宽度（不相交时返回0）
     */
    public static double overlapWidth(BoundingBox a, BoundingBox b) {
        double width = Math.min(a.right(), b.right()) - Math.max(a.left(), b.left());
        return Math.max(0, width);
    }

    /**
     * 垂直方向重叠高度（不相交时返回0）
     */
    public static double overlapHeight(BoundingBox a, BoundingBox b) {
        double height = Math.min(a.bottom(), b.bottom()) - Math.max(a.top(), b.top());
        return Math.max(0, height);
    }

    /**
     * 相交矩形面积
     *
     * @return 两框不相交（包括仅边界接触）时返回0
     */
    public static double overlapArea(BoundingBox a, BoundingBox b) {
        double w = overlapWidth(a, b);
        double h = overlapHeight(a, b);
        if (w <= 0 || h <= 0) {
            return 0;
        }
        return w * h;
    }

    /**
     * 重叠面积 / a 的面积
     *
     * @return a 面积为0时返回0
     */
    public static double overlapRatio(BoundingBox a, BoundingBox b) {
        double area = a.area();
        if (area <= 0) {
            return 0;
        }
        return overlapArea(a, b) / area;
    }

    /**
     * 垂直方向是否接近
     *
     * 满足以下任一条件即为接近：
     * 1. 两框相近边之间的垂直间隙小于阈值（垂直方向有重叠时间隙为负，视为接近）
     * 2. 一个框的垂直跨度完全落在另一个框内
     *
     * @param proximityPx 像素阈值
     */
    public static boolean verticallyClose(BoundingBox a, BoundingBox b, double proximityPx) {
        double gap = Math.max(a.top(), b.top()) - Math.min(a.bottom(), b.bottom());
        return gap < proximityPx
                || verticalSpanWithin(a, b, 0)
                || verticalSpanWithin(b, a, 0);
    }

    /**
     * inner 的垂直跨度是否落在 outer 的跨度内（outer 上下各扩展 marginPx）
     */
    public static boolean verticalSpanWithin(BoundingBox inner, BoundingBox outer, double marginPx) {
        return inner.top() >= outer.top() - marginPx && inner.bottom() <= outer.bottom() + marginPx;
    }

    /**
     * inner 的中心点是否落在 outer 内
     */
    public static boolean centerInside(BoundingBox inner, BoundingBox outer) {
        return outer.containsPoint(inner.getCenterX(), inner.getCenterY());
    }
}
