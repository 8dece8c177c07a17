package com.example.formstructure.util.geometry;

import com.example.formstructure.util.common.TextUtils;

/**
 * 检测框（中心点坐标 + 宽高，图像像素单位）
 *
 * <h3>坐标系说明</h3>
 * <ul>
 *   <li>原点：图像左上角</li>
 *   <li>X轴向右递增，Y轴向下递增</li>
 *   <li>x/y 为框的中心点，不是左上角</li>
 * </ul>
 *
 * 不可变对象。
 */
public final class BoundingBox {

    private final double centerX;
    private final double centerY;
    private final double width;
    private final double height;

    public BoundingBox(double centerX, double centerY, double width, double height) {
        this.centerX = centerX;
        this.centerY = centerY;
        this.width = width;
        this.height = height;
    }

    public double getCenterX() {
        return centerX;
    }

    public double getCenterY() {
        return centerY;
    }

    public double getWidth() {
        return width;
    }

    public double getHeight() {
        return height;
    }

    public double left() {
        return centerX - width / 2;
    }

    public double right() {
        return centerX + width / 2;
    }

    public double top() {
        return centerY - height / 2;
    }

    public double bottom() {
        return centerY + height / 2;
    }

    public double area() {
        return width * height;
    }

    /**
     * 宽高均为正数时才能参与包含判定
     */
    public boolean hasPositiveExtent() {
        return width > 0 && height > 0;
    }

    /**
     * 点是否落在框内（含边界）
     */
    public boolean containsPoint(double x, double y) {
        return x >= left() && x <= right() && y >= top() && y <= bottom();
    }

    /**
     * 序列化为 "x y width height"（空格分隔）
     */
    public String toBoxString() {
        return TextUtils.formatNumber(centerX) + " " + TextUtils.formatNumber(centerY) + " "
                + TextUtils.formatNumber(width) + " " + TextUtils.formatNumber(height);
    }

    /**
     * 从 "x y width height" 字符串解析
     *
     * @param boxString 空格分隔的四个数字
     * @return 检测框，格式不正确时返回null
     */
    public static BoundingBox parse(String boxString) {
        if (boxString == null) {
            return null;
        }
        String[] parts = boxString.trim().split("\\s+");
        if (parts.length < 4) {
            return null;
        }
        try {
            return new BoundingBox(
                    Double.parseDouble(parts[0]),
                    Double.parseDouble(parts[1]),
                    Double.parseDouble(parts[2]),
                    Double.parseDouble(parts[3]));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BoundingBox)) {
            return false;
        }
        BoundingBox other = (BoundingBox) o;
        return Double.compare(centerX, other.centerX) == 0
                && Double.compare(centerY, other.centerY) == 0
                && Double.compare(width, other.width) == 0
                && Double.compare(height, other.height) == 0;
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(centerX);
        result = 31 * result + Double.hashCode(centerY);
        result = 31 * result + Double.hashCode(width);
        result = 31 * result + Double.hashCode(height);
        return result;
    }

    @Override
    public String toString() {
        return "BoundingBox{" + toBoxString() + "}";
    }
}
