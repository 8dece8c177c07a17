package com.example.formstructure.util.common;

/**
 * 文本工具类
 *
 * 提供常用的字符串处理方法
 */
public class TextUtils {

    /**
     * 判断文本是否为空（null 或只有空白字符）
     */
    public static boolean isBlank(String text) {
        return text == null || text.trim().isEmpty();
    }

    /**
     * null 安全的 trim
     */
    public static String trimToEmpty(String text) {
        return text == null ? "" : text.trim();
    }

    /**
     * 数字格式化：整数值不输出小数部分（100.0 -> "100"，100.5 -> "100.5"）
     */
    public static String formatNumber(double value) {
        if (value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15) {
            return String.valueOf((long) value);
        }
        return String.valueOf(value);
    }
}
