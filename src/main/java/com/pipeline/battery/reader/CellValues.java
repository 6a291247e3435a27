package com.pipeline.battery.reader;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * 单元格取值工具：数值、工步号与时间的解析，以及定点舍入。
 * 空白单元格统一视为缺失值。
 */
public final class CellValues {

    private static final List<DateTimeFormatter> DATE_TIME_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss.SSS"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy/M/d H:mm:ss"),
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm"),
            DateTimeFormatter.ofPattern("yyyy/MM/dd HH:mm"));

    private CellValues() {}

    public static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    /**
     * 解析数值
     *
     * @return 空白时返回null
     * @throws NumberFormatException 非数值内容
     */
    public static Double parseDouble(String value) {
        if (isBlank(value)) return null;
        double parsed = Double.parseDouble(value.trim());
        if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
            throw new NumberFormatException("Not a finite number: " + value);
        }
        return parsed;
    }

    /** 解析数值，空白或非数值时返回null */
    public static Double tryParseDouble(String value) {
        try {
            return parseDouble(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * 解析工步号。允许 "2.0" 这类整数值的浮点写法。
     *
     * @return 空白时返回null
     * @throws NumberFormatException 非整数内容
     */
    public static Integer parseStepNumber(String value) {
        if (isBlank(value)) return null;
        String trimmed = value.trim();
        try {
            return Integer.parseInt(trimmed);
        } catch (NumberFormatException e) {
            BigDecimal decimal = new BigDecimal(trimmed);
            // 小数部分非零时抛出ArithmeticException
            try {
                return decimal.intValueExact();
            } catch (ArithmeticException notIntegral) {
                throw new NumberFormatException("Not an integral step number: " + value);
            }
        }
    }

    /**
     * 解析时间。支持常见日期时间格式与Unix秒级时间戳。
     *
     * @return 空白或无法解析时返回null
     */
    public static LocalDateTime parseDateTime(String value) {
        if (isBlank(value)) return null;
        String trimmed = value.trim();
        for (DateTimeFormatter format : DATE_TIME_FORMATS) {
            LocalDateTime parsed = tryParse(trimmed, format);
            if (parsed != null) return parsed;
        }
        Double epochSeconds = tryParseDouble(trimmed);
        if (epochSeconds != null && epochSeconds > 0) {
            long millis = Math.round(epochSeconds * 1000);
            return LocalDateTime.ofInstant(Instant.ofEpochMilli(millis), ZoneId.systemDefault());
        }
        return null;
    }

    private static LocalDateTime tryParse(String text, DateTimeFormatter format) {
        try {
            return LocalDateTime.parse(text, format);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    public static double round(double value, int scale) {
        return BigDecimal.valueOf(value).setScale(scale, RoundingMode.HALF_UP).doubleValue();
    }

    public static Double round(Double value, int scale) {
        return value == null ? null : round(value.doubleValue(), scale);
    }
}
