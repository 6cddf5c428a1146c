package com.ddm.iris.format;

import com.ddm.iris.utils.Temporals;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.time.format.FormatStyle;
import java.time.temporal.TemporalAccessor;
import java.util.Objects;

/**
 * 内置的参数格式化扩展。
 *
 * @author liyifei
 */
public final class ArgumentFormatters {

    private ArgumentFormatters() {
    }

    /**
     * 按布局格式化日期时间，如 {@code "dd/MM/yyyy HH:mm"}，月份/星期名称随语言变化。
     *
     * @throws IllegalArgumentException 如果布局非法
     */
    public static ArgumentFormatter dateTime(String layout) {
        return dateTime(layout, ZoneId.systemDefault());
    }

    public static ArgumentFormatter dateTime(String layout, ZoneId zone) {
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern(Objects.requireNonNull(layout, "layout"));
        return (value, locale) -> formatter.withLocale(locale).format(temporal(value, zone));
    }

    /**
     * 按本地化日期样式格式化（仅日期部分）。
     */
    public static ArgumentFormatter localizedDate(FormatStyle style) {
        DateTimeFormatter formatter = DateTimeFormatter.ofLocalizedDate(Objects.requireNonNull(style, "style"));
        ZoneId zone = ZoneId.systemDefault();
        return (value, locale) -> formatter.withLocale(locale).format(temporal(value, zone));
    }

    /**
     * 按 {@link DecimalFormat} 模式格式化数值，分组与小数符号随语言变化。
     *
     * @throws IllegalArgumentException 如果模式非法
     */
    public static ArgumentFormatter number(String decimalPattern) {
        Objects.requireNonNull(decimalPattern, "decimalPattern");
        new DecimalFormat(decimalPattern);
        return (value, locale) -> {
            if (!(value instanceof Number number)) {
                throw new IllegalArgumentException("Not a number: " + value);
            }
            // DecimalFormat 非线程安全，每次新建
            return new DecimalFormat(decimalPattern, DecimalFormatSymbols.getInstance(locale)).format(number);
        };
    }

    private static TemporalAccessor temporal(Object value, ZoneId zone) {
        TemporalAccessor temporal = Temporals.toTemporal(value, zone);
        if (temporal == null) {
            throw new IllegalArgumentException("Not a date/time value: " + value);
        }
        return temporal;
    }
}
