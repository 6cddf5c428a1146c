package com.ddm.iris.utils;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.Calendar;
import java.util.Date;

/**
 * 日期时间参数的归一化工具。
 *
 * @author liyifei
 */
public final class Temporals {

    private Temporals() {
    }

    /**
     * 将参数值转换为可被 {@link java.time.format.DateTimeFormatter} 格式化的对象。
     * <ul>
     *   <li>java.time 类型：原样返回（{@link Instant} 按 zone 转换为 ZonedDateTime）</li>
     *   <li>{@link java.sql.Date} / {@link java.sql.Time}：转换为 LocalDate / LocalTime（不含时区）</li>
     *   <li>{@link Date}：按 zone 转换</li>
     *   <li>{@link Calendar}：使用其自身时区</li>
     * </ul>
     *
     * @return 转换结果；不是日期时间类型时返回 null
     */
    public static TemporalAccessor toTemporal(Object value, ZoneId zone) {
        if (value instanceof Instant instant) {
            return ZonedDateTime.ofInstant(instant, zone);
        }
        if (value instanceof TemporalAccessor temporal) {
            return temporal;
        }
        if (value instanceof Calendar calendar) {
            return ZonedDateTime.ofInstant(calendar.toInstant(), calendar.getTimeZone().toZoneId());
        }
        // java.sql.Date 与 java.sql.Time 不支持 toInstant()
        if (value instanceof java.sql.Date sqlDate) {
            return sqlDate.toLocalDate();
        }
        if (value instanceof java.sql.Time sqlTime) {
            return sqlTime.toLocalTime();
        }
        if (value instanceof Date date) {
            return ZonedDateTime.ofInstant(date.toInstant(), zone);
        }
        return null;
    }

    public static boolean hasDate(TemporalAccessor temporal) {
        return temporal.isSupported(ChronoField.EPOCH_DAY);
    }

    public static boolean hasTime(TemporalAccessor temporal) {
        return temporal.isSupported(ChronoField.NANO_OF_DAY);
    }
}
