package com.ddm.iris.format;

import java.util.Locale;

/**
 * 参数级格式化扩展。
 * <p>调用方通过 {@link FormattedArgument} 把格式器随参数一起传入，
 * 存储中的模式保持通用，展示方式由调用点决定。格式器会覆盖占位符自身的类型与样式。
 *
 * <pre>{@code
 * renderer.render("travel", "booking", "Departure: {0}", ctx,
 *         FormattedArgument.of(departure, ArgumentFormatters.dateTime("EEE d MMM HH:mm")));
 * }</pre>
 *
 * @author liyifei
 * @see ArgumentFormatters
 */
@FunctionalInterface
public interface ArgumentFormatter {

    /**
     * 格式化参数值。
     *
     * @param value  参数原始值，可能为 null
     * @param locale 目标语言
     * @return 格式化结果，不能为 null
     */
    String format(Object value, Locale locale);
}
