package com.ddm.iris.format;

import java.util.Objects;

/**
 * 携带格式化扩展的参数。
 *
 * @param value     参数值；choice 占位符使用该值选择规则
 * @param formatter 格式器，不能为 null
 * @author liyifei
 */
public record FormattedArgument(Object value, ArgumentFormatter formatter) {

    public FormattedArgument {
        Objects.requireNonNull(formatter, "formatter cannot be null");
    }

    public static FormattedArgument of(Object value, ArgumentFormatter formatter) {
        return new FormattedArgument(value, formatter);
    }
}
