package com.ddm.iris.format;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Objects;

/**
 * 已编译消息模式的组成片段：字面文本或参数占位符。
 *
 * @author liyifei
 * @see CompiledPattern
 */
public sealed interface PatternPart permits PatternPart.Literal, PatternPart.Argument {

    /**
     * 字面文本（已去除引号转义）。
     */
    record Literal(String text) implements PatternPart {
        public Literal {
            Objects.requireNonNull(text, "text");
        }
    }

    /**
     * 参数占位符 {@code {index[,type[,style]]}}。
     *
     * @param index         参数下标
     * @param type          占位符类型；无类型时为 null
     * @param style         原始样式文本；无样式时为 null
     * @param dateFormatter date/time 自定义样式预编译的格式器，其余情况为 null
     * @param choices       choice 规则（按下界升序），其余情况为空
     */
    record Argument(int index,
                    FormatType type,
                    String style,
                    DateTimeFormatter dateFormatter,
                    List<ChoiceRule> choices) implements PatternPart {

        public Argument {
            if (index < 0) {
                throw new IllegalArgumentException("index must not be negative: " + index);
            }
            choices = choices == null ? List.of() : List.copyOf(choices);
        }

        static Argument plain(int index) {
            return new Argument(index, null, null, null, List.of());
        }
    }

    /**
     * choice 规则：数值满足下界时选择 {@code pattern}。
     *
     * @param limit     规则中书写的界限值
     * @param inclusive {@code #}/{@code ≤} 为 true（value ≥ limit），{@code <} 为 false（value &gt; limit）
     * @param pattern   子模式，可继续引用同一参数列表
     */
    record ChoiceRule(double limit, boolean inclusive, CompiledPattern pattern) {

        /**
         * 规则的有效下界，排他规则取 limit 的下一个可表示值。
         */
        double lowerBound() {
            return inclusive ? limit : Math.nextUp(limit);
        }

        boolean matches(double value) {
            return inclusive ? value >= limit : value > limit;
        }
    }
}
