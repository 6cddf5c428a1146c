package com.ddm.iris.format;

import java.util.List;
import java.util.Objects;

/**
 * 预编译的消息模式，不可变，可在并发渲染间安全共享。
 *
 * <p>例如 {@code "Hello {0}, you have {1,number,integer} messages"} 编译为：
 * <pre>
 * [Literal("Hello "), Argument(0), Literal(", you have "), Argument(1, NUMBER, "integer"), Literal(" messages")]
 * </pre>
 *
 * @param source 原始模式文本
 * @param parts  片段列表
 * @author liyifei
 * @see MessagePatternParser
 */
public record CompiledPattern(String source, List<PatternPart> parts) {

    public CompiledPattern {
        Objects.requireNonNull(source, "source cannot be null");
        parts = List.copyOf(parts);
    }

    /**
     * 是否不含任何占位符。
     */
    public boolean isLiteral() {
        for (PatternPart part : parts) {
            if (part instanceof PatternPart.Argument) {
                return false;
            }
        }
        return true;
    }

    /**
     * 引用到的最大参数下标（含 choice 子模式）；不含占位符时返回 -1。
     */
    public int maxArgumentIndex() {
        int max = -1;
        for (PatternPart part : parts) {
            if (part instanceof PatternPart.Argument arg) {
                max = Math.max(max, arg.index());
                for (PatternPart.ChoiceRule rule : arg.choices()) {
                    max = Math.max(max, rule.pattern().maxArgumentIndex());
                }
            }
        }
        return max;
    }

    @Override
    public String toString() {
        return "CompiledPattern{\"" + source + "\", parts=" + parts.size() + "}";
    }
}
