package com.ddm.iris.exception;

/**
 * 渲染失败：参数缺失、参数类型与占位符类型不符、choice 规则无法匹配等。
 * <p>渲染要么产出完整字符串，要么抛出本异常，不会返回部分结果。
 *
 * @author liyifei
 */
public class PatternFormatException extends IllegalArgumentException {

    private final String pattern;

    public PatternFormatException(String message, String pattern) {
        super(message + " in pattern \"" + pattern + "\"");
        this.pattern = pattern;
    }

    public PatternFormatException(String message, String pattern, Throwable cause) {
        this(message, pattern);
        initCause(cause);
    }

    public String getPattern() {
        return pattern;
    }
}
