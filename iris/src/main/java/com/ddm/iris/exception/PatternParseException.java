package com.ddm.iris.exception;

/**
 * 消息模式语法错误（未闭合的占位符、非法参数下标、未知类型、错误的 choice 规则等）。
 * <p>解析失败的模式不会进入缓存。
 *
 * @author liyifei
 */
public class PatternParseException extends IllegalArgumentException {

    private final String pattern;
    private final int position;

    public PatternParseException(String message, String pattern, int position) {
        super(message + " at position " + position + " in pattern \"" + pattern + "\"");
        this.pattern = pattern;
        this.position = position;
    }

    public PatternParseException(String message, String pattern, int position, Throwable cause) {
        this(message, pattern, position);
        initCause(cause);
    }

    public String getPattern() {
        return pattern;
    }

    public int getPosition() {
        return position;
    }
}
