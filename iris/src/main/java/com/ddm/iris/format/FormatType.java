package com.ddm.iris.format;

import java.util.Locale;

/**
 * 占位符类型（封闭集合）。渲染时使用 switch 表达式分派，新增类型会在编译期暴露遗漏的分支。
 *
 * @author liyifei
 */
public enum FormatType {

    NUMBER,

    DATE,

    TIME,

    CHOICE;

    /**
     * 按模式中的类型名查找，大小写不敏感。
     *
     * @return 对应的类型，未知类型返回 null
     */
    static FormatType of(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "number" -> NUMBER;
            case "date" -> DATE;
            case "time" -> TIME;
            case "choice" -> CHOICE;
            default -> null;
        };
    }
}
