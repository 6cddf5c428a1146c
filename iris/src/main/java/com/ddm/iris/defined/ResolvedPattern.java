package com.ddm.iris.defined;

import java.util.Objects;

/**
 * 解析结果（临时值）。
 *
 * @param pattern        选中的消息模式
 * @param variant        来源变体；回退到 defaultText 时为 null
 * @param freshlyCreated 标签是否在本次调用中首次创建（未校验）
 * @author liyifei
 */
public record ResolvedPattern(String pattern, LocalizedLabel variant, boolean freshlyCreated) {

    public ResolvedPattern {
        Objects.requireNonNull(pattern, "pattern cannot be null");
    }

    public boolean validated() {
        return variant != null && variant.validated();
    }
}
