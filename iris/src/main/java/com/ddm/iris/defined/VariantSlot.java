package com.ddm.iris.defined;

import java.util.Locale;
import java.util.Objects;

/**
 * 变体槽位，即 (locale, connectorType, interfaceType) 三元组。
 * <p>
 * 同一个标签内，每个槽位最多对应一个 {@link LocalizedLabel}。
 * {@code connectorType} / {@code interfaceType} 为 null 表示"适用于该语言下的所有渠道/模态"，特异性最低。
 *
 * @param locale        语言区域，不能为 null
 * @param connectorType 渠道类型（如 whatsapp、messenger），可为 null
 * @param interfaceType 交互模态，可为 null
 * @author liyifei
 */
public record VariantSlot(Locale locale, String connectorType, InterfaceType interfaceType) {

    public VariantSlot {
        Objects.requireNonNull(locale, "locale cannot be null");
        if (connectorType != null && connectorType.isBlank()) {
            connectorType = null;
        }
    }

    /**
     * 仅包含语言的槽位（特异性最低）。
     */
    public static VariantSlot of(Locale locale) {
        return new VariantSlot(locale, null, null);
    }

    @Override
    public String toString() {
        return locale.toLanguageTag()
                + "/" + (connectorType == null ? "*" : connectorType)
                + "/" + (interfaceType == null ? "*" : interfaceType.name().toLowerCase(Locale.ROOT));
    }
}
