package com.ddm.iris.defined;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 渲染请求上下文：目标语言、渠道与模态。
 *
 * @param locale        目标语言，不能为 null
 * @param connectorType 渠道类型，可为 null
 * @param interfaceType 交互模态，可为 null
 * @author liyifei
 */
public record I18nContext(Locale locale, String connectorType, InterfaceType interfaceType) {

    public I18nContext {
        Objects.requireNonNull(locale, "locale cannot be null");
        if (connectorType != null && connectorType.isBlank()) {
            connectorType = null;
        }
    }

    public static I18nContext of(Locale locale) {
        return new I18nContext(locale, null, null);
    }

    /**
     * 最具体的槽位 (L,C,I)。
     */
    public VariantSlot slot() {
        return new VariantSlot(locale, connectorType, interfaceType);
    }

    /**
     * 以当前语言生成按特异性降序排列的候选槽位。
     */
    public List<VariantSlot> candidates() {
        return candidates(locale);
    }

    /**
     * 以指定语言生成候选槽位：
     * (L,C,I) → (L,C,∅) → (L,∅,I) → (L,∅,∅)，渠道或模态缺失时去重。
     */
    public List<VariantSlot> candidates(Locale target) {
        Set<VariantSlot> ordered = new LinkedHashSet<>(4);
        ordered.add(new VariantSlot(target, connectorType, interfaceType));
        ordered.add(new VariantSlot(target, connectorType, null));
        ordered.add(new VariantSlot(target, null, interfaceType));
        ordered.add(new VariantSlot(target, null, null));
        return new ArrayList<>(ordered);
    }
}
