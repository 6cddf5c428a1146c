package com.ddm.iris.defined;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 本地化变体，表示某个槽位下的一组可互换文案。
 * <ul>
 *   <li><strong>slot</strong>：(locale, connectorType, interfaceType)</li>
 *   <li><strong>alternatives</strong>：候选消息模式，非空且有序，渲染时随机选取其一</li>
 *   <li><strong>validated</strong>：是否经过人工校验；自动创建的默认变体为 false</li>
 * </ul>
 *
 * @author liyifei
 * @see Label
 */
public record LocalizedLabel(VariantSlot slot, List<String> alternatives, boolean validated) {

    public LocalizedLabel {
        Objects.requireNonNull(slot, "slot cannot be null");
        Objects.requireNonNull(alternatives, "alternatives cannot be null");
        alternatives = List.copyOf(alternatives);
        if (alternatives.isEmpty()) {
            throw new IllegalArgumentException("alternatives must not be empty for " + slot);
        }
    }

    public static LocalizedLabel of(VariantSlot slot, boolean validated, String... alternatives) {
        return new LocalizedLabel(slot, List.of(alternatives), validated);
    }

    /**
     * 未校验的单文案变体，用于首次使用时自动创建。
     */
    public static LocalizedLabel unvalidated(Locale locale, String text) {
        return new LocalizedLabel(VariantSlot.of(locale), List.of(text), false);
    }
}
