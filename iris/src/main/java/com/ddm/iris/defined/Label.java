package com.ddm.iris.defined;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * 标签聚合根，表示从存储中读取的完整标签数据（不可变快照）。
 * <p>
 * 包含标签的完整信息：
 * <ul>
 *   <li><strong>ref</strong>：标签引用 (namespace, key)</li>
 *   <li><strong>category</strong>：首次创建时的对话单元（仅作元数据，解析时不使用）</li>
 *   <li><strong>defaultLocale</strong>：首次创建时的语言，作为回退语言</li>
 *   <li><strong>defaultText</strong>：代码中首次出现的原始文案</li>
 *   <li><strong>variants</strong>：本地化变体集合，每个 {@link VariantSlot} 至多一个</li>
 * </ul>
 *
 * <p>所有修改方法均返回新实例，快照可以安全地跨线程共享与缓存。
 *
 * @author liyifei
 * @see LabelRef
 * @see LocalizedLabel
 * @since 1.0
 */
public record Label(LabelRef ref,
                    String category,
                    Locale defaultLocale,
                    String defaultText,
                    List<LocalizedLabel> variants) {

    public Label {
        Objects.requireNonNull(ref, "ref cannot be null");
        Objects.requireNonNull(defaultLocale, "defaultLocale cannot be null");
        Objects.requireNonNull(defaultText, "defaultText cannot be null");
        variants = variants == null ? List.of() : List.copyOf(variants);
        Set<VariantSlot> seen = new HashSet<>();
        for (LocalizedLabel v : variants) {
            if (!seen.add(v.slot())) {
                throw new IllegalArgumentException("Duplicate variant slot " + v.slot() + " in label " + ref);
            }
        }
    }

    /**
     * 按精确槽位查找变体。
     *
     * @return 匹配的变体，不存在时返回 null
     */
    public LocalizedLabel find(VariantSlot slot) {
        for (LocalizedLabel v : variants) {
            if (v.slot().equals(slot)) {
                return v;
            }
        }
        return null;
    }

    /**
     * 替换（或新增）同槽位的变体。
     */
    public Label withVariant(LocalizedLabel variant) {
        Objects.requireNonNull(variant, "variant cannot be null");
        List<LocalizedLabel> copy = new ArrayList<>(variants.size() + 1);
        boolean replaced = false;
        for (LocalizedLabel v : variants) {
            if (v.slot().equals(variant.slot())) {
                copy.add(variant);
                replaced = true;
            } else {
                copy.add(v);
            }
        }
        if (!replaced) {
            copy.add(variant);
        }
        return new Label(ref, category, defaultLocale, defaultText, copy);
    }

    public Label withDefaultText(String text) {
        return new Label(ref, category, defaultLocale, text, variants);
    }
}
