package com.ddm.iris.provider.memory;

import com.ddm.iris.defined.Label;
import com.ddm.iris.defined.LabelRef;
import com.ddm.iris.defined.LocalizedLabel;
import com.ddm.iris.defined.VariantSlot;
import com.ddm.iris.provider.LabelStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 基于内存的标签存储，适用于测试与单实例部署。
 * <p>
 * 并发语义：
 * <ul>
 *   <li>{@code upsertIfAbsent}：{@link ConcurrentMap#putIfAbsent}，同一引用只保留第一次写入</li>
 *   <li>{@code saveVariant} / {@code replaceDefaultText}：{@link ConcurrentMap#compute}，按引用串行化</li>
 *   <li>读路径无锁，返回不可变快照</li>
 * </ul>
 *
 * @author liyifei
 * @since 1.0
 */
public class InMemoryLabelStore implements LabelStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryLabelStore.class);

    private final ConcurrentMap<LabelRef, Label> labels = new ConcurrentHashMap<>();

    @Override
    public String type() {
        return "memory";
    }

    @Override
    public void init(Map<String, String> options) {
        log.info("InMemoryLabelStore initialized");
    }

    @Override
    public Label getLabel(LabelRef ref) {
        return labels.get(Objects.requireNonNull(ref, "ref"));
    }

    @Override
    public Label upsertIfAbsent(Label label) {
        Objects.requireNonNull(label, "label");
        Label existing = labels.putIfAbsent(label.ref(), label);
        if (existing != null) {
            log.debug("Label {} already exists, keeping stored entry", label.ref());
            return existing;
        }
        log.debug("Created label {} (defaultLocale={})", label.ref(), label.defaultLocale());
        return label;
    }

    @Override
    public LocalizedLabel findVariant(LabelRef ref, VariantSlot slot) {
        Label label = labels.get(ref);
        return label == null ? null : label.find(slot);
    }

    @Override
    public void saveVariant(LabelRef ref, LocalizedLabel variant) {
        Objects.requireNonNull(variant, "variant");
        labels.compute(ref, (k, current) -> {
            if (current == null) {
                throw new IllegalStateException("Label not found: " + ref);
            }
            return current.withVariant(variant);
        });
        log.debug("Saved variant {} of label {}", variant.slot(), ref);
    }

    @Override
    public void saveLabel(Label label) {
        Objects.requireNonNull(label, "label");
        labels.put(label.ref(), label);
        log.debug("Saved label {} ({} variants)", label.ref(), label.variants().size());
    }

    @Override
    public boolean replaceDefaultText(LabelRef ref, String defaultText) {
        Objects.requireNonNull(defaultText, "defaultText");
        boolean[] replaced = {false};
        labels.compute(ref, (k, current) -> {
            if (current == null) {
                throw new IllegalStateException("Label not found: " + ref);
            }
            LocalizedLabel defaultVariant = current.find(VariantSlot.of(current.defaultLocale()));
            if (defaultVariant != null && defaultVariant.validated()) {
                return current;
            }
            replaced[0] = true;
            return current.withDefaultText(defaultText)
                    .withVariant(LocalizedLabel.unvalidated(current.defaultLocale(), defaultText));
        });
        log.debug("Default text of label {} {}", ref, replaced[0] ? "replaced" : "kept (validated)");
        return replaced[0];
    }

    /**
     * 当前标签数量。
     */
    public int size() {
        return labels.size();
    }

    @Override
    public void close() {
        labels.clear();
    }
}
