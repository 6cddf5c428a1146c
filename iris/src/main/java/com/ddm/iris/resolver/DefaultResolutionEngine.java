package com.ddm.iris.resolver;

import com.ddm.iris.defined.I18nContext;
import com.ddm.iris.defined.Label;
import com.ddm.iris.defined.LabelRef;
import com.ddm.iris.defined.LocalizedLabel;
import com.ddm.iris.defined.ResolvedPattern;
import com.ddm.iris.defined.VariantSlot;
import com.ddm.iris.exception.StoreUnavailableException;
import com.ddm.iris.key.KeyDeriver;
import com.ddm.iris.provider.LabelStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 默认的解析引擎实现。
 *
 * <p><strong>首次使用：</strong>标签不存在时，以请求语言为默认语言创建标签，写入未校验的
 * (L,∅,∅) 默认变体与调用方提供的额外默认变体。创建通过 {@link LabelStore#upsertIfAbsent(Label)}
 * 原子完成，并发首次使用只会落库一份；写入失败时重试一次读取。
 *
 * <p><strong>键冲突：</strong>推导键命中已有标签、但规范化后的默认文案不同时，
 * 在 {@code com.ddm.iris.collision} 日志上输出 WARN 并通知监听器。若默认变体尚未校验，
 * 通过 {@link LabelStore#replaceDefaultText} 以本次文案覆盖默认文案与默认变体（后写者胜），
 * 其它变体不受影响；已校验的内容不会被覆盖。
 *
 * <p>本类无可变状态，线程安全。
 *
 * @author liyifei
 * @see ResolutionEngine
 * @since 1.0
 */
public class DefaultResolutionEngine implements ResolutionEngine {

    private static final Logger log = LoggerFactory.getLogger(DefaultResolutionEngine.class);

    private static final Logger collisionLog = LoggerFactory.getLogger("com.ddm.iris.collision");

    private final LabelStore store;

    private final KeyDeriver deriver;

    private final AlternativeSelector selector;

    private final List<KeyCollisionListener> listeners;

    public DefaultResolutionEngine(LabelStore store, KeyDeriver deriver, AlternativeSelector selector) {
        this(store, deriver, selector, List.of());
    }

    public DefaultResolutionEngine(LabelStore store, KeyDeriver deriver, AlternativeSelector selector,
                                   List<KeyCollisionListener> listeners) {
        this.store = Objects.requireNonNull(store, "store required");
        this.deriver = Objects.requireNonNull(deriver, "deriver required");
        this.selector = Objects.requireNonNull(selector, "selector required");
        this.listeners = listeners == null ? List.of() : List.copyOf(listeners);
    }

    @Override
    public ResolvedPattern resolve(LabelRef ref, String category, String defaultText, I18nContext ctx,
                                   List<LocalizedLabel> defaultI18n, boolean derivedKey) {
        Objects.requireNonNull(ref, "ref");
        Objects.requireNonNull(defaultText, "defaultText");
        Objects.requireNonNull(ctx, "ctx");

        Label label = read(ref);
        boolean freshlyCreated = false;
        if (label == null) {
            Label built = newLabel(ref, category, defaultText, ctx.locale(), defaultI18n);
            label = create(built);
            // 存储返回本次构建的实例，说明由本次调用写入
            freshlyCreated = label == built;
        }
        if (!freshlyCreated && derivedKey) {
            label = observeCollision(label, defaultText);
        }

        LocalizedLabel variant = match(label, ctx.candidates());
        if (variant == null && !label.defaultLocale().equals(ctx.locale())) {
            variant = match(label, ctx.candidates(label.defaultLocale()));
        }
        if (variant == null) {
            log.trace("No variant of {} matches {}, using default text", ref, ctx);
            return new ResolvedPattern(label.defaultText(), null, freshlyCreated);
        }
        String pattern = selector.choose(variant.alternatives());
        log.trace("Resolved {} for {} via {}", ref, ctx, variant.slot());
        return new ResolvedPattern(pattern, variant, freshlyCreated);
    }

    @Override
    public void saveVariant(LabelRef ref, LocalizedLabel variant) {
        Objects.requireNonNull(ref, "ref");
        store.saveVariant(ref, variant);
        log.info("Variant {} of label {} saved (validated={})", variant.slot(), ref, variant.validated());
    }

    @Override
    public void saveLabel(Label label) {
        store.saveLabel(label);
        log.info("Label {} saved with {} variants", label.ref(), label.variants().size());
    }

    private Label read(LabelRef ref) {
        try {
            return store.getLabel(ref);
        } catch (RuntimeException e) {
            log.error("Failed to read label {} from store '{}'", ref, store.type(), e);
            throw new StoreUnavailableException("Label store unavailable while reading " + ref, ref, e);
        }
    }

    /**
     * 原子创建；写入失败时重试一次读取，仍失败则视为存储不可用。
     */
    private Label create(Label built) {
        LabelRef ref = built.ref();
        try {
            Label stored = store.upsertIfAbsent(built);
            log.debug("Label {} created on first use (locale={})", ref, built.defaultLocale());
            return stored;
        } catch (RuntimeException e) {
            log.warn("Failed to create label {}, retrying as read", ref, e);
            Label existing;
            try {
                existing = store.getLabel(ref);
            } catch (RuntimeException retry) {
                retry.addSuppressed(e);
                throw new StoreUnavailableException("Label store unavailable while creating " + ref, ref, retry);
            }
            if (existing == null) {
                throw new StoreUnavailableException("Label " + ref + " could not be created", ref, e);
            }
            return existing;
        }
    }

    private Label newLabel(LabelRef ref, String category, String defaultText, Locale locale,
                           List<LocalizedLabel> defaultI18n) {
        List<LocalizedLabel> variants = new ArrayList<>();
        variants.add(LocalizedLabel.unvalidated(locale, defaultText));
        Label label = new Label(ref, category, locale, defaultText, variants);
        if (defaultI18n != null) {
            for (LocalizedLabel seed : defaultI18n) {
                if (label.find(seed.slot()) == null) {
                    label = label.withVariant(new LocalizedLabel(seed.slot(), seed.alternatives(), false));
                }
            }
        }
        return label;
    }

    private Label observeCollision(Label stored, String incomingText) {
        if (deriver.canonicalize(stored.defaultText()).equals(deriver.canonicalize(incomingText))) {
            return stored;
        }
        KeyCollision collision = new KeyCollision(stored.ref(), stored.defaultText(), incomingText);
        collisionLog.warn("Derived key {} collides: stored text \"{}\" differs from \"{}\"",
                stored.ref(), stored.defaultText(), incomingText);
        for (KeyCollisionListener listener : listeners) {
            try {
                listener.onCollision(collision);
            } catch (RuntimeException e) {
                log.warn("Key collision listener {} failed for {}", listener.getClass().getName(), stored.ref(), e);
            }
        }

        LocalizedLabel defaultVariant = stored.find(VariantSlot.of(stored.defaultLocale()));
        if (defaultVariant != null && defaultVariant.validated()) {
            collisionLog.warn("Default variant of {} is validated, keeping stored text", stored.ref());
            return stored;
        }
        // 快照可能已过期，由存储按当前状态重新判断是否已校验
        try {
            if (!store.replaceDefaultText(stored.ref(), incomingText)) {
                collisionLog.warn("Default variant of {} is validated, keeping stored text", stored.ref());
            }
            Label current = store.getLabel(stored.ref());
            return current != null ? current : stored;
        } catch (RuntimeException e) {
            log.warn("Failed to overwrite colliding label {}, keeping stored text", stored.ref(), e);
            return stored;
        }
    }

    private static LocalizedLabel match(Label label, List<VariantSlot> candidates) {
        for (VariantSlot slot : candidates) {
            LocalizedLabel v = label.find(slot);
            if (v != null) {
                return v;
            }
        }
        return null;
    }
}
