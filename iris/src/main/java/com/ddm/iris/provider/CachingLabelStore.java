package com.ddm.iris.provider;

import com.ddm.iris.defined.Label;
import com.ddm.iris.defined.LabelRef;
import com.ddm.iris.defined.LocalizedLabel;
import com.ddm.iris.defined.VariantSlot;
import com.ddm.iris.format.MessagePatternParser;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.LoadingCache;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.HashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 带读缓存的标签存储装饰器，基于 Caffeine LoadingCache + 异步刷新。
 *
 * <p><strong>缓存机制：</strong>
 * <ul>
 *   <li>标签快照按 {@link LabelRef} 缓存，超过 TTL 后异步刷新，读取时返回旧值</li>
 *   <li>不存在的标签不缓存（loader 返回 null），保证首次使用总能走到创建逻辑</li>
 *   <li>{@link #upsertIfAbsent(Label)} 将存储中的最终结果直接放入缓存</li>
 *   <li>{@link #saveVariant} / {@link #saveLabel} / {@link #replaceDefaultText} 淘汰标签缓存，并淘汰被替换文案的编译结果</li>
 * </ul>
 *
 * <p>刷新操作在独立的守护线程池中执行，随 {@link #close()} 关闭。
 *
 * @author liyifei
 * @see LabelStore
 * @since 1.0
 */
public class CachingLabelStore implements LabelStore {

    private static final Logger log = LoggerFactory.getLogger(CachingLabelStore.class);

    private static final int REFRESH_POOL_SIZE = 2;

    private final LabelStore delegate;

    private final MessagePatternParser parser;

    private final ExecutorService refreshPool;

    private final LoadingCache<LabelRef, Label> cache;

    /**
     * @param delegate 底层存储，不能为 null
     * @param parser   模式解析器，编辑时淘汰其编译缓存
     * @param ttl      刷新间隔，不能为 null
     */
    public CachingLabelStore(LabelStore delegate, MessagePatternParser parser, Duration ttl) {
        this.delegate = Objects.requireNonNull(delegate, "delegate required");
        this.parser = Objects.requireNonNull(parser, "parser required");
        Objects.requireNonNull(ttl, "ttl required");
        this.refreshPool = createRefreshExecutor();
        this.cache = Caffeine.newBuilder()
                .refreshAfterWrite(ttl)
                .executor(refreshPool)
                .build(this::loadLabel);
        log.info("Label cache initialized over store '{}' (ttl={})", delegate.type(), ttl);
    }

    private Label loadLabel(LabelRef ref) {
        log.trace("Loading label {} from store '{}'", ref, delegate.type());
        return delegate.getLabel(ref);
    }

    @Override
    public String type() {
        return delegate.type();
    }

    @Override
    public void init(Map<String, String> options) {
        delegate.init(options);
    }

    @Override
    public Label getLabel(LabelRef ref) {
        return cache.get(Objects.requireNonNull(ref, "ref"));
    }

    @Override
    public Label upsertIfAbsent(Label label) {
        Label stored = delegate.upsertIfAbsent(label);
        cache.put(stored.ref(), stored);
        return stored;
    }

    @Override
    public LocalizedLabel findVariant(LabelRef ref, VariantSlot slot) {
        Label label = getLabel(ref);
        return label == null ? null : label.find(slot);
    }

    @Override
    public void saveVariant(LabelRef ref, LocalizedLabel variant) {
        LocalizedLabel previous = delegate.findVariant(ref, variant.slot());
        delegate.saveVariant(ref, variant);
        cache.invalidate(ref);
        if (previous != null) {
            Set<String> replaced = new HashSet<>(previous.alternatives());
            replaced.removeAll(variant.alternatives());
            replaced.forEach(parser::invalidate);
        }
        log.debug("Invalidated cached label {} after variant edit {}", ref, variant.slot());
    }

    @Override
    public void saveLabel(Label label) {
        Label previous = delegate.getLabel(label.ref());
        delegate.saveLabel(label);
        cache.invalidate(label.ref());
        if (previous != null) {
            Set<String> replaced = patternTexts(previous);
            replaced.removeAll(patternTexts(label));
            replaced.forEach(parser::invalidate);
        }
        log.debug("Invalidated cached label {} after label edit", label.ref());
    }

    /**
     * 委托给底层存储判断并替换；无论是否替换都淘汰缓存，缓存中的快照可能已过期。
     */
    @Override
    public boolean replaceDefaultText(LabelRef ref, String defaultText) {
        Label previous = delegate.getLabel(ref);
        boolean replaced = delegate.replaceDefaultText(ref, defaultText);
        cache.invalidate(ref);
        if (replaced && previous != null) {
            Set<String> texts = new HashSet<>();
            texts.add(previous.defaultText());
            LocalizedLabel defaultVariant = previous.find(VariantSlot.of(previous.defaultLocale()));
            if (defaultVariant != null) {
                texts.addAll(defaultVariant.alternatives());
            }
            texts.remove(defaultText);
            texts.forEach(parser::invalidate);
        }
        log.debug("Invalidated cached label {} after default text replacement (replaced={})", ref, replaced);
        return replaced;
    }

    /**
     * 淘汰指定标签的缓存，下次读取时重新加载。
     */
    public void invalidate(LabelRef ref) {
        cache.invalidate(ref);
    }

    private static Set<String> patternTexts(Label label) {
        Set<String> texts = new HashSet<>();
        texts.add(label.defaultText());
        for (LocalizedLabel v : label.variants()) {
            texts.addAll(v.alternatives());
        }
        return texts;
    }

    private static ExecutorService createRefreshExecutor() {
        return Executors.newFixedThreadPool(REFRESH_POOL_SIZE, r -> {
            Thread t = new Thread(r, "label-refresh");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * 关闭刷新线程池与底层存储。关闭过程中的异常仅记录日志。
     */
    @PreDestroy
    @Override
    public void close() {
        log.info("Shutting down label cache (store={})", delegate.type());
        refreshPool.shutdownNow();
        cache.invalidateAll();
        try {
            delegate.close();
        } catch (Exception e) {
            log.warn("Failed to close label store {}", delegate.type(), e);
        }
    }
}
