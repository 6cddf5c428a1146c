package com.ddm.iris.render;

import com.ddm.iris.defined.I18nContext;
import com.ddm.iris.defined.LabelRef;
import com.ddm.iris.defined.LabelValue;
import com.ddm.iris.defined.ResolvedPattern;
import com.ddm.iris.format.CompiledPattern;
import com.ddm.iris.format.MessagePatternParser;
import com.ddm.iris.format.PatternFormatter;
import com.ddm.iris.key.DefaultKeyDeriver;
import com.ddm.iris.key.KeyDeriver;
import com.ddm.iris.provider.LabelStore;
import com.ddm.iris.resolver.AlternativeSelector;
import com.ddm.iris.resolver.DefaultResolutionEngine;
import com.ddm.iris.resolver.KeyCollisionListener;
import com.ddm.iris.resolver.ResolutionEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * 默认的渲染器实现，组合 {@link KeyDeriver}、{@link ResolutionEngine}、
 * {@link MessagePatternParser} 与 {@link PatternFormatter}。
 *
 * <p>未指定命名空间或对话单元时，使用构建时配置的默认值。
 *
 * <p><strong>构建示例：</strong>
 * <pre>{@code
 * Renderer renderer = DefaultRenderer.builder()
 *         .store(new InMemoryLabelStore())
 *         .defaultNamespace("travel")
 *         .listener(c -> alerts.send(c.ref()))
 *         .build();
 * }</pre>
 *
 * @author liyifei
 * @see Renderer
 * @since 1.0
 */
public class DefaultRenderer implements Renderer {

    private static final Logger log = LoggerFactory.getLogger(DefaultRenderer.class);

    private final KeyDeriver deriver;

    private final ResolutionEngine engine;

    private final MessagePatternParser parser;

    private final PatternFormatter formatter;

    private final String defaultNamespace;

    private final String defaultCategory;

    public DefaultRenderer(KeyDeriver deriver, ResolutionEngine engine, MessagePatternParser parser,
                           PatternFormatter formatter, String defaultNamespace, String defaultCategory) {
        this.deriver = Objects.requireNonNull(deriver, "deriver required");
        this.engine = Objects.requireNonNull(engine, "engine required");
        this.parser = Objects.requireNonNull(parser, "parser required");
        this.formatter = Objects.requireNonNull(formatter, "formatter required");
        this.defaultNamespace = defaultNamespace;
        this.defaultCategory = defaultCategory;
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String render(String namespace, String category, String defaultText, I18nContext ctx, Object... args) {
        return render(LabelValue.of(namespace, category, defaultText, args), ctx);
    }

    @Override
    public String renderKey(String namespace, String explicitKey, String defaultText, I18nContext ctx,
                            Object... args) {
        return render(LabelValue.ofKey(namespace, explicitKey, defaultText, args), ctx);
    }

    @Override
    public String render(LabelValue value, I18nContext ctx) {
        Objects.requireNonNull(value, "value");
        Objects.requireNonNull(ctx, "ctx");
        LabelValue effective = applyDefaults(value);
        LabelRef ref = deriver.derive(effective);
        ResolvedPattern resolved = engine.resolve(effective, ref, ctx);
        CompiledPattern pattern = parser.parse(resolved.pattern());
        String text = formatter.format(pattern, effective.args(), ctx.locale());
        log.trace("Rendered {} for {}: {}", ref, ctx, text);
        return text;
    }

    @Override
    public String raw(String text, Locale locale, Object... args) {
        Objects.requireNonNull(text, "text");
        List<Object> values = args == null ? List.of() : Arrays.asList(args);
        return formatter.format(parser.compile(text), values, locale);
    }

    @Override
    public LabelRef keyOf(LabelValue value) {
        return deriver.derive(applyDefaults(value));
    }

    private LabelValue applyDefaults(LabelValue value) {
        String namespace = value.namespace() == null || value.namespace().isBlank()
                ? defaultNamespace : value.namespace();
        String category = value.category() == null && !value.hasExplicitKey()
                ? defaultCategory : value.category();
        if (Objects.equals(namespace, value.namespace()) && Objects.equals(category, value.category())) {
            return value;
        }
        return new LabelValue(namespace, category, value.defaultText(), value.explicitKey(),
                value.defaultI18n(), value.args());
    }

    /**
     * {@link DefaultRenderer} 构建器。
     * <p>未指定 engine 时，以 store、selector 与监听器构建 {@link DefaultResolutionEngine}。
     */
    public static final class Builder {

        private KeyDeriver deriver;
        private ResolutionEngine engine;
        private LabelStore store;
        private AlternativeSelector selector;
        private MessagePatternParser parser;
        private PatternFormatter formatter;
        private String defaultNamespace;
        private String defaultCategory;
        private final List<KeyCollisionListener> listeners = new ArrayList<>();

        private Builder() {
        }

        public Builder deriver(KeyDeriver deriver) {
            this.deriver = deriver;
            return this;
        }

        public Builder engine(ResolutionEngine engine) {
            this.engine = engine;
            return this;
        }

        public Builder store(LabelStore store) {
            this.store = store;
            return this;
        }

        public Builder selector(AlternativeSelector selector) {
            this.selector = selector;
            return this;
        }

        public Builder parser(MessagePatternParser parser) {
            this.parser = parser;
            return this;
        }

        public Builder formatter(PatternFormatter formatter) {
            this.formatter = formatter;
            return this;
        }

        public Builder defaultNamespace(String defaultNamespace) {
            this.defaultNamespace = defaultNamespace;
            return this;
        }

        public Builder defaultCategory(String defaultCategory) {
            this.defaultCategory = defaultCategory;
            return this;
        }

        public Builder listener(KeyCollisionListener listener) {
            this.listeners.add(Objects.requireNonNull(listener, "listener"));
            return this;
        }

        /**
         * @throws IllegalStateException 如果既未指定 engine 也未指定 store
         */
        public DefaultRenderer build() {
            KeyDeriver d = deriver != null ? deriver : new DefaultKeyDeriver();
            ResolutionEngine e = engine;
            if (e == null) {
                if (store == null) {
                    throw new IllegalStateException("Either engine or store must be set");
                }
                e = new DefaultResolutionEngine(store, d,
                        selector != null ? selector : AlternativeSelector.random(), listeners);
            } else if (!listeners.isEmpty()) {
                log.warn("Collision listeners are ignored when an engine is supplied");
            }
            return new DefaultRenderer(d, e,
                    parser != null ? parser : new MessagePatternParser(),
                    formatter != null ? formatter : new PatternFormatter(),
                    defaultNamespace, defaultCategory);
        }
    }
}
