package com.ddm.iris.autoconfigure;

import com.ddm.iris.config.IrisProperties;
import com.ddm.iris.format.MessagePatternParser;
import com.ddm.iris.format.PatternFormatter;
import com.ddm.iris.key.DefaultKeyDeriver;
import com.ddm.iris.key.KeyDeriver;
import com.ddm.iris.provider.CachingLabelStore;
import com.ddm.iris.provider.LabelStore;
import com.ddm.iris.provider.LabelStores;
import com.ddm.iris.render.DefaultRenderer;
import com.ddm.iris.render.Renderer;
import com.ddm.iris.resolver.AlternativeSelector;
import com.ddm.iris.resolver.DefaultResolutionEngine;
import com.ddm.iris.resolver.KeyCollisionListener;
import com.ddm.iris.resolver.ResolutionEngine;
import com.ddm.iris.transfer.LabelImporter;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.util.stream.Collectors;

/**
 * 标签国际化的自动配置类。
 * <p>自动配置以下组件（均可由应用自定义 Bean 覆盖）：
 * <ul>
 *   <li>{@link LabelStore}：按 {@code iris.i18n.store.type} 通过 SPI 加载，并包装为 {@link CachingLabelStore}</li>
 *   <li>{@link KeyDeriver}、{@link MessagePatternParser}、{@link PatternFormatter}</li>
 *   <li>{@link ResolutionEngine}：注入容器中的全部 {@link KeyCollisionListener}</li>
 *   <li>{@link Renderer}、{@link LabelImporter}</li>
 * </ul>
 *
 * @author liyifei
 * @see IrisProperties
 * @since 1.0
 */
@AutoConfiguration
@EnableConfigurationProperties(IrisProperties.class)
public class IrisAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public MessagePatternParser messagePatternParser(IrisProperties props) {
        return new MessagePatternParser(props.patternCacheSize());
    }

    @Bean
    @ConditionalOnMissingBean
    public PatternFormatter patternFormatter() {
        return new PatternFormatter();
    }

    @Bean
    @ConditionalOnMissingBean
    public KeyDeriver keyDeriver(IrisProperties props) {
        return new DefaultKeyDeriver(props.maxKeyLength());
    }

    @Bean
    @ConditionalOnMissingBean
    public AlternativeSelector alternativeSelector() {
        return AlternativeSelector.random();
    }

    /**
     * 标签存储 Bean，容器销毁时关闭刷新线程池与底层存储。
     */
    @Bean
    @ConditionalOnMissingBean
    public LabelStore labelStore(IrisProperties props, MessagePatternParser parser) {
        IrisProperties.Store store = props.store();
        return new CachingLabelStore(LabelStores.load(store.type(), store.options()), parser, props.ttl());
    }

    @Bean
    @ConditionalOnMissingBean
    public ResolutionEngine resolutionEngine(LabelStore store, KeyDeriver deriver, AlternativeSelector selector,
                                             ObjectProvider<KeyCollisionListener> listeners) {
        return new DefaultResolutionEngine(store, deriver, selector,
                listeners.orderedStream().collect(Collectors.toList()));
    }

    @Bean
    @ConditionalOnMissingBean
    public Renderer renderer(KeyDeriver deriver, ResolutionEngine engine, MessagePatternParser parser,
                             PatternFormatter formatter, IrisProperties props) {
        return new DefaultRenderer(deriver, engine, parser, formatter,
                props.defaultNamespace(), props.defaultCategory());
    }

    @Bean
    @ConditionalOnMissingBean
    public LabelImporter labelImporter(LabelStore store) {
        return new LabelImporter(store);
    }
}
