package com.ddm.iris.config;

import com.ddm.iris.format.MessagePatternParser;
import com.ddm.iris.key.DefaultKeyDeriver;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * 标签国际化配置绑定类，对应属性前缀：{@code iris.i18n.*}
 *
 * <p><strong>示例 YAML 配置：</strong>
 * <pre>{@code
 * iris:
 *   i18n:
 *     default-namespace: travel
 *     default-category: default
 *     max-key-length: 64
 *     ttl: 30S
 *     pattern-cache-size: 10000
 *     store:
 *       type: jdbc
 *       options:
 *         url: jdbc:h2:mem:labels;DB_CLOSE_DELAY=-1
 *         username: sa
 *         password: ""
 *         init_sql: true
 * }</pre>
 *
 * @author liyifei
 * @since 1.0
 */
@ConfigurationProperties(prefix = "iris.i18n")
public record IrisProperties(

        /**
         * 未指定命名空间时使用的默认命名空间。
         */
        String defaultNamespace,

        /**
         * 未指定对话单元时使用的默认值。
         */
        String defaultCategory,

        /**
         * 推导键的最大长度，超出部分截断并追加摘要。
         */
        Integer maxKeyLength,

        /**
         * 标签缓存刷新间隔，单位：秒。
         */
        @DurationUnit(ChronoUnit.SECONDS)
        Duration ttl,

        /**
         * 模式编译缓存容量。
         */
        Long patternCacheSize,

        /**
         * 标签存储定义。
         */
        Store store

) {

    public static final Duration DEFAULT_TTL = Duration.ofSeconds(30);

    public IrisProperties {
        if (maxKeyLength == null) {
            maxKeyLength = DefaultKeyDeriver.DEFAULT_MAX_LENGTH;
        }
        if (ttl == null) {
            ttl = DEFAULT_TTL;
        }
        if (patternCacheSize == null) {
            patternCacheSize = MessagePatternParser.DEFAULT_CACHE_SIZE;
        }
        if (store == null) {
            store = new Store(null, null);
        }
    }

    /**
     * 标签存储定义。
     *
     * @param type    存储类型，如 "memory"、"jdbc"，不区分大小写，默认 "memory"
     * @param options 存储初始化选项，具体选项取决于存储类型
     */
    public record Store(String type, Map<String, String> options) {

        public Store {
            if (type == null || type.isBlank()) {
                type = "memory";
            }
            options = options == null ? Map.of() : Map.copyOf(options);
        }
    }
}
