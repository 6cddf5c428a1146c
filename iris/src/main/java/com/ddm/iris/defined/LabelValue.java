package com.ddm.iris.defined;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 调用方描述一次标签使用的值对象。
 * <p>
 * 两种构造方式：
 * <ul>
 *   <li>{@link #of(String, String, String, Object...)}：由 (namespace, category, 文案) 推导键</li>
 *   <li>{@link #ofKey(String, String, String, Object...)}：显式指定键，避免推导冲突</li>
 * </ul>
 *
 * <p><strong>使用示例：</strong>
 * <pre>{@code
 * LabelValue hello = LabelValue.of("travel", "greetings", "Hello {0}!", user.name());
 * LabelValue cancel = LabelValue.ofKey("travel", "booking_cancelled", "Your booking is cancelled.")
 *         .withDefaultI18n(LocalizedLabel.of(new VariantSlot(Locale.ENGLISH, null, InterfaceType.VOICE),
 *                 false, "Okay, I cancelled your booking."));
 * }</pre>
 *
 * <p><strong>注意：</strong>参数必须通过占位符 {@code {0}} 传入，不能预先用字符串拼接，
 * 否则不同运行期取值会共享同一个键与同一份译文。确实无法模板化的文本请使用
 * {@link com.ddm.iris.render.Renderer#raw}。
 *
 * @param namespace   命名空间
 * @param category    对话单元，仅用于键推导，可为 null
 * @param defaultText 默认文案（消息模式）
 * @param explicitKey 显式键，可为 null
 * @param defaultI18n 首次创建时额外写入的默认变体
 * @param args        位置参数
 * @author liyifei
 */
public record LabelValue(String namespace,
                         String category,
                         String defaultText,
                         String explicitKey,
                         List<LocalizedLabel> defaultI18n,
                         List<Object> args) {

    public LabelValue {
        Objects.requireNonNull(defaultText, "defaultText cannot be null");
        defaultI18n = defaultI18n == null ? List.of() : List.copyOf(defaultI18n);
        // 参数允许 null 元素，不能使用 List.copyOf
        args = args == null ? List.of() : Collections.unmodifiableList(Arrays.asList(args.toArray()));
    }

    public static LabelValue of(String namespace, String category, String defaultText, Object... args) {
        return new LabelValue(namespace, category, defaultText, null, List.of(), asList(args));
    }

    public static LabelValue ofKey(String namespace, String key, String defaultText, Object... args) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("explicit key must not be blank");
        }
        return new LabelValue(namespace, null, defaultText, key, List.of(), asList(args));
    }

    public LabelValue withDefaultI18n(LocalizedLabel... variants) {
        return new LabelValue(namespace, category, defaultText, explicitKey, List.of(variants), args);
    }

    public boolean hasExplicitKey() {
        return explicitKey != null && !explicitKey.isBlank();
    }

    private static List<Object> asList(Object[] args) {
        return args == null ? List.of() : Arrays.asList(args);
    }
}
