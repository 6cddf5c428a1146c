package com.ddm.iris.render;

import com.ddm.iris.defined.I18nContext;
import com.ddm.iris.defined.LabelRef;
import com.ddm.iris.defined.LabelValue;

import java.util.Locale;

/**
 * 标签渲染入口：推导键 → 解析变体 → 解析模式（缓存）→ 格式化。
 *
 * <p><strong>使用示例：</strong>
 * <pre>{@code
 * I18nContext ctx = new I18nContext(Locale.FRENCH, "messenger", InterfaceType.TEXT);
 * String text = renderer.render("travel", "booking", "You have {0} bookings", ctx, 3);
 * String fixed = renderer.renderKey("travel", "welcome", "Welcome!", ctx);
 * String raw = renderer.raw("Order #{0}", Locale.ENGLISH, orderId);
 * }</pre>
 *
 * <p>模式解析与格式化错误原样抛给调用方，不返回部分结果。
 *
 * @author liyifei
 * @see DefaultRenderer
 * @since 1.0
 */
public interface Renderer {

    /**
     * 以推导键渲染。
     *
     * @throws com.ddm.iris.exception.PatternParseException     如果模式语法错误
     * @throws com.ddm.iris.exception.PatternFormatException    如果参数缺失或类型不符
     * @throws com.ddm.iris.exception.StoreUnavailableException 如果存储不可用
     */
    String render(String namespace, String category, String defaultText, I18nContext ctx, Object... args);

    /**
     * 渲染调用方的标签描述，支持推导键与显式键。
     */
    String render(LabelValue value, I18nContext ctx);

    /**
     * 以显式键渲染。
     */
    String renderKey(String namespace, String explicitKey, String defaultText, I18nContext ctx, Object... args);

    /**
     * 直接格式化文本，不推导键、不访问存储，适用于无法模板化的文本。
     */
    String raw(String text, Locale locale, Object... args);

    /**
     * 返回标签描述对应的引用，供管理工具与测试使用。
     */
    LabelRef keyOf(LabelValue value);
}
