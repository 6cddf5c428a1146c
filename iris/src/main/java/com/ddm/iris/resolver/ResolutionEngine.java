package com.ddm.iris.resolver;

import com.ddm.iris.defined.I18nContext;
import com.ddm.iris.defined.Label;
import com.ddm.iris.defined.LabelRef;
import com.ddm.iris.defined.LabelValue;
import com.ddm.iris.defined.LocalizedLabel;
import com.ddm.iris.defined.ResolvedPattern;

import java.util.List;

/**
 * 标签解析引擎：按特异性查找本地化变体，首次使用时创建标签，并选取一条候选文案。
 *
 * <p><strong>查找顺序：</strong>
 * <ol>
 *   <li>请求语言下的 (L,C,I) → (L,C,∅) → (L,∅,I) → (L,∅,∅)</li>
 *   <li>标签默认语言下的同样四个槽位</li>
 *   <li>都不存在时使用标签的默认文案</li>
 * </ol>
 *
 * @author liyifei
 * @see DefaultResolutionEngine
 * @since 1.0
 */
public interface ResolutionEngine {

    /**
     * 解析标签。
     *
     * @param ref         标签引用
     * @param category    对话单元，仅作为创建时的元数据，可为 null
     * @param defaultText 默认文案，首次使用时写入
     * @param ctx         请求上下文
     * @param defaultI18n 首次创建时额外写入的默认变体
     * @param derivedKey  键是否由文案推导；仅推导键会做冲突检测
     * @return 解析结果
     * @throws com.ddm.iris.exception.StoreUnavailableException 如果存储不可用
     */
    ResolvedPattern resolve(LabelRef ref, String category, String defaultText, I18nContext ctx,
                            List<LocalizedLabel> defaultI18n, boolean derivedKey);

    /**
     * 按显式键解析，不带额外默认变体。
     */
    default ResolvedPattern resolve(LabelRef ref, String defaultText, I18nContext ctx) {
        return resolve(ref, null, defaultText, ctx, List.of(), false);
    }

    /**
     * 按调用方的标签描述解析。
     *
     * @param ref 由 {@link com.ddm.iris.key.KeyDeriver} 得到的引用
     */
    default ResolvedPattern resolve(LabelValue value, LabelRef ref, I18nContext ctx) {
        return resolve(ref, value.category(), value.defaultText(), ctx, value.defaultI18n(),
                !value.hasExplicitKey());
    }

    /**
     * 保存（新增或替换）变体，管理端编辑路径。
     */
    void saveVariant(LabelRef ref, LocalizedLabel variant);

    /**
     * 整体保存标签，管理端编辑路径。
     */
    void saveLabel(Label label);
}
