package com.ddm.iris.key;

import com.ddm.iris.defined.LabelRef;
import com.ddm.iris.defined.LabelValue;

/**
 * 标签键推导器：将 (namespace, category, 默认文案, 显式键?) 映射为稳定的 {@link LabelRef}。
 *
 * <p><strong>约束：</strong>
 * <ul>
 *   <li>纯函数，无副作用，不访问存储</li>
 *   <li>相同输入永远得到相同的键</li>
 *   <li>显式键原样使用，由调用方保证命名空间内唯一</li>
 * </ul>
 *
 * @author liyifei
 * @see DefaultKeyDeriver
 * @since 1.0
 */
public interface KeyDeriver {

    /**
     * 推导标签引用。
     *
     * @param namespace   命名空间，不能为空白
     * @param category    对话单元，可为 null
     * @param defaultText 默认文案
     * @param explicitKey 显式键，可为 null；非空白时跳过推导
     * @return 标签引用
     * @throws IllegalArgumentException 如果 namespace 为空白
     */
    LabelRef derive(String namespace, String category, String defaultText, String explicitKey);

    /**
     * 归一化默认文案：去除占位符与插值数字，折叠空白。
     * <p>仅在插值内容上不同的文案归一化后相同。
     */
    String normalize(String defaultText);

    /**
     * 规范化默认文案，用于判断两段文案是否实为同一措辞：保留占位符原文，
     * 仅将占位符之外的数字统一并折叠空白。
     * <p>占位符不同的文案规范化结果不同；仅在插值数字上不同的文案规范化结果相同。
     */
    String canonicalize(String defaultText);

    default LabelRef derive(LabelValue value) {
        return derive(value.namespace(), value.category(), value.defaultText(), value.explicitKey());
    }
}
