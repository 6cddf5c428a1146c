package com.ddm.iris.defined;

/**
 * 标签引用，唯一标识一个可翻译标签的逻辑主键。
 * <p>
 * 标签引用由两个字段组成：
 * <ul>
 *   <li><strong>namespace</strong>：命名空间，用于隔离不同应用（机器人部署）的标签</li>
 *   <li><strong>key</strong>：标签键，显式指定或由 {@link com.ddm.iris.key.KeyDeriver} 推导</li>
 * </ul>
 *
 * <p>标签引用不包含文案、变体等数据信息，仅作为标签的坐标。
 * 通过标签引用可以从 {@link com.ddm.iris.provider.LabelStore} 获取对应的 {@link Label}。
 *
 * <p><strong>唯一性规则：</strong>(namespace, key) 二元组在存储中唯一。
 *
 * @param namespace 命名空间，不能为空白
 * @param key       标签键，不能为空白
 * @author liyifei
 * @see Label
 * @since 1.0
 */
public record LabelRef(String namespace, String key) {

    public LabelRef {
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("namespace must not be blank");
        }
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("key must not be blank");
        }
    }

    @Override
    public String toString() {
        return namespace + ":" + key;
    }
}
