package com.ddm.iris.provider;

import com.ddm.iris.defined.Label;
import com.ddm.iris.defined.LabelRef;
import com.ddm.iris.defined.LocalizedLabel;
import com.ddm.iris.defined.VariantSlot;

import java.util.Map;

/**
 * 标签存储接口，负责标签与本地化变体的持久化（数据库、内存等）。
 *
 * <p>实现类通过 SPI（{@code META-INF/services/com.ddm.iris.provider.LabelStore}）注册，
 * 由 {@link #type()} 区分，使用前调用 {@link #init(Map)} 初始化。
 *
 * <p><strong>实现示例：</strong>
 * <pre>{@code
 * public class RedisLabelStore implements LabelStore {
 *     @Override
 *     public String type() {
 *         return "redis";
 *     }
 *
 *     @Override
 *     public void init(Map<String, String> options) {
 *         this.client = RedisClient.create(options.get("uri"));
 *     }
 *     ...
 * }
 * }</pre>
 *
 * <p><strong>注意事项：</strong>
 * <ul>
 *   <li>实现类必须线程安全，支持大量并发读</li>
 *   <li>{@link #upsertIfAbsent(Label)} 必须是原子的：同一 {@link LabelRef} 并发首次写入只能落库一份</li>
 *   <li>数据源故障时抛出 {@link IllegalStateException}（附带上下文），不要返回空结果掩盖故障</li>
 * </ul>
 *
 * @author liyifei
 * @since 1.0
 */
public interface LabelStore extends AutoCloseable {

    /**
     * 存储类型标识，如 "jdbc"、"memory"，不区分大小写。
     */
    String type();

    /**
     * 使用配置参数初始化存储。
     *
     * @param options 配置参数 Map（如 url、username、password 等）
     * @throws IllegalArgumentException 如果必填参数缺失
     * @throws IllegalStateException    如果初始化失败
     */
    void init(Map<String, String> options);

    /**
     * 按引用读取标签。
     *
     * @return 标签快照，不存在时返回 null
     */
    Label getLabel(LabelRef ref);

    /**
     * 原子地"不存在则创建"。
     *
     * @param label 待创建的标签
     * @return 存储中最终的标签：本次写入时返回传入的同一实例，否则返回已存在的标签
     */
    Label upsertIfAbsent(Label label);

    /**
     * 按精确槽位读取变体。
     *
     * @return 变体，标签或槽位不存在时返回 null
     */
    LocalizedLabel findVariant(LabelRef ref, VariantSlot slot);

    /**
     * 保存（新增或替换）变体，管理端编辑路径。
     *
     * @throws IllegalStateException 如果标签不存在或写入失败
     */
    void saveVariant(LabelRef ref, LocalizedLabel variant);

    /**
     * 整体保存标签（默认文案与全部变体），管理端编辑与导入路径。
     * <p>存储中已有而 label 中没有的变体将被删除。
     */
    void saveLabel(Label label);

    /**
     * 原子地替换默认文案：默认变体 {@code (defaultLocale,∅,∅)} 未校验（或不存在）时，
     * 将默认文案与该变体替换为 {@code defaultText}（未校验），其它变体保持不变。
     * <p>是否已校验以存储中的当前状态为准；已校验时不做任何写入。
     *
     * @return 是否发生替换
     * @throws IllegalStateException 如果标签不存在或写入失败
     */
    boolean replaceDefaultText(LabelRef ref, String defaultText);

    /**
     * 关闭存储，释放相关资源。默认实现为空操作。
     */
    @Override
    default void close() {
        // 默认无操作，由具体实现类重写
    }
}
