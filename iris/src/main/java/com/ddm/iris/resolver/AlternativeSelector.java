package com.ddm.iris.resolver;

import java.util.List;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * 从变体的候选文案中选取一条。
 *
 * <p>默认实现 {@link #random()} 基于 {@link ThreadLocalRandom}，近似均匀分布；
 * 测试中使用 {@link #seeded(long)} 获得可复现的选择序列。
 *
 * @author liyifei
 * @since 1.0
 */
@FunctionalInterface
public interface AlternativeSelector {

    /**
     * 选择一条候选文案。
     *
     * @param alternatives 非空候选列表
     * @return 选中的文案
     */
    String choose(List<String> alternatives);

    static AlternativeSelector random() {
        return alternatives -> alternatives.size() == 1
                ? alternatives.get(0)
                : alternatives.get(ThreadLocalRandom.current().nextInt(alternatives.size()));
    }

    /**
     * 固定种子的选择器，相同种子与调用顺序得到相同结果。
     */
    static AlternativeSelector seeded(long seed) {
        Random random = new Random(seed);
        return alternatives -> alternatives.get(random.nextInt(alternatives.size()));
    }
}
