package com.ddm.iris.resolver;

import com.ddm.iris.defined.LabelRef;

/**
 * 推导键冲突：两段归一化后不同的文案推导出了同一个键。
 *
 * @param ref          冲突的标签引用
 * @param storedText   存储中的默认文案
 * @param incomingText 本次调用传入的默认文案
 * @author liyifei
 */
public record KeyCollision(LabelRef ref, String storedText, String incomingText) {
}
