package com.ddm.iris.exception;

import com.ddm.iris.defined.LabelRef;

/**
 * 标签存储不可用（读取失败，或首次创建冲突后重读仍失败）。
 *
 * @author liyifei
 */
public class StoreUnavailableException extends IllegalStateException {

    private final transient LabelRef ref;

    public StoreUnavailableException(String message, LabelRef ref, Throwable cause) {
        super(message, cause);
        this.ref = ref;
    }

    public LabelRef getRef() {
        return ref;
    }
}
