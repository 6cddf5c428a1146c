package com.ddm.iris.resolver;

/**
 * 推导键冲突监听器，用于告警或统计。
 * <p>回调在渲染线程中同步执行，实现应尽量轻量；抛出的异常只记录日志，不影响渲染。
 *
 * @author liyifei
 * @see KeyCollision
 */
@FunctionalInterface
public interface KeyCollisionListener {

    void onCollision(KeyCollision collision);
}
