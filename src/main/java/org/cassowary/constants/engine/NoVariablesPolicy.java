package org.cassowary.constants.engine;

/**
 * 约束消去后不含变量、且常数关系恒成立时的处理方式。
 * 恒不成立的情况总是报错，不受此策略影响。
 */
public enum NoVariablesPolicy {
    /** 抛出 NO_VARIABLES。 */
    REJECT,
    /** 记录警告，不安装任何约束。 */
    IGNORE
}
