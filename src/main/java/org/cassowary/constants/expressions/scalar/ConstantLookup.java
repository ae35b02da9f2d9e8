package org.cassowary.constants.expressions.scalar;

import org.cassowary.constants.core.Constant;

import java.util.OptionalDouble;

/**
 * 求值时查询常量当前值的回调。未解析的常量返回 {@link OptionalDouble#empty()}。
 */
@FunctionalInterface
public interface ConstantLookup {

    OptionalDouble valueOf(Constant constant);
}
