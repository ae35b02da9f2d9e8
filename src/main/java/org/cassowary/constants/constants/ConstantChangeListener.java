package org.cassowary.constants.constants;

import org.cassowary.constants.core.Constant;

import java.util.OptionalDouble;

/**
 * 常量值变化通知。只在值确实改变时触发；重复设置相同的值不会通知。
 */
@FunctionalInterface
public interface ConstantChangeListener {

    void constantChanged(Constant constant, OptionalDouble oldValue, OptionalDouble newValue);
}
