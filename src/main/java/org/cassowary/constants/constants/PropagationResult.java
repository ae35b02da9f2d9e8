package org.cassowary.constants.constants;

import lombok.Getter;
import org.cassowary.constants.core.Constant;

import java.util.*;

/**
 * 一次成功的 set 调用的结果。
 * resolved 按解析顺序列出被重新求值的常量（被设置的常量在最前），
 * changed 是其中值确实改变的子集，warnings 记录依赖项重新解析时的非致命失败。
 */
@Getter
public final class PropagationResult {

    private final Constant origin;
    private final List<Constant> resolved;
    private final List<Constant> changed;
    private final Map<Constant, OptionalDouble> values;
    private final List<ConstantException> warnings;

    PropagationResult(Constant origin, List<Constant> resolved, List<Constant> changed,
                      Map<Constant, OptionalDouble> values, List<ConstantException> warnings) {
        this.origin = origin;
        this.resolved = List.copyOf(resolved);
        this.changed = List.copyOf(changed);
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
        this.warnings = List.copyOf(warnings);
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    public OptionalDouble valueOf(Constant constant) {
        return values.getOrDefault(constant, OptionalDouble.empty());
    }

    @Override
    public String toString() {
        return "PropagationResult{origin=" + origin + ", changed=" + changed + ", warnings=" + warnings.size() + "}";
    }
}
