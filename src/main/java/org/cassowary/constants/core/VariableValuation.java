package org.cassowary.constants.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 一次求解之后各决策变量的取值。不可变。
 */
@Getter
public final class VariableValuation {

    private static final Logger logger = LoggerFactory.getLogger(VariableValuation.class);

    public static final VariableValuation EMPTY = new VariableValuation(Collections.emptyMap());

    private final SortedMap<Variable, Double> values;

    private VariableValuation(Map<Variable, Double> values) {
        this.values = Collections.unmodifiableSortedMap(new TreeMap<>(values));
    }

    public static VariableValuation of(Map<Variable, Double> values) {
        Objects.requireNonNull(values, "Values map cannot be null");
        logger.debug("创建 VariableValuation: {}", values);
        return new VariableValuation(values);
    }

    /**
     * 获取指定变量的值。
     * @param variable 变量。
     * @return 变量的取值。
     * @throws IllegalArgumentException 如果变量不在本次求解结果中。
     */
    public double getValue(Variable variable) {
        Double value = values.get(variable);
        if (value == null) {
            logger.error("尝试获取不存在的变量值：变量 '{}' 不存在于当前赋值 {} 中。", variable.getName(), this);
            throw new IllegalArgumentException("变量 '" + variable.getName() + "' 不存在于当前赋值中。");
        }
        return value;
    }

    public boolean contains(Variable variable) {
        return values.containsKey(variable);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        VariableValuation that = (VariableValuation) o;
        return values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(values);
    }

    @Override
    public String toString() {
        return "{" +
                values.entrySet().stream()
                        .map(entry -> entry.getKey().getName() + "=" + entry.getValue())
                        .collect(Collectors.joining(", ")) +
                "}";
    }
}
