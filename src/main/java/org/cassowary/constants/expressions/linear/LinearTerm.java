package org.cassowary.constants.expressions.linear;

import lombok.Getter;
import org.cassowary.constants.core.Variable;

import java.util.Objects;

/**
 * 线性形式中的一项 coefficient * variable。
 */
@Getter
public final class LinearTerm {

    private final Variable variable;
    private final double coefficient;

    private LinearTerm(Variable variable, double coefficient) {
        this.variable = Objects.requireNonNull(variable, "Variable cannot be null");
        this.coefficient = coefficient;
    }

    public static LinearTerm of(Variable variable, double coefficient) {
        return new LinearTerm(variable, coefficient);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LinearTerm that = (LinearTerm) o;
        return Double.compare(coefficient, that.coefficient) == 0 && variable.equals(that.variable);
    }

    @Override
    public int hashCode() {
        return Objects.hash(variable, coefficient);
    }

    @Override
    public String toString() {
        return coefficient + "*" + variable.getName();
    }
}
