package org.cassowary.constants.expressions.linear;

import lombok.Getter;
import org.cassowary.constants.core.Constant;
import org.cassowary.constants.core.Variable;
import org.cassowary.constants.expressions.ArithmeticOperator;
import org.cassowary.constants.expressions.scalar.ScalarExpression;

import java.util.*;

/**
 * 约束一侧的表达式树：在 {@link ScalarExpression} 的基础上增加决策变量叶子。
 * 常量与变量的区分在构造时就由节点类型确定，线性化时只需判断一次。
 * 不可变。
 */
public abstract class ConstraintExpression {

    ConstraintExpression() {
    }

    // --- 工厂方法 ---

    public static ConstraintExpression of(Variable variable) {
        return new VariableRef(variable);
    }

    public static ConstraintExpression of(Constant constant) {
        return new Scalar(ScalarExpression.ref(constant));
    }

    public static ConstraintExpression of(double value) {
        return new Scalar(ScalarExpression.literal(value));
    }

    public static ConstraintExpression of(ScalarExpression scalar) {
        return new Scalar(scalar);
    }

    public static ConstraintExpression binary(ArithmeticOperator operator, ConstraintExpression left, ConstraintExpression right) {
        return new Binary(operator, left, right);
    }

    public ConstraintExpression add(ConstraintExpression other) {
        return binary(ArithmeticOperator.ADD, this, other);
    }

    public ConstraintExpression add(Variable variable) {
        return add(of(variable));
    }

    public ConstraintExpression add(double value) {
        return add(of(value));
    }

    public ConstraintExpression subtract(ConstraintExpression other) {
        return binary(ArithmeticOperator.SUB, this, other);
    }

    public ConstraintExpression subtract(Variable variable) {
        return subtract(of(variable));
    }

    public ConstraintExpression subtract(double value) {
        return subtract(of(value));
    }

    public ConstraintExpression multiply(ConstraintExpression other) {
        return binary(ArithmeticOperator.MUL, this, other);
    }

    public ConstraintExpression multiply(Constant constant) {
        return multiply(of(constant));
    }

    public ConstraintExpression multiply(double value) {
        return multiply(of(value));
    }

    public ConstraintExpression divide(ConstraintExpression other) {
        return binary(ArithmeticOperator.DIV, this, other);
    }

    public ConstraintExpression divide(Constant constant) {
        return divide(of(constant));
    }

    public ConstraintExpression divide(double value) {
        return divide(of(value));
    }

    /**
     * @return 子树中是否出现决策变量。
     */
    public abstract boolean containsVariable();

    /**
     * @return 子树中出现的所有常量，按 ID 排序。
     */
    public SortedSet<Constant> referencedConstants() {
        SortedSet<Constant> result = new TreeSet<>();
        collectConstants(result);
        return Collections.unmodifiableSortedSet(result);
    }

    abstract void collectConstants(Set<Constant> into);

    // --- 节点 ---

    /**
     * 不含变量的叶子，包装一棵标量表达式。
     */
    @Getter
    public static final class Scalar extends ConstraintExpression {

        private final ScalarExpression expression;

        private Scalar(ScalarExpression expression) {
            this.expression = Objects.requireNonNull(expression, "Scalar expression cannot be null");
        }

        @Override
        public boolean containsVariable() {
            return false;
        }

        @Override
        void collectConstants(Set<Constant> into) {
            into.addAll(expression.referencedConstants());
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            return expression.equals(((Scalar) o).expression);
        }

        @Override
        public int hashCode() {
            return expression.hashCode();
        }

        @Override
        public String toString() {
            return expression.toString();
        }
    }

    @Getter
    public static final class VariableRef extends ConstraintExpression {

        private final Variable variable;

        private VariableRef(Variable variable) {
            this.variable = Objects.requireNonNull(variable, "Variable cannot be null");
        }

        @Override
        public boolean containsVariable() {
            return true;
        }

        @Override
        void collectConstants(Set<Constant> into) {
            // 没有常量
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            return variable.equals(((VariableRef) o).variable);
        }

        @Override
        public int hashCode() {
            return variable.hashCode();
        }

        @Override
        public String toString() {
            return variable.getName();
        }
    }

    @Getter
    public static final class Binary extends ConstraintExpression {

        private final ArithmeticOperator operator;
        private final ConstraintExpression left;
        private final ConstraintExpression right;
        private final boolean containsVariable;
        private final int hashCode;

        private Binary(ArithmeticOperator operator, ConstraintExpression left, ConstraintExpression right) {
            this.operator = Objects.requireNonNull(operator, "Operator cannot be null");
            this.left = Objects.requireNonNull(left, "Left operand cannot be null");
            this.right = Objects.requireNonNull(right, "Right operand cannot be null");
            this.containsVariable = left.containsVariable() || right.containsVariable();
            this.hashCode = Objects.hash(operator, left, right);
        }

        @Override
        public boolean containsVariable() {
            return containsVariable;
        }

        @Override
        void collectConstants(Set<Constant> into) {
            left.collectConstants(into);
            right.collectConstants(into);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            Binary that = (Binary) o;
            return operator == that.operator && left.equals(that.left) && right.equals(that.right);
        }

        @Override
        public int hashCode() {
            return hashCode;
        }

        @Override
        public String toString() {
            return "(" + left + " " + operator.getSymbol() + " " + right + ")";
        }
    }
}
