package org.cassowary.constants.expressions.scalar;

import lombok.Getter;
import org.cassowary.constants.core.Constant;
import org.cassowary.constants.expressions.ArithmeticOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 只由字面量和常量引用构成的算术表达式树 (+ - * /)。
 * 节点一旦创建就不可变；重新定义常量时总是构建一棵新树。
 * 求值没有副作用，也不做缓存，缓存由常量表负责。
 */
public abstract class ScalarExpression {

    private static final Logger logger = LoggerFactory.getLogger(ScalarExpression.class);

    ScalarExpression() {
    }

    // --- 工厂方法 ---

    public static ScalarExpression literal(double value) {
        return new Literal(value);
    }

    public static ScalarExpression ref(Constant constant) {
        return new ConstantRef(constant);
    }

    public static ScalarExpression binary(ArithmeticOperator operator, ScalarExpression left, ScalarExpression right) {
        return new Binary(operator, left, right);
    }

    public ScalarExpression add(ScalarExpression other) {
        return binary(ArithmeticOperator.ADD, this, other);
    }

    public ScalarExpression subtract(ScalarExpression other) {
        return binary(ArithmeticOperator.SUB, this, other);
    }

    public ScalarExpression multiply(ScalarExpression other) {
        return binary(ArithmeticOperator.MUL, this, other);
    }

    public ScalarExpression divide(ScalarExpression other) {
        return binary(ArithmeticOperator.DIV, this, other);
    }

    // --- 求值 ---

    /**
     * 在给定的常量查询下计算表达式的值。
     * 二元节点先求左子树，出错立即返回。
     *
     * @param lookup 常量查询。
     * @return 表达式的值。
     * @throws EvaluationException 引用了未解析的常量，或除数为零。
     */
    public abstract double evaluate(ConstantLookup lookup) throws EvaluationException;

    /**
     * @return 表达式中直接出现的所有常量，按 ID 排序。
     */
    public SortedSet<Constant> referencedConstants() {
        SortedSet<Constant> result = new TreeSet<>();
        collectConstants(result);
        return Collections.unmodifiableSortedSet(result);
    }

    abstract void collectConstants(Set<Constant> into);

    // --- 节点 ---

    @Getter
    public static final class Literal extends ScalarExpression {

        private final double value;

        private Literal(double value) {
            if (!Double.isFinite(value)) {
                logger.error("ScalarExpression.Literal: 字面量必须是有限数，收到 {}", value);
                throw new IllegalArgumentException("字面量必须是有限数: " + value);
            }
            this.value = value;
        }

        @Override
        public double evaluate(ConstantLookup lookup) {
            return value;
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
            return Double.compare(value, ((Literal) o).value) == 0;
        }

        @Override
        public int hashCode() {
            return Double.hashCode(value);
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    @Getter
    public static final class ConstantRef extends ScalarExpression {

        private final Constant constant;

        private ConstantRef(Constant constant) {
            this.constant = Objects.requireNonNull(constant, "Constant cannot be null");
        }

        @Override
        public double evaluate(ConstantLookup lookup) throws EvaluationException {
            OptionalDouble value = lookup.valueOf(constant);
            if (value.isEmpty()) {
                logger.debug("求值时常量 {} 尚未解析", constant);
                throw EvaluationException.unresolved(constant);
            }
            return value.getAsDouble();
        }

        @Override
        void collectConstants(Set<Constant> into) {
            into.add(constant);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (o == null || getClass() != o.getClass()) {
                return false;
            }
            return constant.equals(((ConstantRef) o).constant);
        }

        @Override
        public int hashCode() {
            return constant.hashCode();
        }

        @Override
        public String toString() {
            return constant.getLabel();
        }
    }

    @Getter
    public static final class Binary extends ScalarExpression {

        private final ArithmeticOperator operator;
        private final ScalarExpression left;
        private final ScalarExpression right;
        private final int hashCode;

        private Binary(ArithmeticOperator operator, ScalarExpression left, ScalarExpression right) {
            this.operator = Objects.requireNonNull(operator, "Operator cannot be null");
            this.left = Objects.requireNonNull(left, "Left operand cannot be null");
            this.right = Objects.requireNonNull(right, "Right operand cannot be null");
            this.hashCode = Objects.hash(operator, left, right);
        }

        @Override
        public double evaluate(ConstantLookup lookup) throws EvaluationException {
            double l = left.evaluate(lookup);
            double r = right.evaluate(lookup);
            if (operator == ArithmeticOperator.DIV && r == 0.0) {
                throw EvaluationException.divisionByZero(right);
            }
            return operator.apply(l, r);
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
