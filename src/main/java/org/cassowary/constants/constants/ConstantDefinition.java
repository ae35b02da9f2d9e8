package org.cassowary.constants.constants;

import lombok.Getter;
import org.cassowary.constants.core.Constant;
import org.cassowary.constants.expressions.scalar.ScalarExpression;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedSet;

/**
 * 常量的定义：未设置、字面量或公式。不可变。
 */
@Getter
public final class ConstantDefinition {

    public enum Kind {
        UNSET,
        LITERAL,
        FORMULA
    }

    public static final ConstantDefinition UNSET = new ConstantDefinition(Kind.UNSET, 0.0, null);

    private final Kind kind;
    private final double literal;
    /**
     * 仅当 kind 为 FORMULA 时非空。
     */
    private final ScalarExpression formula;

    private ConstantDefinition(Kind kind, double literal, ScalarExpression formula) {
        this.kind = kind;
        this.literal = literal;
        this.formula = formula;
    }

    public static ConstantDefinition literal(double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("常量值必须是有限数: " + value);
        }
        return new ConstantDefinition(Kind.LITERAL, value, null);
    }

    /**
     * 由标量表达式创建定义。单个字面量节点按字面量处理。
     */
    public static ConstantDefinition of(ScalarExpression expression) {
        Objects.requireNonNull(expression, "Expression cannot be null");
        if (expression instanceof ScalarExpression.Literal) {
            return literal(((ScalarExpression.Literal) expression).getValue());
        }
        return new ConstantDefinition(Kind.FORMULA, 0.0, expression);
    }

    /**
     * @return 公式直接引用的常量；字面量与未设置时为空集。
     */
    public SortedSet<Constant> referencedConstants() {
        if (kind != Kind.FORMULA) {
            return Collections.emptySortedSet();
        }
        return formula.referencedConstants();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ConstantDefinition that = (ConstantDefinition) o;
        return kind == that.kind && Double.compare(literal, that.literal) == 0 && Objects.equals(formula, that.formula);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, literal, formula);
    }

    @Override
    public String toString() {
        return switch (kind) {
            case UNSET -> "<unset>";
            case LITERAL -> Double.toString(literal);
            case FORMULA -> formula.toString();
        };
    }
}
