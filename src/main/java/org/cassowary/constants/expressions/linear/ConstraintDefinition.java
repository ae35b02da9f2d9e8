package org.cassowary.constants.expressions.linear;

import lombok.Getter;
import org.cassowary.constants.core.Constant;
import org.cassowary.constants.core.Strength;
import org.cassowary.constants.expressions.RelationType;

import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 调用方提交的原始约束 lhs ~ rhs，常量尚未代入。
 * 保存下来以便常量更新后无需调用方重新提交就能重新线性化。
 */
@Getter
public final class ConstraintDefinition {

    private final ConstraintExpression left;
    private final RelationType relation;
    private final ConstraintExpression right;
    private final Strength strength;

    private ConstraintDefinition(ConstraintExpression left, RelationType relation, ConstraintExpression right, Strength strength) {
        this.left = Objects.requireNonNull(left, "ConstraintDefinition-构造函数: left 表达式不能为 null");
        this.relation = Objects.requireNonNull(relation, "ConstraintDefinition-构造函数: relation 不能为 null");
        this.right = Objects.requireNonNull(right, "ConstraintDefinition-构造函数: right 表达式不能为 null");
        this.strength = Objects.requireNonNull(strength, "ConstraintDefinition-构造函数: strength 不能为 null");
    }

    public static ConstraintDefinition of(ConstraintExpression left, RelationType relation, ConstraintExpression right, Strength strength) {
        return new ConstraintDefinition(left, relation, right, strength);
    }

    public static ConstraintDefinition of(ConstraintExpression left, RelationType relation, ConstraintExpression right) {
        return new ConstraintDefinition(left, relation, right, Strength.REQUIRED);
    }

    /**
     * @return 两侧出现的所有常量。
     */
    public SortedSet<Constant> referencedConstants() {
        SortedSet<Constant> result = new TreeSet<>(left.referencedConstants());
        result.addAll(right.referencedConstants());
        return result;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        ConstraintDefinition that = (ConstraintDefinition) o;
        return left.equals(that.left) && relation == that.relation
                && right.equals(that.right) && strength.equals(that.strength);
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, relation, right, strength);
    }

    @Override
    public String toString() {
        return left + " " + relation.getSymbol() + " " + right + " [" + strength + "]";
    }
}
