package org.cassowary.constants.expressions.linear;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.RealSort;
import lombok.Getter;
import org.cassowary.constants.core.Constant;
import org.cassowary.constants.core.Strength;
import org.cassowary.constants.core.Variable;
import org.cassowary.constants.expressions.RelationType;
import org.cassowary.constants.expressions.ToZ3BoolExpr;
import org.cassowary.constants.symbolic.Z3VariableManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 交给求解器的线性约束，规范化为 Σ coeff_i * var_i + offset ~ 0 的形式。
 * 至少包含一个非零系数的项；同时记录它由哪些常量代入而来，以及代入前的原始约束，
 * 以便常量变化后重新线性化。
 * 此类是不可变的。
 */
@Getter
public final class LinearConstraint implements ToZ3BoolExpr {

    private static final Logger logger = LoggerFactory.getLogger(LinearConstraint.class);

    // 规范化后的形式：expression ~ 0
    private final LinearExpression expression;
    private final RelationType relation;
    private final Strength strength;
    private final SortedSet<Constant> sourceConstants;
    private final ConstraintDefinition definition;

    private final int hashCode;

    private LinearConstraint(LinearExpression expression, RelationType relation, Strength strength,
                             Set<Constant> sourceConstants, ConstraintDefinition definition) {
        this.expression = Objects.requireNonNull(expression, "LinearConstraint-构造函数: expression 不能为 null");
        this.relation = Objects.requireNonNull(relation, "LinearConstraint-构造函数: relation 不能为 null");
        this.strength = Objects.requireNonNull(strength, "LinearConstraint-构造函数: strength 不能为 null");
        this.sourceConstants = Collections.unmodifiableSortedSet(
                new TreeSet<>(Objects.requireNonNull(sourceConstants, "LinearConstraint-构造函数: sourceConstants 不能为 null")));
        this.definition = Objects.requireNonNull(definition, "LinearConstraint-构造函数: definition 不能为 null");
        if (expression.isConstant()) {
            logger.error("LinearConstraint-构造函数: 约束 {} 不含任何变量项", definition);
            throw new IllegalArgumentException("线性约束至少需要一个非零系数的变量项: " + definition);
        }
        this.hashCode = Objects.hash(expression, relation, strength);
    }

    /**
     * 工厂方法：创建 LinearConstraint 实例。
     * @param expression 规范化后的左侧 (lhs - rhs)。
     * @param relation 关系类型。
     * @param strength 强度，原样传给求解器。
     * @param sourceConstants 线性化时消耗的常量。
     * @param definition 代入前的原始约束。
     * @return LinearConstraint 实例。
     * @throws IllegalArgumentException 如果 expression 不含变量项。
     */
    public static LinearConstraint of(LinearExpression expression, RelationType relation, Strength strength,
                                      Set<Constant> sourceConstants, ConstraintDefinition definition) {
        return new LinearConstraint(expression, relation, strength, sourceConstants, definition);
    }

    /**
     * @return 按变量 ID 排序的项。
     */
    public List<LinearTerm> getTerms() {
        return expression.terms();
    }

    /**
     * @return 常数偏移。
     */
    public double getOffset() {
        return expression.getConstant();
    }

    public double coefficientOf(Variable variable) {
        return expression.coefficientOf(variable);
    }

    @Override
    public BoolExpr toZ3BoolExpr(Context ctx, Z3VariableManager varManager) {
        ArithExpr<RealSort> z3LeftExpr = expression.toZ3ArithExpr(ctx, varManager);
        ArithExpr<RealSort> z3Zero = ctx.mkReal(0);

        return switch (relation) {
            case EQ -> ctx.mkEq(z3LeftExpr, z3Zero);
            case LE -> ctx.mkLe(z3LeftExpr, z3Zero);
            case GE -> ctx.mkGe(z3LeftExpr, z3Zero);
        };
    }

    // --- Object 方法 ---
    // 只比较求解器可见的部分：表达式、关系与强度
    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LinearConstraint that = (LinearConstraint) o;
        return relation == that.relation && expression.equals(that.expression) && strength.equals(that.strength);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return expression.toString() + " " + relation.getSymbol() + " 0";
    }
}
