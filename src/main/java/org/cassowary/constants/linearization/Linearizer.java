package org.cassowary.constants.linearization;

import org.cassowary.constants.constants.ConstantTable;
import org.cassowary.constants.expressions.ArithmeticOperator;
import org.cassowary.constants.expressions.linear.ConstraintDefinition;
import org.cassowary.constants.expressions.linear.ConstraintExpression;
import org.cassowary.constants.expressions.linear.LinearConstraint;
import org.cassowary.constants.expressions.linear.LinearExpression;
import org.cassowary.constants.expressions.scalar.EvaluationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 把同时引用常量和决策变量的约束转换成 Σ coeff_i * var_i + offset ~ 0。
 *
 * <p>递归下降，每个子树要么是常量（代入当前解析值），要么是线性的。
 * 两个含变量的子式相乘、或除数含变量，都视为非线性而拒绝。
 * 除了常量表的引用外不持有任何状态。
 */
public class Linearizer {

    private static final Logger logger = LoggerFactory.getLogger(Linearizer.class);

    private final ConstantTable table;
    private final double zeroTolerance;
    private final double satisfactionTolerance;

    public Linearizer(ConstantTable table) {
        this(table, 0.0, 1e-9);
    }

    /**
     * @param table 常量表。
     * @param zeroTolerance 合并后绝对值不超过此值的系数视为零。
     * @param satisfactionTolerance 判断只剩常数的关系是否成立时使用的容差。
     */
    public Linearizer(ConstantTable table, double zeroTolerance, double satisfactionTolerance) {
        this.table = Objects.requireNonNull(table, "Constant table cannot be null");
        if (zeroTolerance < 0 || satisfactionTolerance < 0) {
            throw new IllegalArgumentException("容差不能为负数");
        }
        this.zeroTolerance = zeroTolerance;
        this.satisfactionTolerance = satisfactionTolerance;
    }

    /**
     * 线性化一条约束：两侧分别线性化后移项为 lhs - rhs ~ 0。
     *
     * @param definition 原始约束。
     * @return 至少含一个变量项的线性约束，记录了所用的常量和原始约束。
     * @throws LinearizeException 非线性、引用未解析常量、除零、系数溢出，或消去后不含变量。
     */
    public LinearConstraint linearize(ConstraintDefinition definition) throws LinearizeException {
        Objects.requireNonNull(definition, "Constraint definition cannot be null");
        LinearExpression left = toLinear(definition.getLeft());
        LinearExpression right = toLinear(definition.getRight());
        LinearExpression difference = left.subtract(right);
        // 无穷大与 NaN 在合并、缩放后仍然非有限，只需在过滤容差之前检查一次
        if (!difference.isFinite()) {
            logger.warn("约束 {} 线性化后含有非有限数: {}", definition, difference);
            throw LinearizeException.nonFinite(definition, difference);
        }
        LinearExpression normalized = difference.withoutNegligibleTerms(zeroTolerance);

        if (normalized.isConstant()) {
            double offset = normalized.getConstant();
            if (definition.getRelation().holdsFor(offset, satisfactionTolerance)) {
                logger.warn("约束 {} 消去后不含变量，常数关系恒成立", definition);
                throw LinearizeException.noVariables(definition);
            }
            logger.warn("约束 {} 消去后不含变量，常数关系恒不成立: {} {} 0",
                    definition, offset, definition.getRelation().getSymbol());
            throw LinearizeException.triviallyUnsatisfiable(definition, offset);
        }

        LinearConstraint result = LinearConstraint.of(normalized, definition.getRelation(), definition.getStrength(),
                definition.referencedConstants(), definition);
        logger.debug("线性化 {} => {}", definition, result);
        return result;
    }

    private LinearExpression toLinear(ConstraintExpression expression) throws LinearizeException {
        if (expression instanceof ConstraintExpression.VariableRef) {
            return LinearExpression.of(((ConstraintExpression.VariableRef) expression).getVariable());
        }
        if (expression instanceof ConstraintExpression.Scalar) {
            return LinearExpression.of(evaluate((ConstraintExpression.Scalar) expression));
        }
        ConstraintExpression.Binary binary = (ConstraintExpression.Binary) expression;
        ConstraintExpression leftExpr = binary.getLeft();
        ConstraintExpression rightExpr = binary.getRight();
        ArithmeticOperator operator = binary.getOperator();

        switch (operator) {
            case ADD:
                return toLinear(leftExpr).add(toLinear(rightExpr));
            case SUB:
                return toLinear(leftExpr).subtract(toLinear(rightExpr));
            case MUL:
                if (leftExpr.containsVariable() && rightExpr.containsVariable()) {
                    logger.debug("拒绝非线性乘积 {}", binary);
                    throw LinearizeException.nonlinear(binary);
                }
                if (leftExpr.containsVariable()) {
                    return toLinear(leftExpr).scale(toLinear(rightExpr).getConstant());
                }
                return toLinear(rightExpr).scale(toLinear(leftExpr).getConstant());
            case DIV:
                if (rightExpr.containsVariable()) {
                    logger.debug("拒绝除数含变量的表达式 {}", binary);
                    throw LinearizeException.nonlinear(binary);
                }
                double divisor = toLinear(rightExpr).getConstant();
                if (divisor == 0.0) {
                    throw LinearizeException.divisionByZero(rightExpr, null);
                }
                return toLinear(leftExpr).scale(1.0 / divisor);
            default:
                logger.error("Linearizer: 未知运算符 {}", operator);
                throw new IllegalStateException("未知运算符: " + operator);
        }
    }

    private double evaluate(ConstraintExpression.Scalar scalar) throws LinearizeException {
        try {
            return scalar.getExpression().evaluate(table::valueOf);
        } catch (EvaluationException e) {
            if (e.getReason() == EvaluationException.Reason.DIVISION_BY_ZERO) {
                throw LinearizeException.divisionByZero(scalar, e);
            }
            throw LinearizeException.unresolvedConstant(e.getConstant(), e);
        }
    }
}
