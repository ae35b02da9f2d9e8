package org.cassowary.constants.expressions.linear;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.RealSort;
import lombok.Getter;
import org.cassowary.constants.core.Variable;
import org.cassowary.constants.core.VariableValuation;
import org.cassowary.constants.expressions.ToZ3ArithExpr;
import org.cassowary.constants.symbolic.Z3VariableManager;
import org.cassowary.constants.utils.Z3Numbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.stream.Collectors;

/**
 * 代表一个只包含决策变量的线性表达式，形式为 c1*v1 + c2*v2 + ... + const。
 * 常量在线性化时已被代入为数值，这里不再出现。
 */
@Getter
public final class LinearExpression implements ToZ3ArithExpr {

    private static final Logger logger = LoggerFactory.getLogger(LinearExpression.class);

    public static final LinearExpression ZERO = new LinearExpression(Collections.emptyMap(), 0.0);

    private final SortedMap<Variable, Double> coefficients;

    private final double constant;

    private final int hashCode;

    /**
     * 私有构造函数。系数恰好为零的变量会被过滤掉。
     * @param coefficients 变量到其系数的映射。
     * @param constant 常数项。
     */
    private LinearExpression(Map<Variable, Double> coefficients, double constant) {
        SortedMap<Variable, Double> tempCoefficients = new TreeMap<>();
        for (Map.Entry<Variable, Double> entry : Objects.requireNonNull(coefficients, "Coefficients map cannot be null").entrySet()) {
            Variable variable = Objects.requireNonNull(entry.getKey(), "Variable in coefficients map cannot be null");
            double coeff = Objects.requireNonNull(entry.getValue(), "Coefficient cannot be null");
            if (coeff != 0.0) {
                tempCoefficients.put(variable, coeff);
            }
        }
        this.coefficients = Collections.unmodifiableSortedMap(tempCoefficients);
        // -0.0 统一为 0.0
        this.constant = constant + 0.0;
        this.hashCode = Objects.hash(this.coefficients, this.constant);
        logger.debug("创建 LinearExpression: {}，常数项为{}", this.coefficients, this.constant);
    }

    public static LinearExpression of(Map<Variable, Double> coefficients, double constant) {
        return new LinearExpression(coefficients, constant);
    }

    /**
     * 工厂方法：创建只包含常数项的 LinearExpression 实例。
     */
    public static LinearExpression of(double constant) {
        return new LinearExpression(Collections.emptyMap(), constant);
    }

    /**
     * 工厂方法：创建只包含一个变量、系数为 1 的 LinearExpression 实例。
     */
    public static LinearExpression of(Variable variable) {
        return new LinearExpression(Map.of(variable, 1.0), 0.0);
    }

    public LinearExpression add(LinearExpression other) {
        Map<Variable, Double> newCoefficients = new HashMap<>(this.coefficients);
        other.coefficients.forEach((variable, value) -> newCoefficients.merge(variable, value, Double::sum));
        logger.debug("计算了{}和{}的和", this, other);
        return new LinearExpression(newCoefficients, this.constant + other.constant);
    }

    public LinearExpression subtract(LinearExpression other) {
        Map<Variable, Double> newCoefficients = new HashMap<>(this.coefficients);
        other.coefficients.forEach((variable, value) -> newCoefficients.merge(variable, -value, Double::sum));
        logger.debug("计算了{}和{}的差", this, other);
        return new LinearExpression(newCoefficients, this.constant - other.constant);
    }

    /**
     * 将所有系数和常数项乘以同一个标量。
     * @param factor 标量因子。
     * @return 缩放后的新 LinearExpression。
     */
    public LinearExpression scale(double factor) {
        Map<Variable, Double> scaled = this.coefficients.entrySet().stream()
                .collect(Collectors.toMap(Map.Entry::getKey, entry -> entry.getValue() * factor));
        logger.debug("计算了{}乘以{}", this, factor);
        return new LinearExpression(scaled, this.constant * factor);
    }

    public LinearExpression negate() {
        return scale(-1.0);
    }

    /**
     * 去掉绝对值不超过 tolerance 的系数。tolerance 为 0 时只去掉恰好抵消的项，即构造函数已做的事。
     * @param tolerance 非负容差。
     * @return 过滤后的表达式；没有需要去掉的项时返回自身。
     */
    public LinearExpression withoutNegligibleTerms(double tolerance) {
        if (tolerance <= 0.0) {
            return this;
        }
        Map<Variable, Double> kept = new HashMap<>();
        coefficients.forEach((variable, coeff) -> {
            if (Math.abs(coeff) > tolerance) {
                kept.put(variable, coeff);
            } else {
                logger.debug("系数 {}*{} 低于容差 {}，视为零", coeff, variable, tolerance);
            }
        });
        if (kept.size() == coefficients.size()) {
            return this;
        }
        return new LinearExpression(kept, constant);
    }

    /**
     * @return 常数项和所有系数是否都是有限数。
     */
    public boolean isFinite() {
        if (!Double.isFinite(constant)) {
            return false;
        }
        for (double coeff : coefficients.values()) {
            if (!Double.isFinite(coeff)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @return 是否不含任何变量项。
     */
    public boolean isConstant() {
        return coefficients.isEmpty();
    }

    /**
     * @return 按变量 ID 排序的项列表。
     */
    public List<LinearTerm> terms() {
        return coefficients.entrySet().stream()
                .map(entry -> LinearTerm.of(entry.getKey(), entry.getValue()))
                .collect(Collectors.toUnmodifiableList());
    }

    public double coefficientOf(Variable variable) {
        return coefficients.getOrDefault(variable, 0.0);
    }

    /**
     * 根据给定的变量赋值，计算表达式的具体数值。
     */
    public double evaluate(VariableValuation valuation) {
        double result = this.constant;
        for (Map.Entry<Variable, Double> entry : coefficients.entrySet()) {
            result += entry.getValue() * valuation.getValue(entry.getKey());
        }
        logger.debug("根据变量赋值{}计算了{}的结果为{}", valuation, this, result);
        return result;
    }

    @Override
    public ArithExpr<RealSort> toZ3ArithExpr(Context ctx, Z3VariableManager varManager) {
        ArithExpr<RealSort> result = Z3Numbers.toZ3Real(ctx, constant);
        for (Map.Entry<Variable, Double> entry : coefficients.entrySet()) {
            ArithExpr<RealSort> variableExpr = varManager.getZ3Var(entry.getKey());
            ArithExpr<RealSort> z3Coeff = Z3Numbers.toZ3Real(ctx, entry.getValue());
            result = ctx.mkAdd(result, ctx.mkMul(z3Coeff, variableExpr));
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        boolean firstTerm = true;

        for (Map.Entry<Variable, Double> entry : coefficients.entrySet()) {
            if (!firstTerm) {
                sb.append(" + ");
            }
            sb.append(entry.getValue());
            sb.append("*");
            sb.append(entry.getKey().getName());
            firstTerm = false;
        }

        if (constant != 0.0) {
            if (!firstTerm) {
                sb.append(constant > 0 ? " + " : " ");
            }
            sb.append(constant);
        } else if (firstTerm) {
            return "0";
        }

        return sb.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        LinearExpression that = (LinearExpression) o;
        return Double.compare(constant, that.constant) == 0 && coefficients.equals(that.coefficients);
    }

    @Override
    public int hashCode() {
        return hashCode;
    }
}
