package org.cassowary.constants.linearization;

import lombok.Getter;
import org.cassowary.constants.core.Constant;

/**
 * 约束无法转换为求解器可接受的线性形式。
 */
@Getter
public class LinearizeException extends Exception {

    public enum Reason {
        /** 两个含变量的子式相乘，或除数含变量。 */
        NONLINEAR,
        /** 消去后不含变量，但常数关系本身成立。 */
        NO_VARIABLES,
        /** 消去后不含变量，且常数关系不成立。 */
        TRIVIALLY_UNSATISFIABLE,
        UNRESOLVED_CONSTANT,
        DIVISION_BY_ZERO,
        /** 代入常量后某个系数或常数项溢出为无穷大或 NaN。 */
        NON_FINITE
    }

    private final Reason reason;

    /**
     * 仅 UNRESOLVED_CONSTANT：未解析的常量。
     */
    private final Constant constant;

    private LinearizeException(Reason reason, Constant constant, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.constant = constant;
    }

    public static LinearizeException nonlinear(Object expression) {
        return new LinearizeException(Reason.NONLINEAR, null,
                "表达式 " + expression + " 不是线性的", null);
    }

    public static LinearizeException noVariables(Object definition) {
        return new LinearizeException(Reason.NO_VARIABLES, null,
                "约束 " + definition + " 不含任何变量 (overconstrained)", null);
    }

    public static LinearizeException triviallyUnsatisfiable(Object definition, double offset) {
        return new LinearizeException(Reason.TRIVIALLY_UNSATISFIABLE, null,
                "约束 " + definition + " 不含任何变量且恒不成立，常数项为 " + offset, null);
    }

    public static LinearizeException unresolvedConstant(Constant constant, Throwable cause) {
        return new LinearizeException(Reason.UNRESOLVED_CONSTANT, constant,
                "约束引用的常量 '" + constant + "' 尚未设置", cause);
    }

    public static LinearizeException nonFinite(Object definition, Object expression) {
        return new LinearizeException(Reason.NON_FINITE, null,
                "约束 " + definition + " 线性化后含有非有限数: " + expression, null);
    }

    public static LinearizeException divisionByZero(Object divisor, Throwable cause) {
        return new LinearizeException(Reason.DIVISION_BY_ZERO, null,
                "除数 " + divisor + " 的值为 0", cause);
    }
}
