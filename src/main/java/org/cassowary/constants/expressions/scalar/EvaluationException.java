package org.cassowary.constants.expressions.scalar;

import lombok.Getter;
import org.cassowary.constants.core.Constant;

/**
 * 标量表达式求值失败。
 */
@Getter
public class EvaluationException extends Exception {

    public enum Reason {
        UNRESOLVED_CONSTANT,
        DIVISION_BY_ZERO
    }

    private final Reason reason;

    /**
     * 未解析的常量；除零时为 null。
     */
    private final Constant constant;

    private EvaluationException(Reason reason, Constant constant, String message) {
        super(message);
        this.reason = reason;
        this.constant = constant;
    }

    public static EvaluationException unresolved(Constant constant) {
        return new EvaluationException(Reason.UNRESOLVED_CONSTANT, constant,
                "常量 '" + constant + "' 尚未设置");
    }

    public static EvaluationException divisionByZero(ScalarExpression divisor) {
        return new EvaluationException(Reason.DIVISION_BY_ZERO, null,
                "除数 " + divisor + " 的值为 0");
    }
}
