package org.cassowary.constants.constants;

import lombok.Getter;
import org.cassowary.constants.core.Constant;
import org.cassowary.constants.core.ConstraintHandle;

/**
 * 设置或解析常量失败。
 * RELINEARIZATION_FAILED 时 cause 为导致失败的 LinearizeException 或 InfeasibleException。
 */
@Getter
public class ConstantException extends Exception {

    public enum Reason {
        CONSTANT_NOT_SET,
        UNRESOLVED_DEPENDENCY,
        DIVISION_BY_ZERO,
        /** 公式的结果溢出为无穷大或 NaN。 */
        NON_FINITE,
        RELINEARIZATION_FAILED
    }

    private final Reason reason;

    /**
     * 正在设置或解析的常量；RELINEARIZATION_FAILED 时为触发更新的常量。
     */
    private final Constant constant;

    /**
     * 仅 UNRESOLVED_DEPENDENCY：未解析的被引用常量。
     */
    private final Constant missing;

    /**
     * 仅 RELINEARIZATION_FAILED：重新线性化失败的约束。
     */
    private final ConstraintHandle handle;

    /**
     * 仅 RELINEARIZATION_FAILED：常量表已提交的传播结果，供调用方决定重试或手动回滚。
     */
    private final PropagationResult propagation;

    private ConstantException(Reason reason, Constant constant, Constant missing, ConstraintHandle handle,
                              PropagationResult propagation, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.constant = constant;
        this.missing = missing;
        this.handle = handle;
        this.propagation = propagation;
    }

    public static ConstantException notSet(Constant constant) {
        return new ConstantException(Reason.CONSTANT_NOT_SET, constant, null, null, null,
                "Constant `" + constant + "` is not set.", null);
    }

    public static ConstantException unresolvedDependency(Constant missing, Constant whileSetting) {
        return new ConstantException(Reason.UNRESOLVED_DEPENDENCY, whileSetting, missing, null, null,
                "Can not set constant `" + whileSetting + "` because `" + missing + "` is not set.", null);
    }

    public static ConstantException divisionByZero(Constant constant) {
        return new ConstantException(Reason.DIVISION_BY_ZERO, constant, null, null, null,
                "Can not set constant `" + constant + "` because its formula divides by zero.", null);
    }

    public static ConstantException nonFinite(Constant constant, double value) {
        return new ConstantException(Reason.NON_FINITE, constant, null, null, null,
                "Can not set constant `" + constant + "` because its formula evaluates to " + value + ".", null);
    }

    public static ConstantException relinearizationFailed(Constant constant, ConstraintHandle handle,
                                                          PropagationResult propagation, Exception cause) {
        return new ConstantException(Reason.RELINEARIZATION_FAILED, constant, null, handle, propagation,
                "Constraint " + handle + " could not be relinearized after `" + constant + "` changed: "
                        + cause.getMessage(), cause);
    }
}
