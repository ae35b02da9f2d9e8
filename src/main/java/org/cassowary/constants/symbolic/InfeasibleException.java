package org.cassowary.constants.symbolic;

/**
 * 求解器报告 required 约束集合不可满足。
 */
public class InfeasibleException extends Exception {

    public InfeasibleException(String message) {
        super(message);
    }
}
