package org.cassowary.constants.expressions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public enum RelationType {

    /**
     * 运算符枚举
     */
    EQ("=="),   // Equal
    LE("<="),   // Less Equal
    GE(">=");   // Greater Equal

    private final String symbol;

    RelationType(String symbol) {
        this.symbol = symbol;
    }

    public String getSymbol() {
        return symbol;
    }

    private static Logger logger = LoggerFactory.getLogger(RelationType.class);

    /**
     * 判断 value ~ 0 在给定容差下是否成立。
     * 用于处理消去所有变量之后只剩常数项的约束。
     *
     * @param value 规范化后 (lhs - rhs) 的常数值。
     * @param tolerance 非负容差。
     * @return 关系是否成立。
     */
    public boolean holdsFor(double value, double tolerance) {
        if (Double.isNaN(value)) {
            logger.error("RelationType.holdsFor: 无法判断 NaN {} 0", symbol);
            throw new IllegalArgumentException("无法判断 NaN " + symbol + " 0");
        }
        return switch (this) {
            case EQ -> Math.abs(value) <= tolerance;
            case LE -> value <= tolerance;
            case GE -> value >= -tolerance;
        };
    }
}
