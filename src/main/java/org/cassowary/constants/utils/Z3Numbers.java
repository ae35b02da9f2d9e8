package org.cassowary.constants.utils;

import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.IntNum;
import com.microsoft.z3.RatNum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;

/**
 * double 与 Z3 实数之间的精确转换。
 * double 按其十进制表示转换为分数，避免经过浮点字符串时丢失位数。
 */
public final class Z3Numbers {

    private static final Logger logger = LoggerFactory.getLogger(Z3Numbers.class);

    private Z3Numbers() {
    }

    /**
     * 将有限 double 转换为 Z3 有理数常量。
     * @param ctx Z3 Context 实例。
     * @param value 有限 double。
     * @return 对应的 Z3 RatNum。
     */
    public static RatNum toZ3Real(Context ctx, double value) {
        if (!Double.isFinite(value)) {
            logger.error("非法调用Z3Numbers.toZ3Real: 尝试将非有限数转换为Z3表达式: {}", value);
            throw new IllegalArgumentException("非法调用Z3Numbers.toZ3Real: 尝试将非有限数转换为Z3表达式: " + value);
        }
        return ctx.mkReal(toFraction(value));
    }

    /**
     * @return "num/den" 形式的分数字符串，分母为 10 的幂。
     */
    static String toFraction(double value) {
        BigDecimal bd = new BigDecimal(Double.toString(value));
        int scale = bd.scale();
        BigInteger num;
        BigInteger den;
        if (scale <= 0) {
            // 整数或科学计数法的大数
            num = bd.unscaledValue().multiply(BigInteger.TEN.pow(-scale));
            den = BigInteger.ONE;
        } else {
            num = bd.unscaledValue();
            den = BigInteger.TEN.pow(scale);
        }
        return num + "/" + den;
    }

    /**
     * 将模型中的数值表达式转换回 double。
     * @param value 模型求值的结果，应为 RatNum 或 IntNum。
     * @return 对应的 double。
     */
    public static double toDouble(Expr<?> value) {
        if (value instanceof RatNum) {
            RatNum rat = (RatNum) value;
            BigDecimal num = new BigDecimal(rat.getBigIntNumerator());
            BigDecimal den = new BigDecimal(rat.getBigIntDenominator());
            return num.divide(den, MathContext.DECIMAL64).doubleValue();
        }
        if (value instanceof IntNum) {
            return ((IntNum) value).getBigInteger().doubleValue();
        }
        logger.error("Z3Numbers.toDouble: 无法转换的 Z3 表达式: {}", value);
        throw new IllegalArgumentException("无法将 Z3 表达式转换为数值: " + value);
    }
}
