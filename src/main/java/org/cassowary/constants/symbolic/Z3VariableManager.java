package org.cassowary.constants.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.RealExpr;
import com.microsoft.z3.RealSort;
import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.cassowary.constants.core.ConstraintHandle;
import org.cassowary.constants.core.Variable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 负责管理决策变量到 Z3 实数变量的映射，以及非 required 约束的误差变量。
 * 确保每个 Java 变量在 Z3 Context 中有唯一的对应 Z3 变量。
 */
@Getter
public class Z3VariableManager {

    private static final Logger logger = LoggerFactory.getLogger(Z3VariableManager.class);

    private final Context ctx;
    // 使用 HashMap 存储映射，引擎是单线程的，不会有并发问题
    private final Map<Variable, RealExpr> variableZ3Vars;
    // 每条软约束一对误差变量 (e+, e-)
    private final Map<ConstraintHandle, Pair<RealExpr, RealExpr>> errorZ3Vars;

    public Z3VariableManager(Context ctx) {
        this.ctx = Objects.requireNonNull(ctx, "Z3 Context cannot be null.");
        this.variableZ3Vars = new HashMap<>();
        this.errorZ3Vars = new HashMap<>();
    }

    /**
     * 获取指定变量对应的 Z3 实数变量。如果尚未创建，则会创建并缓存。
     * Z3 名称带上 ID，同名变量不会冲突。
     * @param variable 决策变量。
     * @return 对应的 Z3 RealExpr。
     */
    public RealExpr getZ3Var(Variable variable) {
        return variableZ3Vars.computeIfAbsent(variable, v -> {
            logger.debug("创建 Z3 变量: {}#{}", v.getName(), v.getId());
            return ctx.mkRealConst(v.getName() + "#" + v.getId());
        });
    }

    /**
     * 获取软约束的误差变量对。如果尚未创建，则会创建并缓存。
     * @param handle 约束句柄。
     * @return (e+, e-)。
     */
    public Pair<RealExpr, RealExpr> getErrorVars(ConstraintHandle handle) {
        return errorZ3Vars.computeIfAbsent(handle, h -> {
            logger.debug("创建约束 {} 的误差变量", h);
            return Pair.of(ctx.mkRealConst("e+" + h), ctx.mkRealConst("e-" + h));
        });
    }

    public void releaseErrorVars(ConstraintHandle handle) {
        errorZ3Vars.remove(handle);
    }

    /**
     * @return 误差变量对的非负约束 e+ >= 0 且 e- >= 0。
     */
    public BoolExpr errorBounds(ConstraintHandle handle) {
        Pair<RealExpr, RealExpr> errors = getErrorVars(handle);
        ArithExpr<RealSort> zero = ctx.mkReal(0);
        return ctx.mkAnd(ctx.mkGe(errors.getLeft(), zero), ctx.mkGe(errors.getRight(), zero));
    }
}
