package org.cassowary.constants.symbolic;

import com.microsoft.z3.ArithExpr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Model;
import com.microsoft.z3.Optimize;
import com.microsoft.z3.RealExpr;
import com.microsoft.z3.RealSort;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import lombok.Getter;
import org.apache.commons.lang3.tuple.Pair;
import org.cassowary.constants.core.ConstraintHandle;
import org.cassowary.constants.core.Variable;
import org.cassowary.constants.core.VariableValuation;
import org.cassowary.constants.expressions.linear.LinearConstraint;
import org.cassowary.constants.utils.Z3Numbers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 基于 Z3 Optimize 的求解器适配器。
 *
 * <p>required 约束作为硬约束断言；其余约束按 Cassowary 的方式软化：
 * 每条引入一对非负误差变量 e+、e-，约束变为 expr - e+ + e- ~ 0，
 * 目标函数最小化 Σ weight * (e+ + e-)。
 *
 * <p>安装或替换 required 约束前先检查 required 集合是否仍可满足，不可满足时保持原状。
 * 不是线程安全的。
 */
public class Z3SolverAdapter implements SolverAdapter, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3SolverAdapter.class);

    private final Context ctx;
    private final Z3VariableManager varManager;
    private final Map<ConstraintHandle, LinearConstraint> installed = new LinkedHashMap<>();
    private long nextSequence = 0;

    /**
     * 最近一次 reoptimize 的结果。
     */
    @Getter
    private VariableValuation valuation = VariableValuation.EMPTY;

    public Z3SolverAdapter() {
        this.ctx = new Context();
        this.varManager = new Z3VariableManager(ctx);
        logger.debug("Z3SolverAdapter 初始化完成");
    }

    @Override
    public ConstraintHandle install(LinearConstraint constraint) throws InfeasibleException {
        Objects.requireNonNull(constraint, "Constraint cannot be null");
        ConstraintHandle handle = ConstraintHandle.of(nextSequence);
        if (constraint.getStrength().isRequired()) {
            Map<ConstraintHandle, LinearConstraint> candidate = new LinkedHashMap<>(installed);
            candidate.put(handle, constraint);
            checkRequired(candidate);
        }
        nextSequence++;
        installed.put(handle, constraint);
        logger.info("Z3 安装约束 {}: {}", handle, constraint);
        return handle;
    }

    @Override
    public void replace(ConstraintHandle handle, LinearConstraint constraint) throws InfeasibleException {
        Objects.requireNonNull(constraint, "Constraint cannot be null");
        requireInstalled(handle);
        if (constraint.getStrength().isRequired()) {
            Map<ConstraintHandle, LinearConstraint> candidate = new LinkedHashMap<>(installed);
            candidate.put(handle, constraint);
            checkRequired(candidate);
        }
        installed.put(handle, constraint);
        logger.info("Z3 替换约束 {}: {}", handle, constraint);
    }

    @Override
    public void remove(ConstraintHandle handle) {
        requireInstalled(handle);
        installed.remove(handle);
        varManager.releaseErrorVars(handle);
        logger.info("Z3 移除约束 {}", handle);
    }

    @Override
    public void reoptimize() throws InfeasibleException {
        Optimize optimize = ctx.mkOptimize();
        List<ArithExpr<RealSort>> penalties = new ArrayList<>();
        for (Map.Entry<ConstraintHandle, LinearConstraint> entry : installed.entrySet()) {
            LinearConstraint constraint = entry.getValue();
            if (constraint.getStrength().isRequired()) {
                optimize.Add(constraint.toZ3BoolExpr(ctx, varManager));
                continue;
            }
            ConstraintHandle handle = entry.getKey();
            Pair<RealExpr, RealExpr> errors = varManager.getErrorVars(handle);
            optimize.Add(varManager.errorBounds(handle));
            optimize.Add(softened(constraint, errors));
            ArithExpr<RealSort> weight = ctx.mkReal(constraint.getStrength().getWeight());
            penalties.add(ctx.mkMul(weight, ctx.mkAdd(errors.getLeft(), errors.getRight())));
        }
        if (!penalties.isEmpty()) {
            optimize.MkMinimize(ctx.mkAdd(penalties.toArray(new ArithExpr[0])));
        }

        Status status = optimize.Check();
        if (status != Status.SATISFIABLE) {
            logger.warn("Z3 重新求解失败，状态为 {}", status);
            throw new InfeasibleException("required 约束不可满足 (Z3 状态: " + status + ")");
        }
        Model model = optimize.getModel();
        Map<Variable, Double> values = new HashMap<>();
        for (LinearConstraint constraint : installed.values()) {
            for (Variable variable : constraint.getExpression().getCoefficients().keySet()) {
                values.computeIfAbsent(variable,
                        v -> Z3Numbers.toDouble(model.eval(varManager.getZ3Var(v), true)));
            }
        }
        this.valuation = VariableValuation.of(values);
        logger.info("Z3 重新求解完成: {}", valuation);
    }

    /**
     * @return 变量在最近一次求解中的值。
     */
    public double valueOf(Variable variable) {
        return valuation.getValue(variable);
    }

    public Map<ConstraintHandle, LinearConstraint> getInstalled() {
        return Collections.unmodifiableMap(installed);
    }

    @Override
    public void close() {
        ctx.close();
        logger.debug("Z3 Context 已关闭");
    }

    private BoolExpr softened(LinearConstraint constraint, Pair<RealExpr, RealExpr> errors) {
        ArithExpr<RealSort> expr = ctx.mkAdd(
                ctx.mkSub(constraint.getExpression().toZ3ArithExpr(ctx, varManager), errors.getLeft()),
                errors.getRight());
        ArithExpr<RealSort> zero = ctx.mkReal(0);
        return switch (constraint.getRelation()) {
            case EQ -> ctx.mkEq(expr, zero);
            case LE -> ctx.mkLe(expr, zero);
            case GE -> ctx.mkGe(expr, zero);
        };
    }

    private void checkRequired(Map<ConstraintHandle, LinearConstraint> candidate) throws InfeasibleException {
        Solver solver = ctx.mkSolver();
        for (LinearConstraint constraint : candidate.values()) {
            if (constraint.getStrength().isRequired()) {
                solver.add(constraint.toZ3BoolExpr(ctx, varManager));
            }
        }
        Status status = solver.check();
        if (status != Status.SATISFIABLE) {
            logger.warn("required 约束集合不可满足，状态为 {}", status);
            throw new InfeasibleException("required 约束不可满足 (Z3 状态: " + status + ")");
        }
    }

    private void requireInstalled(ConstraintHandle handle) {
        Objects.requireNonNull(handle, "Handle cannot be null");
        if (!installed.containsKey(handle)) {
            logger.error("Z3SolverAdapter: 约束 {} 未安装", handle);
            throw new IllegalArgumentException("约束 " + handle + " 未安装");
        }
    }
}
