package org.cassowary.constants.engine;

import lombok.Getter;
import org.cassowary.constants.constants.ConstantDefinition;
import org.cassowary.constants.constants.ConstantException;
import org.cassowary.constants.constants.ConstantTable;
import org.cassowary.constants.constants.PropagationResult;
import org.cassowary.constants.core.Constant;
import org.cassowary.constants.core.ConstraintHandle;
import org.cassowary.constants.core.Strength;
import org.cassowary.constants.expressions.RelationType;
import org.cassowary.constants.expressions.linear.ConstraintDefinition;
import org.cassowary.constants.expressions.linear.ConstraintExpression;
import org.cassowary.constants.expressions.linear.LinearConstraint;
import org.cassowary.constants.expressions.scalar.ScalarExpression;
import org.cassowary.constants.linearization.LinearizeException;
import org.cassowary.constants.linearization.Linearizer;
import org.cassowary.constants.symbolic.InfeasibleException;
import org.cassowary.constants.symbolic.SolverAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * 调用方使用的入口：声明和设置常量、添加和移除约束。
 *
 * <p>单写者模型：常量表、依赖索引和约束登记都只在拥有求解器的线程上修改，内部不加锁。
 * 多线程共享时，所有调用必须在外部用同一把锁互斥。
 */
public class ConstraintEngine {

    private static final Logger logger = LoggerFactory.getLogger(ConstraintEngine.class);

    @Getter
    private final ConstantTable table;
    @Getter
    private final EngineOptions options;
    private final Linearizer linearizer;
    private final UpdatePropagator propagator;
    private final SolverAdapter adapter;

    /**
     * 使用 classpath 上 {@value EngineOptions#RESOURCE_NAME} 中的配置；文件不存在时使用默认配置。
     */
    public ConstraintEngine(SolverAdapter adapter) {
        this(adapter, EngineOptions.load());
    }

    public ConstraintEngine(SolverAdapter adapter, EngineOptions options) {
        this.adapter = Objects.requireNonNull(adapter, "Solver adapter cannot be null");
        this.options = Objects.requireNonNull(options, "Options cannot be null");
        this.table = new ConstantTable();
        this.linearizer = new Linearizer(table, options.getZeroTolerance(), options.getSatisfactionTolerance());
        this.propagator = new UpdatePropagator(table, linearizer, adapter);
        logger.debug("ConstraintEngine 初始化完成: {}", options);
    }

    public Constant declareConstant(String label) {
        return table.declare(label);
    }

    public PropagationResult setConstant(Constant constant, double value) throws ConstantException, InfeasibleException {
        return propagator.setConstant(constant, ConstantDefinition.literal(value));
    }

    public PropagationResult setConstant(Constant constant, ScalarExpression expression)
            throws ConstantException, InfeasibleException {
        return propagator.setConstant(constant, ConstantDefinition.of(expression));
    }

    /**
     * 添加约束 left ~ right。
     * @see #addConstraint(ConstraintDefinition)
     */
    public ConstraintHandle addConstraint(ConstraintExpression left, RelationType relation, ConstraintExpression right,
                                          Strength strength) throws LinearizeException, InfeasibleException {
        return addConstraint(ConstraintDefinition.of(left, relation, right, strength));
    }

    public ConstraintHandle addConstraint(ConstraintExpression left, RelationType relation, ConstraintExpression right)
            throws LinearizeException, InfeasibleException {
        return addConstraint(ConstraintDefinition.of(left, relation, right));
    }

    /**
     * 线性化并安装约束，然后重新求解。失败时不安装任何内容。
     *
     * @param definition 原始约束。
     * @return 约束句柄；策略为 {@link NoVariablesPolicy#IGNORE} 且约束消去后恒成立时返回 null。
     * @throws LinearizeException 约束无法线性化。
     * @throws InfeasibleException 加入后 required 约束不可满足。
     */
    public ConstraintHandle addConstraint(ConstraintDefinition definition) throws LinearizeException, InfeasibleException {
        LinearConstraint linear;
        try {
            linear = linearizer.linearize(definition);
        } catch (LinearizeException e) {
            if (e.getReason() == LinearizeException.Reason.NO_VARIABLES
                    && options.getNoVariablesPolicy() == NoVariablesPolicy.IGNORE) {
                logger.warn("忽略不含变量的约束 {}", definition);
                return null;
            }
            throw e;
        }

        ConstraintHandle handle = propagator.register(linear);
        try {
            adapter.reoptimize();
        } catch (InfeasibleException e) {
            logger.warn("添加约束 {} 后不可满足，撤销安装", definition);
            propagator.unregister(handle);
            throw e;
        }
        return handle;
    }

    /**
     * 移除约束并重新求解。
     * @throws IllegalArgumentException 句柄未登记。
     */
    public void removeConstraint(ConstraintHandle handle) throws InfeasibleException {
        propagator.unregister(handle);
        adapter.reoptimize();
    }

    public OptionalDouble valueOf(Constant constant) {
        return table.valueOf(constant);
    }

    /**
     * @return 当前安装在求解器中的线性形式。
     */
    public LinearConstraint linearConstraintOf(ConstraintHandle handle) {
        return propagator.linearConstraintOf(handle);
    }

    public List<ConstraintHandle> installedHandles() {
        return propagator.installedHandles();
    }

    /**
     * @return 当前引用了该常量的约束。
     */
    public Set<ConstraintHandle> constraintsReferencing(Constant constant) {
        return propagator.constraintsReferencing(constant);
    }
}
