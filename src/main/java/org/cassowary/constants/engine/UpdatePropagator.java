package org.cassowary.constants.engine;

import org.cassowary.constants.constants.ConstantDefinition;
import org.cassowary.constants.constants.ConstantException;
import org.cassowary.constants.constants.ConstantTable;
import org.cassowary.constants.constants.PropagationResult;
import org.cassowary.constants.core.Constant;
import org.cassowary.constants.core.ConstraintHandle;
import org.cassowary.constants.expressions.linear.LinearConstraint;
import org.cassowary.constants.linearization.LinearizeException;
import org.cassowary.constants.linearization.Linearizer;
import org.cassowary.constants.symbolic.InfeasibleException;
import org.cassowary.constants.symbolic.SolverAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 已安装约束的权威登记处：记录每条约束的原始定义、当前线性形式，以及常量到约束的反向索引。
 * 常量更新后，重新线性化所有引用了值发生变化的常量的约束，逐条替换，最后只调用一次 reoptimize。
 */
public class UpdatePropagator {

    private static final Logger logger = LoggerFactory.getLogger(UpdatePropagator.class);

    private final ConstantTable table;
    private final Linearizer linearizer;
    private final SolverAdapter adapter;

    private final Map<ConstraintHandle, Registration> registrations = new HashMap<>();
    private final Map<Constant, Set<ConstraintHandle>> constraintsByConstant = new HashMap<>();
    private long nextSequence = 0;

    private static final class Registration {
        private final long sequence;
        private final ConstraintHandle handle;
        private LinearConstraint current;

        private Registration(long sequence, ConstraintHandle handle, LinearConstraint current) {
            this.sequence = sequence;
            this.handle = handle;
            this.current = current;
        }
    }

    public UpdatePropagator(ConstantTable table, Linearizer linearizer, SolverAdapter adapter) {
        this.table = Objects.requireNonNull(table, "Constant table cannot be null");
        this.linearizer = Objects.requireNonNull(linearizer, "Linearizer cannot be null");
        this.adapter = Objects.requireNonNull(adapter, "Solver adapter cannot be null");
    }

    /**
     * 安装一条已线性化的约束并登记。安装失败时不登记任何内容。
     */
    public ConstraintHandle register(LinearConstraint constraint) throws InfeasibleException {
        ConstraintHandle handle = adapter.install(constraint);
        registrations.put(handle, new Registration(nextSequence++, handle, constraint));
        for (Constant constant : constraint.getSourceConstants()) {
            constraintsByConstant.computeIfAbsent(constant, c -> new HashSet<>()).add(handle);
        }
        logger.info("登记约束 {}: {}，依赖常量 {}", handle, constraint, constraint.getSourceConstants());
        return handle;
    }

    /**
     * 从求解器移除约束并注销。
     */
    public void unregister(ConstraintHandle handle) {
        Registration registration = requireRegistered(handle);
        adapter.remove(handle);
        registrations.remove(handle);
        for (Constant constant : registration.current.getSourceConstants()) {
            Set<ConstraintHandle> handles = constraintsByConstant.get(constant);
            if (handles != null) {
                handles.remove(handle);
                if (handles.isEmpty()) {
                    constraintsByConstant.remove(constant);
                }
            }
        }
        logger.info("注销约束 {}", handle);
    }

    /**
     * 设置常量并把变化传播到已安装的约束。
     *
     * <ol>
     *     <li>委托常量表设置并解析，失败时原样抛出，常量表与约束都不变；</li>
     *     <li>收集引用了任一值发生变化的常量的约束，按安装顺序重新线性化并替换；</li>
     *     <li>全部替换成功后调用一次 reoptimize。</li>
     * </ol>
     * 某条约束重新线性化或替换失败时立即停止：已替换的约束保留新形式，
     * 失败的和尚未处理的约束保留旧形式，常量表保留新值。
     *
     * @throws ConstantException 常量无法解析，或某条约束 RELINEARIZATION_FAILED。
     * @throws InfeasibleException reoptimize 报告不可满足。
     */
    public PropagationResult setConstant(Constant constant, ConstantDefinition definition)
            throws ConstantException, InfeasibleException {
        PropagationResult result = table.set(constant, definition);

        List<Registration> affected = affectedBy(result.getChanged());
        if (affected.isEmpty()) {
            logger.debug("常量 {} 的更新没有影响任何已安装约束", constant);
            return result;
        }

        for (Registration registration : affected) {
            LinearConstraint relinearized;
            try {
                relinearized = linearizer.linearize(registration.current.getDefinition());
                adapter.replace(registration.handle, relinearized);
            } catch (LinearizeException | InfeasibleException e) {
                logger.error("常量 {} 更新后约束 {} 重新线性化失败，停止传播: {}",
                        constant, registration.handle, e.getMessage());
                throw ConstantException.relinearizationFailed(constant, registration.handle, result, e);
            }
            logger.debug("约束 {} 重新线性化: {} => {}", registration.handle, registration.current, relinearized);
            registration.current = relinearized;
        }
        logger.info("常量 {} 更新后重新线性化了 {} 条约束", constant, affected.size());
        adapter.reoptimize();
        return result;
    }

    public LinearConstraint linearConstraintOf(ConstraintHandle handle) {
        return requireRegistered(handle).current;
    }

    /**
     * @return 按安装顺序排列的已登记句柄。
     */
    public List<ConstraintHandle> installedHandles() {
        List<Registration> all = new ArrayList<>(registrations.values());
        all.sort(Comparator.comparingLong(r -> r.sequence));
        List<ConstraintHandle> handles = new ArrayList<>();
        for (Registration registration : all) {
            handles.add(registration.handle);
        }
        return handles;
    }

    /**
     * @return 当前引用了该常量的约束句柄。
     */
    public Set<ConstraintHandle> constraintsReferencing(Constant constant) {
        return Collections.unmodifiableSet(constraintsByConstant.getOrDefault(constant, Collections.emptySet()));
    }

    private List<Registration> affectedBy(Collection<Constant> changed) {
        Set<ConstraintHandle> handles = new HashSet<>();
        for (Constant constant : changed) {
            handles.addAll(constraintsByConstant.getOrDefault(constant, Collections.emptySet()));
        }
        List<Registration> affected = new ArrayList<>();
        for (ConstraintHandle handle : handles) {
            affected.add(registrations.get(handle));
        }
        affected.sort(Comparator.comparingLong(r -> r.sequence));
        return affected;
    }

    private Registration requireRegistered(ConstraintHandle handle) {
        Objects.requireNonNull(handle, "Handle cannot be null");
        Registration registration = registrations.get(handle);
        if (registration == null) {
            logger.error("UpdatePropagator: 约束 {} 未登记", handle);
            throw new IllegalArgumentException("约束 " + handle + " 未登记");
        }
        return registration;
    }
}
