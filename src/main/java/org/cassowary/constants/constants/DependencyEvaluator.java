package org.cassowary.constants.constants;

import org.cassowary.constants.core.Constant;
import org.cassowary.constants.expressions.scalar.ConstantLookup;
import org.cassowary.constants.expressions.scalar.EvaluationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 根据常量表解析常量的值，并在某个常量变化后按依赖顺序重新解析它的传递依赖项。
 * 本身不持有状态，只读常量表；写回由 {@link ConstantTable} 负责。
 */
public class DependencyEvaluator {

    private static final Logger logger = LoggerFactory.getLogger(DependencyEvaluator.class);

    private final ConstantTable table;

    DependencyEvaluator(ConstantTable table) {
        this.table = Objects.requireNonNull(table, "Constant table cannot be null");
    }

    /**
     * 在常量表当前状态下解析常量。
     * @param constant 要解析的常量。
     * @return 解析出的值。
     * @throws ConstantException 常量未设置、引用了未解析的常量或除零。
     */
    public double resolve(Constant constant) throws ConstantException {
        return resolve(constant, table.definitionOf(constant), table::valueOf);
    }

    /**
     * 用指定的定义和查询解析常量。
     * 未解析的引用映射为 UNRESOLVED_DEPENDENCY，除零映射为 DIVISION_BY_ZERO，
     * 溢出为无穷大或 NaN 的结果映射为 NON_FINITE。
     */
    double resolve(Constant constant, ConstantDefinition definition, ConstantLookup lookup) throws ConstantException {
        switch (definition.getKind()) {
            case UNSET:
                throw ConstantException.notSet(constant);
            case LITERAL:
                return definition.getLiteral();
            default:
                break;
        }
        double value;
        try {
            value = definition.getFormula().evaluate(lookup);
        } catch (EvaluationException e) {
            if (e.getReason() == EvaluationException.Reason.DIVISION_BY_ZERO) {
                throw ConstantException.divisionByZero(constant);
            }
            throw ConstantException.unresolvedDependency(e.getConstant(), constant);
        }
        if (!Double.isFinite(value)) {
            logger.warn("常量 {} = {} 的结果不是有限数: {}", constant, definition, value);
            throw ConstantException.nonFinite(constant, value);
        }
        logger.debug("解析常量 {} = {} -> {}", constant, definition, value);
        return value;
    }

    /**
     * 传递依赖闭包：所有直接或间接引用 origin 的常量，不含 origin 本身。广度优先。
     */
    Set<Constant> dependentClosure(Constant origin) {
        Set<Constant> closure = new LinkedHashSet<>();
        Deque<Constant> queue = new ArrayDeque<>(table.dependentsOf(origin));
        while (!queue.isEmpty()) {
            Constant current = queue.poll();
            if (closure.add(current)) {
                queue.addAll(table.dependentsOf(current));
            }
        }
        return closure;
    }

    /**
     * 在 origin 已取得新值之后重新解析它的依赖闭包。
     * 按依赖顺序广度优先访问（闭包内的 Kahn 算法），每个常量只访问一次，
     * 并且只在它引用的所有闭包内常量都处理完之后才求值，菱形依赖也能读到最新值。
     * 解析失败的依赖项置为未解析并记入 warnings，不中断其余常量。
     *
     * @param origin 已变化的常量。
     * @param originValue origin 的新值。
     * @param staged 输出：按访问顺序写入 origin 及每个依赖项的新值。
     * @return 非致命失败列表。
     */
    List<ConstantException> sweep(Constant origin, double originValue, Map<Constant, OptionalDouble> staged) {
        Set<Constant> closure = dependentClosure(origin);
        staged.put(origin, OptionalDouble.of(originValue));

        Map<Constant, Integer> pending = new HashMap<>();
        for (Constant dependent : closure) {
            int count = 0;
            for (Constant reference : table.definitionOf(dependent).referencedConstants()) {
                if (reference.equals(origin) || closure.contains(reference)) {
                    count++;
                }
            }
            pending.put(dependent, count);
        }

        ConstantLookup stagedLookup = c -> staged.containsKey(c) ? staged.get(c) : table.valueOf(c);
        List<ConstantException> warnings = new ArrayList<>();
        Deque<Constant> ready = new ArrayDeque<>();
        ready.add(origin);
        while (!ready.isEmpty()) {
            Constant current = ready.poll();
            if (!current.equals(origin)) {
                try {
                    staged.put(current, OptionalDouble.of(resolve(current, table.definitionOf(current), stagedLookup)));
                } catch (ConstantException e) {
                    logger.warn("重新解析依赖常量 {} 失败: {}", current, e.getMessage());
                    staged.put(current, OptionalDouble.empty());
                    warnings.add(e);
                }
            }
            for (Constant dependent : table.dependentsOf(current)) {
                int left = pending.merge(dependent, -1, Integer::sum);
                if (left == 0) {
                    ready.add(dependent);
                }
            }
        }
        logger.debug("常量 {} 的传播访问了 {} 个依赖项", origin, closure.size());
        return warnings;
    }
}
