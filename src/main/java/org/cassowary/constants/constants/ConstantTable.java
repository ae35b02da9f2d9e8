package org.cassowary.constants.constants;

import org.cassowary.constants.core.Constant;
import org.cassowary.constants.expressions.scalar.ScalarExpression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 常量表：持有所有常量的定义、缓存的解析值以及依赖索引。
 *
 * <p>解析严格按调用顺序进行：{@link #set} 只解析被设置的常量本身，
 * 因此公式引用的常量必须在更早的调用中已经解析，前向引用总是报错。
 * 这也使循环定义无法构造：闭合循环的那次调用必然遇到"引用的常量尚未解析"。
 *
 * <p>不是线程安全的；与求解器实例一样由单一线程使用。
 */
public class ConstantTable {

    private static final Logger logger = LoggerFactory.getLogger(ConstantTable.class);

    private final Map<Constant, ConstantDefinition> definitions = new LinkedHashMap<>();
    private final Map<Constant, Double> values = new HashMap<>();
    // 依赖索引：c -> 当前公式直接引用 c 的常量
    private final Map<Constant, Set<Constant>> dependents = new HashMap<>();
    private final List<ConstantChangeListener> listeners = new ArrayList<>();
    private final DependencyEvaluator evaluator;

    public ConstantTable() {
        this.evaluator = new DependencyEvaluator(this);
    }

    /**
     * 声明一个未设置的常量。
     * @param label 诊断名称。
     * @return 新常量。
     */
    public Constant declare(String label) {
        Constant constant = Constant.createNewConstant(label);
        definitions.put(constant, ConstantDefinition.UNSET);
        dependents.put(constant, new LinkedHashSet<>());
        logger.debug("声明常量 {}", constant);
        return constant;
    }

    /**
     * 以字面量设置常量。
     * @see #set(Constant, ConstantDefinition)
     */
    public PropagationResult set(Constant constant, double value) throws ConstantException {
        return set(constant, ConstantDefinition.literal(value));
    }

    /**
     * 以公式设置常量。单个字面量节点按字面量处理。
     * @see #set(Constant, ConstantDefinition)
     */
    public PropagationResult set(Constant constant, ScalarExpression expression) throws ConstantException {
        return set(constant, ConstantDefinition.of(expression));
    }

    /**
     * 设置常量的新定义，立即解析，并按依赖顺序重新解析它的传递依赖项。
     *
     * <p>求值时，常量自身以及它当前依赖闭包中的常量都视为未解析，
     * 所以自引用或引用自己的依赖项会以 UNRESOLVED_DEPENDENCY 失败。
     * 失败时常量表保持调用前的状态。
     *
     * @param constant 要设置的常量，必须属于本表。
     * @param definition 新定义，不能是 UNSET。
     * @return 传播结果。
     * @throws ConstantException 引用了未解析的常量或除零。
     */
    public PropagationResult set(Constant constant, ConstantDefinition definition) throws ConstantException {
        requireKnown(constant);
        Objects.requireNonNull(definition, "Definition cannot be null");
        if (definition.getKind() == ConstantDefinition.Kind.UNSET) {
            logger.error("ConstantTable.set: 不能将常量 {} 设置为 UNSET", constant);
            throw new IllegalArgumentException("不能将常量 " + constant + " 设置为 UNSET");
        }
        for (Constant reference : definition.referencedConstants()) {
            if (!definitions.containsKey(reference)) {
                logger.error("ConstantTable.set: 常量 {} 的公式引用了不属于本表的常量 {}", constant, reference);
                throw new IllegalArgumentException("常量 " + reference + " 不属于本常量表");
            }
        }

        Set<Constant> closure = evaluator.dependentClosure(constant);
        double newValue;
        try {
            newValue = evaluator.resolve(constant, definition,
                    c -> c.equals(constant) || closure.contains(c) ? OptionalDouble.empty() : valueOf(c));
        } catch (ConstantException e) {
            logger.warn("设置常量 {} = {} 失败: {}", constant, definition, e.getMessage());
            throw e;
        }

        Map<Constant, OptionalDouble> staged = new LinkedHashMap<>();
        List<ConstantException> warnings = evaluator.sweep(constant, newValue, staged);

        // 提交：定义、依赖索引、值
        ConstantDefinition previous = definitions.put(constant, definition);
        for (Constant reference : previous.referencedConstants()) {
            dependents.get(reference).remove(constant);
        }
        for (Constant reference : definition.referencedConstants()) {
            dependents.get(reference).add(constant);
        }

        List<Constant> changed = new ArrayList<>();
        Map<Constant, OptionalDouble> oldValues = new HashMap<>();
        for (Map.Entry<Constant, OptionalDouble> entry : staged.entrySet()) {
            OptionalDouble oldValue = valueOf(entry.getKey());
            OptionalDouble updated = entry.getValue();
            if (updated.isPresent()) {
                values.put(entry.getKey(), updated.getAsDouble());
            } else {
                values.remove(entry.getKey());
            }
            if (!oldValue.equals(updated)) {
                changed.add(entry.getKey());
                oldValues.put(entry.getKey(), oldValue);
            }
        }
        logger.info("设置常量 {} = {} -> {}，重新解析 {} 个常量，其中 {} 个值发生变化",
                constant, definition, newValue, staged.size(), changed.size());

        for (Constant c : changed) {
            for (ConstantChangeListener listener : listeners) {
                listener.constantChanged(c, oldValues.get(c), valueOf(c));
            }
        }
        return new PropagationResult(constant, new ArrayList<>(staged.keySet()), changed, staged, warnings);
    }

    /**
     * @return 常量当前缓存的值；未解析时为空。
     */
    public OptionalDouble valueOf(Constant constant) {
        Double value = values.get(constant);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public ConstantDefinition definitionOf(Constant constant) {
        requireKnown(constant);
        return definitions.get(constant);
    }

    /**
     * @return 当前公式直接引用了该常量的常量。
     */
    public Set<Constant> dependentsOf(Constant constant) {
        requireKnown(constant);
        return Collections.unmodifiableSet(dependents.get(constant));
    }

    public boolean contains(Constant constant) {
        return definitions.containsKey(constant);
    }

    /**
     * @return 按声明顺序排列的所有常量。
     */
    public List<Constant> constants() {
        return List.copyOf(definitions.keySet());
    }

    public DependencyEvaluator getEvaluator() {
        return evaluator;
    }

    public void addListener(ConstantChangeListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    public void removeListener(ConstantChangeListener listener) {
        listeners.remove(listener);
    }

    private void requireKnown(Constant constant) {
        Objects.requireNonNull(constant, "Constant cannot be null");
        if (!definitions.containsKey(constant)) {
            logger.error("常量 {} 不属于本常量表", constant);
            throw new IllegalArgumentException("常量 " + constant + " 不属于本常量表");
        }
    }
}
