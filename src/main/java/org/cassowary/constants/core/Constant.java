package org.cassowary.constants.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 外部持有的只读标量。求解器永远不会调整它的值，它在所有表达式中都按普通数值处理。
 * 相等性只看 ID，label 仅用于诊断输出。
 * 通常通过 {@link org.cassowary.constants.constants.ConstantTable#declare(String)} 创建；
 * 直接创建的常量不属于任何常量表，交给常量表时会被拒绝。
 */
@Getter
public final class Constant implements Comparable<Constant> {

    private static final Logger logger = LoggerFactory.getLogger(Constant.class);

    // 全局唯一，避免不同常量表之间的 ID 冲突
    private static final AtomicInteger NEXT_ID = new AtomicInteger(0);

    private final int id;
    private final String label;
    private final int hashCode;

    private Constant(int id, String label) {
        this.id = id;
        this.label = label;
        this.hashCode = Objects.hash(id);
        logger.debug("创建了一个Constant: {} with id {}", label, id);
    }

    /**
     * 创建新常量。如果 label 为空，使用 "c" + ID 作为名称。
     * @param label 诊断名称，可为 null。
     * @return 新的 Constant 实例。
     */
    public static Constant createNewConstant(String label) {
        int id = NEXT_ID.getAndIncrement();
        String name = (label == null || label.isBlank()) ? "c" + id : label;
        return new Constant(id, name);
    }

    @Override
    public int compareTo(Constant o) {
        return Integer.compare(this.id, o.id);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Constant constant = (Constant) o;
        return id == constant.id;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return label;
    }
}
