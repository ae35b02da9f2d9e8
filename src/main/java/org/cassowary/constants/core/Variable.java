package org.cassowary.constants.core;

import lombok.Getter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 决策变量：求解器可以自由调整的未知量。
 */
@Getter
public final class Variable implements Comparable<Variable> {

    private static final Logger logger = LoggerFactory.getLogger(Variable.class);

    private static final AtomicInteger NEXT_ID = new AtomicInteger(0);
    // 默认命名规则是 "v" + ID
    private final String name;
    private final int id;
    private final int hashCode;

    private Variable(int id, String name) {
        this.name = name;
        this.id = id;
        this.hashCode = Objects.hash(id);
        logger.debug("创建了一个Variable: {} with id {}", name, id);
    }

    public static Variable createNewVariable() {
        int id = NEXT_ID.getAndIncrement();
        return new Variable(id, "v" + id);
    }

    /**
     * 创建一个指定名称的变量。名称不参与相等性判断。
     * @param name 变量名称。
     * @return 新的 Variable 实例。
     */
    public static Variable createNewVariable(String name) {
        Objects.requireNonNull(name, "Variable name cannot be null");
        return new Variable(NEXT_ID.getAndIncrement(), name);
    }

    @Override
    public int compareTo(Variable o) {
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
        Variable variable = (Variable) o;
        return id == variable.id;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return name;
    }
}
