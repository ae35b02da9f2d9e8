package org.cassowary.constants.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 约束强度。核心逻辑不解释它，只原样交给求解器适配器。
 * 预定义的四个级别对应 Cassowary 的 required / strong / medium / weak。
 */
@Getter
public final class Strength implements Comparable<Strength> {

    public static final Strength REQUIRED = new Strength("required", Integer.MAX_VALUE);
    public static final Strength STRONG = new Strength("strong", 1_000_000);
    public static final Strength MEDIUM = new Strength("medium", 1_000);
    public static final Strength WEAK = new Strength("weak", 1);

    private final String name;
    private final int weight;

    private Strength(String name, int weight) {
        this.name = name;
        this.weight = weight;
    }

    /**
     * 自定义强度，权重必须为正且小于 REQUIRED。
     */
    public static Strength of(String name, int weight) {
        Objects.requireNonNull(name, "Strength name cannot be null");
        if (weight <= 0 || weight == Integer.MAX_VALUE) {
            throw new IllegalArgumentException("非法的强度权重: " + weight);
        }
        return new Strength(name, weight);
    }

    public boolean isRequired() {
        return weight == Integer.MAX_VALUE;
    }

    @Override
    public int compareTo(Strength other) {
        return Integer.compare(this.weight, other.weight);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Strength strength = (Strength) o;
        return weight == strength.weight && name.equals(strength.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, weight);
    }

    @Override
    public String toString() {
        return name;
    }
}
