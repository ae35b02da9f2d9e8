package org.cassowary.constants.core;

import lombok.Getter;

import java.util.Objects;

/**
 * 已安装约束的句柄。序号按安装顺序递增，传播时按序号升序处理以保证确定性。
 */
@Getter
public final class ConstraintHandle implements Comparable<ConstraintHandle> {

    private final long sequence;
    private final int hashCode;

    private ConstraintHandle(long sequence) {
        this.sequence = sequence;
        this.hashCode = Objects.hash(sequence);
    }

    public static ConstraintHandle of(long sequence) {
        return new ConstraintHandle(sequence);
    }

    @Override
    public int compareTo(ConstraintHandle other) {
        return Long.compare(this.sequence, other.sequence);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return sequence == ((ConstraintHandle) o).sequence;
    }

    @Override
    public int hashCode() {
        return hashCode;
    }

    @Override
    public String toString() {
        return "#" + sequence;
    }
}
