package org.cassowary.constants.engine;

import org.cassowary.constants.core.ConstraintHandle;
import org.cassowary.constants.expressions.linear.LinearConstraint;
import org.cassowary.constants.symbolic.InfeasibleException;
import org.cassowary.constants.symbolic.SolverAdapter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 记录所有调用的求解器替身，不做任何求解。
 */
class RecordingSolverAdapter implements SolverAdapter {

    final Map<ConstraintHandle, LinearConstraint> installed = new LinkedHashMap<>();
    final List<ConstraintHandle> replaced = new ArrayList<>();
    final List<ConstraintHandle> removed = new ArrayList<>();
    int installCount;
    int reoptimizeCount;

    boolean failInstall;
    boolean failReplace;
    boolean failReoptimize;

    private long nextSequence = 100;

    @Override
    public ConstraintHandle install(LinearConstraint constraint) throws InfeasibleException {
        if (failInstall) {
            throw new InfeasibleException("install rejected");
        }
        ConstraintHandle handle = ConstraintHandle.of(nextSequence++);
        installed.put(handle, constraint);
        installCount++;
        return handle;
    }

    @Override
    public void replace(ConstraintHandle handle, LinearConstraint constraint) throws InfeasibleException {
        if (failReplace) {
            throw new InfeasibleException("replace rejected");
        }
        if (!installed.containsKey(handle)) {
            throw new IllegalArgumentException("unknown handle " + handle);
        }
        installed.put(handle, constraint);
        replaced.add(handle);
    }

    @Override
    public void remove(ConstraintHandle handle) {
        installed.remove(handle);
        removed.add(handle);
    }

    @Override
    public void reoptimize() throws InfeasibleException {
        reoptimizeCount++;
        if (failReoptimize) {
            throw new InfeasibleException("reoptimize rejected");
        }
    }

    void resetCounters() {
        replaced.clear();
        removed.clear();
        installCount = 0;
        reoptimizeCount = 0;
    }
}
