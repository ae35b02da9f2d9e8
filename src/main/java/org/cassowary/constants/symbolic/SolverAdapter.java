package org.cassowary.constants.symbolic;

import org.cassowary.constants.core.ConstraintHandle;
import org.cassowary.constants.expressions.linear.LinearConstraint;

/**
 * 与实际表格 (tableau) 求解器之间的窄接口。
 * 常量代入和重新线性化都在调用方完成，这里只接收纯线性约束。
 * 实现不需要线程安全：同一个引擎实例只由一个线程调用。
 */
public interface SolverAdapter {

    /**
     * 安装一条新约束。
     * @param constraint 线性约束。
     * @return 该约束的句柄。
     * @throws InfeasibleException 加入后 required 约束不可满足；此时求解器保持不变。
     */
    ConstraintHandle install(LinearConstraint constraint) throws InfeasibleException;

    /**
     * 原子地替换一条已安装约束的系数。
     * @throws InfeasibleException 替换后不可满足；此时原约束保持不变。
     */
    void replace(ConstraintHandle handle, LinearConstraint constraint) throws InfeasibleException;

    /**
     * 移除一条约束。
     */
    void remove(ConstraintHandle handle);

    /**
     * 在结构或系数变化后重新求解变量的值。同步阻塞。
     * @throws InfeasibleException required 约束不可满足。
     */
    void reoptimize() throws InfeasibleException;
}
