package org.cassowary.constants.constants;

import org.cassowary.constants.core.Constant;
import org.cassowary.constants.expressions.scalar.ScalarExpression;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

import static org.cassowary.constants.expressions.scalar.ScalarExpression.literal;
import static org.cassowary.constants.expressions.scalar.ScalarExpression.ref;
import static org.junit.jupiter.api.Assertions.*;

class ConstantTableTest {

    private ConstantTable table;
    private Constant a, b;

    @BeforeEach
    void setUp() {
        table = new ConstantTable();
        a = table.declare("a");
        b = table.declare("b");
    }

    @Nested
    @DisplayName("设置与解析 (Set and Resolve)")
    class SetTests {

        @Test
        @DisplayName("新声明的常量未设置")
        void testDeclaredConstantIsUnset() {
            assertAll(
                    () -> assertEquals(OptionalDouble.empty(), table.valueOf(a)),
                    () -> assertEquals(ConstantDefinition.Kind.UNSET, table.definitionOf(a).getKind()),
                    () -> assertEquals("a", a.getLabel())
            );
        }

        @Test
        @DisplayName("设置字面量后 valueOf 返回该值")
        void testSetLiteral() throws ConstantException {
            table.set(a, 42.5);
            assertEquals(OptionalDouble.of(42.5), table.valueOf(a));
        }

        @Test
        @DisplayName("单个字面量节点按字面量定义处理")
        void testLiteralNodeIsLiteralDefinition() throws ConstantException {
            table.set(a, literal(3));
            assertEquals(ConstantDefinition.Kind.LITERAL, table.definitionOf(a).getKind());
        }

        @Test
        @DisplayName("公式引用未设置的常量应失败，且不修改常量表")
        void testFormulaWithUnsetReferenceFails() {
            ConstantException e = assertThrows(ConstantException.class, () -> table.set(a, ref(b).multiply(literal(2))));
            assertAll(
                    () -> assertEquals(ConstantException.Reason.UNRESOLVED_DEPENDENCY, e.getReason()),
                    () -> assertEquals(b, e.getMissing()),
                    () -> assertEquals(a, e.getConstant()),
                    () -> assertEquals("Can not set constant `a` because `b` is not set.", e.getMessage()),
                    () -> assertEquals(OptionalDouble.empty(), table.valueOf(a)),
                    () -> assertEquals(ConstantDefinition.Kind.UNSET, table.definitionOf(a).getKind()),
                    () -> assertTrue(table.dependentsOf(b).isEmpty())
            );
        }

        @Test
        @DisplayName("解析按调用顺序进行：先引用后设置失败，先设置后引用成功")
        void testResolutionFollowsCallOrder() throws ConstantException {
            assertThrows(ConstantException.class, () -> table.set(a, ref(b).add(literal(1))));
            table.set(b, 5);
            table.set(a, ref(b).add(literal(1)));
            assertEquals(OptionalDouble.of(6.0), table.valueOf(a));
        }

        @Test
        @DisplayName("失败的重新定义保留原有的定义和值")
        void testFailedRedefinitionKeepsPreviousState() throws ConstantException {
            table.set(a, 5);
            Constant unset = table.declare("unset");
            assertThrows(ConstantException.class, () -> table.set(a, ref(unset)));
            assertAll(
                    () -> assertEquals(OptionalDouble.of(5.0), table.valueOf(a)),
                    () -> assertEquals(ConstantDefinition.literal(5), table.definitionOf(a)),
                    () -> assertTrue(table.dependentsOf(unset).isEmpty())
            );
        }

        @Test
        @DisplayName("公式除零应报告 DIVISION_BY_ZERO")
        void testDivisionByZero() throws ConstantException {
            table.set(b, 0);
            ConstantException e = assertThrows(ConstantException.class, () -> table.set(a, literal(1).divide(ref(b))));
            assertAll(
                    () -> assertEquals(ConstantException.Reason.DIVISION_BY_ZERO, e.getReason()),
                    () -> assertEquals(a, e.getConstant()),
                    () -> assertEquals(OptionalDouble.empty(), table.valueOf(a))
            );
        }

        @Test
        @DisplayName("公式结果溢出为无穷大时报告 NON_FINITE，且不修改常量表")
        void testOverflowingFormulaRejected() throws ConstantException {
            table.set(b, 1e308);
            ConstantException e = assertThrows(ConstantException.class,
                    () -> table.set(a, ref(b).multiply(literal(10))));
            assertAll(
                    () -> assertEquals(ConstantException.Reason.NON_FINITE, e.getReason()),
                    () -> assertEquals(a, e.getConstant()),
                    () -> assertEquals(OptionalDouble.empty(), table.valueOf(a)),
                    () -> assertEquals(ConstantDefinition.Kind.UNSET, table.definitionOf(a).getKind()),
                    () -> assertTrue(table.dependentsOf(b).isEmpty())
            );
        }

        @Test
        @DisplayName("UNSET 不能作为新定义")
        void testUnsetDefinitionRejected() {
            assertThrows(IllegalArgumentException.class, () -> table.set(a, ConstantDefinition.UNSET));
        }

        @Test
        @DisplayName("不属于本表的常量应被拒绝")
        void testForeignConstantRejected() {
            Constant foreign = new ConstantTable().declare("foreign");
            assertThrows(IllegalArgumentException.class, () -> table.set(foreign, 1));
            assertThrows(IllegalArgumentException.class, () -> table.set(a, ref(foreign)));
        }
    }

    @Nested
    @DisplayName("循环防护 (Cycle Guard)")
    class CycleTests {

        @Test
        @DisplayName("自引用应以 UNRESOLVED_DEPENDENCY 失败")
        void testSelfReference() throws ConstantException {
            table.set(a, 1);
            ConstantException e = assertThrows(ConstantException.class, () -> table.set(a, ref(a).add(literal(1))));
            assertAll(
                    () -> assertEquals(ConstantException.Reason.UNRESOLVED_DEPENDENCY, e.getReason()),
                    () -> assertEquals(a, e.getMissing()),
                    () -> assertEquals(OptionalDouble.of(1.0), table.valueOf(a))
            );
        }

        @Test
        @DisplayName("引用自己的依赖项应失败 (b = a * 2 后 a = b)")
        void testReferenceToOwnDependent() throws ConstantException {
            table.set(a, 1);
            table.set(b, ref(a).multiply(literal(2)));
            ConstantException e = assertThrows(ConstantException.class, () -> table.set(a, ref(b)));
            assertAll(
                    () -> assertEquals(b, e.getMissing()),
                    () -> assertEquals(OptionalDouble.of(1.0), table.valueOf(a)),
                    () -> assertEquals(OptionalDouble.of(2.0), table.valueOf(b))
            );
        }

        @Test
        @DisplayName("引用传递依赖项同样失败 (a <- b <- c, 然后 a = c)")
        void testReferenceToTransitiveDependent() throws ConstantException {
            Constant c = table.declare("c");
            table.set(a, 1);
            table.set(b, ref(a));
            table.set(c, ref(b));
            ConstantException e = assertThrows(ConstantException.class, () -> table.set(a, ref(c)));
            assertEquals(c, e.getMissing());
        }
    }

    @Nested
    @DisplayName("依赖传播 (Dependent Propagation)")
    class PropagationTests {

        @Test
        @DisplayName("更新被引用的常量后依赖项自动重新求值 (b = 2, a = b * 3, 然后 b = 5)")
        void testDependentReResolved() throws ConstantException {
            table.set(b, 2);
            table.set(a, ref(b).multiply(literal(3)));
            assertEquals(OptionalDouble.of(6.0), table.valueOf(a));

            PropagationResult result = table.set(b, 5);

            assertAll(
                    () -> assertEquals(OptionalDouble.of(15.0), table.valueOf(a)),
                    () -> assertEquals(List.of(b, a), result.getChanged()),
                    () -> assertEquals(OptionalDouble.of(15.0), result.valueOf(a)),
                    () -> assertFalse(result.hasWarnings())
            );
        }

        @Test
        @DisplayName("依赖按依赖顺序求值，菱形和深度不同的路径都读到最新值")
        void testDependencyOrderUnderDiamond() throws ConstantException {
            // a -> b -> c -> d，同时 a -> d
            Constant c = table.declare("c");
            Constant d = table.declare("d");
            table.set(a, 1);
            table.set(b, ref(a));
            table.set(c, ref(b).multiply(literal(2)));
            table.set(d, ref(a).add(ref(c)));
            assertEquals(OptionalDouble.of(3.0), table.valueOf(d));

            PropagationResult result = table.set(a, 2);

            assertAll(
                    () -> assertEquals(OptionalDouble.of(2.0), table.valueOf(b)),
                    () -> assertEquals(OptionalDouble.of(4.0), table.valueOf(c)),
                    () -> assertEquals(OptionalDouble.of(6.0), table.valueOf(d)),
                    () -> assertEquals(List.of(a, b, c, d), result.getResolved())
            );
        }

        @Test
        @DisplayName("公式重新定义为字面量后不再依赖原来的常量")
        void testRedefinitionDropsOldDependency() throws ConstantException {
            table.set(a, 1);
            table.set(b, ref(a).multiply(literal(3)));
            assertEquals(Set.of(b), table.dependentsOf(a));

            table.set(b, 7);
            table.set(a, 10);

            assertAll(
                    () -> assertTrue(table.dependentsOf(a).isEmpty()),
                    () -> assertEquals(OptionalDouble.of(7.0), table.valueOf(b))
            );
        }

        @Test
        @DisplayName("依赖项重新解析后溢出时记入 NON_FINITE 警告并置为未解析")
        void testOverflowingDependentIsReportedAsWarning() throws ConstantException {
            table.set(b, 1);
            table.set(a, ref(b).multiply(literal(1e308)));

            PropagationResult result = table.set(b, 10);

            assertAll(
                    () -> assertEquals(OptionalDouble.of(10.0), table.valueOf(b)),
                    () -> assertEquals(OptionalDouble.empty(), table.valueOf(a)),
                    () -> assertEquals(1, result.getWarnings().size()),
                    () -> assertEquals(ConstantException.Reason.NON_FINITE, result.getWarnings().get(0).getReason()),
                    () -> assertEquals(a, result.getWarnings().get(0).getConstant())
            );
        }

        @Test
        @DisplayName("依赖项重新解析失败时记入警告并置为未解析，不影响本次设置")
        void testFailingDependentIsReportedAsWarning() throws ConstantException {
            Constant c = table.declare("c");
            table.set(a, 2);
            table.set(b, literal(10).divide(ref(a)));
            table.set(c, ref(b).add(literal(1)));

            PropagationResult result = table.set(a, 0);

            assertAll(
                    () -> assertEquals(OptionalDouble.of(0.0), table.valueOf(a)),
                    () -> assertEquals(OptionalDouble.empty(), table.valueOf(b)),
                    () -> assertEquals(OptionalDouble.empty(), table.valueOf(c)),
                    () -> assertEquals(2, result.getWarnings().size()),
                    () -> assertEquals(ConstantException.Reason.DIVISION_BY_ZERO, result.getWarnings().get(0).getReason()),
                    () -> assertEquals(b, result.getWarnings().get(0).getConstant()),
                    () -> assertEquals(ConstantException.Reason.UNRESOLVED_DEPENDENCY, result.getWarnings().get(1).getReason()),
                    () -> assertEquals(b, result.getWarnings().get(1).getMissing())
            );

            // 恢复后依赖项重新可用
            table.set(a, 5);
            assertEquals(OptionalDouble.of(3.0), table.valueOf(c));
        }
    }

    @Nested
    @DisplayName("变化通知 (Change Notification)")
    class ListenerTests {

        @Test
        @DisplayName("只对值确实改变的常量发出通知")
        void testListenerFiresOnlyOnChange() throws ConstantException {
            List<String> events = new ArrayList<>();
            table.addListener((constant, oldValue, newValue) ->
                    events.add(constant.getLabel() + ":" + oldValue + "->" + newValue));

            table.set(b, 2);
            table.set(a, ref(b).multiply(literal(3)));
            events.clear();

            PropagationResult same = table.set(b, 2);
            assertAll(
                    () -> assertTrue(events.isEmpty()),
                    () -> assertTrue(same.getChanged().isEmpty()),
                    () -> assertEquals(List.of(b, a), same.getResolved())
            );

            table.set(b, 4);
            assertEquals(List.of(
                    "b:" + OptionalDouble.of(2.0) + "->" + OptionalDouble.of(4.0),
                    "a:" + OptionalDouble.of(6.0) + "->" + OptionalDouble.of(12.0)), events);
        }

        @Test
        @DisplayName("移除监听器后不再收到通知")
        void testRemoveListener() throws ConstantException {
            List<Constant> events = new ArrayList<>();
            ConstantChangeListener listener = (constant, oldValue, newValue) -> events.add(constant);
            table.addListener(listener);
            table.set(a, 1);
            table.removeListener(listener);
            table.set(a, 2);
            assertEquals(List.of(a), events);
        }
    }

    @Test
    @DisplayName("constants 按声明顺序返回")
    void testConstantsInDeclarationOrder() {
        Constant c = table.declare("c");
        assertEquals(List.of(a, b, c), table.constants());
        assertTrue(table.contains(c));
    }

    @Test
    @DisplayName("DependencyEvaluator.resolve 对未设置的常量报告 CONSTANT_NOT_SET")
    void testResolveUnsetConstant() {
        ConstantException e = assertThrows(ConstantException.class, () -> table.getEvaluator().resolve(a));
        assertEquals(ConstantException.Reason.CONSTANT_NOT_SET, e.getReason());
    }

    @Test
    @DisplayName("DependencyEvaluator.resolve 使用常量表当前的值")
    void testResolveAgainstCurrentTable() throws ConstantException {
        table.set(b, 3);
        table.set(a, ScalarExpression.ref(b).subtract(literal(1)));
        assertEquals(2.0, table.getEvaluator().resolve(a));
    }
}
