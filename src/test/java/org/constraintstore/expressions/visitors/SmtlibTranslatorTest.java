package org.constraintstore.expressions.visitors;

import org.apache.commons.lang3.tuple.Triple;
import org.constraintstore.core.ArrayVariable;
import org.constraintstore.core.BitVecVariable;
import org.constraintstore.core.BoolVariable;
import org.constraintstore.expressions.BitVecConstant;
import org.constraintstore.expressions.BitVecExpression;
import org.constraintstore.expressions.BoolConstant;
import org.constraintstore.expressions.Expression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SmtlibTranslatorTest {

    private final BoolVariable p = new BoolVariable("p", Set.of());
    private final BitVecVariable x = new BitVecVariable(32, "x", Set.of());
    private final BitVecVariable y = new BitVecVariable(32, "y", Set.of());

    @Nested
    @DisplayName("直接翻译")
    class TranslateTests {

        @Test
        @DisplayName("叶子节点")
        void testLeaves() {
            assertAll(
                    () -> assertEquals("x", SmtlibTranslator.translate(x)),
                    () -> assertEquals("true", SmtlibTranslator.translate(BoolConstant.TRUE)),
                    () -> assertEquals("false", SmtlibTranslator.translate(BoolConstant.FALSE)),
                    () -> assertEquals("(_ bv255 8)", SmtlibTranslator.translate(BitVecConstant.of(-1, 8)))
            );
        }

        @Test
        @DisplayName("运算节点按 (符号 操作数...) 输出")
        void testOperations() {
            assertAll(
                    () -> assertEquals("(bvult x (_ bv3 32))", SmtlibTranslator.translate(x.ult(3))),
                    () -> assertEquals("(and p (bvsge x y))", SmtlibTranslator.translate(p.and(x.sge(y)))),
                    () -> assertEquals("(=> p (not p))", SmtlibTranslator.translate(p.implies(p.not()))),
                    () -> assertEquals("(ite p x y)", SmtlibTranslator.translate(p.ite(x, y))),
                    () -> assertEquals("(bvneg (bvlshr x y))", SmtlibTranslator.translate(x.lshr(y).neg()))
            );
        }

        @Test
        @DisplayName("数组读写")
        void testArrays() {
            ArrayVariable mem = new ArrayVariable(32, null, 8, "mem", Set.of());

            assertEquals("(select (store mem x (_ bv7 8)) y)",
                    SmtlibTranslator.translate(mem.store(x, BitVecConstant.of(7, 8)).select(y)));
        }

        @Test
        @DisplayName("不使用绑定时共享子表达式被原样展开两次")
        void testNoBindings_ExpandsSharedNodes() {
            BitVecExpression sum = x.add(y);

            assertEquals("(and (bvult (bvadd x y) (_ bv1 32)) (bvugt (bvadd x y) (_ bv0 32)))",
                    SmtlibTranslator.translate(sum.ult(1).and(sum.ugt(0))));
        }
    }

    @Nested
    @DisplayName("结果队列与辅助绑定")
    class BindingTests {

        @Test
        @DisplayName("按 visit 顺序取出结果，取尽后返回 null")
        void testPopOrder() {
            SmtlibTranslator translator = new SmtlibTranslator(true);
            translator.visit(p);
            translator.visit(x.ult(1));

            assertAll(
                    () -> assertEquals("p", translator.pop()),
                    () -> assertEquals("(bvult x (_ bv1 32))", translator.pop()),
                    () -> assertNull(translator.pop())
            );
        }

        @Test
        @DisplayName("只被引用一次的节点不生成绑定")
        void testSingleReference_NoBinding() {
            SmtlibTranslator translator = new SmtlibTranslator(true);
            translator.visit(x.add(y).ult(3));

            assertTrue(translator.getBindings().isEmpty());
        }

        @Test
        @DisplayName("被多次引用的内部节点生成一个绑定")
        void testSharedNode_Binding() {
            BitVecExpression sum = x.add(y);
            SmtlibTranslator translator = new SmtlibTranslator(true);
            translator.visit(sum.ult(1).and(sum.ugt(0)));

            List<Triple<String, Expression, String>> bindings = translator.getBindings();

            assertAll(
                    () -> assertEquals(1, bindings.size()),
                    () -> assertEquals("!aux_1!", bindings.get(0).getLeft()),
                    () -> assertSame(sum, bindings.get(0).getMiddle()),
                    () -> assertEquals("(bvadd x y)", bindings.get(0).getRight()),
                    () -> assertEquals("(and (bvult !aux_1! (_ bv1 32)) (bvugt !aux_1! (_ bv0 32)))", translator.pop())
            );
        }

        @Test
        @DisplayName("根节点即使被多次 visit 也不成为绑定")
        void testRootIsNeverBound() {
            Expression constraint = x.ult(y);
            SmtlibTranslator translator = new SmtlibTranslator(true);
            translator.visit(constraint);
            translator.visit(constraint);

            assertAll(
                    () -> assertTrue(translator.getBindings().isEmpty()),
                    () -> assertEquals("(bvult x y)", translator.pop()),
                    () -> assertEquals("(bvult x y)", translator.pop())
            );
        }

        @Test
        @DisplayName("已有绑定在之后的 visit 中复用")
        void testBindingReusedAcrossVisits() {
            BitVecExpression sum = x.add(y);
            SmtlibTranslator translator = new SmtlibTranslator(true);
            translator.visit(sum.ult(1).and(sum.ugt(0)));
            translator.visit(sum.mul(2).eq(4));

            translator.pop();

            assertAll(
                    () -> assertEquals(1, translator.getBindings().size()),
                    () -> assertEquals("(= (bvmul !aux_1! (_ bv2 32)) (_ bv4 32))", translator.pop())
            );
        }

        @Test
        @DisplayName("嵌套的共享节点按创建顺序编号")
        void testNestedBindings() {
            BitVecExpression inner = x.add(y);
            BitVecExpression outer = inner.mul(inner);
            SmtlibTranslator translator = new SmtlibTranslator(true);
            translator.visit(outer.ult(1).and(outer.ugt(0)));

            List<Triple<String, Expression, String>> bindings = translator.getBindings();

            assertAll(
                    () -> assertEquals(2, bindings.size()),
                    () -> assertEquals("(bvadd x y)", bindings.get(0).getRight()),
                    () -> assertEquals("(bvmul !aux_1! !aux_1!)", bindings.get(1).getRight()),
                    () -> assertEquals("(and (bvult !aux_2! (_ bv1 32)) (bvugt !aux_2! (_ bv0 32)))", translator.pop())
            );
        }
    }
}
