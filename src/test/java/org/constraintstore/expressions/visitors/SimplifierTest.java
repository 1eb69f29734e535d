package org.constraintstore.expressions.visitors;

import org.constraintstore.core.ArrayVariable;
import org.constraintstore.core.BitVecVariable;
import org.constraintstore.core.BoolVariable;
import org.constraintstore.expressions.*;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SimplifierTest {

    private final BoolVariable p = new BoolVariable("p", Set.of());
    private final BoolVariable q = new BoolVariable("q", Set.of());
    private final BitVecVariable x = new BitVecVariable(32, "x", Set.of());
    private final BitVecVariable y = new BitVecVariable(32, "y", Set.of());

    private static BigInteger valueOf(Expression expression) {
        assertTrue(expression instanceof BitVecConstant, "期望折叠为常量，实际为 " + expression);
        return ((BitVecConstant) expression).getValue();
    }

    @Nested
    @DisplayName("布尔运算")
    class BoolTests {

        @Test
        @DisplayName("与 false 合取得 false，与 true 合取得另一侧")
        void testAnd() {
            assertAll(
                    () -> assertSame(BoolConstant.FALSE, Simplifier.simplify(p.and(BoolConstant.FALSE))),
                    () -> assertSame(p, Simplifier.simplify(p.and(BoolConstant.TRUE))),
                    () -> assertSame(BoolConstant.TRUE, Simplifier.simplify(BoolConstant.TRUE.and(BoolConstant.TRUE)))
            );
        }

        @Test
        @DisplayName("与 true 析取得 true，与 false 析取得另一侧")
        void testOr() {
            assertAll(
                    () -> assertSame(BoolConstant.TRUE, Simplifier.simplify(p.or(BoolConstant.TRUE))),
                    () -> assertSame(q, Simplifier.simplify(BoolConstant.FALSE.or(q)))
            );
        }

        @Test
        @DisplayName("双重否定被消去，常量取反")
        void testNot() {
            assertAll(
                    () -> assertSame(p, Simplifier.simplify(p.not().not())),
                    () -> assertSame(BoolConstant.FALSE, Simplifier.simplify(BoolConstant.TRUE.not()))
            );
        }

        @Test
        @DisplayName("蕴含、异或与条件表达式的折叠")
        void testImpliesXorIte() {
            assertAll(
                    () -> assertSame(BoolConstant.TRUE, Simplifier.simplify(BoolConstant.FALSE.implies(p))),
                    () -> assertSame(q, Simplifier.simplify(BoolConstant.TRUE.implies(q))),
                    () -> assertSame(BoolConstant.FALSE, Simplifier.simplify(p.xor(p))),
                    () -> assertSame(p, Simplifier.simplify(BoolConstant.TRUE.ite(p, q))),
                    () -> assertSame(q, Simplifier.simplify(BoolConstant.FALSE.ite(p, q))),
                    () -> assertSame(x, Simplifier.simplify(p.ite(x, x)))
            );
        }

        @Test
        @DisplayName("矛盾的常量比较折叠为 false")
        void testConstantComparisonFolds() {
            BitVecConstant three = BitVecConstant.of(3, 32);
            BitVecConstant five = BitVecConstant.of(5, 32);

            assertAll(
                    () -> assertSame(BoolConstant.TRUE, Simplifier.simplify(three.ult(five))),
                    () -> assertSame(BoolConstant.FALSE, Simplifier.simplify(three.eq(five))),
                    () -> assertSame(BoolConstant.TRUE, Simplifier.simplify(three.eq(BitVecConstant.of(3, 32))))
            );
        }

        @Test
        @DisplayName("有符号比较按补码解释")
        void testSignedComparison() {
            BitVecConstant minusOne = BitVecConstant.of(-1, 8);
            BitVecConstant one = BitVecConstant.of(1, 8);

            assertAll(
                    () -> assertSame(BoolConstant.TRUE, Simplifier.simplify(minusOne.slt(one))),
                    () -> assertSame(BoolConstant.FALSE, Simplifier.simplify(minusOne.ult(one)))
            );
        }

        @Test
        @DisplayName("同一个表达式与自身比较")
        void testSelfComparison() {
            assertAll(
                    () -> assertSame(BoolConstant.TRUE, Simplifier.simplify(x.eq(x))),
                    () -> assertSame(BoolConstant.TRUE, Simplifier.simplify(x.ule(x))),
                    () -> assertSame(BoolConstant.FALSE, Simplifier.simplify(x.ult(x)))
            );
        }

        @Test
        @DisplayName("x < 3 且 x > 5 中含变量，不被折叠")
        void testSymbolicComparisonIsKept() {
            BoolExpression expression = x.ult(3).and(x.ugt(5));

            assertSame(expression, Simplifier.simplify(expression));
        }
    }

    @Nested
    @DisplayName("位向量运算")
    class BitVecTests {

        @Test
        @DisplayName("常量算术按位宽回绕")
        void testConstantArithmetic() {
            BitVecConstant max = BitVecConstant.of(255, 8);

            assertAll(
                    () -> assertEquals(BigInteger.ZERO, valueOf(Simplifier.simplify(max.add(1)))),
                    () -> assertEquals(BigInteger.valueOf(255), valueOf(Simplifier.simplify(BitVecConstant.of(0, 8).sub(1)))),
                    () -> assertEquals(BigInteger.valueOf(254), valueOf(Simplifier.simplify(max.mul(2)))),
                    () -> assertEquals(BigInteger.valueOf(255), valueOf(Simplifier.simplify(BitVecConstant.of(7, 8).udiv(BitVecConstant.of(0, 8))))),
                    () -> assertEquals(BigInteger.valueOf(7), valueOf(Simplifier.simplify(BitVecConstant.of(7, 8).urem(BitVecConstant.of(0, 8))))),
                    () -> assertEquals(BigInteger.valueOf(0xF0), valueOf(Simplifier.simplify(BitVecConstant.of(0x0F, 8).bitNot()))),
                    () -> assertEquals(BigInteger.valueOf(255), valueOf(Simplifier.simplify(BitVecConstant.of(1, 8).neg()))),
                    () -> assertEquals(BigInteger.valueOf(0x80), valueOf(Simplifier.simplify(BitVecConstant.of(1, 8).shl(BitVecConstant.of(7, 8))))),
                    () -> assertEquals(BigInteger.ZERO, valueOf(Simplifier.simplify(BitVecConstant.of(1, 8).shl(BitVecConstant.of(8, 8)))))
            );
        }

        @Test
        @DisplayName("加零、乘零等恒等式")
        void testIdentities() {
            assertAll(
                    () -> assertSame(x, Simplifier.simplify(x.add(0))),
                    () -> assertSame(x, Simplifier.simplify(BitVecConstant.of(0, 32).add(x))),
                    () -> assertSame(x, Simplifier.simplify(x.sub(0))),
                    () -> assertEquals(BigInteger.ZERO, valueOf(Simplifier.simplify(x.mul(0)))),
                    () -> assertSame(x, Simplifier.simplify(x.bitNot().bitNot())),
                    () -> assertSame(x, Simplifier.simplify(x.neg().neg()))
            );
        }

        @Test
        @DisplayName("嵌套常量子树自底向上折叠")
        void testNestedFolding() {
            BitVecExpression expression = x.add(BitVecConstant.of(2, 32).add(3));

            BitVecExpression simplified = Simplifier.simplify(expression);

            assertAll(
                    () -> assertEquals(BitVecOperator.ADD, ((BitVecOperation) simplified).getOperator()),
                    () -> assertSame(x, simplified.getOperands().get(0)),
                    () -> assertEquals(BigInteger.valueOf(5), valueOf(simplified.getOperands().get(1)))
            );
        }

        @Test
        @DisplayName("常量下标读取最近一次对同一下标的写入")
        void testSelectOverStore() {
            ArrayVariable mem = new ArrayVariable(32, null, 8, "mem", Set.of());
            ArrayExpression written = mem.store(1, 10).store(2, 20);

            assertAll(
                    () -> assertEquals(BigInteger.valueOf(10), valueOf(Simplifier.simplify(written.select(1)))),
                    () -> assertEquals(BigInteger.valueOf(20), valueOf(Simplifier.simplify(written.select(2))))
            );
        }

        @Test
        @DisplayName("未命中的常量写入被越过")
        void testSelectSkipsUnrelatedStore() {
            ArrayVariable mem = new ArrayVariable(32, null, 8, "mem", Set.of());

            Expression simplified = Simplifier.simplify(mem.store(1, 10).select(3));

            assertAll(
                    () -> assertTrue(simplified instanceof ArraySelect),
                    () -> assertSame(mem, ((ArraySelect) simplified).getArray())
            );
        }
    }

    @Nested
    @DisplayName("污点")
    class TaintTests {

        @Test
        @DisplayName("重建的节点保留自身的污点")
        void testRebuiltNodeKeepsTaint() {
            BoolExpression guarded = new BoolOperation(BoolOperator.ULT,
                    List.of(x.add(0), BitVecConstant.of(3, 32)), Set.of("branch"));

            BoolExpression simplified = Simplifier.simplify(guarded);

            assertAll(
                    () -> assertNotSame(guarded, simplified),
                    () -> assertSame(x, simplified.getOperands().get(0)),
                    () -> assertEquals(Set.of("branch"), simplified.getTaint())
            );
        }

        @Test
        @DisplayName("折叠出的位向量常量继承操作数的污点")
        void testFoldedBitVecKeepsOperandTaint() {
            BitVecConstant input = new BitVecConstant(BigInteger.TWO, 32, Set.of("stdin"));

            Expression folded = Simplifier.simplify(input.add(3));

            assertAll(
                    () -> assertEquals(BigInteger.valueOf(5), valueOf(folded)),
                    () -> assertEquals(Set.of("stdin"), folded.getTaint())
            );
        }

        @Test
        @DisplayName("折叠出的布尔常量继承被折叠节点的污点")
        void testFoldedBoolKeepsTaint() {
            BoolExpression comparison = new BoolOperation(BoolOperator.ULT,
                    List.of(BitVecConstant.of(3, 32), BitVecConstant.of(5, 32)), Set.of("cmp"));

            BoolExpression folded = Simplifier.simplify(comparison);

            assertAll(
                    () -> assertTrue(BoolConstant.isTrue(folded)),
                    () -> assertEquals(Set.of("cmp"), folded.getTaint())
            );
        }

        @Test
        @DisplayName("替换变量后重建的节点保留自身的污点")
        void testReplacedNodeKeepsTaint() {
            BitVecVariable z = new BitVecVariable(32, "z", Set.of());
            BoolExpression guarded = new BoolOperation(BoolOperator.ULT, List.of(x, y), Set.of("branch"));

            Expression replaced = Replacer.replace(guarded, Map.of(x, z));

            assertAll(
                    () -> assertSame(z, replaced.getOperands().get(0)),
                    () -> assertTrue(replaced.getTaint().contains("branch"))
            );
        }
    }

    @Test
    @DisplayName("化简是幂等的")
    void testIdempotent() {
        BoolExpression expression = p.and(BoolConstant.TRUE).or(x.add(0).ult(y.mul(1)));

        BoolExpression once = Simplifier.simplify(expression);
        BoolExpression twice = Simplifier.simplify(once);

        assertSame(once, twice);
    }

    @Test
    @DisplayName("无可化简之处时返回原对象")
    void testNothingToFold_ReturnsSameObject() {
        BoolExpression expression = p.or(x.ult(y));

        assertSame(expression, Simplifier.simplify(expression));
    }
}
