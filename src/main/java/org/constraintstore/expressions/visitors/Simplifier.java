package org.constraintstore.expressions.visitors;

import org.constraintstore.expressions.*;
import org.constraintstore.utils.BitVectors;

import java.math.BigInteger;
import java.util.*;

/**
 * 自底向上的常量折叠。
 * 结果对已化简的输入是幂等的：simplify(simplify(e)) 与 simplify(e) 引用相同。
 * 没有可折叠之处的子树原样返回。
 */
public final class Simplifier {

    private final Map<Expression, Expression> cache = new IdentityHashMap<>();

    private Simplifier() {
    }

    public static Expression simplify(Expression expression) {
        return new Simplifier().visit(Objects.requireNonNull(expression, "Simplifier: expression 不能为 null"));
    }

    public static BoolExpression simplify(BoolExpression expression) {
        return (BoolExpression) simplify((Expression) expression);
    }

    public static BitVecExpression simplify(BitVecExpression expression) {
        return (BitVecExpression) simplify((Expression) expression);
    }

    private Expression visit(Expression expression) {
        if (expression.isLeaf()) {
            return expression;
        }
        Expression cached = cache.get(expression);
        if (cached != null) {
            return cached;
        }
        List<Expression> newOperands = new ArrayList<>();
        for (Expression operand : expression.getOperands()) {
            newOperands.add(visit(operand));
        }
        Expression rebuilt = expression.withOperands(newOperands);
        Expression result = fold(rebuilt);
        cache.put(expression, result);
        return result;
    }

    private Expression fold(Expression expression) {
        if (expression instanceof BoolOperation) {
            return foldBool((BoolOperation) expression);
        }
        if (expression instanceof BitVecOperation) {
            return foldBitVec((BitVecOperation) expression);
        }
        if (expression instanceof ArraySelect) {
            return foldSelect((ArraySelect) expression);
        }
        return expression;
    }

    // --- 布尔运算 ---

    private Expression foldBool(BoolOperation operation) {
        List<Expression> ops = operation.getOperands();
        return switch (operation.getOperator()) {
            case NOT -> foldNot(operation, ops.get(0));
            case AND -> foldJunction(operation, false);
            case OR -> foldJunction(operation, true);
            case XOR -> foldXor(operation, ops.get(0), ops.get(1));
            case IMPLIES -> foldImplies(operation, ops.get(0), ops.get(1));
            case EQ -> foldEq(operation, ops.get(0), ops.get(1));
            case ITE -> foldIte(operation, ops.get(0), ops.get(1), ops.get(2));
            default -> foldComparison(operation, (BitVecExpression) ops.get(0), (BitVecExpression) ops.get(1));
        };
    }

    private Expression foldNot(BoolOperation operation, Expression operand) {
        if (operand instanceof BoolConstant) {
            return constant(operation, !((BoolConstant) operand).isValue());
        }
        if (operand instanceof BoolOperation && ((BoolOperation) operand).getOperator() == BoolOperator.NOT) {
            return operand.getOperands().get(0);
        }
        return operation;
    }

    /**
     * AND / OR 的折叠。absorbing 为吸收元的值：OR 为 true，AND 为 false。
     */
    private Expression foldJunction(BoolOperation operation, boolean absorbing) {
        List<Expression> kept = new ArrayList<>();
        for (Expression operand : operation.getOperands()) {
            if (operand instanceof BoolConstant) {
                if (((BoolConstant) operand).isValue() == absorbing) {
                    return constant(operation, absorbing);
                }
                continue;
            }
            kept.add(operand);
        }
        if (kept.isEmpty()) {
            return constant(operation, !absorbing);
        }
        if (kept.size() == 1) {
            return kept.get(0);
        }
        if (kept.size() == operation.getOperands().size()) {
            return operation;
        }
        return new BoolOperation(operation.getOperator(), kept, operation.getTaint());
    }

    private Expression foldXor(BoolOperation operation, Expression left, Expression right) {
        if (left instanceof BoolConstant && right instanceof BoolConstant) {
            return constant(operation, ((BoolConstant) left).isValue() ^ ((BoolConstant) right).isValue());
        }
        if (left == right) {
            return constant(operation, false);
        }
        if (BoolConstant.isFalse(left)) {
            return right;
        }
        if (BoolConstant.isFalse(right)) {
            return left;
        }
        return operation;
    }

    private Expression foldImplies(BoolOperation operation, Expression left, Expression right) {
        if (BoolConstant.isFalse(left) || BoolConstant.isTrue(right) || left == right) {
            return constant(operation, true);
        }
        if (BoolConstant.isTrue(left)) {
            return right;
        }
        return operation;
    }

    private Expression foldEq(BoolOperation operation, Expression left, Expression right) {
        if (left == right) {
            return constant(operation, true);
        }
        if (left instanceof BoolConstant && right instanceof BoolConstant) {
            return constant(operation, ((BoolConstant) left).isValue() == ((BoolConstant) right).isValue());
        }
        if (left instanceof BitVecConstant && right instanceof BitVecConstant) {
            return constant(operation, ((BitVecConstant) left).sameValue((BitVecConstant) right));
        }
        return operation;
    }

    private Expression foldIte(Expression operation, Expression condition, Expression whenTrue, Expression whenFalse) {
        if (condition instanceof BoolConstant) {
            return ((BoolConstant) condition).isValue() ? whenTrue : whenFalse;
        }
        if (whenTrue == whenFalse) {
            return whenTrue;
        }
        return operation;
    }

    private Expression foldComparison(BoolOperation operation, BitVecExpression left, BitVecExpression right) {
        BoolOperator operator = operation.getOperator();
        if (left == right) {
            return constant(operation, switch (operator) {
                case ULE, UGE, SLE, SGE -> true;
                default -> false;
            });
        }
        if (!(left instanceof BitVecConstant) || !(right instanceof BitVecConstant)) {
            return operation;
        }
        BitVecConstant a = (BitVecConstant) left;
        BitVecConstant b = (BitVecConstant) right;
        int unsigned = a.getValue().compareTo(b.getValue());
        int signed = a.getSignedValue().compareTo(b.getSignedValue());
        boolean value = switch (operator) {
            case ULT -> unsigned < 0;
            case ULE -> unsigned <= 0;
            case UGT -> unsigned > 0;
            case UGE -> unsigned >= 0;
            case SLT -> signed < 0;
            case SLE -> signed <= 0;
            case SGT -> signed > 0;
            case SGE -> signed >= 0;
            default -> throw new IllegalStateException("不是比较运算：" + operator);
        };
        return constant(operation, value);
    }

    // --- 位向量运算 ---

    private Expression foldBitVec(BitVecOperation operation) {
        List<Expression> ops = operation.getOperands();
        BitVecOperator operator = operation.getOperator();
        int size = operation.getSize();
        if (operator == BitVecOperator.ITE) {
            return foldIte(operation, ops.get(0), ops.get(1), ops.get(2));
        }
        if (operator.isUnary()) {
            if (ops.get(0) instanceof BitVecConstant) {
                BigInteger a = ((BitVecConstant) ops.get(0)).getValue();
                return constant(operation, operator == BitVecOperator.NOT ? BitVectors.not(a, size) : BitVectors.neg(a, size));
            }
            Expression operand = ops.get(0);
            if (operand instanceof BitVecOperation && ((BitVecOperation) operand).getOperator() == operator) {
                return operand.getOperands().get(0);
            }
            return operation;
        }
        Expression left = ops.get(0);
        Expression right = ops.get(1);
        if (left instanceof BitVecConstant && right instanceof BitVecConstant) {
            BigInteger a = ((BitVecConstant) left).getValue();
            BigInteger b = ((BitVecConstant) right).getValue();
            BigInteger value = switch (operator) {
                case ADD -> BitVectors.add(a, b, size);
                case SUB -> BitVectors.sub(a, b, size);
                case MUL -> BitVectors.mul(a, b, size);
                case UDIV -> BitVectors.udiv(a, b, size);
                case UREM -> BitVectors.urem(a, b, size);
                case AND -> a.and(b);
                case OR -> a.or(b);
                case XOR -> a.xor(b);
                case SHL -> BitVectors.shl(a, b, size);
                case LSHR -> BitVectors.lshr(a, b, size);
                default -> throw new IllegalStateException("不是二元位向量运算：" + operator);
            };
            return constant(operation, value);
        }
        boolean leftZero = left instanceof BitVecConstant && ((BitVecConstant) left).isZero();
        boolean rightZero = right instanceof BitVecConstant && ((BitVecConstant) right).isZero();
        switch (operator) {
            case ADD, OR, XOR -> {
                if (rightZero) {
                    return left;
                }
                if (leftZero) {
                    return right;
                }
            }
            case SUB, SHL, LSHR -> {
                if (rightZero) {
                    return left;
                }
            }
            case MUL, AND -> {
                if (leftZero || rightZero) {
                    return constant(operation, BigInteger.ZERO);
                }
            }
            default -> {
            }
        }
        return operation;
    }

    /**
     * select(store(a, i, v), j)：i、j 均为常量时可以直接读出或越过这次写入。
     */
    private Expression foldSelect(ArraySelect select) {
        ArrayExpression array = select.getArray();
        BitVecExpression index = select.getIndex();
        while (array instanceof ArrayStore && index instanceof BitVecConstant) {
            ArrayStore store = (ArrayStore) array;
            if (!(store.getIndex() instanceof BitVecConstant)) {
                break;
            }
            if (((BitVecConstant) store.getIndex()).sameValue((BitVecConstant) index)) {
                return store.getValue();
            }
            array = store.getArray();
        }
        if (array == select.getArray()) {
            return select;
        }
        return new ArraySelect(array, index);
    }

    /**
     * 折叠出的布尔常量继承被折叠节点的污点。
     */
    private static BoolConstant constant(Expression folded, boolean value) {
        if (folded.getTaint().isEmpty()) {
            return BoolConstant.of(value);
        }
        return new BoolConstant(value, folded.getTaint());
    }

    private static BitVecConstant constant(BitVecExpression folded, BigInteger value) {
        return new BitVecConstant(value, folded.getSize(), folded.getTaint());
    }
}
