package org.constraintstore.constraints;

import org.constraintstore.config.ConstraintStoreConfig;
import org.constraintstore.core.ArrayVariable;
import org.constraintstore.core.BitVecVariable;
import org.constraintstore.core.Variable;
import org.constraintstore.expressions.Expression;
import org.constraintstore.expressions.visitors.Replacer;
import org.constraintstore.expressions.visitors.VariableCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 把在别的约束集中构造的表达式迁移到目标约束集。
 * <p>
 * 表达式中每个不属于目标约束集的变量，都被替换为目标约束集里的等价变量：
 * 若名字映射表里已有记录，沿用之前迁移出的本地变量；否则新声明一个同类型变量。
 * 名字映射表由调用方持有，在多次迁移之间复用，保证同一个外来变量总是映射到同一个本地变量。
 */
public class ConstraintMigrator {

    private static final Logger logger = LoggerFactory.getLogger(ConstraintMigrator.class);

    private final ConstraintSet destination;

    public ConstraintMigrator(ConstraintSet destination) {
        this.destination = Objects.requireNonNull(destination, "ConstraintMigrator-构造函数: destination 不能为 null");
    }

    /**
     * @param expression       可能含有外来变量的表达式。
     * @param nameMigrationMap 外来变量名到本地变量名的映射，会被就地更新。
     * @return 只引用目标约束集变量的表达式；没有外来变量时返回原对象。
     */
    public Expression migrate(Expression expression, Map<String, String> nameMigrationMap) {
        Objects.requireNonNull(expression, "ConstraintMigrator: expression 不能为 null");
        Objects.requireNonNull(nameMigrationMap, "ConstraintMigrator: nameMigrationMap 不能为 null");

        // 键恒为外来变量，值恒为本地变量
        Map<Expression, Expression> objectMigrationMap = new IdentityHashMap<>();

        for (Variable foreign : VariableCollector.collect(expression)) {
            if (destination.isDeclared(foreign)) {
                continue;
            }

            String migratedName = nameMigrationMap.get(foreign.getName());
            if (migratedName != null) {
                Variable nativeVariable = destination.getVariable(migratedName);
                if (nativeVariable == null) {
                    logger.error("迁移映射表记录了 {} -> {}，但目标约束集中没有对应的变量", foreign.getName(), migratedName);
                    throw new ConstraintUsageException("name migration map contains an unknown variable: " + migratedName);
                }
                if (!sameShape(foreign, nativeVariable)) {
                    logger.error("迁移映射表记录了 {} -> {}，但两者的类型或位宽不一致", foreign.getName(), migratedName);
                    throw new ConstraintUsageException("name migration map points " + foreign.getName()
                            + " at a variable of a different shape: " + migratedName);
                }
                objectMigrationMap.put((Expression) foreign, (Expression) nativeVariable);
                continue;
            }

            String name = foreign.getName();
            if (destination.getVariable(name) != null) {
                name = destination.makeUniqueName(name + ConstraintStoreConfig.migratedSuffix);
            }
            Variable created = switch (foreign.getSort()) {
                case BOOL -> destination.newBool(name, foreign.getTaint(), false);
                case BITVEC -> destination.newBitVec(((BitVecVariable) foreign).getSize(), name, foreign.getTaint(), false);
                case ARRAY -> {
                    ArrayVariable array = (ArrayVariable) foreign;
                    yield destination.newArray(array.getIndexBits(), array.getIndexMax(), array.getValueBits(),
                            name, foreign.getTaint(), false);
                }
            };
            logger.debug("迁移变量 {} -> {}", foreign.getName(), created.getName());
            objectMigrationMap.put((Expression) foreign, (Expression) created);
            nameMigrationMap.put(foreign.getName(), created.getName());
        }

        return Replacer.replace(expression, objectMigrationMap);
    }

    /**
     * 类型相同，且位向量宽度或数组的下标、值宽度相同。
     */
    private static boolean sameShape(Variable foreign, Variable nativeVariable) {
        if (foreign.getSort() != nativeVariable.getSort()) {
            return false;
        }
        return switch (foreign.getSort()) {
            case BOOL -> true;
            case BITVEC -> ((BitVecVariable) foreign).getSize() == ((BitVecVariable) nativeVariable).getSize();
            case ARRAY -> {
                ArrayVariable a = (ArrayVariable) foreign;
                ArrayVariable b = (ArrayVariable) nativeVariable;
                yield a.getIndexBits() == b.getIndexBits() && a.getValueBits() == b.getValueBits();
            }
        };
    }
}
