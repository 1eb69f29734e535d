package org.constraintstore.constraints;

import lombok.Getter;
import org.constraintstore.config.ConstraintStoreConfig;
import org.constraintstore.core.ArrayVariable;
import org.constraintstore.core.BitVecVariable;
import org.constraintstore.core.BoolVariable;
import org.constraintstore.core.Variable;
import org.constraintstore.expressions.BitVecExpression;
import org.constraintstore.expressions.BoolConstant;
import org.constraintstore.expressions.BoolExpression;
import org.constraintstore.expressions.Expression;
import org.constraintstore.expressions.visitors.Simplifier;
import org.constraintstore.expressions.visitors.VariableCollector;
import org.constraintstore.utils.BitVectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * 一条执行路径上的约束集合，同时也是新符号变量的唯一来源。
 * <p>
 * 约束集可以 fork 出子约束集：子约束集引用父约束集，复制父约束集此刻的声明表与计数器。
 * 有子约束集存在期间父约束集被冻结，不能再添加约束或声明变量；子约束集 {@link #close()} 后父约束集解冻。
 * 有效约束序列 = 祖先的有效约束序列 + 本地约束序列。
 * <pre>{@code
 * try (ConstraintSet child = parent.fork()) {
 *     child.add(x.ult(3));
 *     ...
 * }
 * parent.add(...); // 重新可写
 * }</pre>
 * 同一个约束集不能被多个调用方同时修改。
 */
public class ConstraintSet implements Iterable<BoolExpression>, AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ConstraintSet.class);

    private List<BoolExpression> constraints = new ArrayList<>();

    @Getter
    private ConstraintSet parent;

    /** 当前未释放的子约束集；非 null 即冻结 */
    private ConstraintSet child;

    /** 生成唯一名后缀的单调计数器 */
    private int sid;

    /** 名字到变量的声明表，fork 时按值复制给子约束集 */
    private final Map<String, Variable> declarations;

    @Getter
    private final ConstraintDiagnostics diagnostics;

    public ConstraintSet() {
        this(new LoggingConstraintDiagnostics());
    }

    public ConstraintSet(ConstraintDiagnostics diagnostics) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "ConstraintSet-构造函数: diagnostics 不能为 null");
        this.declarations = new LinkedHashMap<>();
    }

    private ConstraintSet(ConstraintSet parent) {
        this.diagnostics = parent.diagnostics;
        this.parent = parent;
        this.sid = parent.sid;
        this.declarations = new LinkedHashMap<>(parent.declarations);
    }

    // --- fork / 释放 ---

    /**
     * 派生一个子约束集，并冻结当前约束集直到子约束集被 close。
     * @return 新的子约束集。
     * @throws ConstraintUsageException 已有未释放的子约束集。
     */
    public ConstraintSet fork() {
        if (child != null) {
            logger.error("ConstraintSet.fork: 已存在未释放的子约束集，不能再次 fork");
            throw new ConstraintUsageException("ConstraintSet already has an active fork");
        }
        child = new ConstraintSet(this);
        logger.debug("fork 出子约束集，父约束集本地约束 {} 条，声明 {} 个", constraints.size(), declarations.size());
        return child;
    }

    /**
     * 释放本约束集：断开与父约束集的链接，父约束集恢复可写。
     * 释放后本约束集只剩本地约束。对根约束集调用没有效果。
     */
    @Override
    public void close() {
        if (parent == null) {
            return;
        }
        if (parent.child == this) {
            parent.child = null;
        }
        parent = null;
        logger.debug("释放子约束集，父约束集已解冻");
    }

    public boolean isFrozen() {
        return child != null;
    }

    // --- 约束 ---

    public void add(boolean constraint) {
        add(BoolConstant.of(constraint));
    }

    /**
     * 添加一条约束。约束先被化简：
     * 化简为 false 时，本地约束序列整体替换为 [false]（祖先的约束不受影响）；
     * 化简为 true 时什么也不做；否则追加到本地约束序列末尾。
     * @throws ConstraintUsageException 约束集已被冻结。
     */
    public void add(BoolExpression constraint) {
        Objects.requireNonNull(constraint, "ConstraintSet.add: constraint 不能为 null");
        BoolExpression simplified = Simplifier.simplify(constraint);
        if (child != null) {
            logger.error("ConstraintSet.add: 约束集已被 fork 冻结，拒绝添加 {}", simplified);
            throw new ConstraintUsageException("ConstraintSet is frozen");
        }
        if (simplified instanceof BoolConstant) {
            if (!((BoolConstant) simplified).isValue()) {
                diagnostics.unsatisfiableConstraint(this);
                constraints = new ArrayList<>(List.of(simplified));
            }
            return;
        }
        constraints.add(simplified);
    }

    /**
     * @return 整条祖先链上的约束总数。
     */
    public int size() {
        int total = 0;
        for (ConstraintSet current = this; current != null; current = current.parent) {
            total += current.constraints.size();
        }
        return total;
    }

    /**
     * @return 有效约束序列：祖先的约束在前，本地约束在后。
     */
    public List<BoolExpression> getConstraints() {
        Deque<ConstraintSet> chain = new ArrayDeque<>();
        for (ConstraintSet current = this; current != null; current = current.parent) {
            chain.push(current);
        }
        List<BoolExpression> result = new ArrayList<>();
        for (ConstraintSet node : chain) {
            result.addAll(node.constraints);
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * @return 只属于本约束集的约束。
     */
    public List<BoolExpression> getLocalConstraints() {
        return Collections.unmodifiableList(constraints);
    }

    @Override
    public Iterator<BoolExpression> iterator() {
        return getConstraints().iterator();
    }

    // --- 声明 ---

    /**
     * 把变量登记到声明表。
     * @throws ConstraintUsageException 约束集已被冻结，或同名变量已经声明过。
     */
    public <V extends Variable> V declare(V variable) {
        Objects.requireNonNull(variable, "ConstraintSet.declare: variable 不能为 null");
        if (child != null) {
            logger.error("ConstraintSet.declare: 约束集已被 fork 冻结，拒绝声明 {}", variable.getName());
            throw new ConstraintUsageException("ConstraintSet is frozen");
        }
        if (declarations.containsKey(variable.getName())) {
            logger.error("ConstraintSet.declare: 变量名 {} 已被声明", variable.getName());
            throw new ConstraintUsageException("Variable already declared: " + variable.getName());
        }
        declarations.put(variable.getName(), variable);
        logger.debug("声明变量 {}", variable.getDeclaration());
        return variable;
    }

    /**
     * @return 以 name 声明的变量；不存在时返回 null。
     */
    public Variable getVariable(String name) {
        return declarations.get(name);
    }

    public Collection<Variable> getDeclaredVariables() {
        return Collections.unmodifiableCollection(declarations.values());
    }

    /**
     * 按对象同一性判断 variable 是否就是本约束集声明的那个变量。
     */
    public boolean isDeclared(Variable variable) {
        return declarations.get(variable.getName()) == variable;
    }

    /**
     * @return 有效约束中实际引用到的变量。
     */
    public Set<Variable> getDeclarations() {
        return VariableCollector.collect(getConstraints());
    }

    // --- 变量工厂 ---

    public BoolVariable newBool() {
        return newBool(null, Set.of(), false);
    }

    public BoolVariable newBool(String name) {
        return newBool(name, Set.of(), false);
    }

    /**
     * 声明一个新的布尔符号变量。
     * @param name            期望的名字；为 null 时使用默认前缀并强制避让重名。
     * @param taint           污点标签。
     * @param avoidCollisions 重名时是否自动追加 "_<计数>"；为 false 且重名时抛出异常。
     */
    public BoolVariable newBool(String name, Set<String> taint, boolean avoidCollisions) {
        String resolved = resolveName(name, ConstraintStoreConfig.boolPrefix, avoidCollisions);
        return declare(new BoolVariable(resolved, taint));
    }

    public BitVecVariable newBitVec(int size) {
        return newBitVec(size, null, Set.of(), false);
    }

    public BitVecVariable newBitVec(int size, String name) {
        return newBitVec(size, name, Set.of(), false);
    }

    /**
     * 声明一个新的位向量符号变量。
     * @throws InvalidParameterException size 既不是 1 也不是 8 的正整数倍。
     */
    public BitVecVariable newBitVec(int size, String name, Set<String> taint, boolean avoidCollisions) {
        if (!BitVectors.isValidSize(size)) {
            logger.error("ConstraintSet.newBitVec: 非法的位向量宽度 {}", size);
            throw new InvalidParameterException("Invalid bitvec size " + size);
        }
        String resolved = resolveName(name, ConstraintStoreConfig.bitVecPrefix, avoidCollisions);
        return declare(new BitVecVariable(size, resolved, taint));
    }

    public ArrayVariable newArray() {
        return newArray(ConstraintStoreConfig.arrayIndexBits, null, ConstraintStoreConfig.arrayValueBits, null, Set.of(), false);
    }

    public ArrayVariable newArray(String name) {
        return newArray(ConstraintStoreConfig.arrayIndexBits, null, ConstraintStoreConfig.arrayValueBits, name, Set.of(), false);
    }

    /**
     * 声明一个新的数组符号变量。
     * @param indexBits 下标位宽。
     * @param indexMax  下标上界，可以为 null。
     * @param valueBits 值位宽。
     */
    public ArrayVariable newArray(int indexBits, Long indexMax, int valueBits, String name, Set<String> taint, boolean avoidCollisions) {
        if (indexBits <= 0 || valueBits <= 0) {
            logger.error("ConstraintSet.newArray: 非法的数组位宽 {}/{}", indexBits, valueBits);
            throw new InvalidParameterException("Invalid array widths " + indexBits + "/" + valueBits);
        }
        String resolved = resolveName(name, ConstraintStoreConfig.arrayPrefix, avoidCollisions);
        return declare(new ArrayVariable(indexBits, indexMax, valueBits, resolved, taint));
    }

    private String resolveName(String name, String defaultPrefix, boolean avoidCollisions) {
        if (name == null) {
            name = defaultPrefix;
            avoidCollisions = true;
        }
        if (avoidCollisions) {
            return makeUniqueName(name);
        }
        if (declarations.containsKey(name)) {
            logger.error("ConstraintSet: 变量名 {} 已被使用", name);
            throw new ConstraintUsageException("Name already used: " + name);
        }
        return name;
    }

    /**
     * 反复追加 "_<计数>" 直到名字不在声明表中。
     * 追加一次不一定够：带后缀的名字也可能已经被显式声明过。
     */
    String makeUniqueName(String name) {
        while (declarations.containsKey(name)) {
            name = name + "_" + nextSid();
        }
        return name;
    }

    private int nextSid() {
        if (child != null) {
            logger.error("ConstraintSet: 约束集已被 fork 冻结，不能再生成唯一编号");
            throw new ConstraintUsageException("ConstraintSet is frozen");
        }
        return ++sid;
    }

    // --- 切片 / 序列化 / 迁移 ---

    /**
     * @param target 目标表达式，可以为 null。
     * @return 有效约束中与 target 相关的约束及其变量。
     */
    public RelatedConstraints getRelatedConstraints(Expression target) {
        return RelatedConstraints.of(getConstraints(), target);
    }

    public String toText() {
        return toText(null, ConstraintStoreConfig.replaceConstants);
    }

    public String toText(Expression target) {
        return toText(target, ConstraintStoreConfig.replaceConstants);
    }

    /**
     * 渲染为 SMT-LIB 文本。
     * @param target           只输出与之相关的约束；为 null 时输出全部。
     * @param replaceConstants 是否做常量替换。
     */
    public String toText(Expression target, boolean replaceConstants) {
        return new ConstraintSerializer(diagnostics).serialize(getConstraints(), target, replaceConstants);
    }

    public Expression migrate(Expression expression) {
        return migrate(expression, new HashMap<>());
    }

    /**
     * 把在其他约束集中构造的表达式迁移到本约束集。迁移不改变表达式的类型。
     * @param nameMigrationMap 外来名到本地名的映射，会被就地更新，可在多次调用间复用。
     * @see ConstraintMigrator
     */
    public Expression migrate(Expression expression, Map<String, String> nameMigrationMap) {
        return new ConstraintMigrator(this).migrate(expression, nameMigrationMap);
    }

    public BoolExpression migrate(BoolExpression expression) {
        return migrate(expression, new HashMap<>());
    }

    public BoolExpression migrate(BoolExpression expression, Map<String, String> nameMigrationMap) {
        return (BoolExpression) migrate((Expression) expression, nameMigrationMap);
    }

    public BitVecExpression migrate(BitVecExpression expression) {
        return migrate(expression, new HashMap<>());
    }

    public BitVecExpression migrate(BitVecExpression expression, Map<String, String> nameMigrationMap) {
        return (BitVecExpression) migrate((Expression) expression, nameMigrationMap);
    }

    @Override
    public String toString() {
        return toText();
    }
}
