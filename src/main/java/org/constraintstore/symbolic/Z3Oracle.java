package org.constraintstore.symbolic;

import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.Context;
import com.microsoft.z3.Expr;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Model;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import lombok.Getter;
import org.constraintstore.constraints.ConstraintSet;
import org.constraintstore.expressions.Expression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * 约束集 SMT-LIB 文本的求解端：把 {@link ConstraintSet#toText} 的输出交给 Z3。
 * 持有一个 Z3 Context，用完需要 close。
 */
@Getter
public class Z3Oracle implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(Z3Oracle.class);

    public enum OracleResult {
        SAT,
        UNSAT,
        UNKNOWN
    }

    private final Context context;

    public Z3Oracle() {
        this.context = new Context();
        logger.debug("Z3Oracle 初始化完成");
    }

    /**
     * 判断约束集（可选地切片到 target）是否可满足。
     */
    public OracleResult checkSatisfiable(ConstraintSet constraintSet, Expression target) {
        return toResult(check(constraintSet.toText(target)));
    }

    public OracleResult checkSatisfiable(ConstraintSet constraintSet) {
        return checkSatisfiable(constraintSet, null);
    }

    /**
     * 把一段 SMT-LIB 文本载入新的求解器并求解。
     */
    public Status check(String smtlib) {
        Solver solver = load(smtlib);
        Status status = solver.check();
        logger.debug("Z3 对 {} 条断言的求解结果: {}", solver.getNumAssertions(), status);
        return status;
    }

    /**
     * @return Z3 解析 smtlib 后得到的断言条数。
     */
    public int countAssertions(String smtlib) {
        return load(smtlib).getNumAssertions();
    }

    /**
     * 求一个模型，把每个常量名映射为其取值的文本。
     * 位向量取值按无符号十进制输出。
     * @return 不可满足或未知时返回 empty。
     */
    public Optional<Map<String, String>> solve(String smtlib) {
        Solver solver = load(smtlib);
        Status status = solver.check();
        if (status != Status.SATISFIABLE) {
            logger.debug("Z3 未给出模型: {}", status);
            return Optional.empty();
        }
        Model model = solver.getModel();
        Map<String, String> values = new TreeMap<>();
        for (FuncDecl<?> decl : model.getConstDecls()) {
            Expr<?> value = model.getConstInterp(decl);
            String text = value instanceof BitVecNum ? ((BitVecNum) value).getBigInteger().toString() : value.toString();
            values.put(decl.getName().toString(), text);
        }
        return Optional.of(values);
    }

    private Solver load(String smtlib) {
        Objects.requireNonNull(smtlib, "Z3Oracle: smtlib 不能为 null");
        Solver solver = context.mkSolver();
        solver.fromString(smtlib);
        return solver;
    }

    private static OracleResult toResult(Status status) {
        return switch (status) {
            case SATISFIABLE -> OracleResult.SAT;
            case UNSATISFIABLE -> OracleResult.UNSAT;
            case UNKNOWN -> OracleResult.UNKNOWN;
        };
    }

    @Override
    public void close() {
        context.close();
        logger.debug("Z3Oracle 已关闭");
    }
}
