package net.katagaitai.kaidoku.decompile;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import net.katagaitai.kaidoku.evm.expr.Expr;
import net.katagaitai.kaidoku.evm.expr.Prop;
import net.katagaitai.kaidoku.smt.CheckSatResult;
import net.katagaitai.kaidoku.smt.Solvers;
import org.junit.Test;

import java.util.List;

import static junit.framework.TestCase.*;

public class SafetyNormalizerTest {
    private final Expr a = Expr.var("a");
    private final Expr b = Expr.var("b");
    private final Expr storage = Expr.abstractStore("storage");

    /**
     * 決まった結果を返し、問い合わせを記録するソルバ。
     */
    static class StubSolvers implements Solvers {
        final List<List<Prop>> queries = Lists.newArrayList();
        private final CheckSatResult result;

        StubSolvers(CheckSatResult result) {
            this.result = result;
        }

        @Override
        public synchronized CheckSatResult checkSat(List<Prop> props) {
            queries.add(ImmutableList.copyOf(props));
            return result;
        }
    }

    private static Expr returning(Expr w) {
        return Expr.success(ImmutableList.of(), Expr.wordBytes(w), Expr.abstractStore("storage"));
    }

    @Test
    public void test_証明できれば包まない() {
        StubSolvers solvers = new StubSolvers(CheckSatResult.unsat());
        Expr outcome = returning(Expr.add(a, b));
        assertEquals(outcome, new SafetyNormalizer(solvers).makeSafe(outcome));
        assertEquals(1, solvers.queries.size());
        assertEquals(Prop.pneg(Prop.pgeq(Expr.add(a, b), a)), solvers.queries.get(0).get(2));
    }

    @Test
    public void test_反例があれば包む() {
        StubSolvers solvers = new StubSolvers(CheckSatResult.sat(ImmutableMap.of()));
        Expr outcome = returning(Expr.sub(a, b));
        Expr safe = new SafetyNormalizer(solvers).makeSafe(outcome);
        assertEquals(Expr.wrap(Expr.sub(a, b)), Expr.readWord(Expr.ZERO, safe.getReturnData()));
    }

    @Test
    public void test_判定不能なら包む() {
        StubSolvers solvers = new StubSolvers(CheckSatResult.unknown("timeout"));
        Expr outcome = returning(Expr.mul(a, b));
        Expr safe = new SafetyNormalizer(solvers).makeSafe(outcome);
        assertEquals(Expr.wrap(Expr.mul(a, b)), Expr.readWord(Expr.ZERO, safe.getReturnData()));
    }

    @Test
    public void test_指数と符号拡張は常に包む() {
        StubSolvers solvers = new StubSolvers(CheckSatResult.unsat());
        Expr outcome = returning(Expr.add(Expr.exp(a, b), Expr.sex(Expr.ZERO, a)));
        Expr safe = new SafetyNormalizer(solvers).makeSafe(outcome);
        Expr expected = Expr.add(Expr.wrap(Expr.exp(a, b)), Expr.wrap(Expr.sex(Expr.ZERO, a)));
        assertEquals(expected, Expr.readWord(Expr.ZERO, safe.getReturnData()));
        // 問い合わせは ADD の1回だけ
        assertEquals(1, solvers.queries.size());
    }

    @Test
    public void test_子の安全性を前提に使う() {
        StubSolvers solvers = new StubSolvers(CheckSatResult.unsat());
        Expr inner = Expr.add(a, b);
        Expr outer = Expr.add(inner, Expr.ONE);
        new SafetyNormalizer(solvers).makeSafe(returning(outer));
        assertEquals(2, solvers.queries.size());
        List<Prop> outerQuery = solvers.queries.get(1);
        assertEquals(Prop.pgeq(inner, a), outerQuery.get(0));
        assertEquals(Prop.TRUE, outerQuery.get(1));
    }

    @Test
    public void test_同じ部分項は一度だけ問い合わせる() {
        StubSolvers solvers = new StubSolvers(CheckSatResult.unsat());
        Expr shared = Expr.add(a, b);
        Expr outcome = Expr.success(ImmutableList.of(Prop.plt(shared, Expr.lit(10))), Expr.wordBytes(shared),
                Expr.sstore(Expr.ZERO, shared, storage));
        new SafetyNormalizer(solvers).makeSafe(outcome);
        assertEquals(1, solvers.queries.size());
    }
}
