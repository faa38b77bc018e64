package net.katagaitai.kaidoku.smt;

import com.google.common.collect.Lists;
import com.google.common.collect.Queues;
import com.microsoft.z3.Context;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.kaidoku.evm.expr.Prop;
import net.katagaitai.kaidoku.util.Constants;
import net.katagaitai.kaidoku.util.Z3Util;

import java.util.List;
import java.util.concurrent.BlockingQueue;

// Z3 の Context をスレッド間で共有しないよう、ワーカーごとに Context と Solver を持たせるプール
@Slf4j(topic = "kaidoku")
public class Z3SolverPool implements Solvers, AutoCloseable {
    @AllArgsConstructor
    private static class Worker {
        private final Context context;
        private final Solver solver;
    }

    private final BlockingQueue<Worker> workers;
    private final List<Worker> all = Lists.newArrayList();
    @Getter
    private final int timeoutMills;

    public Z3SolverPool() {
        this(Constants.SOLVER_POOL_SIZE, Constants.SOLVER_TIMEOUT_MILLS);
    }

    public Z3SolverPool(int size, int timeoutMills) {
        if (size <= 0) {
            throw new IllegalArgumentException("ソルバ数が不正: " + size);
        }
        this.timeoutMills = timeoutMills;
        this.workers = Queues.newArrayBlockingQueue(size);
        for (int i = 0; i < size; i++) {
            Context context = new Context();
            Worker worker = new Worker(context, Z3Util.mkSolver(context, timeoutMills));
            all.add(worker);
            workers.add(worker);
        }
    }

    @Override
    public CheckSatResult checkSat(List<Prop> props) {
        final Worker worker;
        try {
            worker = workers.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CheckSatResult.unknown("interrupted");
        }
        try {
            return check(worker, props);
        } finally {
            workers.add(worker);
        }
    }

    private CheckSatResult check(Worker worker, List<Prop> props) {
        Solver solver = worker.solver;
        solver.push();
        try {
            Z3Encoder encoder = new Z3Encoder(worker.context);
            for (Prop p : props) {
                solver.add(encoder.encode(p));
            }
            Status status = solver.check();
            if (status == Status.SATISFIABLE) {
                return CheckSatResult.sat(Z3Util.getBitVecValues(solver.getModel()));
            } else if (status == Status.UNSATISFIABLE) {
                return CheckSatResult.unsat();
            }
            String reason = solver.getReasonUnknown();
            log.debug("判定不能: {}", reason);
            return CheckSatResult.unknown(reason);
        } catch (Z3Exception e) {
            log.warn("Z3の例外: {}", e.getMessage());
            return CheckSatResult.unknown(e.getMessage());
        } finally {
            solver.pop();
        }
    }

    @Override
    public void close() {
        for (Worker worker : all) {
            worker.context.close();
        }
    }
}
