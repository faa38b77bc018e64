package net.katagaitai.kaidoku.evm;

import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.Getter;
import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.kaidoku.evm.expr.Expr;
import net.katagaitai.kaidoku.evm.expr.Sort;
import net.katagaitai.kaidoku.smt.Solvers;
import net.katagaitai.kaidoku.util.Constants;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

@Slf4j(topic = "kaidoku")
public class MachineManager implements SymbolicExecutor, AutoCloseable {
    private final ExecutorService executor;
    // nullなら分岐の枝刈りをしない
    @Getter
    private final Solvers solvers;
    @Setter
    @Getter
    private int maxIterations = Constants.MAX_ITERATIONS;
    @Setter
    @Getter
    private long timeoutMills = Constants.MANAGER_TIMEOUT_MILLS;

    public MachineManager(Solvers solvers) {
        this(solvers, Constants.THREAD_POOL_SIZE);
    }

    public MachineManager(Solvers solvers, int threads) {
        this.solvers = solvers;
        ThreadFactory namedThreadFactory = new ThreadFactoryBuilder().setNameFormat("machine-%d").build();
        executor = Executors.newFixedThreadPool(threads, namedThreadFactory);
    }

    @Override
    public Expr execute(byte[] code, Expr calldata, boolean creation, int maxIterations) {
        if (calldata.getSort() != Sort.BUF) {
            throw new IllegalArgumentException("バッファではない: " + calldata);
        }
        final Code parsed = new Code(code);
        final MachineState state;
        if (creation) {
            state = new MachineState(parsed, Calldata.appendToCode(code, calldata), Expr.EMPTY_BUF,
                    Expr.concreteStore(ImmutableMap.of()), maxIterations);
        } else {
            state = new MachineState(parsed, Expr.bytes(code), calldata,
                    Expr.abstractStore(Constants.STORAGE_NAME), maxIterations);
        }
        Expr result = new Machine(this, state).run();
        log.debug("記号実行終了: 葉の数 {}", Expr.flatten(result).size());
        return result;
    }

    public Expr execute(byte[] code, Expr calldata, boolean creation) {
        return execute(code, calldata, creation, maxIterations);
    }

    public <T> Future<T> submit(Callable<T> task) {
        return executor.submit(task);
    }

    @Override
    public void close() {
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(1, TimeUnit.MINUTES)) {
                log.warn("スレッドプールが終了しない");
            }
        } catch (InterruptedException e) {
            log.error("", e);
            Thread.currentThread().interrupt();
        }
    }
}
