package net.katagaitai.kaidoku.decompile;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.kaidoku.DecompileException;
import net.katagaitai.kaidoku.ErrorKind;
import net.katagaitai.kaidoku.act.Interface;
import net.katagaitai.kaidoku.evm.Calldata;
import net.katagaitai.kaidoku.evm.MachineManager;
import net.katagaitai.kaidoku.evm.expr.Expr;
import net.katagaitai.kaidoku.solidity.CompiledContract;
import net.katagaitai.kaidoku.solidity.Method;
import net.katagaitai.kaidoku.solidity.Param;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

@Slf4j(topic = "kaidoku")
@RequiredArgsConstructor
public class Summarizer {
    private final MachineManager manager;
    private final SafetyNormalizer normalizer;

    public ContractSummary summarize(CompiledContract contract) throws DecompileException {
        if (!contract.hasStorageLayout()) {
            throw new DecompileException(ErrorKind.MISSING_LAYOUT, "missing storage layout in solc output");
        }
        log.info("要約開始: {}", contract.getName());

        List<String> ctorArgs = names(contract.getConstructorInputs());
        Future<ImmutableSet<Expr>> creation = manager.submit(() -> summarize(contract.getCreationCode(),
                Calldata.forConstructor(ctorArgs), true, "creation code"));
        Map<Method, Future<ImmutableSet<Expr>>> futures = Maps.newLinkedHashMap();
        for (Method method : contract.getAbiMap().values()) {
            Expr calldata = Calldata.forMethod(method.getSelector(), names(method.getInputs()));
            futures.put(method, manager.submit(() -> summarize(contract.getRuntimeCode(), calldata, false,
                    "runtime code")));
        }

        try {
            ImmutableSet<Expr> ctor = await(creation, "constructor");
            ImmutableSortedMap.Builder<Method, ImmutableSet<Expr>> runtime = ImmutableSortedMap.naturalOrder();
            for (Map.Entry<Method, Future<ImmutableSet<Expr>>> entry : futures.entrySet()) {
                ImmutableSet<Expr> outcomes = await(entry.getValue(), entry.getKey().getSignature());
                if (outcomes.isEmpty()) {
                    // 必ず失敗する関数は仕様に現れない
                    log.warn("成功するパスがない: {}", entry.getKey());
                    continue;
                }
                runtime.put(entry.getKey(), outcomes);
            }
            return new ContractSummary(contract.getName(), contract.getStorageLayout(), runtime.build(),
                    Interface.of("constructor", contract.getConstructorInputs()), ctor);
        } finally {
            futures.values().forEach(f -> f.cancel(true));
            creation.cancel(true);
        }
    }

    private ImmutableSet<Expr> await(Future<ImmutableSet<Expr>> future, String target) throws DecompileException {
        try {
            return future.get(manager.getTimeoutMills(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("中断された: " + target, e);
        } catch (TimeoutException e) {
            throw new DecompileException(ErrorKind.UNEXPLORED_BRANCH,
                    "symbolic execution timed out: " + target);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof DecompileException) {
                throw (DecompileException) cause;
            } else if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException(cause);
        }
    }

    ImmutableSet<Expr> summarize(byte[] code, Expr calldata, boolean creation, String where)
            throws DecompileException {
        Expr result = manager.execute(code, calldata, creation).simplify();
        List<Expr> leaves = Expr.flatten(result);
        List<Expr> partials = leaves.stream().filter(e -> e.is(Expr.Kind.PARTIAL)).collect(Collectors.toList());
        if (!partials.isEmpty()) {
            throw new DecompileException(ErrorKind.UNEXPLORED_BRANCH,
                    "partially explored branches in " + where + ":\n"
                            + partials.stream().map(Expr::toString).collect(Collectors.joining("\n")));
        }
        ImmutableSet.Builder<Expr> outcomes = ImmutableSet.builder();
        for (Expr leaf : leaves) {
            if (leaf.is(Expr.Kind.SUCCESS)) {
                outcomes.add(normalizer.makeSafe(leaf));
            }
        }
        return outcomes.build();
    }

    private static List<String> names(List<Param> params) {
        return params.stream().map(Param::getName).collect(Collectors.toList());
    }
}
