package net.katagaitai.kaidoku.verify;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import lombok.AllArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.kaidoku.ErrorKind;
import net.katagaitai.kaidoku.act.Act;
import net.katagaitai.kaidoku.act.Behaviour;
import net.katagaitai.kaidoku.act.Constructor;
import net.katagaitai.kaidoku.act.Contract;
import net.katagaitai.kaidoku.act.Interface;
import net.katagaitai.kaidoku.evm.Calldata;
import net.katagaitai.kaidoku.evm.MachineManager;
import net.katagaitai.kaidoku.evm.expr.Expr;
import net.katagaitai.kaidoku.evm.expr.Prop;
import net.katagaitai.kaidoku.evm.expr.Sort;
import net.katagaitai.kaidoku.smt.CheckSatResult;
import net.katagaitai.kaidoku.smt.Solvers;
import net.katagaitai.kaidoku.solidity.CompiledContract;
import net.katagaitai.kaidoku.solidity.Selectors;
import net.katagaitai.kaidoku.util.Constants;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * 生成した仕様がバイトコードと同じ振る舞いをすることを確かめる。
 * <p>
 * 問い合わせをすべて組み立ててから並列に解き、失敗をまとめて返す。
 */
@Slf4j(topic = "kaidoku")
@RequiredArgsConstructor
public class EquivalenceChecker {
    static final String UNCOVERED_SELECTOR =
            "The following function selector results in behaviors not covered by the Act spec:";

    private final MachineManager manager;
    private final Solvers solvers;

    // 1つの問い合わせ。props が充足可能なら失敗
    @AllArgsConstructor
    private static class Query {
        private final String location;
        private final String description;
        private final List<Prop> props;
        // 反例の表示に使う。null なら変数を並べるだけ
        private final Interface iface;
    }

    public List<VerificationFailure> verify(CompiledContract contract, Act act) {
        SpecCompiler compiler = new SpecCompiler(act);
        List<VerificationFailure> failures = Lists.newArrayList();
        List<Query> queries = Lists.newArrayList();
        Set<String> specSignatures = Sets.newTreeSet();

        for (Contract c : act.getContracts()) {
            Constructor ctor = c.getConstructor();
            Expr creation = manager.execute(contract.getCreationCode(),
                    Calldata.forConstructor(ctor.getIface().argNames()), true);
            List<Expr> bytecode = successes(creation, "constructor", failures);
            List<Expr> spec = ImmutableList.of(compiler.compile(ctor, contract.getRuntimeCode()));
            equivalence("constructor", ctor.getIface(), bytecode, spec, queries);

            Map<String, List<Behaviour>> bySignature = Maps.newTreeMap();
            for (Behaviour b : c.getBehaviours()) {
                bySignature.computeIfAbsent(b.getIface().signature(), k -> Lists.newArrayList()).add(b);
            }
            specSignatures.addAll(bySignature.keySet());
            for (Map.Entry<String, List<Behaviour>> entry : bySignature.entrySet()) {
                String signature = entry.getKey();
                Interface iface = entry.getValue().get(0).getIface();
                Expr calldata = Calldata.forMethod(Selectors.selector(signature), iface.argNames());
                Expr result = manager.execute(contract.getRuntimeCode(), calldata, false);
                List<Expr> bytecodeLeaves = successes(result, signature, failures);
                List<Expr> specLeaves = entry.getValue().stream().map(compiler::compile)
                        .collect(Collectors.toList());
                disjointness(signature, iface, specLeaves, queries);
                equivalence(signature, iface, bytecodeLeaves, specLeaves, queries);
            }
        }
        abiCoverage(contract, specSignatures, failures, queries);

        failures.addAll(solve(queries));
        if (failures.isEmpty()) {
            log.info("検証成功: {}", contract.getName());
        } else {
            failures.forEach(f -> log.warn("検証失敗: {}", f));
        }
        return failures;
    }

    private static List<Expr> successes(Expr result, String location, List<VerificationFailure> failures) {
        List<Expr> leaves = Expr.flatten(result.simplify());
        List<Expr> successes = Lists.newArrayList();
        for (Expr leaf : leaves) {
            if (leaf.is(Expr.Kind.SUCCESS)) {
                successes.add(leaf);
            } else if (leaf.is(Expr.Kind.PARTIAL)) {
                failures.add(new VerificationFailure(ErrorKind.UNEXPLORED_BRANCH, location,
                        "partially explored branch: " + leaf));
            }
        }
        return successes;
    }

    // 入力空間が一致し、重なる入力では結果が一致する
    private static void equivalence(String location, Interface iface, List<Expr> bytecode, List<Expr> spec,
                                    List<Query> queries) {
        for (Expr a : bytecode) {
            for (Expr b : spec) {
                List<Prop> props = Lists.newArrayList(a.getProps());
                props.addAll(b.getProps());
                Prop same = Prop.pand(bufEq(a.getReturnData(), b.getReturnData()),
                        Prop.peq(a.getStorage(), b.getStorage()));
                props.add(Prop.pneg(same));
                queries.add(new Query(location, "bytecode and spec disagree on the result", props, iface));
            }
        }
        Prop inBytecode = Prop.pors(bytecode.stream().map(e -> Prop.pands(e.getProps()))
                .collect(Collectors.toList()));
        Prop inSpec = Prop.pors(spec.stream().map(e -> Prop.pands(e.getProps())).collect(Collectors.toList()));
        Prop differ = Prop.por(Prop.pand(inBytecode, Prop.pneg(inSpec)), Prop.pand(inSpec, Prop.pneg(inBytecode)));
        queries.add(new Query(location, "bytecode and spec succeed on different inputs",
                ImmutableList.of(differ), iface));
    }

    private static void disjointness(String location, Interface iface, List<Expr> spec, List<Query> queries) {
        for (int i = 0; i < spec.size(); i++) {
            for (int j = i + 1; j < spec.size(); j++) {
                List<Prop> props = Lists.newArrayList(spec.get(i).getProps());
                props.addAll(spec.get(j).getProps());
                queries.add(new Query(location, "behaviours " + i + " and " + j + " overlap", props, iface));
            }
        }
    }

    private void abiCoverage(CompiledContract contract, Set<String> specSignatures,
                             List<VerificationFailure> failures, List<Query> queries) {
        Expr txdata = Calldata.abstractCalldata();
        Expr result = manager.execute(contract.getRuntimeCode(), txdata, false);
        Expr selector = Expr.shr(Expr.lit(224), Expr.readWord(Expr.ZERO, txdata));
        for (Expr leaf : successes(result, "abi", failures)) {
            List<Prop> props = Lists.newArrayList(leaf.getProps());
            props.add(Prop.peq(Expr.var(Constants.SELECTOR_NAME), selector));
            for (String signature : specSignatures) {
                props.add(Prop.pneg(Prop.peq(selector, Expr.lit(Selectors.selectorValue(signature)))));
            }
            queries.add(new Query("abi", UNCOVERED_SELECTOR, props, null));
        }
    }

    // 長さの違う具体的なバッファは等しくない。同じ長さならワードごとに比べる
    static Prop bufEq(Expr a, Expr b) {
        if (a.getSort() != Sort.BUF || b.getSort() != Sort.BUF) {
            throw new IllegalArgumentException("バッファではない: " + a + " " + b);
        }
        if (a.is(Expr.Kind.BYTES) && b.is(Expr.Kind.BYTES)) {
            int length = a.getArgs().size();
            if (length != b.getArgs().size()) {
                return Prop.FALSE;
            }
            List<Prop> words = Lists.newArrayList();
            for (int offset = 0; offset < length; offset += Constants.WORD_BYTES) {
                Expr o = Expr.lit(offset);
                words.add(Prop.peq(Expr.readWord(o, a), Expr.readWord(o, b)));
            }
            return Prop.pands(words);
        }
        return Prop.peq(a, b);
    }

    private List<VerificationFailure> solve(List<Query> queries) {
        log.info("問い合わせ数: {}", queries.size());
        List<Future<CheckSatResult>> futures = Lists.newArrayList();
        for (Query q : queries) {
            futures.add(manager.submit(() -> check(q.props)));
        }
        List<VerificationFailure> failures = Lists.newArrayList();
        try {
            for (int i = 0; i < queries.size(); i++) {
                Query q = queries.get(i);
                CheckSatResult result = await(futures.get(i), q);
                if (result.isSat()) {
                    failures.add(new VerificationFailure(ErrorKind.VERIFICATION_COUNTEREXAMPLE, q.location,
                            q.description + "\n" + renderModel(q, result.getModel())));
                } else if (result.isUnknown()) {
                    failures.add(new VerificationFailure(ErrorKind.VERIFICATION_TIMEOUT, q.location,
                            q.description + ": solver returned unknown (" + result.getReason() + ")"));
                }
            }
        } finally {
            futures.forEach(f -> f.cancel(true));
        }
        return failures;
    }

    private CheckSatResult check(List<Prop> props) {
        // 自明に偽ならソルバを呼ばない
        Prop conjunction = Prop.pands(props);
        if (conjunction.is(Prop.Kind.PBOOL)) {
            return conjunction.isValue() ? CheckSatResult.sat(Maps.newTreeMap()) : CheckSatResult.unsat();
        }
        return solvers.checkSat(props);
    }

    private CheckSatResult await(Future<CheckSatResult> future, Query q) {
        try {
            return future.get(manager.getTimeoutMills(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return CheckSatResult.unknown("interrupted");
        } catch (TimeoutException e) {
            return CheckSatResult.unknown("timeout");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("問い合わせに失敗: " + q.location, cause);
        }
    }

    static String renderModel(Interface iface, Map<String, BigInteger> model) {
        StringBuilder sb = new StringBuilder();
        List<String> args = iface == null ? ImmutableList.of() : iface.argNames();
        if (iface != null) {
            sb.append(iface.getName()).append("(");
            sb.append(args.stream().map(n -> n + " = " + model.getOrDefault(n, BigInteger.ZERO))
                    .collect(Collectors.joining(", ")));
            sb.append(")");
        }
        for (Map.Entry<String, BigInteger> entry : model.entrySet()) {
            if (args.contains(entry.getKey())) {
                continue;
            }
            if (entry.getKey().equals(Constants.SELECTOR_NAME)) {
                sb.append("\n  ").append(entry.getKey()).append(" = 0x")
                        .append(String.format("%08x", entry.getValue()));
            } else {
                sb.append("\n  ").append(entry.getKey()).append(" = ").append(entry.getValue());
            }
        }
        return sb.toString().trim();
    }

    private static String renderModel(Query q, Map<String, BigInteger> model) {
        return renderModel(q.iface, model);
    }
}
