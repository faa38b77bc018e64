package net.katagaitai.kaidoku;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.kaidoku.act.Act;
import net.katagaitai.kaidoku.act.Enricher;
import net.katagaitai.kaidoku.decompile.ContractSummary;
import net.katagaitai.kaidoku.decompile.SafetyNormalizer;
import net.katagaitai.kaidoku.decompile.Summarizer;
import net.katagaitai.kaidoku.decompile.Translator;
import net.katagaitai.kaidoku.evm.MachineManager;
import net.katagaitai.kaidoku.smt.Solvers;
import net.katagaitai.kaidoku.smt.Z3SolverPool;
import net.katagaitai.kaidoku.solidity.CompiledContract;
import net.katagaitai.kaidoku.verify.EquivalenceChecker;
import net.katagaitai.kaidoku.verify.VerificationFailure;

import java.util.List;

/**
 * コンパイル済みコントラクトから Act の仕様を作り、バイトコードと等価であることを確かめる。
 * <p>
 * 要約、変換、型の範囲の補完、検証の順に進め、どこかで失敗すれば {@link DecompileException} を投げる。
 * 返す仕様には補完した範囲条件を含めない。
 */
@Slf4j(topic = "kaidoku")
public class Decompiler implements AutoCloseable {
    @Getter
    private final MachineManager manager;
    private final Solvers solvers;
    // 自分で作ったものだけを閉じる
    private final Z3SolverPool ownedPool;

    public Decompiler() {
        this(new Z3SolverPool());
    }

    public Decompiler(int solverCount, int solverTimeoutMills) {
        this(new Z3SolverPool(solverCount, solverTimeoutMills));
    }

    private Decompiler(Z3SolverPool pool) {
        this.ownedPool = pool;
        this.solvers = pool;
        this.manager = new MachineManager(pool);
    }

    public Decompiler(MachineManager manager, Solvers solvers) {
        this.ownedPool = null;
        this.solvers = solvers;
        this.manager = manager;
    }

    public Act decompile(CompiledContract contract) throws DecompileException {
        Summarizer summarizer = new Summarizer(manager, new SafetyNormalizer(solvers));
        ContractSummary summary = summarizer.summarize(contract);
        Act act = new Translator(summary).translate();
        log.info("変換終了: {} 振る舞いの数 {}", contract.getName(),
                act.getContracts().get(0).getBehaviours().size());

        Act enriched = Enricher.enrich(act);
        List<VerificationFailure> failures = new EquivalenceChecker(manager, solvers).verify(contract, enriched);
        if (!failures.isEmpty()) {
            throw DecompileException.verification(failures);
        }
        return act;
    }

    @Override
    public void close() {
        if (ownedPool != null) {
            manager.close();
            ownedPool.close();
        }
    }
}
