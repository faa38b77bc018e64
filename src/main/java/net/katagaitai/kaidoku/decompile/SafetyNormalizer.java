package net.katagaitai.kaidoku.decompile;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.kaidoku.evm.expr.Expr;
import net.katagaitai.kaidoku.evm.expr.Prop;
import net.katagaitai.kaidoku.smt.CheckSatResult;
import net.katagaitai.kaidoku.smt.Solvers;

import java.util.Map;

// 算術ノードを整数として扱えるようにする。オーバーフローしないことを証明できないノードは Wrap で包む
@Slf4j(topic = "kaidoku")
@RequiredArgsConstructor
public class SafetyNormalizer {
    private final Solvers solvers;

    public Expr makeSafe(Expr outcome) {
        final Map<Expr, Prop> memo = Maps.newHashMap();
        return outcome.map(e -> rewrite(e, memo));
    }

    private Expr rewrite(Expr e, Map<Expr, Prop> memo) {
        switch (e.getKind()) {
            case ADD:
                return binop(Prop.pgeq(e, e.arg(0)), e, memo);
            case SUB:
                return binop(Prop.pleq(e, e.arg(0)), e, memo);
            case MUL:
                return binop(Prop.peq(Expr.div(e, e.arg(1)), e.arg(0)), e, memo);
            case EXP:
            case SEX:
                // 記号的な指数と符号拡張は常に包む
                return Expr.wrap(e);
            default:
                return e;
        }
    }

    private Expr binop(Prop safe, Expr full, Map<Expr, Prop> memo) {
        Prop left = memo.getOrDefault(full.arg(0), Prop.TRUE);
        Prop right = memo.getOrDefault(full.arg(1), Prop.TRUE);
        CheckSatResult result = solvers.checkSat(ImmutableList.of(left, right, Prop.pneg(safe)));
        if (result.isUnsat()) {
            memo.put(full, safe);
            return full;
        }
        log.debug("オーバーフローの可能性: {} ({})", full, result.getStatus());
        return Expr.wrap(full);
    }
}
