package net.katagaitai.kaidoku.verify;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import net.katagaitai.kaidoku.act.Act;
import net.katagaitai.kaidoku.act.ActType;
import net.katagaitai.kaidoku.act.Behaviour;
import net.katagaitai.kaidoku.act.Constructor;
import net.katagaitai.kaidoku.act.Exp;
import net.katagaitai.kaidoku.act.StorageItem;
import net.katagaitai.kaidoku.act.StorageUpdate;
import net.katagaitai.kaidoku.act.Timing;
import net.katagaitai.kaidoku.evm.expr.Expr;
import net.katagaitai.kaidoku.evm.expr.Prop;
import net.katagaitai.kaidoku.solidity.AbiType;
import net.katagaitai.kaidoku.util.Constants;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * Act の振る舞いを、記号実行の結果と同じ形の成功パスに戻す。
 * <p>
 * 整数は 256 ビットのワードとして扱い、inRange はオーバーフローしない条件に展開する。
 */
public class SpecCompiler {
    private static final BigInteger TWO_256 = Constants.TWO_256;

    private final Map<String, BigInteger> slots;

    public SpecCompiler(Act act) {
        Map<String, BigInteger> map = Maps.newHashMap();
        act.getStore().forEach((contract, vars) ->
                vars.forEach((name, slot) -> map.put(contract + "." + name, slot.getRight())));
        this.slots = ImmutableMap.copyOf(map);
    }

    // 事前状態を抽象ストレージとした成功パス
    public Expr compile(Behaviour behaviour) {
        Expr prestate = Expr.abstractStore(Constants.STORAGE_NAME);
        Expr poststate = writes(behaviour.getStateUpdates(), prestate, prestate);
        Scope scope = new Scope(prestate, poststate);
        List<Prop> props = Lists.newArrayList();
        for (Exp p : behaviour.getPreconditions()) {
            props.add(scope.prop(p.setTime(Timing.PRE)));
        }
        for (Exp p : behaviour.getCaseConditions()) {
            props.add(scope.prop(p.setTime(Timing.PRE)));
        }
        Expr returnData = behaviour.getReturns() == null
                ? Expr.EMPTY_BUF
                : Expr.wordBytes(scope.word(behaviour.getReturns().setTime(Timing.PRE)));
        return Expr.success(props, returnData, poststate);
    }

    // 作成時の成功パス。実行コードを返し、空のストレージに初期値を書き込む
    public Expr compile(Constructor ctor, byte[] runtimeCode) {
        Expr prestate = Expr.concreteStore(ImmutableMap.of());
        Expr poststate = writes(ctor.getInitialStorage(), prestate, prestate);
        Scope scope = new Scope(prestate, poststate);
        List<Prop> props = Lists.newArrayList();
        for (Exp p : ctor.getPreconditions()) {
            props.add(scope.prop(p.setTime(Timing.PRE)));
        }
        return Expr.success(props, Expr.bytes(runtimeCode), poststate);
    }

    private Expr writes(List<StorageUpdate> updates, Expr base, Expr prestate) {
        // 書き込む値は事前状態から読む
        Scope scope = new Scope(prestate, prestate);
        Expr store = base;
        for (StorageUpdate update : updates) {
            Expr value = scope.word(update.getValue().setTime(Timing.PRE));
            store = Expr.sstore(Expr.lit(slot(update.getItem())), value, store);
        }
        return store;
    }

    private BigInteger slot(StorageItem item) {
        if (!item.getIndices().isEmpty()) {
            throw new IllegalArgumentException("mappingの参照は扱えない: " + item);
        }
        BigInteger slot = slots.get(item.qualifiedName());
        if (slot == null) {
            throw new IllegalArgumentException("レイアウトにない変数: " + item);
        }
        return slot;
    }

    private class Scope {
        private final Expr prestate;
        private final Expr poststate;

        Scope(Expr prestate, Expr poststate) {
            this.prestate = prestate;
            this.poststate = poststate;
        }

        Expr word(Exp e) {
            e.checkType(ActType.INTEGER);
            switch (e.getKind()) {
                case LIT_INT:
                    return Expr.lit(toWord(e.getValue()));
                case VAR:
                    return Expr.var(e.getName());
                case INT_ENV:
                    return Expr.env(e.getEnv().getEvmName());
                case INT_MIN:
                    return Expr.lit(toWord(BigInteger.ONE.shiftLeft(e.getValue().intValue() - 1).negate()));
                case INT_MAX:
                    return Expr.lit(BigInteger.ONE.shiftLeft(e.getValue().intValue() - 1).subtract(BigInteger.ONE));
                case UINT_MIN:
                    return Expr.ZERO;
                case UINT_MAX:
                    return Expr.lit(BigInteger.ONE.shiftLeft(e.getValue().intValue()).subtract(BigInteger.ONE));
                case ADD:
                    return Expr.add(word(e.arg(0)), word(e.arg(1)));
                case SUB:
                    return Expr.sub(word(e.arg(0)), word(e.arg(1)));
                case MUL:
                    return Expr.mul(word(e.arg(0)), word(e.arg(1)));
                case DIV:
                    return Expr.div(word(e.arg(0)), word(e.arg(1)));
                case MOD:
                    // ワード上の演算は常に 2^256 の剰余
                    if (e.arg(1).is(Exp.Kind.LIT_INT) && e.arg(1).getValue().equals(TWO_256)) {
                        return word(e.arg(0));
                    }
                    return Expr.mod(word(e.arg(0)), word(e.arg(1)));
                case EXP:
                    return Expr.exp(word(e.arg(0)), word(e.arg(1)));
                case ITE:
                    return Expr.iteWord(prop(e.arg(0)), word(e.arg(1)), word(e.arg(2)));
                case TENTRY:
                    return read(e);
                default:
                    throw new IllegalArgumentException("ワードに変換できない: " + e);
            }
        }

        private Expr read(Exp e) {
            Expr key = Expr.lit(slot(e.getItem()));
            switch (e.getTiming()) {
                case PRE:
                    return Expr.sload(key, prestate);
                case POST:
                    return Expr.sload(key, poststate);
                default:
                    throw new IllegalArgumentException("時刻が未指定: " + e);
            }
        }

        Prop prop(Exp e) {
            e.checkType(ActType.BOOLEAN);
            switch (e.getKind()) {
                case AND:
                    return Prop.pand(prop(e.arg(0)), prop(e.arg(1)));
                case OR:
                    return Prop.por(prop(e.arg(0)), prop(e.arg(1)));
                case IMPL:
                    return Prop.pimpl(prop(e.arg(0)), prop(e.arg(1)));
                case NEG:
                    return Prop.pneg(prop(e.arg(0)));
                case LT:
                    return Prop.plt(word(e.arg(0)), word(e.arg(1)));
                case LEQ:
                    return Prop.pleq(word(e.arg(0)), word(e.arg(1)));
                case GEQ:
                    return Prop.pgeq(word(e.arg(0)), word(e.arg(1)));
                case GT:
                    return Prop.pgt(word(e.arg(0)), word(e.arg(1)));
                case LIT_BOOL:
                    return Prop.pbool(e.isBoolValue());
                case EQ:
                    return equality(e);
                case NEQ:
                    return Prop.pneg(equality(e));
                case ITE: {
                    Prop c = prop(e.arg(0));
                    return Prop.por(Prop.pand(c, prop(e.arg(1))), Prop.pand(Prop.pneg(c), prop(e.arg(2))));
                }
                case IN_RANGE:
                    return inRange(e.getAbiType(), e.arg(0));
                default:
                    throw new IllegalArgumentException("命題に変換できない: " + e);
            }
        }

        private Prop equality(Exp e) {
            if (e.getOperandType() == ActType.INTEGER) {
                return Prop.peq(word(e.arg(0)), word(e.arg(1)));
            }
            if (e.getOperandType() == ActType.BOOLEAN) {
                Prop a = prop(e.arg(0));
                Prop b = prop(e.arg(1));
                return Prop.pand(Prop.pimpl(a, b), Prop.pimpl(b, a));
            }
            throw new IllegalArgumentException("比較できない型: " + e);
        }

        Prop inRange(AbiType type, Exp e) {
            Expr w = word(e);
            Prop safe = noOverflow(e);
            switch (type.getKind()) {
                case UINT:
                case INT:
                    if (type.getSize() == Constants.WORD_BITS) {
                        return safe;
                    }
                    if (type.getKind() == AbiType.Kind.UINT) {
                        return Prop.pand(Prop.pleq(w, maxUint(type.getSize())), safe);
                    }
                    Expr extended = Expr.sex(Expr.lit(type.getSize() / 8 - 1), w);
                    return Prop.pand(Prop.peq(extended, w), safe);
                case ADDRESS:
                    return Prop.pand(Prop.pleq(w, maxUint(160)), safe);
                case BOOL:
                    return Prop.pand(Prop.pleq(w, Expr.ONE), safe);
                case FIXED_BYTES:
                    return Prop.TRUE;
                default:
                    throw new IllegalArgumentException("範囲を表せない型: " + type);
            }
        }

        // 2^256 の剰余の下は見ない
        private Prop noOverflow(Exp e) {
            List<Prop> conds = Lists.newArrayList();
            collectOverflow(e, conds);
            return Prop.pands(ImmutableList.copyOf(conds));
        }

        private void collectOverflow(Exp e, List<Prop> conds) {
            if (e.is(Exp.Kind.MOD) && e.arg(1).is(Exp.Kind.LIT_INT) && e.arg(1).getValue().equals(TWO_256)) {
                return;
            }
            if (e.getType() != ActType.INTEGER) {
                return;
            }
            for (Exp arg : e.getArgs()) {
                collectOverflow(arg, conds);
            }
            switch (e.getKind()) {
                case ADD: {
                    Expr a = word(e.arg(0));
                    conds.add(Prop.pgeq(Expr.add(a, word(e.arg(1))), a));
                    break;
                }
                case SUB: {
                    Expr a = word(e.arg(0));
                    conds.add(Prop.pleq(Expr.sub(a, word(e.arg(1))), a));
                    break;
                }
                case MUL: {
                    Expr a = word(e.arg(0));
                    Expr b = word(e.arg(1));
                    conds.add(Prop.por(Prop.peq(a, Expr.ZERO), Prop.peq(Expr.div(Expr.mul(a, b), a), b)));
                    break;
                }
                default:
                    break;
            }
        }
    }

    private static Expr maxUint(int bits) {
        return Expr.lit(BigInteger.ONE.shiftLeft(bits).subtract(BigInteger.ONE));
    }

    private static BigInteger toWord(BigInteger v) {
        return v.mod(TWO_256);
    }
}
