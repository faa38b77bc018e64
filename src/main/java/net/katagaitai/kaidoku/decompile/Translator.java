package net.katagaitai.kaidoku.decompile;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.kaidoku.DecompileException;
import net.katagaitai.kaidoku.act.Act;
import net.katagaitai.kaidoku.act.ActType;
import net.katagaitai.kaidoku.act.Behaviour;
import net.katagaitai.kaidoku.act.Constructor;
import net.katagaitai.kaidoku.act.Contract;
import net.katagaitai.kaidoku.act.Decl;
import net.katagaitai.kaidoku.act.EthEnv;
import net.katagaitai.kaidoku.act.Exp;
import net.katagaitai.kaidoku.act.Interface;
import net.katagaitai.kaidoku.act.SlotType;
import net.katagaitai.kaidoku.act.StorageItem;
import net.katagaitai.kaidoku.act.StorageUpdate;
import net.katagaitai.kaidoku.act.Timing;
import net.katagaitai.kaidoku.evm.expr.Expr;
import net.katagaitai.kaidoku.evm.expr.Prop;
import net.katagaitai.kaidoku.evm.expr.Sort;
import net.katagaitai.kaidoku.solidity.AbiType;
import net.katagaitai.kaidoku.solidity.LayoutItem;
import net.katagaitai.kaidoku.solidity.Method;
import net.katagaitai.kaidoku.solidity.Param;
import net.katagaitai.kaidoku.util.Constants;
import org.apache.commons.lang3.tuple.Pair;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 要約した成功パスを Act の仕様に変換する。
 * <p>
 * ワードは非負の整数として、EVM の真偽値は {@code if p then 1 else 0} として表す。
 * solc が出力するオーバーフロー検査の形は inRange に置き換える。
 */
@Slf4j(topic = "kaidoku")
public class Translator {
    private static final AbiType UINT256 = AbiType.uint(256);
    private static final AbiType DEFAULT_VAR_TYPE = AbiType.fixedBytes(32);

    private final ContractSummary summary;
    // offset 0 のスロットだけを引く
    private final Map<BigInteger, Pair<String, SlotType>> layout;

    public Translator(ContractSummary summary) {
        this.summary = summary;
        this.layout = invertLayout(summary.getStorageLayout());
    }

    private static Map<BigInteger, Pair<String, SlotType>> invertLayout(Map<String, LayoutItem> storageLayout) {
        Map<BigInteger, Pair<String, SlotType>> inverted = Maps.newHashMap();
        storageLayout.forEach((name, item) -> {
            if (item.getOffset() == 0) {
                inverted.put(item.getSlot(), Pair.of(name, SlotType.of(item.getSlotType())));
            }
        });
        return inverted;
    }

    public Act translate() throws DecompileException {
        Constructor ctor = mkConstructor();
        ImmutableList<Behaviour> behaviours = mkBehaviours();
        return new Act(mkStore(), ImmutableList.of(new Contract(ctor, behaviours)));
    }

    private ImmutableMap<String, ImmutableMap<String, Pair<SlotType, BigInteger>>> mkStore() {
        ImmutableMap.Builder<String, Pair<SlotType, BigInteger>> items = ImmutableMap.builder();
        summary.getStorageLayout().forEach((name, item) ->
                items.put(name, Pair.of(SlotType.of(item.getSlotType()), item.getSlot())));
        return ImmutableMap.of(summary.getName(), items.build());
    }

    // ---- constructor / behaviour ----

    Constructor mkConstructor() throws DecompileException {
        ImmutableSet<Expr> outcomes = summary.getCreation();
        if (outcomes.isEmpty()) {
            throw DecompileException.unsupported("cannot decompile constructors that always revert");
        }
        if (outcomes.size() > 1) {
            throw DecompileException.unsupported("decompile constructors with multiple branches");
        }
        Expr outcome = checkSuccess(outcomes.iterator().next());
        Interface iface = summary.getCreationInterface();
        Map<String, AbiType> params = paramTypes(iface);
        List<Exp> pres = preconditions(outcome.getProps(), params);
        ImmutableList<StorageUpdate> updates = mkRewrites(StoragePartitioner.partition(outcome.getStorage()), params);
        return new Constructor(summary.getName(), iface, ImmutableList.copyOf(pres), ImmutableList.of(),
                ImmutableList.of(), updates);
    }

    ImmutableList<Behaviour> mkBehaviours() throws DecompileException {
        ImmutableList.Builder<Behaviour> behaviours = ImmutableList.builder();
        for (Map.Entry<Method, ImmutableSet<Expr>> entry : summary.getRuntime().entrySet()) {
            for (Expr outcome : entry.getValue()) {
                behaviours.add(mkBehaviour(entry.getKey(), checkSuccess(outcome)));
            }
        }
        return behaviours.build();
    }

    private Behaviour mkBehaviour(Method method, Expr outcome) throws DecompileException {
        Interface iface = Interface.of(method.getName(), method.getInputs());
        Map<String, AbiType> params = paramTypes(iface);
        List<Exp> pres = preconditions(outcome.getProps(), params);
        Exp ret = mkReturn(method.getOutputs(), outcome.getReturnData(), params);
        ImmutableList<StorageUpdate> updates = mkRewrites(StoragePartitioner.partition(outcome.getStorage()), params);
        return new Behaviour(method.getName(), summary.getName(), iface, ImmutableList.copyOf(pres),
                ImmutableList.of(), ImmutableList.of(), updates, ret);
    }

    private static Expr checkSuccess(Expr outcome) {
        if (!outcome.is(Expr.Kind.SUCCESS)) {
            throw new IllegalStateException("成功パスではない: " + outcome);
        }
        return outcome;
    }

    private static Map<String, AbiType> paramTypes(Interface iface) {
        Map<String, AbiType> params = Maps.newHashMap();
        for (Decl decl : iface.getDecls()) {
            params.put(decl.getName(), decl.getType());
        }
        return params;
    }

    private List<Exp> preconditions(List<Prop> props, Map<String, AbiType> params) throws DecompileException {
        Set<Exp> pres = Sets.newLinkedHashSet();
        for (Prop p : props) {
            flatten(fromProp(p, params), pres);
        }
        return Lists.newArrayList(pres);
    }

    // 連言を分解する
    private static void flatten(Exp e, Set<Exp> out) {
        if (e.is(Exp.Kind.AND)) {
            flatten(e.arg(0), out);
            flatten(e.arg(1), out);
        } else {
            out.add(e);
        }
    }

    private Exp mkReturn(List<Param> outputs, Expr returnData, Map<String, AbiType> params)
            throws DecompileException {
        if (outputs.isEmpty()) {
            return null;
        }
        if (outputs.size() > 1) {
            throw DecompileException.unsupported("cannot decompile methods with multiple return types");
        }
        AbiType type = outputs.get(0).getType();
        if (type.isDynamic()) {
            throw DecompileException.unsupported("cannot decompile methods that return dynamically sized types");
        }
        if (type.getKind() == AbiType.Kind.TUPLE) {
            throw DecompileException.unsupported("cannot decompile methods that return a tuple");
        }
        if (type.getKind() == AbiType.Kind.FUNCTION) {
            throw DecompileException.unsupported("cannot decompile methods that return a function pointer");
        }
        return fromWord(Expr.readWord(Expr.ZERO, returnData), params);
    }

    private ImmutableList<StorageUpdate> mkRewrites(DistinctStore store, Map<String, AbiType> params)
            throws DecompileException {
        ImmutableList.Builder<StorageUpdate> updates = ImmutableList.builder();
        for (Map.Entry<BigInteger, Expr> write : store.getWrites().entrySet()) {
            Pair<String, SlotType> named = layout.get(write.getKey());
            if (named == null) {
                throw DecompileException.unsupported(
                        "write to a storage location that is not mentioned in the solc layout: " + write.getKey());
            }
            SlotType slotType = named.getRight();
            if (slotType.isMapping()) {
                throw DecompileException.unsupported("cannot decompile contracts that write to mappings");
            }
            if (slotType.getValue().isContract()) {
                throw DecompileException.unsupported(
                        "cannot decompile contracts that have contract types in storage");
            }
            AbiType type = slotType.getValue().getAbiType();
            if (type.isDynamic()) {
                throw DecompileException.unsupported("cannot decompile methods that store dynamically sized types");
            }
            if (type.getKind() == AbiType.Kind.TUPLE) {
                throw DecompileException.unsupported("cannot decompile methods that write to tuple in storage");
            }
            if (type.getKind() == AbiType.Kind.FUNCTION) {
                throw DecompileException.unsupported("cannot decompile methods that store function pointers");
            }
            StorageItem item = StorageItem.of(ActType.INTEGER, slotType.getValue(), summary.getName(),
                    named.getLeft());
            updates.add(new StorageUpdate(item, fromWord(write.getValue(), params)));
        }
        return updates.build();
    }

    // ---- 式の変換 ----

    Exp fromProp(Prop p, Map<String, AbiType> params) throws DecompileException {
        return Simplifier.simplify(prop(p, params));
    }

    private Exp prop(Prop p, Map<String, AbiType> params) throws DecompileException {
        switch (p.getKind()) {
            case PEQ:
                if (p.expr(0).getSort() != Sort.WORD) {
                    throw DecompileException.unsupported(
                            "cannot decompile props comparing equality of non word terms: " + p);
                }
                return Exp.eq(fromWord(p.expr(0), params), fromWord(p.expr(1), params));
            case PLT:
                return Exp.lt(fromWord(p.expr(0), params), fromWord(p.expr(1), params));
            case PGT:
                return Exp.gt(fromWord(p.expr(0), params), fromWord(p.expr(1), params));
            case PGEQ:
                return Exp.geq(fromWord(p.expr(0), params), fromWord(p.expr(1), params));
            case PLEQ:
                return Exp.leq(fromWord(p.expr(0), params), fromWord(p.expr(1), params));
            case PNEG:
                return Exp.neg(prop(p.prop(0), params));
            case PAND:
                return Exp.and(prop(p.prop(0), params), prop(p.prop(1), params));
            case POR:
                return Exp.or(prop(p.prop(0), params), prop(p.prop(1), params));
            case PIMPL:
                return Exp.impl(prop(p.prop(0), params), prop(p.prop(1), params));
            case PBOOL:
                return Exp.litBool(p.isValue());
            default:
                throw new IllegalStateException("未対応の命題: " + p);
        }
    }

    Exp fromWord(Expr w, Map<String, AbiType> params) throws DecompileException {
        return new WordTranslator(w, params).go(w);
    }

    // エラーメッセージ用に外側の式を持つ
    private class WordTranslator {
        private final Expr outer;
        private final Map<String, AbiType> params;

        WordTranslator(Expr outer, Map<String, AbiType> params) {
            this.outer = outer;
            this.params = params;
        }

        private DecompileException err(Expr e) {
            return DecompileException.unsupported(
                    "unable to convert to integer: " + e + "\nouter expression: " + outer);
        }

        Exp go(Expr e) throws DecompileException {
            Exp idiom = overflowIdiom(e);
            if (idiom != null) {
                return idiom;
            }
            switch (e.getKind()) {
                case LIT:
                    return Exp.litInt(e.getValue());
                case VAR:
                    return Exp.var(ActType.INTEGER, params.getOrDefault(e.getName(), DEFAULT_VAR_TYPE), e.getName());
                case ENV: {
                    EthEnv env = EthEnv.fromEvmName(e.getName());
                    if (env == null) {
                        throw err(e);
                    }
                    return Exp.intEnv(env);
                }
                case LT:
                    return evmBool(Exp.lt(go(e.arg(0)), go(e.arg(1))));
                case EQ:
                    return evmBool(Exp.eq(go(e.arg(0)), go(e.arg(1))));
                case ISZERO:
                    return evmBool(Exp.eq(go(e.arg(0)), Exp.ZERO));
                case AND:
                    return bitAnd(e);
                case OR: {
                    Exp a = go(e.arg(0));
                    Exp b = go(e.arg(1));
                    if (Simplifier.isEvmBool(a) && Simplifier.isEvmBool(b)) {
                        return evmBool(Exp.or(a.arg(0), b.arg(0)));
                    }
                    throw err(e);
                }
                case ADD:
                    return Exp.add(go(e.arg(0)), go(e.arg(1)));
                case SUB:
                    return Exp.sub(go(e.arg(0)), go(e.arg(1)));
                case MUL:
                    return Exp.mul(go(e.arg(0)), go(e.arg(1)));
                case DIV:
                    return Exp.div(go(e.arg(0)), go(e.arg(1)));
                case MOD:
                    return Exp.mod(go(e.arg(0)), go(e.arg(1)));
                case EXP:
                    return Exp.exp(go(e.arg(0)), go(e.arg(1)));
                case WRAP:
                    return Exp.mod(go(e.arg(0)), Exp.litInt(Constants.TWO_256));
                case ITE_WORD:
                    return Exp.ite(prop(e.getProps().get(0), params), go(e.arg(0)), go(e.arg(1)));
                case SLOAD:
                    return storageRead(e);
                default:
                    throw err(e);
            }
        }

        // ~a < b, a != 0 && MAX / a < c, a == 0 || b == (a * b) / a
        private Exp overflowIdiom(Expr e) throws DecompileException {
            if (e.is(Expr.Kind.LT) && e.arg(0).is(Expr.Kind.NOT)) {
                Exp a = go(e.arg(0).arg(0));
                Exp b = go(e.arg(1));
                return evmBool(Exp.neg(Exp.inRange(UINT256, Exp.add(a, b))));
            }
            if (e.is(Expr.Kind.AND)) {
                for (int i = 0; i < 2; i++) {
                    Exp result = mulBound(e.arg(i), e.arg(1 - i));
                    if (result != null) {
                        return result;
                    }
                }
            }
            if (e.is(Expr.Kind.OR)) {
                for (int i = 0; i < 2; i++) {
                    Exp result = mulCheck(e.arg(i), e.arg(1 - i));
                    if (result != null) {
                        return result;
                    }
                }
            }
            return null;
        }

        // IsZero(IsZero a) & LT(Div(MAX, a), c)
        private Exp mulBound(Expr nonZero, Expr bound) throws DecompileException {
            if (!nonZero.is(Expr.Kind.ISZERO) || !nonZero.arg(0).is(Expr.Kind.ISZERO)
                    || !bound.is(Expr.Kind.LT) || !bound.arg(0).is(Expr.Kind.DIV)) {
                return null;
            }
            Expr a = nonZero.arg(0).arg(0);
            Expr div = bound.arg(0);
            if (!div.arg(0).equals(Expr.MAX) || !div.arg(1).equals(a)) {
                return null;
            }
            Exp a1 = go(a);
            Exp c1 = go(bound.arg(1));
            return evmBool(Exp.and(Exp.neg(Exp.eq(a1, Exp.ZERO)), Exp.neg(Exp.inRange(UINT256, Exp.mul(a1, c1)))));
        }

        // IsZero a | Eq(b, Div(Wrap?(Mul(a, b)), a))
        private Exp mulCheck(Expr isZero, Expr eq) throws DecompileException {
            if (!isZero.is(Expr.Kind.ISZERO) || !eq.is(Expr.Kind.EQ)) {
                return null;
            }
            Expr a = isZero.arg(0);
            for (int i = 0; i < 2; i++) {
                Expr b = eq.arg(i);
                Expr div = eq.arg(1 - i);
                if (!div.is(Expr.Kind.DIV) || !div.arg(1).equals(a)) {
                    continue;
                }
                Expr mul = div.arg(0).is(Expr.Kind.WRAP) ? div.arg(0).arg(0) : div.arg(0);
                if (!mul.is(Expr.Kind.MUL)) {
                    continue;
                }
                boolean operands = (mul.arg(0).equals(a) && mul.arg(1).equals(b))
                        || (mul.arg(1).equals(a) && mul.arg(0).equals(b));
                if (operands) {
                    return evmBool(Exp.inRange(UINT256, Exp.mul(go(a), go(b))));
                }
            }
            return null;
        }

        private Exp bitAnd(Expr e) throws DecompileException {
            // 下位kビットのマスクは 2^k の剰余
            for (int i = 0; i < 2; i++) {
                Expr mask = e.arg(i);
                if (mask.isLit() && mask.getValue().signum() > 0
                        && mask.getValue().add(BigInteger.ONE).bitCount() == 1) {
                    return Exp.mod(go(e.arg(1 - i)), Exp.litInt(mask.getValue().add(BigInteger.ONE)));
                }
            }
            Exp a = go(e.arg(0));
            Exp b = go(e.arg(1));
            if (Simplifier.isEvmBool(a) && Simplifier.isEvmBool(b)) {
                return evmBool(Exp.and(a.arg(0), b.arg(0)));
            }
            throw err(e);
        }

        private Exp storageRead(Expr e) throws DecompileException {
            Expr key = e.arg(0);
            if (!key.isLit() || !e.arg(1).is(Expr.Kind.ABSTRACT_STORE)) {
                throw err(e);
            }
            Pair<String, SlotType> named = layout.get(key.getValue());
            if (named == null) {
                throw DecompileException.unsupported(
                        "read from a storage location that is not present in the solc layout");
            }
            SlotType slotType = named.getRight();
            if (slotType.isMapping() || slotType.getValue().isContract()
                    || !slotType.getValue().getAbiType().isWord()) {
                throw DecompileException.unsupported(
                        "unable to handle storage reads for variables of type: " + slotType);
            }
            StorageItem item = StorageItem.of(ActType.INTEGER, slotType.getValue(), summary.getName(),
                    named.getLeft());
            return Exp.tEntry(Timing.PRE, item);
        }
    }

    private static Exp evmBool(Exp p) {
        return Exp.ite(p, Exp.ONE, Exp.ZERO);
    }
}
