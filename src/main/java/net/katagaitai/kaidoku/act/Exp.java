package net.katagaitai.kaidoku.act;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import net.katagaitai.kaidoku.solidity.AbiType;

import java.math.BigInteger;
import java.util.List;
import java.util.function.Function;

/**
 * Act の式。Kind と結果型 ActType を持つタグ付き共用体。
 * <p>
 * 等価性はソース上の位置 pn を無視する。
 */
@Getter
@EqualsAndHashCode(cacheStrategy = EqualsAndHashCode.CacheStrategy.LAZY)
public final class Exp {
    public enum Kind {
        // boolean
        AND("and"),
        OR("or"),
        IMPL("=>"),
        NEG("not"),
        LT("<"),
        LEQ("<="),
        GEQ(">="),
        GT(">"),
        LIT_BOOL("bool"),
        // integer
        ADD("+"),
        SUB("-"),
        MUL("*"),
        DIV("/"),
        MOD("%"),
        EXP("^"),
        LIT_INT("int"),
        INT_ENV("env"),
        INT_MIN("intmin"),
        INT_MAX("intmax"),
        UINT_MIN("uintmin"),
        UINT_MAX("uintmax"),
        IN_RANGE("inrange"),
        // polymorphic
        EQ("=="),
        NEQ("=/="),
        ITE("ite"),
        VAR("var"),
        TENTRY("entry");

        @Getter
        private final String symbol;

        Kind(String symbol) {
            this.symbol = symbol;
        }
    }

    public static final Exp TRUE = litBool(true);
    public static final Exp FALSE = litBool(false);
    public static final Exp ZERO = litInt(BigInteger.ZERO);
    public static final Exp ONE = litInt(BigInteger.ONE);

    private final Kind kind;
    private final ActType type;
    @EqualsAndHashCode.Exclude
    private final Pn pn;
    private final ImmutableList<Exp> args;
    // LIT_INTの値、LIT_BOOLは0/1、INT_MIN等はビット数
    private final BigInteger value;
    // IN_RANGEの範囲、VARの宣言型
    private final AbiType abiType;
    private final EthEnv env;
    private final String name;
    private final Timing timing;
    private final StorageItem item;
    // EQ/NEQの被比較型
    private final ActType operandType;

    private Exp(Kind kind, ActType type, Pn pn, List<Exp> args, BigInteger value, AbiType abiType, EthEnv env,
                String name, Timing timing, StorageItem item, ActType operandType) {
        this.kind = kind;
        this.type = type;
        this.pn = pn;
        this.args = ImmutableList.copyOf(args);
        this.value = value;
        this.abiType = abiType;
        this.env = env;
        this.name = name;
        this.timing = timing;
        this.item = item;
        this.operandType = operandType;
    }

    private static Exp node(Kind kind, ActType type, Exp... args) {
        return new Exp(kind, type, Pn.NOWHERE, ImmutableList.copyOf(args), null, null, null, null, null, null, null);
    }

    private static Exp leaf(Kind kind, ActType type, BigInteger value) {
        return new Exp(kind, type, Pn.NOWHERE, ImmutableList.of(), value, null, null, null, null, null, null);
    }

    public Exp checkType(ActType expected) {
        if (type != expected) {
            throw new IllegalArgumentException("型が異なる: " + expected + "が必要だが" + type + ": " + this);
        }
        return this;
    }

    public Exp arg(int i) {
        return args.get(i);
    }

    public boolean is(Kind k) {
        return kind == k;
    }

    public boolean isLitInt(long v) {
        return kind == Kind.LIT_INT && value.equals(BigInteger.valueOf(v));
    }

    public boolean isBoolValue() {
        return kind == Kind.LIT_BOOL && value.signum() != 0;
    }

    public Exp at(Pn position) {
        return new Exp(kind, type, position, args, value, abiType, env, name, timing, item, operandType);
    }

    // ---- boolean ----

    public static Exp and(Exp a, Exp b) {
        return node(Kind.AND, ActType.BOOLEAN, a.checkType(ActType.BOOLEAN), b.checkType(ActType.BOOLEAN));
    }

    public static Exp or(Exp a, Exp b) {
        return node(Kind.OR, ActType.BOOLEAN, a.checkType(ActType.BOOLEAN), b.checkType(ActType.BOOLEAN));
    }

    public static Exp impl(Exp a, Exp b) {
        return node(Kind.IMPL, ActType.BOOLEAN, a.checkType(ActType.BOOLEAN), b.checkType(ActType.BOOLEAN));
    }

    public static Exp neg(Exp a) {
        return node(Kind.NEG, ActType.BOOLEAN, a.checkType(ActType.BOOLEAN));
    }

    public static Exp lt(Exp a, Exp b) {
        return comparison(Kind.LT, a, b);
    }

    public static Exp leq(Exp a, Exp b) {
        return comparison(Kind.LEQ, a, b);
    }

    public static Exp geq(Exp a, Exp b) {
        return comparison(Kind.GEQ, a, b);
    }

    public static Exp gt(Exp a, Exp b) {
        return comparison(Kind.GT, a, b);
    }

    private static Exp comparison(Kind kind, Exp a, Exp b) {
        return node(kind, ActType.BOOLEAN, a.checkType(ActType.INTEGER), b.checkType(ActType.INTEGER));
    }

    public static Exp litBool(boolean b) {
        return leaf(Kind.LIT_BOOL, ActType.BOOLEAN, b ? BigInteger.ONE : BigInteger.ZERO);
    }

    // ---- integer ----

    public static Exp add(Exp a, Exp b) {
        return arith(Kind.ADD, a, b);
    }

    public static Exp sub(Exp a, Exp b) {
        return arith(Kind.SUB, a, b);
    }

    public static Exp mul(Exp a, Exp b) {
        return arith(Kind.MUL, a, b);
    }

    public static Exp div(Exp a, Exp b) {
        return arith(Kind.DIV, a, b);
    }

    public static Exp mod(Exp a, Exp b) {
        return arith(Kind.MOD, a, b);
    }

    public static Exp exp(Exp a, Exp b) {
        return arith(Kind.EXP, a, b);
    }

    private static Exp arith(Kind kind, Exp a, Exp b) {
        return node(kind, ActType.INTEGER, a.checkType(ActType.INTEGER), b.checkType(ActType.INTEGER));
    }

    public static Exp litInt(BigInteger v) {
        return leaf(Kind.LIT_INT, ActType.INTEGER, v);
    }

    public static Exp litInt(long v) {
        return litInt(BigInteger.valueOf(v));
    }

    public static Exp intEnv(EthEnv env) {
        return new Exp(Kind.INT_ENV, ActType.INTEGER, Pn.NOWHERE, ImmutableList.of(), null, null, env, null, null,
                null, null);
    }

    public static Exp intMin(int bits) {
        return leaf(Kind.INT_MIN, ActType.INTEGER, BigInteger.valueOf(bits));
    }

    public static Exp intMax(int bits) {
        return leaf(Kind.INT_MAX, ActType.INTEGER, BigInteger.valueOf(bits));
    }

    public static Exp uintMin(int bits) {
        return leaf(Kind.UINT_MIN, ActType.INTEGER, BigInteger.valueOf(bits));
    }

    public static Exp uintMax(int bits) {
        return leaf(Kind.UINT_MAX, ActType.INTEGER, BigInteger.valueOf(bits));
    }

    public static Exp inRange(AbiType range, Exp e) {
        return new Exp(Kind.IN_RANGE, ActType.BOOLEAN, Pn.NOWHERE, ImmutableList.of(e.checkType(ActType.INTEGER)),
                null, range, null, null, null, null, null);
    }

    // ---- polymorphic ----

    public static Exp eq(Exp a, Exp b) {
        return equality(Kind.EQ, a, b);
    }

    public static Exp neq(Exp a, Exp b) {
        return equality(Kind.NEQ, a, b);
    }

    private static Exp equality(Kind kind, Exp a, Exp b) {
        b.checkType(a.type);
        return new Exp(kind, ActType.BOOLEAN, Pn.NOWHERE, ImmutableList.of(a, b), null, null, null, null, null, null,
                a.type);
    }

    public static Exp ite(Exp cond, Exp a, Exp b) {
        b.checkType(a.type);
        return node(Kind.ITE, a.type, cond.checkType(ActType.BOOLEAN), a, b);
    }

    public static Exp var(ActType type, AbiType abiType, String name) {
        return new Exp(Kind.VAR, type, Pn.NOWHERE, ImmutableList.of(), null, abiType, null, name, null, null, null);
    }

    public static Exp tEntry(Timing timing, StorageItem item) {
        return new Exp(Kind.TENTRY, item.getType(), Pn.NOWHERE, ImmutableList.of(), null, null, null, null, timing,
                item, null);
    }

    // ---- traversal ----

    // ボトムアップに書き換える。子を書き換えた後、f を適用する
    public Exp map(Function<Exp, Exp> f) {
        if (args.isEmpty()) {
            return f.apply(this);
        }
        List<Exp> newArgs = Lists.newArrayListWithCapacity(args.size());
        boolean changed = false;
        for (Exp a : args) {
            Exp mapped = a.map(f);
            changed |= mapped != a;
            newArgs.add(mapped);
        }
        Exp rebuilt = changed
                ? new Exp(kind, type, pn, newArgs, value, abiType, env, name, timing, item, operandType)
                : this;
        return f.apply(rebuilt);
    }

    // 時刻が未指定のストレージ参照をすべて time に置き換える
    public Exp setTime(Timing time) {
        return map(e -> {
            if (e.is(Kind.TENTRY) && e.timing == Timing.UNSPECIFIED) {
                return new Exp(e.kind, e.type, e.pn, e.args, e.value, e.abiType, e.env, e.name, time,
                        e.item.setTime(time), e.operandType);
            }
            return e;
        });
    }

    @Override
    public String toString() {
        switch (kind) {
            case LIT_BOOL:
                return isBoolValue() ? "true" : "false";
            case LIT_INT:
                return value.toString();
            case INT_ENV:
                return env.getLabel();
            case INT_MIN:
            case INT_MAX:
            case UINT_MIN:
            case UINT_MAX:
                return kind.getSymbol() + value;
            case VAR:
                return name;
            case TENTRY:
                return timing == Timing.UNSPECIFIED ? item.toString() : timing.label().toLowerCase() + "(" + item + ")";
            case NEG:
                return "not(" + args.get(0) + ")";
            case IN_RANGE:
                return "inRange(" + abiType + ", " + args.get(0) + ")";
            case ITE:
                return "if " + args.get(0) + " then " + args.get(1) + " else " + args.get(2);
            default:
                return "(" + args.get(0) + " " + kind.getSymbol() + " " + args.get(1) + ")";
        }
    }
}
