package net.katagaitai.kaidoku.evm.expr;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import net.katagaitai.kaidoku.util.Constants;
import net.katagaitai.kaidoku.util.Util;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 記号実行の項。Kind ごとに Sort が決まるタグ付き共用体。
 * <p>
 * インスタンスはスマートコンストラクタ経由でのみ作成し、リテラル同士の演算はその場で畳み込む。
 * 等価性は構造的で、ハッシュ値はキャッシュされる。
 */
@Getter
@EqualsAndHashCode(cacheStrategy = EqualsAndHashCode.CacheStrategy.LAZY)
public final class Expr {
    public enum Kind {
        // word
        LIT("Lit", Sort.WORD),
        VAR("Var", Sort.WORD),
        ENV("Env", Sort.WORD),
        ADD("Add", Sort.WORD),
        SUB("Sub", Sort.WORD),
        MUL("Mul", Sort.WORD),
        DIV("Div", Sort.WORD),
        SDIV("SDiv", Sort.WORD),
        MOD("Mod", Sort.WORD),
        SMOD("SMod", Sort.WORD),
        ADDMOD("AddMod", Sort.WORD),
        MULMOD("MulMod", Sort.WORD),
        EXP("Exp", Sort.WORD),
        SEX("SEx", Sort.WORD),
        LT("LT", Sort.WORD),
        SLT("SLT", Sort.WORD),
        EQ("Eq", Sort.WORD),
        ISZERO("IsZero", Sort.WORD),
        AND("And", Sort.WORD),
        OR("Or", Sort.WORD),
        XOR("Xor", Sort.WORD),
        NOT("Not", Sort.WORD),
        SHL("SHL", Sort.WORD),
        SHR("SHR", Sort.WORD),
        SAR("SAR", Sort.WORD),
        GETBYTE("GetByte", Sort.WORD),
        WRAP("Wrap", Sort.WORD),
        ITE_WORD("ITEWord", Sort.WORD),
        SLOAD("SLoad", Sort.WORD),
        READ_WORD("ReadWord", Sort.WORD),
        JOIN_BYTES("JoinBytes", Sort.WORD),
        KECCAK("Keccak", Sort.WORD),
        BUF_LENGTH("BufLength", Sort.WORD),
        // byte
        LIT_BYTE("LitByte", Sort.BYTE),
        INDEX_WORD("IndexWord", Sort.BYTE),
        READ_BYTE("ReadByte", Sort.BYTE),
        // buffer
        ABSTRACT_BUF("AbstractBuf", Sort.BUF),
        BYTES("Bytes", Sort.BUF),
        // storage
        ABSTRACT_STORE("AbstractStore", Sort.STORAGE),
        CONCRETE_STORE("ConcreteStore", Sort.STORAGE),
        SSTORE("SStore", Sort.STORAGE),
        // end
        SUCCESS("Success", Sort.END),
        FAILURE("Failure", Sort.END),
        PARTIAL("Partial", Sort.END),
        ITE("ITE", Sort.END);

        @Getter
        private final String label;
        @Getter
        private final Sort sort;

        Kind(String label, Sort sort) {
            this.label = label;
            this.sort = sort;
        }
    }

    public static final Expr ZERO = lit(BigInteger.ZERO);
    public static final Expr ONE = lit(BigInteger.ONE);
    public static final Expr MAX = lit(Constants.MAX_UINT256);
    public static final Expr ZERO_BYTE = litByte(0);
    public static final Expr EMPTY_BUF = bytes(ImmutableList.of());

    private final Kind kind;
    private final ImmutableList<Expr> args;
    private final BigInteger value;
    private final String name;
    private final ImmutableSortedMap<BigInteger, BigInteger> store;
    private final ImmutableList<Prop> props;

    private Expr(Kind kind, List<Expr> args, BigInteger value, String name,
                 Map<BigInteger, BigInteger> store, List<Prop> props) {
        this.kind = kind;
        this.args = ImmutableList.copyOf(args);
        this.value = value;
        this.name = name;
        this.store = store == null ? null : ImmutableSortedMap.copyOf(store);
        this.props = ImmutableList.copyOf(props);
    }

    private static Expr node(Kind kind, Expr... args) {
        return new Expr(kind, ImmutableList.copyOf(args), null, null, null, ImmutableList.of());
    }

    public Sort getSort() {
        return kind.getSort();
    }

    public Expr arg(int i) {
        return args.get(i);
    }

    public boolean is(Kind k) {
        return kind == k;
    }

    public boolean isLit() {
        return kind == Kind.LIT;
    }

    public boolean isLit(long v) {
        return kind == Kind.LIT && value.equals(BigInteger.valueOf(v));
    }

    // ---- word ----

    public static Expr lit(BigInteger v) {
        return new Expr(Kind.LIT, ImmutableList.of(), Util.toWord(v), null, null, ImmutableList.of());
    }

    public static Expr lit(long v) {
        return lit(BigInteger.valueOf(v));
    }

    public static Expr var(String name) {
        return new Expr(Kind.VAR, ImmutableList.of(), null, name, null, ImmutableList.of());
    }

    public static Expr env(String name) {
        return new Expr(Kind.ENV, ImmutableList.of(), null, name, null, ImmutableList.of());
    }

    private static Expr bool(boolean b) {
        return b ? ONE : ZERO;
    }

    public static Expr add(Expr a, Expr b) {
        if (a.isLit() && b.isLit()) {
            return lit(a.value.add(b.value));
        }
        if (a.isLit(0)) {
            return b;
        }
        if (b.isLit(0)) {
            return a;
        }
        return node(Kind.ADD, a, b);
    }

    public static Expr sub(Expr a, Expr b) {
        if (a.isLit() && b.isLit()) {
            return lit(a.value.subtract(b.value));
        }
        if (b.isLit(0)) {
            return a;
        }
        if (a.equals(b)) {
            return ZERO;
        }
        return node(Kind.SUB, a, b);
    }

    public static Expr mul(Expr a, Expr b) {
        if (a.isLit() && b.isLit()) {
            return lit(a.value.multiply(b.value));
        }
        if (a.isLit(0) || b.isLit(0)) {
            return ZERO;
        }
        if (a.isLit(1)) {
            return b;
        }
        if (b.isLit(1)) {
            return a;
        }
        return node(Kind.MUL, a, b);
    }

    public static Expr div(Expr a, Expr b) {
        if (a.isLit() && b.isLit()) {
            return b.value.signum() == 0 ? ZERO : lit(a.value.divide(b.value));
        }
        if (b.isLit(0)) {
            return ZERO;
        }
        if (b.isLit(1)) {
            return a;
        }
        // 古いsolcはセレクタの取り出しにDIVを使う
        if (b.isLit() && a.is(Kind.JOIN_BYTES) && b.value.bitCount() == 1 && b.value.getLowestSetBit() % 8 == 0) {
            return shr(lit(b.value.getLowestSetBit()), a);
        }
        return node(Kind.DIV, a, b);
    }

    public static Expr sdiv(Expr a, Expr b) {
        if (a.isLit() && b.isLit()) {
            if (b.value.signum() == 0) {
                return ZERO;
            }
            return lit(Util.toSigned(a.value).divide(Util.toSigned(b.value)));
        }
        if (b.isLit(0)) {
            return ZERO;
        }
        return node(Kind.SDIV, a, b);
    }

    public static Expr mod(Expr a, Expr b) {
        if (a.isLit() && b.isLit()) {
            return b.value.signum() == 0 ? ZERO : lit(a.value.mod(b.value));
        }
        if (b.isLit(0) || b.isLit(1)) {
            return ZERO;
        }
        return node(Kind.MOD, a, b);
    }

    public static Expr smod(Expr a, Expr b) {
        if (a.isLit() && b.isLit()) {
            if (b.value.signum() == 0) {
                return ZERO;
            }
            // 符号は被除数に従う
            return lit(Util.toSigned(a.value).remainder(Util.toSigned(b.value)));
        }
        if (b.isLit(0)) {
            return ZERO;
        }
        return node(Kind.SMOD, a, b);
    }

    public static Expr addmod(Expr a, Expr b, Expr n) {
        if (a.isLit() && b.isLit() && n.isLit()) {
            return n.value.signum() == 0 ? ZERO : lit(a.value.add(b.value).mod(n.value));
        }
        if (n.isLit(0)) {
            return ZERO;
        }
        return node(Kind.ADDMOD, a, b, n);
    }

    public static Expr mulmod(Expr a, Expr b, Expr n) {
        if (a.isLit() && b.isLit() && n.isLit()) {
            return n.value.signum() == 0 ? ZERO : lit(a.value.multiply(b.value).mod(n.value));
        }
        if (n.isLit(0)) {
            return ZERO;
        }
        return node(Kind.MULMOD, a, b, n);
    }

    public static Expr exp(Expr a, Expr b) {
        if (a.isLit() && b.isLit()) {
            return lit(a.value.modPow(b.value, Constants.TWO_256));
        }
        if (b.isLit(0)) {
            return ONE;
        }
        if (b.isLit(1)) {
            return a;
        }
        return node(Kind.EXP, a, b);
    }

    public static Expr sex(Expr b, Expr x) {
        if (b.isLit() && b.value.compareTo(BigInteger.valueOf(31)) >= 0) {
            return x;
        }
        if (b.isLit() && x.isLit()) {
            int bit = b.value.intValue() * 8 + 7;
            BigInteger mask = BigInteger.ONE.shiftLeft(bit + 1).subtract(BigInteger.ONE);
            if (x.value.testBit(bit)) {
                return lit(x.value.or(Constants.MAX_UINT256.xor(mask)));
            }
            return lit(x.value.and(mask));
        }
        return node(Kind.SEX, b, x);
    }

    public static Expr lt(Expr a, Expr b) {
        if (a.isLit() && b.isLit()) {
            return bool(a.value.compareTo(b.value) < 0);
        }
        if (a.equals(b) || b.isLit(0)) {
            return ZERO;
        }
        return node(Kind.LT, a, b);
    }

    public static Expr gt(Expr a, Expr b) {
        return lt(b, a);
    }

    public static Expr slt(Expr a, Expr b) {
        if (a.isLit() && b.isLit()) {
            return bool(Util.toSigned(a.value).compareTo(Util.toSigned(b.value)) < 0);
        }
        if (a.equals(b)) {
            return ZERO;
        }
        return node(Kind.SLT, a, b);
    }

    public static Expr sgt(Expr a, Expr b) {
        return slt(b, a);
    }

    public static Expr eq(Expr a, Expr b) {
        if (a.isLit() && b.isLit()) {
            return bool(a.value.equals(b.value));
        }
        if (a.equals(b)) {
            return ONE;
        }
        return node(Kind.EQ, a, b);
    }

    public static Expr iszero(Expr a) {
        if (a.isLit()) {
            return bool(a.value.signum() == 0);
        }
        return node(Kind.ISZERO, a);
    }

    public static Expr and(Expr a, Expr b) {
        if (a.isLit() && b.isLit()) {
            return lit(a.value.and(b.value));
        }
        if (a.isLit(0) || b.isLit(0)) {
            return ZERO;
        }
        if (a.isLit() && a.value.equals(Constants.MAX_UINT256)) {
            return b;
        }
        if (b.isLit() && b.value.equals(Constants.MAX_UINT256)) {
            return a;
        }
        if (a.isLit() && b.is(Kind.JOIN_BYTES)) {
            Expr masked = maskBytes(a.value, b);
            if (masked != null) {
                return masked;
            }
        }
        if (b.isLit() && a.is(Kind.JOIN_BYTES)) {
            Expr masked = maskBytes(b.value, a);
            if (masked != null) {
                return masked;
            }
        }
        return node(Kind.AND, a, b);
    }

    // バイト単位のマスク(0xffか0x00のみ)ならバイト列として畳み込む
    private static Expr maskBytes(BigInteger mask, Expr joined) {
        byte[] maskBytes = Util.wordToBytes(mask);
        List<Expr> result = Lists.newArrayList();
        for (int i = 0; i < Constants.WORD_BYTES; i++) {
            int m = maskBytes[i] & 0xff;
            if (m == 0xff) {
                result.add(joined.arg(i));
            } else if (m == 0) {
                result.add(ZERO_BYTE);
            } else {
                return null;
            }
        }
        return joinBytes(result);
    }

    public static Expr or(Expr a, Expr b) {
        if (a.isLit() && b.isLit()) {
            return lit(a.value.or(b.value));
        }
        if (a.isLit(0)) {
            return b;
        }
        if (b.isLit(0)) {
            return a;
        }
        return node(Kind.OR, a, b);
    }

    public static Expr xor(Expr a, Expr b) {
        if (a.isLit() && b.isLit()) {
            return lit(a.value.xor(b.value));
        }
        if (a.isLit(0)) {
            return b;
        }
        if (b.isLit(0)) {
            return a;
        }
        return node(Kind.XOR, a, b);
    }

    public static Expr not(Expr a) {
        if (a.isLit()) {
            return lit(Constants.MAX_UINT256.xor(a.value));
        }
        return node(Kind.NOT, a);
    }

    public static Expr shl(Expr shift, Expr v) {
        if (shift.isLit(0)) {
            return v;
        }
        if (shift.isLit() && shift.value.compareTo(BigInteger.valueOf(Constants.WORD_BITS)) >= 0) {
            return ZERO;
        }
        if (shift.isLit() && v.isLit()) {
            return lit(v.value.shiftLeft(shift.value.intValue()));
        }
        if (shift.isLit() && v.is(Kind.JOIN_BYTES) && shift.value.intValue() % 8 == 0) {
            int k = shift.value.intValue() / 8;
            List<Expr> bytes = Lists.newArrayList();
            for (int i = 0; i < Constants.WORD_BYTES; i++) {
                bytes.add(i + k < Constants.WORD_BYTES ? v.arg(i + k) : ZERO_BYTE);
            }
            return joinBytes(bytes);
        }
        return node(Kind.SHL, shift, v);
    }

    public static Expr shr(Expr shift, Expr v) {
        if (shift.isLit(0)) {
            return v;
        }
        if (shift.isLit() && shift.value.compareTo(BigInteger.valueOf(Constants.WORD_BITS)) >= 0) {
            return ZERO;
        }
        if (shift.isLit() && v.isLit()) {
            return lit(v.value.shiftRight(shift.value.intValue()));
        }
        if (shift.isLit() && v.is(Kind.JOIN_BYTES) && shift.value.intValue() % 8 == 0) {
            int k = shift.value.intValue() / 8;
            List<Expr> bytes = Lists.newArrayList();
            for (int i = 0; i < Constants.WORD_BYTES; i++) {
                bytes.add(i < k ? ZERO_BYTE : v.arg(i - k));
            }
            return joinBytes(bytes);
        }
        return node(Kind.SHR, shift, v);
    }

    public static Expr sar(Expr shift, Expr v) {
        if (shift.isLit(0)) {
            return v;
        }
        if (shift.isLit() && v.isLit()) {
            int s = shift.value.min(BigInteger.valueOf(Constants.WORD_BITS)).intValue();
            return lit(Util.toSigned(v.value).shiftRight(s));
        }
        return node(Kind.SAR, shift, v);
    }

    public static Expr getByte(Expr index, Expr w) {
        if (index.isLit() && index.value.compareTo(BigInteger.valueOf(Constants.WORD_BYTES)) >= 0) {
            return ZERO;
        }
        if (index.isLit() && w.isLit()) {
            int shift = 8 * (Constants.WORD_BYTES - 1 - index.value.intValue());
            return lit(w.value.shiftRight(shift).and(BigInteger.valueOf(0xff)));
        }
        if (index.isLit() && w.is(Kind.JOIN_BYTES) && w.arg(index.value.intValue()).is(Kind.LIT_BYTE)) {
            return lit(w.arg(index.value.intValue()).value);
        }
        return node(Kind.GETBYTE, index, w);
    }

    /**
     * 2^256 を法とする明示的な剰余。256ビットワード上では恒等写像。
     */
    public static Expr wrap(Expr a) {
        if (a.isLit() || a.is(Kind.WRAP)) {
            return a;
        }
        return node(Kind.WRAP, a);
    }

    public static Expr iteWord(Prop cond, Expr a, Expr b) {
        if (cond.is(Prop.Kind.PBOOL)) {
            return cond.isValue() ? a : b;
        }
        if (a.equals(b)) {
            return a;
        }
        return new Expr(Kind.ITE_WORD, ImmutableList.of(a, b), null, null, null, ImmutableList.of(cond));
    }

    // ---- byte ----

    public static Expr litByte(int v) {
        return new Expr(Kind.LIT_BYTE, ImmutableList.of(), BigInteger.valueOf(v & 0xff), null, null,
                ImmutableList.of());
    }

    public static Expr indexWord(int index, Expr w) {
        if (index < 0 || index >= Constants.WORD_BYTES) {
            return ZERO_BYTE;
        }
        if (w.isLit()) {
            return litByte(Util.wordToBytes(w.value)[index]);
        }
        if (w.is(Kind.JOIN_BYTES)) {
            return w.arg(index);
        }
        return new Expr(Kind.INDEX_WORD, ImmutableList.of(w), BigInteger.valueOf(index), null, null,
                ImmutableList.of());
    }

    public static Expr joinBytes(List<Expr> bytes) {
        if (bytes.size() != Constants.WORD_BYTES) {
            throw new IllegalArgumentException("JoinBytesには32バイトが必要: " + bytes.size());
        }
        if (bytes.stream().allMatch(b -> b.is(Kind.LIT_BYTE))) {
            byte[] raw = new byte[Constants.WORD_BYTES];
            for (int i = 0; i < raw.length; i++) {
                raw[i] = bytes.get(i).value.byteValue();
            }
            return lit(new BigInteger(1, raw));
        }
        Expr first = bytes.get(0);
        if (first.is(Kind.INDEX_WORD)) {
            Expr word = first.arg(0);
            boolean whole = true;
            for (int i = 0; i < Constants.WORD_BYTES; i++) {
                Expr b = bytes.get(i);
                if (!b.is(Kind.INDEX_WORD) || b.value.intValue() != i || !b.arg(0).equals(word)) {
                    whole = false;
                    break;
                }
            }
            if (whole) {
                return word;
            }
        }
        return new Expr(Kind.JOIN_BYTES, bytes, null, null, null, ImmutableList.of());
    }

    public static Expr readByte(Expr index, Expr buf) {
        if (index.isLit() && buf.is(Kind.BYTES)) {
            if (index.value.compareTo(BigInteger.valueOf(buf.args.size())) >= 0) {
                return ZERO_BYTE;
            }
            return buf.arg(index.value.intValue());
        }
        return node(Kind.READ_BYTE, index, buf);
    }

    public static Expr readWord(Expr offset, Expr buf) {
        if (offset.isLit() && buf.is(Kind.BYTES)) {
            if (offset.value.compareTo(BigInteger.valueOf(buf.args.size())) >= 0) {
                return ZERO;
            }
            List<Expr> bytes = Lists.newArrayList();
            for (int i = 0; i < Constants.WORD_BYTES; i++) {
                bytes.add(readByte(lit(offset.value.add(BigInteger.valueOf(i))), buf));
            }
            return joinBytes(bytes);
        }
        return node(Kind.READ_WORD, offset, buf);
    }

    // ---- buffer ----

    public static Expr abstractBuf(String name) {
        return new Expr(Kind.ABSTRACT_BUF, ImmutableList.of(), null, name, null, ImmutableList.of());
    }

    public static Expr bytes(List<Expr> bytes) {
        return new Expr(Kind.BYTES, bytes, null, null, null, ImmutableList.of());
    }

    public static Expr bytes(byte[] raw) {
        List<Expr> list = Lists.newArrayListWithCapacity(raw.length);
        for (byte b : raw) {
            list.add(litByte(b));
        }
        return bytes(list);
    }

    public static Expr wordBytes(Expr w) {
        List<Expr> list = Lists.newArrayList();
        for (int i = 0; i < Constants.WORD_BYTES; i++) {
            list.add(indexWord(i, w));
        }
        return bytes(list);
    }

    public static Expr bufLength(Expr buf) {
        if (buf.is(Kind.BYTES)) {
            return lit(buf.args.size());
        }
        return node(Kind.BUF_LENGTH, buf);
    }

    public static Expr keccak(Expr buf) {
        if (buf.is(Kind.BYTES) && buf.args.stream().allMatch(b -> b.is(Kind.LIT_BYTE))) {
            byte[] raw = new byte[buf.args.size()];
            for (int i = 0; i < raw.length; i++) {
                raw[i] = buf.arg(i).value.byteValue();
            }
            return lit(new BigInteger(1, Util.keccak256(raw)));
        }
        return node(Kind.KECCAK, buf);
    }

    // ---- storage ----

    public static Expr abstractStore(String name) {
        return new Expr(Kind.ABSTRACT_STORE, ImmutableList.of(), null, name, null, ImmutableList.of());
    }

    public static Expr concreteStore(Map<BigInteger, BigInteger> store) {
        return new Expr(Kind.CONCRETE_STORE, ImmutableList.of(), null, null, store, ImmutableList.of());
    }

    public static Expr sstore(Expr key, Expr value, Expr base) {
        return node(Kind.SSTORE, key, value, base);
    }

    public static Expr sload(Expr key, Expr storage) {
        Expr s = storage;
        while (true) {
            if (s.is(Kind.SSTORE)) {
                Expr k = s.arg(0);
                if (k.equals(key)) {
                    return s.arg(1);
                }
                if (k.isLit() && key.isLit()) {
                    s = s.arg(2);
                    continue;
                }
                return node(Kind.SLOAD, key, s);
            }
            if (s.is(Kind.CONCRETE_STORE) && key.isLit()) {
                return lit(s.store.getOrDefault(key.value, BigInteger.ZERO));
            }
            return node(Kind.SLOAD, key, s);
        }
    }

    // ---- end ----

    public static Expr success(List<Prop> props, Expr returnData, Expr storage) {
        return new Expr(Kind.SUCCESS, ImmutableList.of(returnData, storage), null, null, null, props);
    }

    public static Expr failure(List<Prop> props) {
        return new Expr(Kind.FAILURE, ImmutableList.of(), null, null, null, props);
    }

    public static Expr partial(String reason, List<Prop> props) {
        return new Expr(Kind.PARTIAL, ImmutableList.of(), null, reason, null, props);
    }

    public static Expr ite(Expr cond, Expr t, Expr f) {
        return node(Kind.ITE, cond, t, f);
    }

    public Expr getReturnData() {
        checkKind(Kind.SUCCESS);
        return args.get(0);
    }

    public Expr getStorage() {
        checkKind(Kind.SUCCESS);
        return args.get(1);
    }

    private void checkKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException(expected.getLabel() + "ではない: " + kind.getLabel());
        }
    }

    // END 木の葉を左から順に集める
    public static List<Expr> flatten(Expr end) {
        List<Expr> leaves = Lists.newArrayList();
        flatten(end, leaves);
        return leaves;
    }

    private static void flatten(Expr e, List<Expr> leaves) {
        if (e.getSort() != Sort.END) {
            throw new IllegalArgumentException("END木ではない: " + e);
        }
        if (e.is(Kind.ITE)) {
            flatten(e.arg(1), leaves);
            flatten(e.arg(2), leaves);
        } else {
            leaves.add(e);
        }
    }

    // ---- traversal ----

    // ボトムアップに書き換える。同じ部分項は一度だけ処理される
    public Expr map(Function<Expr, Expr> f) {
        return map(f, Maps.newHashMap());
    }

    Expr map(Function<Expr, Expr> f, Map<Expr, Expr> cache) {
        Expr cached = cache.get(this);
        if (cached != null) {
            return cached;
        }
        List<Expr> newArgs = Lists.newArrayListWithCapacity(args.size());
        for (Expr a : args) {
            newArgs.add(a.map(f, cache));
        }
        List<Prop> newProps = props.stream()
                .map(p -> p.mapExprs(e -> e.map(f, cache)))
                .collect(Collectors.toList());
        Expr result = f.apply(rebuild(newArgs, newProps));
        cache.put(this, result);
        return result;
    }

    public Expr simplify() {
        return map(Function.identity());
    }

    private Expr rebuild(List<Expr> a, List<Prop> p) {
        switch (kind) {
            case LIT:
            case VAR:
            case ENV:
            case LIT_BYTE:
            case ABSTRACT_BUF:
            case ABSTRACT_STORE:
            case CONCRETE_STORE:
                return this;
            case ADD:
                return add(a.get(0), a.get(1));
            case SUB:
                return sub(a.get(0), a.get(1));
            case MUL:
                return mul(a.get(0), a.get(1));
            case DIV:
                return div(a.get(0), a.get(1));
            case SDIV:
                return sdiv(a.get(0), a.get(1));
            case MOD:
                return mod(a.get(0), a.get(1));
            case SMOD:
                return smod(a.get(0), a.get(1));
            case ADDMOD:
                return addmod(a.get(0), a.get(1), a.get(2));
            case MULMOD:
                return mulmod(a.get(0), a.get(1), a.get(2));
            case EXP:
                return exp(a.get(0), a.get(1));
            case SEX:
                return sex(a.get(0), a.get(1));
            case LT:
                return lt(a.get(0), a.get(1));
            case SLT:
                return slt(a.get(0), a.get(1));
            case EQ:
                return eq(a.get(0), a.get(1));
            case ISZERO:
                return iszero(a.get(0));
            case AND:
                return and(a.get(0), a.get(1));
            case OR:
                return or(a.get(0), a.get(1));
            case XOR:
                return xor(a.get(0), a.get(1));
            case NOT:
                return not(a.get(0));
            case SHL:
                return shl(a.get(0), a.get(1));
            case SHR:
                return shr(a.get(0), a.get(1));
            case SAR:
                return sar(a.get(0), a.get(1));
            case GETBYTE:
                return getByte(a.get(0), a.get(1));
            case WRAP:
                return wrap(a.get(0));
            case ITE_WORD:
                return iteWord(p.get(0), a.get(0), a.get(1));
            case SLOAD:
                return sload(a.get(0), a.get(1));
            case READ_WORD:
                return readWord(a.get(0), a.get(1));
            case JOIN_BYTES:
                return joinBytes(a);
            case KECCAK:
                return keccak(a.get(0));
            case BUF_LENGTH:
                return bufLength(a.get(0));
            case INDEX_WORD:
                return indexWord(value.intValue(), a.get(0));
            case READ_BYTE:
                return readByte(a.get(0), a.get(1));
            case BYTES:
                return bytes(a);
            case SSTORE:
                return sstore(a.get(0), a.get(1), a.get(2));
            case SUCCESS:
                return success(p, a.get(0), a.get(1));
            case FAILURE:
                return failure(p);
            case PARTIAL:
                return partial(name, p);
            case ITE:
                return ite(a.get(0), a.get(1), a.get(2));
            default:
                throw new IllegalStateException("未対応のKind: " + kind);
        }
    }

    @Override
    public String toString() {
        switch (kind) {
            case LIT:
                return Util.wordToHex(value);
            case VAR:
            case ABSTRACT_BUF:
            case ABSTRACT_STORE:
                return name;
            case ENV:
                return name + "()";
            case LIT_BYTE:
                return String.format("0x%02x", value.intValue());
            case INDEX_WORD:
                return "(IndexWord " + value + " " + args.get(0) + ")";
            case CONCRETE_STORE:
                return store.entrySet().stream()
                        .map(e -> Util.wordToHex(e.getKey()) + ": " + Util.wordToHex(e.getValue()))
                        .collect(Collectors.joining(", ", "{", "}"));
            case ITE_WORD:
                return "(ITEWord " + props.get(0) + " " + args.get(0) + " " + args.get(1) + ")";
            case SUCCESS:
                return "Success(props=" + props + ", returndata=" + args.get(0) + ", storage=" + args.get(1) + ")";
            case FAILURE:
                return "Failure(props=" + props + ")";
            case PARTIAL:
                return "Partial(" + name + ", props=" + props + ")";
            default:
                return args.stream().map(Expr::toString)
                        .collect(Collectors.joining(" ", "(" + kind.getLabel() + " ", ")"));
        }
    }
}
