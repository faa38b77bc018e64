package net.katagaitai.kaidoku.evm.expr;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;
import java.util.function.Function;

@Getter
@EqualsAndHashCode(cacheStrategy = EqualsAndHashCode.CacheStrategy.LAZY)
public final class Prop {
    public enum Kind {
        PEQ("PEq"),
        PLT("PLT"),
        PGT("PGT"),
        PLEQ("PLEq"),
        PGEQ("PGEq"),
        PNEG("PNeg"),
        PAND("PAnd"),
        POR("POr"),
        PIMPL("PImpl"),
        PBOOL("PBool");

        @Getter
        private final String label;

        Kind(String label) {
            this.label = label;
        }
    }

    public static final Prop TRUE = new Prop(Kind.PBOOL, ImmutableList.of(), ImmutableList.of(), true);
    public static final Prop FALSE = new Prop(Kind.PBOOL, ImmutableList.of(), ImmutableList.of(), false);

    private final Kind kind;
    private final ImmutableList<Expr> exprs;
    private final ImmutableList<Prop> props;
    private final boolean value;

    private Prop(Kind kind, List<Expr> exprs, List<Prop> props, boolean value) {
        this.kind = kind;
        this.exprs = ImmutableList.copyOf(exprs);
        this.props = ImmutableList.copyOf(props);
        this.value = value;
    }

    private static Prop ofExprs(Kind kind, Expr a, Expr b) {
        return new Prop(kind, ImmutableList.of(a, b), ImmutableList.of(), false);
    }

    private static Prop ofProps(Kind kind, Prop... ps) {
        return new Prop(kind, ImmutableList.of(), ImmutableList.copyOf(ps), false);
    }

    public boolean is(Kind k) {
        return kind == k;
    }

    public Expr expr(int i) {
        return exprs.get(i);
    }

    public Prop prop(int i) {
        return props.get(i);
    }

    public static Prop pbool(boolean b) {
        return b ? TRUE : FALSE;
    }

    public static Prop peq(Expr a, Expr b) {
        if (a.getSort() != b.getSort()) {
            throw new IllegalArgumentException("Sortが異なる: " + a.getSort() + " " + b.getSort());
        }
        if (a.isLit() && b.isLit()) {
            return pbool(a.getValue().equals(b.getValue()));
        }
        if (a.equals(b)) {
            return TRUE;
        }
        return ofExprs(Kind.PEQ, a, b);
    }

    public static Prop plt(Expr a, Expr b) {
        if (a.isLit() && b.isLit()) {
            return pbool(a.getValue().compareTo(b.getValue()) < 0);
        }
        return ofExprs(Kind.PLT, a, b);
    }

    public static Prop pgt(Expr a, Expr b) {
        if (a.isLit() && b.isLit()) {
            return pbool(a.getValue().compareTo(b.getValue()) > 0);
        }
        return ofExprs(Kind.PGT, a, b);
    }

    public static Prop pleq(Expr a, Expr b) {
        if (a.isLit() && b.isLit()) {
            return pbool(a.getValue().compareTo(b.getValue()) <= 0);
        }
        if (a.equals(b)) {
            return TRUE;
        }
        return ofExprs(Kind.PLEQ, a, b);
    }

    public static Prop pgeq(Expr a, Expr b) {
        if (a.isLit() && b.isLit()) {
            return pbool(a.getValue().compareTo(b.getValue()) >= 0);
        }
        if (a.equals(b)) {
            return TRUE;
        }
        return ofExprs(Kind.PGEQ, a, b);
    }

    public static Prop pneg(Prop p) {
        if (p.is(Kind.PBOOL)) {
            return pbool(!p.value);
        }
        if (p.is(Kind.PNEG)) {
            return p.prop(0);
        }
        return ofProps(Kind.PNEG, p);
    }

    public static Prop pand(Prop a, Prop b) {
        if (a.is(Kind.PBOOL)) {
            return a.value ? b : FALSE;
        }
        if (b.is(Kind.PBOOL)) {
            return b.value ? a : FALSE;
        }
        return ofProps(Kind.PAND, a, b);
    }

    public static Prop por(Prop a, Prop b) {
        if (a.is(Kind.PBOOL)) {
            return a.value ? TRUE : b;
        }
        if (b.is(Kind.PBOOL)) {
            return b.value ? TRUE : a;
        }
        return ofProps(Kind.POR, a, b);
    }

    public static Prop pimpl(Prop a, Prop b) {
        if (a.is(Kind.PBOOL)) {
            return a.value ? b : TRUE;
        }
        if (b.is(Kind.PBOOL) && b.value) {
            return TRUE;
        }
        return ofProps(Kind.PIMPL, a, b);
    }

    public static Prop pands(List<Prop> ps) {
        Prop result = TRUE;
        for (Prop p : ps) {
            result = pand(result, p);
        }
        return result;
    }

    public static Prop pors(List<Prop> ps) {
        Prop result = FALSE;
        for (Prop p : ps) {
            result = por(result, p);
        }
        return result;
    }

    // 含まれる項に f を適用し、スマートコンストラクタで組み直す
    public Prop mapExprs(Function<Expr, Expr> f) {
        switch (kind) {
            case PEQ:
                return peq(f.apply(expr(0)), f.apply(expr(1)));
            case PLT:
                return plt(f.apply(expr(0)), f.apply(expr(1)));
            case PGT:
                return pgt(f.apply(expr(0)), f.apply(expr(1)));
            case PLEQ:
                return pleq(f.apply(expr(0)), f.apply(expr(1)));
            case PGEQ:
                return pgeq(f.apply(expr(0)), f.apply(expr(1)));
            case PNEG:
                return pneg(prop(0).mapExprs(f));
            case PAND:
                return pand(prop(0).mapExprs(f), prop(1).mapExprs(f));
            case POR:
                return por(prop(0).mapExprs(f), prop(1).mapExprs(f));
            case PIMPL:
                return pimpl(prop(0).mapExprs(f), prop(1).mapExprs(f));
            case PBOOL:
                return this;
            default:
                throw new IllegalStateException("未対応のKind: " + kind);
        }
    }

    @Override
    public String toString() {
        if (kind == Kind.PBOOL) {
            return "(PBool " + value + ")";
        }
        StringBuilder sb = new StringBuilder("(").append(kind.getLabel());
        for (Expr e : exprs) {
            sb.append(" ").append(e);
        }
        for (Prop p : props) {
            sb.append(" ").append(p);
        }
        return sb.append(")").toString();
    }
}
