package net.katagaitai.kaidoku.decompile;

import com.google.common.collect.ImmutableList;
import net.katagaitai.kaidoku.act.Exp;
import net.katagaitai.kaidoku.solidity.AbiType;

import java.util.function.Function;

// EVM の真偽値(1/0)から来る冗長な形を取り除く。規則を順に試し、変化がなくなるまで繰り返す
public class Simplifier {
    // 一致しなければ null を返す書き換え規則
    interface Rule extends Function<Exp, Exp> {
    }

    static final ImmutableList<Rule> RULES = ImmutableList.of(
            Simplifier::doubleNegation,
            Simplifier::boolEqOne,
            Simplifier::boolEqZero,
            Simplifier::safeMul
    );

    public static Exp simplify(Exp e) {
        Exp current = e;
        while (true) {
            Exp next = current.map(Simplifier::rewrite);
            if (next.equals(current)) {
                return current;
            }
            current = next;
        }
    }

    private static Exp rewrite(Exp e) {
        for (Rule rule : RULES) {
            Exp result = rule.apply(e);
            if (result != null) {
                return result;
            }
        }
        return e;
    }

    // not(not(p)) -> p
    static Exp doubleNegation(Exp e) {
        if (e.is(Exp.Kind.NEG) && e.arg(0).is(Exp.Kind.NEG)) {
            return e.arg(0).arg(0);
        }
        return null;
    }

    // (if p then 1 else 0) == 1 -> p
    static Exp boolEqOne(Exp e) {
        return evmBoolCompared(e, 1);
    }

    // (if p then 1 else 0) == 0 -> not(p)
    static Exp boolEqZero(Exp e) {
        Exp p = evmBoolCompared(e, 0);
        return p == null ? null : Exp.neg(p);
    }

    private static Exp evmBoolCompared(Exp e, long literal) {
        if (!e.is(Exp.Kind.EQ)) {
            return null;
        }
        if (isEvmBool(e.arg(0)) && e.arg(1).isLitInt(literal)) {
            return e.arg(0).arg(0);
        }
        if (isEvmBool(e.arg(1)) && e.arg(0).isLitInt(literal)) {
            return e.arg(1).arg(0);
        }
        return null;
    }

    static boolean isEvmBool(Exp e) {
        return e.is(Exp.Kind.ITE) && e.arg(1).isLitInt(1) && e.arg(2).isLitInt(0);
    }

    // not(not(a == 0) and not(inRange(uintN, a * c))) -> inRange(uintN, a * c)
    static Exp safeMul(Exp e) {
        if (!e.is(Exp.Kind.NEG) || !e.arg(0).is(Exp.Kind.AND)) {
            return null;
        }
        Exp left = e.arg(0).arg(0);
        Exp right = e.arg(0).arg(1);
        if (!left.is(Exp.Kind.NEG) || !right.is(Exp.Kind.NEG)) {
            return null;
        }
        Exp isZero = left.arg(0);
        Exp inRange = right.arg(0);
        if (!isZero.is(Exp.Kind.EQ) || !isZero.arg(1).isLitInt(0)
                || !inRange.is(Exp.Kind.IN_RANGE) || inRange.getAbiType().getKind() != AbiType.Kind.UINT
                || !inRange.arg(0).is(Exp.Kind.MUL)) {
            return null;
        }
        Exp a = isZero.arg(0);
        Exp mul = inRange.arg(0);
        if (mul.arg(0).equals(a)) {
            return Exp.inRange(inRange.getAbiType(), Exp.mul(a, mul.arg(1)));
        }
        if (mul.arg(1).equals(a)) {
            return Exp.inRange(inRange.getAbiType(), Exp.mul(mul.arg(0), a));
        }
        return null;
    }
}
