package net.katagaitai.kaidoku.util;

import com.google.common.collect.Maps;
import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BitVecNum;
import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.FuncDecl;
import com.microsoft.z3.Model;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Sort;
import org.apache.commons.lang3.StringUtils;

import java.math.BigInteger;
import java.util.Map;

public class Z3Util {
    public static BitVecExpr mkBVConst(Context context, String name, int bits) {
        if (StringUtils.isNumeric(name)) {
            throw new IllegalArgumentException("異常なシンボル: " + name);
        }
        return context.mkBVConst(name, bits);
    }

    public static BitVecNum mkBV(Context context, BigInteger value, int bits) {
        return context.mkBV(value.toString(), bits);
    }

    public static BitVecNum mkBV(Context context, int i, int bits) {
        return context.mkBV(i, bits);
    }

    public static BitVecExpr mkITE(Context context, BoolExpr condition, BitVecExpr trueExpr,
                                   BitVecExpr falseExpr) {
        return (BitVecExpr) context.mkITE(condition, trueExpr, falseExpr);
    }

    // EVMの真偽値(1/0)
    public static BitVecExpr mkBool(Context context, BoolExpr condition) {
        return mkITE(context, condition, mkBV(context, 1, 256), mkBV(context, 0, 256));
    }

    public static BoolExpr isZero(Context context, BitVecExpr a) {
        return context.mkEq(a, mkBV(context, 0, a.getSortSize()));
    }

    // 0除算は0
    public static BitVecExpr guardZero(Context context, BitVecExpr divisor, BitVecExpr result) {
        return mkITE(context, isZero(context, divisor), mkBV(context, 0, 256), result);
    }

    public static BitVecExpr mkSignExtend(Context context, BitVecExpr index, BitVecExpr value) {
        BitVecExpr a8_7 = context.mkBVAdd(context.mkBVMul(index, mkBV(context, 8, 256)), mkBV(context, 7, 256));
        BitVecExpr a8_7_mask = context.mkBVSHL(mkBV(context, 1, 256), a8_7);
        BitVecExpr test = context.mkBVAND(value, a8_7_mask);

        // testbitが0の場合
        BitVecExpr mask0 = context.mkBVSub(context.mkBVSHL(a8_7_mask, mkBV(context, 1, 256)),
                mkBV(context, 1, 256));
        BitVecExpr result0 = context.mkBVAND(mask0, value);

        // testbitが1の場合
        BitVecExpr result1 = context.mkBVOR(context.mkBVNot(mask0), value);

        BitVecExpr extended = mkITE(context, isZero(context, test), result0, result1);
        return mkITE(context, context.mkBVUGE(index, mkBV(context, 31, 256)), value, extended);
    }

    public static Solver mkSolver(Context context, int timeoutMills) {
        final Solver solver = context.mkSolver();
        setParameters(context, solver, timeoutMills);
        return solver;
    }

    public static void setParameters(Context context, Solver solver, int timeoutMills) {
        Params params = context.mkParams();
        params.add("timeout", timeoutMills);
        solver.setParameters(params);
    }

    // モデル中のビットベクタ定数を名前順に取り出す
    public static Map<String, BigInteger> getBitVecValues(Model model) {
        Map<String, BigInteger> values = Maps.newTreeMap();
        for (FuncDecl<?> decl : model.getConstDecls()) {
            Sort range = decl.getRange();
            if (!(range instanceof BitVecSort)) {
                continue;
            }
            com.microsoft.z3.Expr<?> value = model.getConstInterp(decl);
            if (value instanceof BitVecNum) {
                values.put(decl.getName().toString(), ((BitVecNum) value).getBigInteger());
            }
        }
        return values;
    }
}
