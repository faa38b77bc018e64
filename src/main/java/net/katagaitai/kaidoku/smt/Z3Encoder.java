package net.katagaitai.kaidoku.smt;

import com.google.common.collect.Maps;
import com.microsoft.z3.ArrayExpr;
import com.microsoft.z3.BitVecExpr;
import com.microsoft.z3.BitVecSort;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.FuncDecl;
import net.katagaitai.kaidoku.evm.expr.Expr;
import net.katagaitai.kaidoku.evm.expr.Prop;
import net.katagaitai.kaidoku.evm.expr.Sort;
import net.katagaitai.kaidoku.util.Z3Util;

import java.util.List;
import java.util.Map;

/**
 * Expr/Prop を Z3 の項に変換する。ワードは256ビット、バイトは8ビットのビットベクタ、
 * バッファとストレージは配列、keccak と記号的な EXP は未解釈関数として扱う。
 * <p>
 * 1回の問い合わせごとに作り直す。Context は呼び出し側が所有する。
 */
class Z3Encoder {
    private static final int WORD = 256;
    private static final int BYTE = 8;

    private final Context ctx;
    private final BitVecSort wordSort;
    private final BitVecSort byteSort;
    private final Map<Expr, BitVecExpr> words = Maps.newHashMap();
    // バッファとストレージ。どちらもワードを添字とする配列
    private final Map<Expr, ArrayExpr<BitVecSort, BitVecSort>> arrays = Maps.newHashMap();
    private final Map<String, FuncDecl<BitVecSort>> functions = Maps.newHashMap();

    Z3Encoder(Context ctx) {
        this.ctx = ctx;
        this.wordSort = ctx.mkBitVecSort(WORD);
        this.byteSort = ctx.mkBitVecSort(BYTE);
    }

    BoolExpr encode(Prop p) {
        switch (p.getKind()) {
            case PEQ:
                return encodeEq(p.expr(0), p.expr(1));
            case PLT:
                return ctx.mkBVULT(word(p.expr(0)), word(p.expr(1)));
            case PGT:
                return ctx.mkBVUGT(word(p.expr(0)), word(p.expr(1)));
            case PLEQ:
                return ctx.mkBVULE(word(p.expr(0)), word(p.expr(1)));
            case PGEQ:
                return ctx.mkBVUGE(word(p.expr(0)), word(p.expr(1)));
            case PNEG:
                return ctx.mkNot(encode(p.prop(0)));
            case PAND:
                return ctx.mkAnd(encode(p.prop(0)), encode(p.prop(1)));
            case POR:
                return ctx.mkOr(encode(p.prop(0)), encode(p.prop(1)));
            case PIMPL:
                return ctx.mkImplies(encode(p.prop(0)), encode(p.prop(1)));
            case PBOOL:
                return ctx.mkBool(p.isValue());
            default:
                throw new IllegalArgumentException("未対応の命題: " + p);
        }
    }

    private BoolExpr encodeEq(Expr a, Expr b) {
        Sort sort = a.getSort();
        if (sort == Sort.WORD) {
            return ctx.mkEq(word(a), word(b));
        } else if (sort == Sort.BYTE) {
            return ctx.mkEq(byteOf(a), byteOf(b));
        } else if (sort == Sort.STORAGE) {
            return ctx.mkEq(storage(a), storage(b));
        } else if (sort == Sort.BUF) {
            return ctx.mkAnd(ctx.mkEq(buf(a), buf(b)), ctx.mkEq(bufLength(a), bufLength(b)));
        }
        throw new IllegalArgumentException("比較できないSort: " + sort);
    }

    BitVecExpr word(Expr e) {
        BitVecExpr cached = words.get(e);
        if (cached != null) {
            return cached;
        }
        BitVecExpr result = encodeWord(e);
        words.put(e, result);
        return result;
    }

    private BitVecExpr encodeWord(Expr e) {
        switch (e.getKind()) {
            case LIT:
                return Z3Util.mkBV(ctx, e.getValue(), WORD);
            case VAR:
                return Z3Util.mkBVConst(ctx, e.getName(), WORD);
            case ENV:
                return Z3Util.mkBVConst(ctx, e.getName() + "()", WORD);
            case ADD:
                return ctx.mkBVAdd(word(e.arg(0)), word(e.arg(1)));
            case SUB:
                return ctx.mkBVSub(word(e.arg(0)), word(e.arg(1)));
            case MUL:
                return ctx.mkBVMul(word(e.arg(0)), word(e.arg(1)));
            case DIV:
                return Z3Util.guardZero(ctx, word(e.arg(1)), ctx.mkBVUDiv(word(e.arg(0)), word(e.arg(1))));
            case SDIV:
                return Z3Util.guardZero(ctx, word(e.arg(1)), ctx.mkBVSDiv(word(e.arg(0)), word(e.arg(1))));
            case MOD:
                return Z3Util.guardZero(ctx, word(e.arg(1)), ctx.mkBVURem(word(e.arg(0)), word(e.arg(1))));
            case SMOD:
                // 符号は被除数に従う
                return Z3Util.guardZero(ctx, word(e.arg(1)), ctx.mkBVSRem(word(e.arg(0)), word(e.arg(1))));
            case ADDMOD: {
                BitVecExpr n = word(e.arg(2));
                BitVecExpr sum = ctx.mkBVAdd(widen(e.arg(0)), widen(e.arg(1)));
                return Z3Util.guardZero(ctx, n,
                        ctx.mkExtract(WORD - 1, 0, ctx.mkBVURem(sum, ctx.mkZeroExt(WORD, n))));
            }
            case MULMOD: {
                BitVecExpr n = word(e.arg(2));
                BitVecExpr product = ctx.mkBVMul(widen(e.arg(0)), widen(e.arg(1)));
                return Z3Util.guardZero(ctx, n,
                        ctx.mkExtract(WORD - 1, 0, ctx.mkBVURem(product, ctx.mkZeroExt(WORD, n))));
            }
            case EXP:
                return apply("exp", word(e.arg(0)), word(e.arg(1)));
            case SEX:
                return Z3Util.mkSignExtend(ctx, word(e.arg(0)), word(e.arg(1)));
            case LT:
                return Z3Util.mkBool(ctx, ctx.mkBVULT(word(e.arg(0)), word(e.arg(1))));
            case SLT:
                return Z3Util.mkBool(ctx, ctx.mkBVSLT(word(e.arg(0)), word(e.arg(1))));
            case EQ:
                return Z3Util.mkBool(ctx, ctx.mkEq(word(e.arg(0)), word(e.arg(1))));
            case ISZERO:
                return Z3Util.mkBool(ctx, Z3Util.isZero(ctx, word(e.arg(0))));
            case AND:
                return ctx.mkBVAND(word(e.arg(0)), word(e.arg(1)));
            case OR:
                return ctx.mkBVOR(word(e.arg(0)), word(e.arg(1)));
            case XOR:
                return ctx.mkBVXOR(word(e.arg(0)), word(e.arg(1)));
            case NOT:
                return ctx.mkBVNot(word(e.arg(0)));
            case SHL:
                return ctx.mkBVSHL(word(e.arg(1)), word(e.arg(0)));
            case SHR:
                return ctx.mkBVLSHR(word(e.arg(1)), word(e.arg(0)));
            case SAR:
                return ctx.mkBVASHR(word(e.arg(1)), word(e.arg(0)));
            case GETBYTE: {
                // indexは左から数えたバイト位置
                BitVecExpr index = word(e.arg(0));
                BitVecExpr count = ctx.mkBVMul(ctx.mkBVSub(Z3Util.mkBV(ctx, 31, WORD), index),
                        Z3Util.mkBV(ctx, 8, WORD));
                BitVecExpr b = ctx.mkBVAND(ctx.mkBVLSHR(word(e.arg(1)), count), Z3Util.mkBV(ctx, 255, WORD));
                return Z3Util.mkITE(ctx, ctx.mkBVUGE(index, Z3Util.mkBV(ctx, 32, WORD)),
                        Z3Util.mkBV(ctx, 0, WORD), b);
            }
            case WRAP:
                // ワード上では恒等写像
                return word(e.arg(0));
            case ITE_WORD:
                return Z3Util.mkITE(ctx, encode(e.getProps().get(0)), word(e.arg(0)), word(e.arg(1)));
            case SLOAD:
                return (BitVecExpr) ctx.mkSelect(storage(e.arg(1)), word(e.arg(0)));
            case READ_WORD: {
                ArrayExpr<BitVecSort, BitVecSort> buf = buf(e.arg(1));
                BitVecExpr offset = word(e.arg(0));
                BitVecExpr result = null;
                for (int i = 0; i < 32; i++) {
                    BitVecExpr index = ctx.mkBVAdd(offset, Z3Util.mkBV(ctx, i, WORD));
                    BitVecExpr b = (BitVecExpr) ctx.mkSelect(buf, index);
                    result = result == null ? b : ctx.mkConcat(result, b);
                }
                return result;
            }
            case JOIN_BYTES: {
                BitVecExpr result = null;
                for (Expr b : e.getArgs()) {
                    BitVecExpr encoded = byteOf(b);
                    result = result == null ? encoded : ctx.mkConcat(result, encoded);
                }
                return result;
            }
            case KECCAK:
                return keccak(e.arg(0));
            case BUF_LENGTH:
                return bufLength(e.arg(0));
            default:
                throw new IllegalArgumentException("ワードではない: " + e);
        }
    }

    private BitVecExpr widen(Expr e) {
        return ctx.mkZeroExt(WORD, word(e));
    }

    private BitVecExpr keccak(Expr buf) {
        if (buf.is(Expr.Kind.BYTES)) {
            List<Expr> bytes = buf.getArgs();
            BitVecExpr input = null;
            for (Expr b : bytes) {
                BitVecExpr encoded = byteOf(b);
                input = input == null ? encoded : ctx.mkConcat(input, encoded);
            }
            // 長さごとに別の関数にする
            String name = "keccak256_" + bytes.size();
            FuncDecl<BitVecSort> f = functions.computeIfAbsent(name,
                    n -> ctx.mkFuncDecl(n, new com.microsoft.z3.Sort[]{ctx.mkBitVecSort(BYTE * bytes.size())},
                            wordSort));
            return (BitVecExpr) ctx.mkApp(f, input);
        }
        FuncDecl<BitVecSort> f = functions.computeIfAbsent("keccak256_buf",
                n -> ctx.mkFuncDecl(n, new com.microsoft.z3.Sort[]{ctx.mkArraySort(wordSort, byteSort), wordSort},
                        wordSort));
        return (BitVecExpr) ctx.mkApp(f, buf(buf), bufLength(buf));
    }

    private BitVecExpr apply(String name, BitVecExpr a, BitVecExpr b) {
        FuncDecl<BitVecSort> f = functions.computeIfAbsent(name,
                n -> ctx.mkFuncDecl(n, new com.microsoft.z3.Sort[]{wordSort, wordSort}, wordSort));
        return (BitVecExpr) ctx.mkApp(f, a, b);
    }

    BitVecExpr byteOf(Expr e) {
        switch (e.getKind()) {
            case LIT_BYTE:
                return Z3Util.mkBV(ctx, e.getValue(), BYTE);
            case INDEX_WORD: {
                int i = e.getValue().intValue();
                return ctx.mkExtract(WORD - 1 - 8 * i, WORD - 8 - 8 * i, word(e.arg(0)));
            }
            case READ_BYTE:
                return (BitVecExpr) ctx.mkSelect(buf(e.arg(1)), word(e.arg(0)));
            default:
                throw new IllegalArgumentException("バイトではない: " + e);
        }
    }

    ArrayExpr<BitVecSort, BitVecSort> buf(Expr e) {
        ArrayExpr<BitVecSort, BitVecSort> cached = arrays.get(e);
        if (cached != null) {
            return cached;
        }
        ArrayExpr<BitVecSort, BitVecSort> result;
        if (e.is(Expr.Kind.ABSTRACT_BUF)) {
            result = ctx.mkArrayConst(e.getName(), wordSort, byteSort);
        } else if (e.is(Expr.Kind.BYTES)) {
            result = ctx.mkConstArray(wordSort, Z3Util.mkBV(ctx, 0, BYTE));
            List<Expr> bytes = e.getArgs();
            for (int i = 0; i < bytes.size(); i++) {
                result = ctx.mkStore(result, Z3Util.mkBV(ctx, i, WORD), byteOf(bytes.get(i)));
            }
        } else {
            throw new IllegalArgumentException("バッファではない: " + e);
        }
        arrays.put(e, result);
        return result;
    }

    BitVecExpr bufLength(Expr e) {
        if (e.is(Expr.Kind.ABSTRACT_BUF)) {
            return Z3Util.mkBVConst(ctx, e.getName() + "_length", WORD);
        } else if (e.is(Expr.Kind.BYTES)) {
            return Z3Util.mkBV(ctx, e.getArgs().size(), WORD);
        }
        throw new IllegalArgumentException("バッファではない: " + e);
    }

    ArrayExpr<BitVecSort, BitVecSort> storage(Expr e) {
        ArrayExpr<BitVecSort, BitVecSort> cached = arrays.get(e);
        if (cached != null) {
            return cached;
        }
        ArrayExpr<BitVecSort, BitVecSort> result;
        if (e.is(Expr.Kind.ABSTRACT_STORE)) {
            result = ctx.mkArrayConst(e.getName(), wordSort, wordSort);
        } else if (e.is(Expr.Kind.CONCRETE_STORE)) {
            result = ctx.mkConstArray(wordSort, Z3Util.mkBV(ctx, 0, WORD));
            for (Map.Entry<java.math.BigInteger, java.math.BigInteger> entry : e.getStore().entrySet()) {
                result = ctx.mkStore(result, Z3Util.mkBV(ctx, entry.getKey(), WORD),
                        Z3Util.mkBV(ctx, entry.getValue(), WORD));
            }
        } else if (e.is(Expr.Kind.SSTORE)) {
            result = ctx.mkStore(storage(e.arg(2)), word(e.arg(0)), word(e.arg(1)));
        } else {
            throw new IllegalArgumentException("ストレージではない: " + e);
        }
        arrays.put(e, result);
        return result;
    }
}
