package net.katagaitai.kaidoku.evm;

import com.google.common.collect.Lists;
import net.katagaitai.kaidoku.evm.expr.Expr;
import net.katagaitai.kaidoku.util.Constants;

import java.util.List;

public class Calldata {
    // セレクタ4バイトの後に、引数ごとの記号ワードを並べる
    public static Expr forMethod(byte[] selector, List<String> argNames) {
        List<Expr> bytes = Lists.newArrayList();
        for (byte b : selector) {
            bytes.add(Expr.litByte(b));
        }
        bytes.addAll(words(argNames));
        return Expr.bytes(bytes);
    }

    public static Expr forConstructor(List<String> argNames) {
        return Expr.bytes(words(argNames));
    }

    public static Expr abstractCalldata() {
        return Expr.abstractBuf(Constants.CALLDATA_NAME);
    }

    private static List<Expr> words(List<String> argNames) {
        List<Expr> bytes = Lists.newArrayList();
        for (String name : argNames) {
            Expr word = Expr.var(name);
            for (int i = 0; i < Constants.WORD_BYTES; i++) {
                bytes.add(Expr.indexWord(i, word));
            }
        }
        return bytes;
    }

    // 作成コードの後ろに引数を連結する
    public static Expr appendToCode(byte[] code, Expr args) {
        List<Expr> bytes = Lists.newArrayList(Expr.bytes(code).getArgs());
        bytes.addAll(args.getArgs());
        return Expr.bytes(bytes);
    }
}
