package net.katagaitai.kaidoku.decompile;

import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;
import net.katagaitai.kaidoku.DecompileException;
import net.katagaitai.kaidoku.evm.expr.Expr;

import java.math.BigInteger;
import java.util.Map;
import java.util.TreeMap;

// 書き込みの連鎖を新しい方から辿り、スロットごとに最初に見つけた値を残す
// 元の値を書き戻す更新もそのまま残る
public class StoragePartitioner {
    public static DistinctStore partition(Expr storage) throws DecompileException {
        TreeMap<BigInteger, Expr> writes = Maps.newTreeMap();
        Expr s = storage;
        while (true) {
            switch (s.getKind()) {
                case ABSTRACT_STORE:
                    return new DistinctStore(ImmutableSortedMap.copyOfSorted(writes));
                case CONCRETE_STORE:
                    for (Map.Entry<BigInteger, BigInteger> entry : s.getStore().entrySet()) {
                        writes.putIfAbsent(entry.getKey(), Expr.lit(entry.getValue()));
                    }
                    return new DistinctStore(ImmutableSortedMap.copyOfSorted(writes));
                case SSTORE:
                    Expr key = s.arg(0);
                    if (!key.isLit()) {
                        throw DecompileException.unsupported(
                                "cannot decompile contracts with writes to symbolic storage slots");
                    }
                    writes.putIfAbsent(key.getValue(), s.arg(1));
                    s = s.arg(2);
                    break;
                default:
                    throw new IllegalArgumentException("ストレージではない: " + s);
            }
        }
    }
}
