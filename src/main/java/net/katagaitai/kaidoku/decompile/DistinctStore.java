package net.katagaitai.kaidoku.decompile;

import com.google.common.collect.ImmutableSortedMap;
import lombok.Value;
import net.katagaitai.kaidoku.evm.expr.Expr;

import java.math.BigInteger;

@Value
public class DistinctStore {
    private ImmutableSortedMap<BigInteger, Expr> writes;
}
