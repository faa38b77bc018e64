package net.katagaitai.kaidoku.decompile;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedMap;
import lombok.Value;
import net.katagaitai.kaidoku.act.Interface;
import net.katagaitai.kaidoku.evm.expr.Expr;
import net.katagaitai.kaidoku.solidity.LayoutItem;
import net.katagaitai.kaidoku.solidity.Method;

@Value
public class ContractSummary {
    private String name;
    private ImmutableMap<String, LayoutItem> storageLayout;
    private ImmutableSortedMap<Method, ImmutableSet<Expr>> runtime;
    private Interface creationInterface;
    private ImmutableSet<Expr> creation;
}
