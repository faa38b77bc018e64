package net.katagaitai.kaidoku.smt;

import net.katagaitai.kaidoku.evm.expr.Prop;

import java.util.List;

// 命題の連言を判定するソルバ群。スレッドセーフであること
public interface Solvers {
    CheckSatResult checkSat(List<Prop> props);
}
