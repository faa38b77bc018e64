package net.katagaitai.kaidoku.act;

import com.google.common.collect.ImmutableList;
import lombok.Value;

// 1つの関数の1つの成功パス。returns は戻り値がなければ null
@Value
public class Behaviour {
    private String name;
    private String contract;
    private Interface iface;
    private ImmutableList<Exp> preconditions;
    private ImmutableList<Exp> caseConditions;
    private ImmutableList<Exp> postconditions;
    private ImmutableList<StorageUpdate> stateUpdates;
    private Exp returns;

    public Behaviour withPreconditions(ImmutableList<Exp> pres) {
        return new Behaviour(name, contract, iface, pres, caseConditions, postconditions, stateUpdates, returns);
    }
}
