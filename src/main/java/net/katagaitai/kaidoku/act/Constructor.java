package net.katagaitai.kaidoku.act;

import com.google.common.collect.ImmutableList;
import lombok.Value;

@Value
public class Constructor {
    private String name;
    private Interface iface;
    private ImmutableList<Exp> preconditions;
    private ImmutableList<Exp> postconditions;
    private ImmutableList<Exp> invariants;
    private ImmutableList<StorageUpdate> initialStorage;

    public Constructor withPreconditions(ImmutableList<Exp> pres) {
        return new Constructor(name, iface, pres, postconditions, invariants, initialStorage);
    }
}
