package net.katagaitai.kaidoku.act;

import lombok.Value;
import net.katagaitai.kaidoku.solidity.AbiType;

@Value
public class Decl {
    private AbiType type;
    private String name;

    @Override
    public String toString() {
        return type.typeName() + " " + name;
    }
}
