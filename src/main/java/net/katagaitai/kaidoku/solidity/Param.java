package net.katagaitai.kaidoku.solidity;

import lombok.Value;

@Value
public class Param {
    private String name;
    private AbiType type;

    @Override
    public String toString() {
        return type + " " + name;
    }
}
