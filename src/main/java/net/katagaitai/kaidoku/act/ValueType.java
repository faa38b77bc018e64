package net.katagaitai.kaidoku.act;

import lombok.Value;
import net.katagaitai.kaidoku.solidity.AbiType;

@Value
public class ValueType {
    private AbiType abiType;
    private String contractName;

    public static ValueType primitive(AbiType type) {
        return new ValueType(type, null);
    }

    public static ValueType contract(String name) {
        return new ValueType(AbiType.address(), name);
    }

    public boolean isContract() {
        return contractName != null;
    }

    @Override
    public String toString() {
        return isContract() ? contractName : abiType.typeName();
    }
}
