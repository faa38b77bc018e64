package net.katagaitai.kaidoku.act;

import com.google.common.collect.ImmutableList;
import lombok.Value;
import net.katagaitai.kaidoku.solidity.StorageType;

import java.util.List;
import java.util.stream.Collectors;

@Value
public class SlotType {
    private boolean mapping;
    private ImmutableList<ValueType> keys;
    private ValueType value;

    public static SlotType storageValue(ValueType value) {
        return new SlotType(false, ImmutableList.of(), value);
    }

    public static SlotType storageMapping(List<ValueType> keys, ValueType value) {
        return new SlotType(true, ImmutableList.copyOf(keys), value);
    }

    public static SlotType of(StorageType type) {
        if (type.isMapping()) {
            return storageMapping(type.getKeys().stream().map(ValueType::primitive).collect(Collectors.toList()),
                    ValueType.primitive(type.getValue()));
        }
        if (type.isContract()) {
            return storageValue(ValueType.contract(type.getContractName()));
        }
        return storageValue(ValueType.primitive(type.getValue()));
    }

    @Override
    public String toString() {
        if (mapping) {
            return "mapping(" + keys.stream().map(ValueType::toString).collect(Collectors.joining(" => "))
                    + " => " + value + ")";
        }
        return value.toString();
    }
}
