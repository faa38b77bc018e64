package net.katagaitai.kaidoku.solidity;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;

@Getter
@EqualsAndHashCode
public final class StorageType {
    private final boolean mapping;
    private final ImmutableList<AbiType> keys;
    private final AbiType value;
    private final String contractName;

    private StorageType(boolean mapping, List<AbiType> keys, AbiType value, String contractName) {
        this.mapping = mapping;
        this.keys = ImmutableList.copyOf(keys);
        this.value = value;
        this.contractName = contractName;
    }

    public static StorageType value(AbiType type) {
        return new StorageType(false, ImmutableList.of(), type, null);
    }

    public static StorageType contract(String name) {
        return new StorageType(false, ImmutableList.of(), AbiType.address(), name);
    }

    public static StorageType mapping(List<AbiType> keys, AbiType value) {
        if (keys.isEmpty()) {
            throw new IllegalArgumentException("mappingのキーがない");
        }
        return new StorageType(true, keys, value, null);
    }

    public boolean isContract() {
        return contractName != null;
    }

    @Override
    public String toString() {
        if (mapping) {
            StringBuilder sb = new StringBuilder();
            for (AbiType key : keys) {
                sb.append("mapping(").append(key).append(" => ");
            }
            sb.append(value);
            for (int i = 0; i < keys.size(); i++) {
                sb.append(")");
            }
            return sb.toString();
        }
        return isContract() ? "contract " + contractName : value.toString();
    }
}
