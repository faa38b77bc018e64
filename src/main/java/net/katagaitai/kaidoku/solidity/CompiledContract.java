package net.katagaitai.kaidoku.solidity;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSortedMap;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Map;

// コンパイル済みのコントラクト。storageLayout は solc が出力しなかった場合 null
@Getter
public class CompiledContract {
    private final String name;
    private final byte[] creationCode;
    private final byte[] runtimeCode;
    private final ImmutableList<Param> constructorInputs;
    // 正規シグネチャ順
    private final ImmutableSortedMap<String, Method> abiMap;
    private final ImmutableMap<String, LayoutItem> storageLayout;

    public CompiledContract(String name, byte[] creationCode, byte[] runtimeCode, List<Param> constructorInputs,
                            List<Method> methods, Map<String, LayoutItem> storageLayout) {
        // "path/to/A.sol:A" の形式も受け付ける
        this.name = StringUtils.substringAfterLast(":" + name, ":");
        this.creationCode = creationCode.clone();
        this.runtimeCode = runtimeCode.clone();
        this.constructorInputs = ImmutableList.copyOf(constructorInputs);
        ImmutableSortedMap.Builder<String, Method> builder = ImmutableSortedMap.naturalOrder();
        for (Method method : methods) {
            builder.put(method.getSignature(), method);
        }
        this.abiMap = builder.build();
        this.storageLayout = storageLayout == null ? null : ImmutableMap.copyOf(storageLayout);
    }

    public boolean hasStorageLayout() {
        return storageLayout != null;
    }

    public CompiledContract withoutStorageLayout() {
        return new CompiledContract(name, creationCode, runtimeCode, constructorInputs, abiMap.values().asList(),
                null);
    }

    @Override
    public String toString() {
        return name + abiMap.keySet();
    }
}
