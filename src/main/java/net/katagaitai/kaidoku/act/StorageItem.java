package net.katagaitai.kaidoku.act;

import com.google.common.collect.ImmutableList;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

@Value
public class StorageItem {
    private ActType type;
    private ValueType valueType;
    private String contract;
    private String name;
    private ImmutableList<Exp> indices;

    public static StorageItem of(ActType type, ValueType valueType, String contract, String name) {
        return new StorageItem(type, valueType, contract, name, ImmutableList.of());
    }

    public StorageItem setTime(Timing time) {
        if (indices.isEmpty()) {
            return this;
        }
        List<Exp> timed = indices.stream().map(i -> i.setTime(time)).collect(Collectors.toList());
        return new StorageItem(type, valueType, contract, name, ImmutableList.copyOf(timed));
    }

    public String qualifiedName() {
        return contract + "." + name;
    }

    @Override
    public String toString() {
        if (indices.isEmpty()) {
            return qualifiedName();
        }
        return qualifiedName() + indices.stream().map(Exp::toString).collect(Collectors.joining("][", "[", "]"));
    }
}
