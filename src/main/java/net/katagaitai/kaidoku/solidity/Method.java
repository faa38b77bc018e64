package net.katagaitai.kaidoku.solidity;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;

import java.util.List;
import java.util.stream.Collectors;

@Getter
@EqualsAndHashCode(of = "signature")
public class Method implements Comparable<Method> {
    private final String name;
    private final String signature;
    private final ImmutableList<Param> inputs;
    private final ImmutableList<Param> outputs;

    public Method(String name, List<Param> inputs, List<Param> outputs) {
        this.name = name;
        this.inputs = ImmutableList.copyOf(inputs);
        this.outputs = ImmutableList.copyOf(outputs);
        this.signature = signature(name, inputs);
    }

    public static String signature(String name, List<Param> inputs) {
        return inputs.stream()
                .map(p -> p.getType().typeName())
                .collect(Collectors.joining(",", name + "(", ")"));
    }

    public byte[] getSelector() {
        return Selectors.selector(signature);
    }

    @Override
    public int compareTo(Method o) {
        return signature.compareTo(o.signature);
    }

    @Override
    public String toString() {
        return signature;
    }
}
