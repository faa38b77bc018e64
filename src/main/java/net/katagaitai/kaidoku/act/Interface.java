package net.katagaitai.kaidoku.act;

import com.google.common.collect.ImmutableList;
import lombok.Value;
import net.katagaitai.kaidoku.solidity.Param;

import java.util.List;
import java.util.stream.Collectors;

@Value
public class Interface {
    private String name;
    private ImmutableList<Decl> decls;

    public static Interface of(String name, List<Param> params) {
        return new Interface(name, params.stream()
                .map(p -> new Decl(p.getType(), p.getName()))
                .collect(ImmutableList.toImmutableList()));
    }

    public String signature() {
        return decls.stream().map(d -> d.getType().typeName()).collect(Collectors.joining(",", name + "(", ")"));
    }

    public List<String> argNames() {
        return decls.stream().map(Decl::getName).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return decls.stream().map(Decl::toString).collect(Collectors.joining(", ", name + "(", ")"));
    }
}
