package net.katagaitai.kaidoku.solidity;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.kaidoku.util.Util;
import org.apache.commons.lang3.StringUtils;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.util.List;
import java.util.Map;

/**
 * コンパイル結果のJSONを読む。
 * <pre>
 * { "contractName", "creationCode", "runtimeCode", "abi": [...],
 *   "storageLayout": { "storage": [...], "types": {...} } }
 * </pre>
 */
@Slf4j(topic = "kaidoku")
public class ArtifactReader {
    private final ObjectMapper mapper = new ObjectMapper();

    public CompiledContract read(File file) throws IOException {
        return read(mapper.readTree(file));
    }

    public CompiledContract read(InputStream in) throws IOException {
        return read(mapper.readTree(in));
    }

    public CompiledContract read(String json) throws IOException {
        return read(mapper.readTree(json));
    }

    private CompiledContract read(JsonNode root) {
        String name = required(root, "contractName").asText();
        byte[] creation = Util.hexToBytes(required(root, "creationCode").asText());
        byte[] runtime = Util.hexToBytes(required(root, "runtimeCode").asText());

        List<Param> constructorInputs = Lists.newArrayList();
        List<Method> methods = Lists.newArrayList();
        for (JsonNode entry : root.path("abi")) {
            String type = entry.path("type").asText("function");
            if (type.equals("function")) {
                methods.add(new Method(entry.path("name").asText(), params(entry.path("inputs")),
                        params(entry.path("outputs"))));
            } else if (type.equals("constructor")) {
                constructorInputs = params(entry.path("inputs"));
            } else {
                log.debug("ABIエントリを無視: {}", type);
            }
        }

        Map<String, LayoutItem> layout = null;
        JsonNode storageLayout = root.path("storageLayout");
        if (!storageLayout.isMissingNode() && !storageLayout.isNull()) {
            layout = layout(storageLayout);
        }
        return new CompiledContract(name, creation, runtime, constructorInputs, methods, layout);
    }

    private static JsonNode required(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException(field + "がない");
        }
        return value;
    }

    private List<Param> params(JsonNode inputs) {
        List<Param> params = Lists.newArrayList();
        int i = 0;
        for (JsonNode input : inputs) {
            String name = input.path("name").asText();
            if (StringUtils.isEmpty(name)) {
                name = "arg" + i;
            }
            params.add(new Param(name, abiType(input)));
            i++;
        }
        return params;
    }

    private AbiType abiType(JsonNode input) {
        List<AbiType> components = Lists.newArrayList();
        for (JsonNode component : input.path("components")) {
            components.add(abiType(component));
        }
        return AbiType.parse(required(input, "type").asText(), components);
    }

    private Map<String, LayoutItem> layout(JsonNode storageLayout) {
        JsonNode types = storageLayout.path("types");
        Map<String, LayoutItem> layout = Maps.newLinkedHashMap();
        for (JsonNode item : storageLayout.path("storage")) {
            StorageType slotType = storageType(types, required(item, "type").asText());
            layout.put(required(item, "label").asText(),
                    new LayoutItem(slotType, item.path("offset").asInt(0),
                            new BigInteger(required(item, "slot").asText())));
        }
        return layout;
    }

    private StorageType storageType(JsonNode types, String id) {
        JsonNode type = required(types, id);
        String encoding = type.path("encoding").asText("inplace");
        String label = required(type, "label").asText();
        if (encoding.equals("mapping")) {
            List<AbiType> keys = Lists.newArrayList(valueType(types, required(type, "key").asText()));
            StorageType value = storageType(types, required(type, "value").asText());
            if (value.isMapping()) {
                keys.addAll(value.getKeys());
            }
            return StorageType.mapping(keys, value.getValue());
        }
        if (label.startsWith("contract ") || label.startsWith("interface ")) {
            return StorageType.contract(StringUtils.substringAfter(label, " "));
        }
        return StorageType.value(valueType(types, id));
    }

    private AbiType valueType(JsonNode types, String id) {
        JsonNode type = required(types, id);
        String label = required(type, "label").asText();
        if (label.startsWith("struct ")) {
            List<AbiType> members = Lists.newArrayList();
            for (JsonNode member : type.path("members")) {
                members.add(valueType(types, required(member, "type").asText()));
            }
            return AbiType.tuple(members);
        }
        if (label.startsWith("enum ")) {
            return AbiType.uint(8);
        }
        if (label.startsWith("contract ") || label.startsWith("interface ")) {
            return AbiType.address();
        }
        if (label.startsWith("function ")) {
            return AbiType.function();
        }
        if (label.startsWith("mapping(")) {
            // mappingの値としてのmappingはstorageTypeで展開する
            return AbiType.tuple(ImmutableList.of());
        }
        return AbiType.parse(label);
    }
}
