package net.katagaitai.kaidoku.act;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.tuple.Pair;

import java.math.BigInteger;
import java.util.List;
import java.util.Map;

public class ActJson {
    private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static String write(Act act) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(act));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException(e);
        }
    }

    public static ArrayNode toJson(Act act) {
        ArrayNode claims = FACTORY.arrayNode();
        claims.add(storages(act.getStore()));
        for (Contract contract : act.getContracts()) {
            claims.add(toJson(contract.getConstructor()));
            for (Behaviour behaviour : contract.getBehaviours()) {
                claims.add(toJson(behaviour));
            }
        }
        return claims;
    }

    private static ObjectNode storages(Map<String, ? extends Map<String, Pair<SlotType, BigInteger>>> store) {
        ObjectNode storages = FACTORY.objectNode();
        store.forEach((contract, vars) -> {
            ObjectNode items = storages.putObject(contract);
            vars.forEach((name, slot) -> {
                ArrayNode pair = items.putArray(name);
                pair.add(toJson(slot.getLeft()));
                pair.add(slot.getRight());
            });
        });
        ObjectNode node = FACTORY.objectNode();
        node.put("kind", "Storages");
        node.set("storages", storages);
        return node;
    }

    static ObjectNode toJson(SlotType slotType) {
        ObjectNode node = FACTORY.objectNode();
        if (slotType.isMapping()) {
            node.put("type", "mapping");
            node.put("ixTypes", "[" + StringUtils.join(slotType.getKeys(), ",") + "]");
            node.put("valType", slotType.getValue().toString());
        } else {
            node.put("type", slotType.getValue().toString());
        }
        return node;
    }

    public static ObjectNode toJson(Constructor ctor) {
        ObjectNode node = FACTORY.objectNode();
        node.put("kind", "Constructor");
        node.put("contract", ctor.getName());
        node.put("mode", "Pass");
        node.put("interface", ctor.getIface().toString());
        node.set("preConditions", exps(ctor.getPreconditions()));
        node.set("postConditions", exps(ctor.getPostconditions()));
        ArrayNode storage = node.putArray("storage");
        for (StorageUpdate update : ctor.getInitialStorage()) {
            storage.add(toJson(update));
        }
        return node;
    }

    public static ObjectNode toJson(Behaviour behaviour) {
        ObjectNode node = FACTORY.objectNode();
        node.put("kind", "Behaviour");
        node.put("name", behaviour.getName());
        node.put("contract", behaviour.getContract());
        node.put("mode", "Pass");
        node.put("interface", behaviour.getIface().toString());
        node.set("preConditions", exps(behaviour.getPreconditions()));
        node.set("postConditions", exps(behaviour.getPostconditions()));
        ArrayNode updates = node.putArray("stateUpdates");
        for (StorageUpdate update : behaviour.getStateUpdates()) {
            ObjectNode rewrite = FACTORY.objectNode();
            rewrite.set("Rewrite", toJson(update));
            updates.add(rewrite);
        }
        Exp ret = behaviour.getReturns();
        if (ret == null) {
            node.putNull("returns");
        } else {
            ObjectNode returns = node.putObject("returns");
            returns.put("sort", ret.getType().getSortName());
            returns.set("expression", toJson(ret));
        }
        return node;
    }

    private static ObjectNode toJson(StorageUpdate update) {
        ObjectNode node = FACTORY.objectNode();
        node.set("location", toJson(update.getItem()));
        node.set("value", toJson(update.getValue()));
        return node;
    }

    private static JsonNode toJson(StorageItem item) {
        if (item.getIndices().isEmpty()) {
            ObjectNode node = FACTORY.objectNode();
            node.put("sort", item.getType().getSortName());
            node.put("name", item.qualifiedName());
            return node;
        }
        return symbol("lookup", FACTORY.textNode(item.getContract()), FACTORY.textNode(item.getName()),
                exps(item.getIndices()));
    }

    private static ArrayNode exps(List<Exp> exps) {
        ArrayNode array = FACTORY.arrayNode();
        for (Exp e : exps) {
            array.add(toJson(e));
        }
        return array;
    }

    public static JsonNode toJson(Exp e) {
        switch (e.getKind()) {
            case LIT_INT:
                return FACTORY.textNode(e.getValue().toString());
            case LIT_BOOL:
                return FACTORY.textNode(e.isBoolValue() ? "True" : "False");
            case INT_ENV:
                return FACTORY.textNode(e.getEnv().getLabel());
            case INT_MIN:
                return FACTORY.textNode(BigInteger.ONE.shiftLeft(e.getValue().intValue() - 1).negate().toString());
            case INT_MAX:
                return FACTORY.textNode(
                        BigInteger.ONE.shiftLeft(e.getValue().intValue() - 1).subtract(BigInteger.ONE).toString());
            case UINT_MIN:
                return FACTORY.textNode("0");
            case UINT_MAX:
                return FACTORY.textNode(
                        BigInteger.ONE.shiftLeft(e.getValue().intValue()).subtract(BigInteger.ONE).toString());
            case VAR:
                return FACTORY.textNode(e.getName());
            case TENTRY: {
                ObjectNode node = FACTORY.objectNode();
                node.set(e.getTiming().label(), toJson(e.getItem()));
                return node;
            }
            case IN_RANGE:
                return symbol("inrange", FACTORY.textNode(e.getAbiType().typeName()), toJson(e.arg(0)));
            default: {
                JsonNode[] args = new JsonNode[e.getArgs().size()];
                for (int i = 0; i < args.length; i++) {
                    args[i] = toJson(e.arg(i));
                }
                return symbol(e.getKind().getSymbol(), args);
            }
        }
    }

    private static ObjectNode symbol(String symbol, JsonNode... args) {
        ObjectNode node = FACTORY.objectNode();
        node.put("symbol", symbol);
        node.put("arity", args.length);
        ArrayNode array = node.putArray("args");
        for (JsonNode arg : args) {
            array.add(arg);
        }
        return node;
    }
}
