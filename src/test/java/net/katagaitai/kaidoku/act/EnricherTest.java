package net.katagaitai.kaidoku.act;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.katagaitai.kaidoku.solidity.AbiType;
import net.katagaitai.kaidoku.solidity.Param;
import org.junit.Test;

import static junit.framework.TestCase.*;

public class EnricherTest {
    private final Interface transfer = Interface.of("transfer", ImmutableList.of(
            new Param("to", AbiType.address()), new Param("amount", AbiType.uint(256)),
            new Param("data", AbiType.bytes())));
    private final Exp to = Exp.var(ActType.INTEGER, AbiType.address(), "to");
    private final Exp amount = Exp.var(ActType.INTEGER, AbiType.uint(256), "amount");

    @Test
    public void test_整数型の引数に範囲を加える() {
        Exp pre = Exp.lt(amount, Exp.litInt(100));
        ImmutableList<Exp> enriched = Enricher.enrich(transfer, ImmutableList.of(pre));
        assertEquals(ImmutableList.of(Exp.inRange(AbiType.address(), to),
                Exp.inRange(AbiType.uint(256), amount), pre), enriched);
    }

    @Test
    public void test_既にある範囲は重複させない() {
        Exp bound = Exp.inRange(AbiType.uint(256), amount);
        ImmutableList<Exp> enriched = Enricher.enrich(transfer, ImmutableList.of(bound));
        assertEquals(2, enriched.size());
    }

    @Test
    public void test_コンストラクタと全ての振る舞い() {
        Constructor ctor = new Constructor("Token", Interface.of("constructor", ImmutableList.of(
                new Param("supply", AbiType.uint(8)))), ImmutableList.of(), ImmutableList.of(), ImmutableList.of(),
                ImmutableList.of());
        Behaviour behaviour = new Behaviour("transfer", "Token", transfer, ImmutableList.of(), ImmutableList.of(),
                ImmutableList.of(), ImmutableList.of(), null);
        Act act = new Act(ImmutableMap.of(), ImmutableList.of(new Contract(ctor, ImmutableList.of(behaviour))));

        Act enriched = Enricher.enrich(act);
        Contract contract = enriched.getContracts().get(0);
        assertEquals(ImmutableList.of(Exp.inRange(AbiType.uint(8),
                Exp.var(ActType.INTEGER, AbiType.uint(8), "supply"))), contract.getConstructor().getPreconditions());
        assertEquals(2, contract.getBehaviours().get(0).getPreconditions().size());
        // 元の仕様は変わらない
        assertTrue(act.getContracts().get(0).getBehaviours().get(0).getPreconditions().isEmpty());
    }
}
