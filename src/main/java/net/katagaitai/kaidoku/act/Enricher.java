package net.katagaitai.kaidoku.act;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import java.util.List;
import java.util.Set;

public class Enricher {
    public static Act enrich(Act act) {
        ImmutableList.Builder<Contract> contracts = ImmutableList.builder();
        for (Contract contract : act.getContracts()) {
            Constructor ctor = contract.getConstructor();
            Constructor enrichedCtor = ctor.withPreconditions(
                    enrich(ctor.getIface(), ctor.getPreconditions()));
            ImmutableList.Builder<Behaviour> behaviours = ImmutableList.builder();
            for (Behaviour behaviour : contract.getBehaviours()) {
                behaviours.add(behaviour.withPreconditions(
                        enrich(behaviour.getIface(), behaviour.getPreconditions())));
            }
            contracts.add(new Contract(enrichedCtor, behaviours.build()));
        }
        return new Act(act.getStore(), contracts.build());
    }

    static ImmutableList<Exp> enrich(Interface iface, List<Exp> preconditions) {
        List<Exp> bounds = Lists.newArrayList();
        for (Decl decl : iface.getDecls()) {
            if (decl.getType().isInteger()) {
                bounds.add(Exp.inRange(decl.getType(), Exp.var(ActType.INTEGER, decl.getType(), decl.getName())));
            }
        }
        // 重複は除く
        Set<Exp> result = Sets.newLinkedHashSet(bounds);
        result.addAll(preconditions);
        return ImmutableList.copyOf(result);
    }
}
