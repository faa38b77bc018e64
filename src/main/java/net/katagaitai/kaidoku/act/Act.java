package net.katagaitai.kaidoku.act;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import lombok.Value;
import org.apache.commons.lang3.tuple.Pair;

import java.math.BigInteger;

// 仕様全体。store はコントラクト名 → 変数名 → (型, スロット)
@Value
public class Act {
    private ImmutableMap<String, ImmutableMap<String, Pair<SlotType, BigInteger>>> store;
    private ImmutableList<Contract> contracts;
}
