package net.katagaitai.kaidoku.act;

import com.google.common.collect.ImmutableList;
import lombok.Value;

@Value
public class Contract {
    private Constructor constructor;
    private ImmutableList<Behaviour> behaviours;
}
