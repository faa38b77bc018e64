package net.katagaitai.kaidoku.act;

import lombok.Value;

@Value
public class Pn {
    public static final Pn NOWHERE = new Pn(0, 0);

    private int line;
    private int column;

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
