package net.katagaitai.kaidoku.act;

import lombok.Value;

@Value
public class StorageUpdate {
    private StorageItem item;
    private Exp value;

    @Override
    public String toString() {
        return item + " => " + value;
    }
}
