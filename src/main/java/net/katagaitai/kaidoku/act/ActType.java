package net.katagaitai.kaidoku.act;

import lombok.Getter;

public enum ActType {
    INTEGER("SInteger"),
    BOOLEAN("SBoolean"),
    BYTESTR("SByteStr");

    // JSON上の表記
    @Getter
    private final String sortName;

    ActType(String sortName) {
        this.sortName = sortName;
    }
}
