package net.katagaitai.kaidoku.evm.expr;

public enum Sort {
    WORD,
    BYTE,
    BUF,
    STORAGE,
    END
}
