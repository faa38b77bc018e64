package net.katagaitai.kaidoku.evm;

import lombok.Getter;
import net.katagaitai.kaidoku.evm.expr.Expr;
import net.katagaitai.kaidoku.evm.expr.Sort;

public class Storage {
    @Getter
    private Expr expr;

    public Storage(Expr expr) {
        if (expr.getSort() != Sort.STORAGE) {
            throw new IllegalArgumentException("ストレージではない: " + expr);
        }
        this.expr = expr;
    }

    public Storage copy() {
        return new Storage(expr);
    }

    public void put(Expr key, Expr value) {
        expr = Expr.sstore(key, value, expr);
    }

    public Expr get(Expr key) {
        return Expr.sload(key, expr);
    }
}
