package net.katagaitai.kaidoku.evm;

import com.google.common.collect.Lists;
import net.katagaitai.kaidoku.evm.expr.Expr;
import net.katagaitai.kaidoku.evm.expr.Sort;

import java.util.LinkedList;

public class Stack {
    private final LinkedList<Expr> stack = Lists.newLinkedList();

    // Exprは不変なので浅いコピーでよい
    public Stack copy() {
        Stack copy = new Stack();
        copy.stack.addAll(stack);
        return copy;
    }

    public Expr pop() {
        return stack.pop();
    }

    public void push(Expr expr) {
        if (expr == null) {
            throw new IllegalArgumentException("expr null");
        }
        if (expr.getSort() != Sort.WORD) {
            throw new IllegalArgumentException("ワードではない: " + expr);
        }
        stack.push(expr);
    }

    public int size() {
        return stack.size();
    }

    public Expr get(int i) {
        return stack.get(i);
    }

    public void set(int i, Expr e) {
        stack.set(i, e);
    }
}
