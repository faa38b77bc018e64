package net.katagaitai.kaidoku.evm;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import lombok.Getter;
import lombok.Setter;
import net.katagaitai.kaidoku.evm.expr.Expr;
import net.katagaitai.kaidoku.evm.expr.Prop;
import org.apache.commons.lang3.tuple.Pair;

import java.util.Collections;
import java.util.List;
import java.util.Map;

public class MachineState {
    @Getter
    private final Code code;
    // CODECOPY/CODESIZEから見えるバイト列。作成時はコンストラクタ引数が後ろに付く
    @Getter
    private final Expr codeBuffer;
    @Getter
    private final Expr calldata;
    @Getter
    @Setter
    private int pc;
    private final Stack stack;
    private final Memory memory;
    private final Storage storage;
    private final List<Prop> pathConditions;
    private final Map<Pair<Integer, Integer>, Integer> edgeVisitedCount;
    @Getter
    private final int maxIterations;
    @Getter
    private Expr result;

    public MachineState(Code code, Expr codeBuffer, Expr calldata, Expr initialStorage, int maxIterations) {
        this(code, codeBuffer, calldata, maxIterations, 0, new Stack(), new Memory(), new Storage(initialStorage),
                Lists.newArrayList(), Maps.newHashMap());
    }

    private MachineState(Code code, Expr codeBuffer, Expr calldata, int maxIterations, int pc, Stack stack,
                         Memory memory, Storage storage, List<Prop> pathConditions,
                         Map<Pair<Integer, Integer>, Integer> edgeVisitedCount) {
        this.code = code;
        this.maxIterations = maxIterations;
        this.codeBuffer = codeBuffer;
        this.calldata = calldata;
        this.pc = pc;
        this.stack = stack;
        this.memory = memory;
        this.storage = storage;
        this.pathConditions = pathConditions;
        this.edgeVisitedCount = edgeVisitedCount;
    }

    public MachineState copy() {
        return new MachineState(code, codeBuffer, calldata, maxIterations, pc, stack.copy(), memory.copy(), storage.copy(),
                Lists.newArrayList(pathConditions), Maps.newHashMap(edgeVisitedCount));
    }

    public Instruction getInstruction(int pc) {
        return code.getInstruction(pc);
    }

    public boolean isVmStopped() {
        return result != null;
    }

    // ---- 終了 ----

    public void stop() {
        succeed(Expr.EMPTY_BUF);
    }

    public void succeed(Expr returnData) {
        result = Expr.success(getPathConditions(), returnData, storage.getExpr());
    }

    public void invalid() {
        result = Expr.failure(getPathConditions());
    }

    public void partial(String reason) {
        result = Expr.partial(reason, getPathConditions());
    }

    public void branch(Expr end) {
        result = end;
    }

    // ---- パス条件 ----

    public List<Prop> getPathConditions() {
        return Collections.unmodifiableList(pathConditions);
    }

    public void addPathCondition(Prop prop) {
        if (prop.is(Prop.Kind.PBOOL) && prop.isValue()) {
            return;
        }
        pathConditions.add(prop);
    }

    // 上限を超えたらtrue
    public boolean checkAndIncrementEdgeVisitedCount(int from, int to, int max) {
        Pair<Integer, Integer> edge = Pair.of(from, to);
        int count = edgeVisitedCount.getOrDefault(edge, 0) + 1;
        edgeVisitedCount.put(edge, count);
        return count > max;
    }

    // ---- スタック ----

    public Expr stackPop() {
        return stack.pop();
    }

    public void stackPush(Expr e) {
        stack.push(e);
    }

    public Expr stackGet(int i) {
        return stack.get(i);
    }

    public int stackSize() {
        return stack.size();
    }

    public void stackDup(int i) {
        stack.push(stack.get(i));
    }

    public void stackSwap(int i) {
        Expr top = stack.get(0);
        stack.set(0, stack.get(i));
        stack.set(i, top);
    }

    // ---- メモリ ----

    public Memory getMemory() {
        return memory;
    }

    // ---- ストレージ ----

    public Expr storageGet(Expr key) {
        return storage.get(key);
    }

    public void storagePut(Expr key, Expr value) {
        storage.put(key, value);
    }

    public Expr getStorageExpr() {
        return storage.getExpr();
    }
}
