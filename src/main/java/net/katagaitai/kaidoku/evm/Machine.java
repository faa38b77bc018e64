package net.katagaitai.kaidoku.evm;

import com.google.common.collect.Lists;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.kaidoku.evm.expr.Expr;
import net.katagaitai.kaidoku.evm.expr.Prop;
import net.katagaitai.kaidoku.smt.CheckSatResult;
import net.katagaitai.kaidoku.smt.Solvers;
import net.katagaitai.kaidoku.util.Constants;
import net.katagaitai.kaidoku.util.Util;

import java.math.BigInteger;
import java.util.List;

// 1本のパスを終端まで記号実行する。JUMPIの両側が実行可能なら両方を実行してITEで束ねる
@Slf4j(topic = "kaidoku")
@RequiredArgsConstructor
public class Machine {
    private static final String logString = "{}    Op: [{}]  Stack: [{}]  Hint: [{}]";

    @Getter
    private final MachineManager manager;
    @Getter
    private final MachineState state;

    public Expr run() {
        log.debug("開始 PC:{}", Integer.toHexString(state.getPc()));
        while (!state.isVmStopped()) {
            if (Thread.currentThread().isInterrupted()) {
                state.partial("interrupted");
                break;
            }
            Instruction instruction = state.getInstruction(state.getPc());
            if (log.isTraceEnabled()) {
                log.trace(getDisasmLine(instruction));
            }
            executeOne(instruction);
            logTrace(instruction, state.getPc());
        }
        log.debug("終了 PC:{} {}", Integer.toHexString(state.getPc()), state.getResult().getKind());
        return state.getResult();
    }

    void executeOne(Instruction instruction) {
        if (instruction == null) {
            // コード末尾を超えたらSTOP
            state.stop();
            return;
        }
        OpCode opCode = instruction.getOpCode();
        if (opCode == null) {
            state.invalid();
            return;
        }
        if (state.stackSize() < opCode.require()) {
            log.debug("スタック不足: {}", instruction);
            state.invalid();
            return;
        }
        if (state.stackSize() - opCode.require() + opCode.ret() > Constants.MAX_STACK_SIZE) {
            log.debug("スタック溢れ: {}", instruction);
            state.invalid();
            return;
        }

        if (opCode == OpCode.STOP) {
            state.stop();
            return;
        } else if (opCode == OpCode.ADD) {
            Expr a = pop();
            Expr b = pop();
            push(Expr.add(a, b));
        } else if (opCode == OpCode.MUL) {
            Expr a = pop();
            Expr b = pop();
            push(Expr.mul(a, b));
        } else if (opCode == OpCode.SUB) {
            Expr a = pop();
            Expr b = pop();
            push(Expr.sub(a, b));
        } else if (opCode == OpCode.DIV) {
            Expr a = pop();
            Expr b = pop();
            push(Expr.div(a, b));
        } else if (opCode == OpCode.SDIV) {
            Expr a = pop();
            Expr b = pop();
            push(Expr.sdiv(a, b));
        } else if (opCode == OpCode.MOD) {
            Expr a = pop();
            Expr b = pop();
            push(Expr.mod(a, b));
        } else if (opCode == OpCode.SMOD) {
            Expr a = pop();
            Expr b = pop();
            push(Expr.smod(a, b));
        } else if (opCode == OpCode.ADDMOD) {
            Expr a = pop();
            Expr b = pop();
            Expr n = pop();
            push(Expr.addmod(a, b, n));
        } else if (opCode == OpCode.MULMOD) {
            Expr a = pop();
            Expr b = pop();
            Expr n = pop();
            push(Expr.mulmod(a, b, n));
        } else if (opCode == OpCode.EXP) {
            Expr a = pop();
            Expr b = pop();
            push(Expr.exp(a, b));
        } else if (opCode == OpCode.SIGNEXTEND) {
            // indexは右から数えたバイト位置
            Expr index = pop();
            Expr value = pop();
            push(Expr.sex(index, value));
        } else if (opCode == OpCode.LT) {
            Expr a = pop();
            Expr b = pop();
            push(Expr.lt(a, b));
        } else if (opCode == OpCode.GT) {
            Expr a = pop();
            Expr b = pop();
            push(Expr.gt(a, b));
        } else if (opCode == OpCode.SLT) {
            Expr a = pop();
            Expr b = pop();
            push(Expr.slt(a, b));
        } else if (opCode == OpCode.SGT) {
            Expr a = pop();
            Expr b = pop();
            push(Expr.sgt(a, b));
        } else if (opCode == OpCode.EQ) {
            Expr a = pop();
            Expr b = pop();
            push(Expr.eq(a, b));
        } else if (opCode == OpCode.ISZERO) {
            push(Expr.iszero(pop()));
        } else if (opCode == OpCode.AND) {
            Expr a = pop();
            Expr b = pop();
            push(Expr.and(a, b));
        } else if (opCode == OpCode.OR) {
            Expr a = pop();
            Expr b = pop();
            push(Expr.or(a, b));
        } else if (opCode == OpCode.XOR) {
            Expr a = pop();
            Expr b = pop();
            push(Expr.xor(a, b));
        } else if (opCode == OpCode.NOT) {
            push(Expr.not(pop()));
        } else if (opCode == OpCode.BYTE) {
            // indexは左から数えたバイト位置
            Expr index = pop();
            Expr value = pop();
            push(Expr.getByte(index, value));
        } else if (opCode == OpCode.SHL) {
            Expr shift = pop();
            Expr value = pop();
            push(Expr.shl(shift, value));
        } else if (opCode == OpCode.SHR) {
            Expr shift = pop();
            Expr value = pop();
            push(Expr.shr(shift, value));
        } else if (opCode == OpCode.SAR) {
            Expr shift = pop();
            Expr value = pop();
            push(Expr.sar(shift, value));
        } else if (opCode == OpCode.SHA3) {
            Expr from = pop();
            Expr size = pop();
            int fromInt = toMemoryIndex(from, "SHA3 offset");
            int sizeInt = toMemoryIndex(size, "SHA3 size");
            if (fromInt < 0 || sizeInt < 0) {
                return;
            }
            push(Expr.keccak(state.getMemory().readBuf(fromInt, sizeInt)));
        } else if (opCode == OpCode.ADDRESS) {
            push(Expr.env("address"));
        } else if (opCode == OpCode.ORIGIN) {
            push(Expr.env("origin"));
        } else if (opCode == OpCode.CALLER) {
            push(Expr.env("caller"));
        } else if (opCode == OpCode.CALLVALUE) {
            push(Expr.env("callvalue"));
        } else if (opCode == OpCode.GASPRICE) {
            push(Expr.env("gasprice"));
        } else if (opCode == OpCode.COINBASE) {
            push(Expr.env("coinbase"));
        } else if (opCode == OpCode.TIMESTAMP) {
            push(Expr.env("timestamp"));
        } else if (opCode == OpCode.NUMBER) {
            push(Expr.env("number"));
        } else if (opCode == OpCode.DIFFICULTY) {
            push(Expr.env("difficulty"));
        } else if (opCode == OpCode.GASLIMIT) {
            push(Expr.env("gaslimit"));
        } else if (opCode == OpCode.CHAINID) {
            push(Expr.env("chainid"));
        } else if (opCode == OpCode.SELFBALANCE) {
            push(Expr.env("selfbalance"));
        } else if (opCode == OpCode.BASEFEE) {
            push(Expr.env("basefee"));
        } else if (opCode == OpCode.GAS) {
            push(Expr.env("gas"));
        } else if (opCode == OpCode.CALLDATALOAD) {
            Expr from = pop();
            push(Expr.readWord(from, state.getCalldata()));
        } else if (opCode == OpCode.CALLDATASIZE) {
            push(Expr.bufLength(state.getCalldata()));
        } else if (opCode == OpCode.CALLDATACOPY) {
            if (!copyToMemory(state.getCalldata(), "CALLDATACOPY")) {
                return;
            }
        } else if (opCode == OpCode.CODESIZE) {
            push(Expr.bufLength(state.getCodeBuffer()));
        } else if (opCode == OpCode.CODECOPY) {
            if (!copyToMemory(state.getCodeBuffer(), "CODECOPY")) {
                return;
            }
        } else if (opCode == OpCode.RETURNDATASIZE) {
            // 外部呼び出しは扱わないので常に空
            push(Expr.ZERO);
        } else if (opCode == OpCode.RETURNDATACOPY) {
            pop();
            pop();
            Expr size = pop();
            if (!size.isLit(0)) {
                log.debug("RETURNDATACOPYの範囲外");
                state.invalid();
                return;
            }
        } else if (opCode == OpCode.POP) {
            pop();
        } else if (opCode == OpCode.MLOAD) {
            Expr from = pop();
            int fromInt = toMemoryIndex(from, "MLOAD offset");
            if (fromInt < 0) {
                return;
            }
            push(state.getMemory().readWord(fromInt));
        } else if (opCode == OpCode.MSTORE) {
            Expr to = pop();
            Expr value = pop();
            int toInt = toMemoryIndex(to, "MSTORE offset");
            if (toInt < 0) {
                return;
            }
            state.getMemory().writeWord(toInt, value);
        } else if (opCode == OpCode.MSTORE8) {
            Expr to = pop();
            Expr value = pop();
            int toInt = toMemoryIndex(to, "MSTORE8 offset");
            if (toInt < 0) {
                return;
            }
            state.getMemory().writeByte(toInt, Expr.indexWord(Constants.WORD_BYTES - 1, value));
        } else if (opCode == OpCode.SLOAD) {
            Expr key = pop();
            push(state.storageGet(key));
        } else if (opCode == OpCode.SSTORE) {
            Expr key = pop();
            Expr value = pop();
            state.storagePut(key, value);
        } else if (opCode == OpCode.JUMP) {
            Expr target = pop();
            jump(target);
            return;
        } else if (opCode == OpCode.JUMPI) {
            Expr target = pop();
            Expr condition = pop();
            jumpi(target, condition);
            return;
        } else if (opCode == OpCode.PC) {
            push(Expr.lit(state.getPc()));
        } else if (opCode == OpCode.MSIZE) {
            push(Expr.lit(state.getMemory().size()));
        } else if (opCode == OpCode.JUMPDEST) {
            // nop
        } else if (opCode.isPush()) {
            push(Expr.lit(instruction.getArg()));
        } else if (opCode.isDup()) {
            int num = opCode.getVal() - OpCode.DUP1.getVal() + 1;
            state.stackDup(num - 1);
        } else if (opCode.isSwap()) {
            int num = opCode.getVal() - OpCode.SWAP1.getVal() + 1;
            state.stackSwap(num);
        } else if (opCode.isLog()) {
            // ログは観測しない
            for (int i = 0; i < opCode.require(); i++) {
                pop();
            }
        } else if (opCode == OpCode.RETURN) {
            Expr from = pop();
            Expr size = pop();
            int fromInt = toMemoryIndex(from, "RETURN offset");
            int sizeInt = toMemoryIndex(size, "RETURN size");
            if (fromInt < 0 || sizeInt < 0) {
                return;
            }
            state.succeed(state.getMemory().readBuf(fromInt, sizeInt));
            return;
        } else if (opCode == OpCode.REVERT || opCode == OpCode.INVALID) {
            state.invalid();
            return;
        } else {
            // BALANCE, EXTCODE*, BLOCKHASH, CALL系, CREATE系, SELFDESTRUCT
            log.debug("未対応の命令: {}", opCode);
            state.partial("unsupported opcode: " + opCode);
            return;
        }

        state.setPc(state.getPc() + instruction.size());
    }

    private boolean copyToMemory(Expr src, String name) {
        Expr to = pop();
        Expr from = pop();
        Expr size = pop();
        int toInt = toMemoryIndex(to, name + " offset");
        int sizeInt = toMemoryIndex(size, name + " size");
        if (toInt < 0 || sizeInt < 0) {
            return false;
        }
        state.getMemory().copyFrom(toInt, from, sizeInt, src);
        return true;
    }

    // 具体値でないメモリ位置は扱わない
    private int toMemoryIndex(Expr e, String what) {
        if (!e.isLit()) {
            state.partial("symbolic " + what + ": " + e);
            return -1;
        }
        if (e.getValue().compareTo(BigInteger.valueOf(Constants.MAX_MEMORY_BYTES)) > 0) {
            state.partial("memory access too large " + what + ": " + e);
            return -1;
        }
        return e.getValue().intValue();
    }

    private void jump(Expr target) {
        if (!target.isLit()) {
            log.warn("不明なJUMP ジャンプ先: {}", target);
            state.partial("symbolic jump target: " + target);
            return;
        }
        int targetInt = Util.getInt(target.getValue());
        if (!state.getCode().isJumpDest(targetInt)) {
            state.invalid();
            return;
        }
        if (isOverLoopLimit(targetInt)) {
            log.debug("ループ上限: {} -> {}", state.getPc(), targetInt);
            state.partial("max iterations reached");
            return;
        }
        state.setPc(targetInt);
    }

    private void jumpi(Expr target, Expr condition) {
        final int nextPc = state.getPc() + 1;
        if (condition.isLit()) {
            if (condition.isLit(0)) {
                state.setPc(nextPc);
            } else {
                jump(target);
            }
            return;
        }
        final Prop falseCond = Prop.peq(condition, Expr.ZERO);
        final Prop trueCond = Prop.pneg(falseCond);
        boolean falseable = isAble(falseCond);
        boolean trueable;
        if (falseable) {
            trueable = isAble(trueCond);
        } else {
            trueable = true;
        }
        if (trueable && falseable) {
            log.debug("true/falseの分岐");
            MachineState falseState = state.copy();
            falseState.addPathCondition(falseCond);
            falseState.setPc(nextPc);
            MachineState trueState = state.copy();
            trueState.addPathCondition(trueCond);
            Machine trueMachine = new Machine(manager, trueState);
            trueMachine.jump(target);
            Expr trueResult = trueMachine.run();
            Expr falseResult = new Machine(manager, falseState).run();
            state.branch(Expr.ite(condition, trueResult, falseResult));
        } else if (trueable) {
            log.debug("trueのみの分岐");
            state.addPathCondition(trueCond);
            jump(target);
        } else {
            log.debug("falseのみの分岐");
            state.addPathCondition(falseCond);
            state.setPc(nextPc);
        }
    }

    private boolean isAble(Prop cond) {
        Solvers solvers = manager.getSolvers();
        if (solvers == null) {
            return true;
        }
        List<Prop> props = Lists.newArrayList(state.getPathConditions());
        props.add(cond);
        CheckSatResult result = solvers.checkSat(props);
        if (result.isUnknown()) {
            log.debug("分岐の判定不能: {}", result.getReason());
        }
        return !result.isUnsat();
    }

    private boolean isOverLoopLimit(int target) {
        // 戻るジャンプを制限する
        return target < state.getPc() &&
                state.checkAndIncrementEdgeVisitedCount(state.getPc(), target, state.getMaxIterations());
    }

    private void logTrace(Instruction instruction, int nextPc) {
        if (instruction == null) {
            return;
        }
        if (log.isTraceEnabled()) {
            log.trace(logString,
                    String.format("%5s", "[" + nextPc + "]"),
                    String.format("%-12s", instruction.getOpCode()),
                    state.isVmStopped() ? 0 : state.stackSize(),
                    instruction.getArgHex()
            );
            if (!state.isVmStopped()) {
                log.trace(" -- STACK --   \n{}", getStackLines());
            }
        }
    }

    private String getStackLines() {
        StringBuilder sb = new StringBuilder();
        final int size = state.stackSize();
        for (int i = 0; i < size; i++) {
            String str = state.stackGet(i).toString();
            if (str.length() > 64) {
                str = str.substring(0, 61) + "...";
            }
            sb.append(" ").append(str);
            if (i < size - 1) {
                sb.append("\n");
            }
        }
        return sb.toString();
    }

    private String getDisasmLine(Instruction instruction) {
        // デバッグしやすくするためにevmと同じ表示形式にする
        return String.format("%05x: %s", state.getPc(), instruction);
    }

    private Expr pop() {
        return state.stackPop();
    }

    private void push(Expr e) {
        state.stackPush(e);
    }
}
