package net.katagaitai.kaidoku.evm;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import lombok.extern.slf4j.Slf4j;
import net.katagaitai.kaidoku.util.Util;

import java.util.Arrays;
import java.util.Map;
import java.util.Set;

@Slf4j(topic = "kaidoku")
public class Code {
    private final Map<Integer, Instruction> offsetToInstruction = Maps.newTreeMap();
    private final Set<Integer> jumpDests;

    public Code(byte[] bytes) {
        parse(bytes);
        ImmutableSet.Builder<Integer> dests = ImmutableSet.builder();
        for (Instruction instruction : offsetToInstruction.values()) {
            if (instruction.getOpCode() == OpCode.JUMPDEST) {
                dests.add(instruction.getOffset());
            }
        }
        this.jumpDests = dests.build();
    }

    private void parse(byte[] bytes) {
        int offset = 0;
        while (offset < bytes.length) {
            offset = parseOne(bytes, offset);
        }
    }

    private int parseOne(byte[] bytes, int offset) {
        final byte b = bytes[offset];
        OpCode opCode = OpCode.code(b);
        if (opCode == null) {
            final Instruction instruction = new Instruction(offset, b & 0xff, null, null);
            offsetToInstruction.put(offset, instruction);
            log.trace("{} {}", offset, instruction);
            return offset + 1;
        }
        int size = opCode.pushSize();
        if (size > bytes.length - (offset + 1)) {
            // 末尾で途切れたPUSHは0で埋める
            byte[] a = new byte[size];
            System.arraycopy(bytes, offset + 1, a, 0, bytes.length - (offset + 1));
            final Instruction instruction = new Instruction(offset, b & 0xff, opCode, Util.bytesToHex(a));
            offsetToInstruction.put(offset, instruction);
            log.trace("{} {}", offset, instruction);
            return bytes.length;
        }
        byte[] arg = Arrays.copyOfRange(bytes, offset + 1, offset + 1 + size);
        final Instruction instruction = new Instruction(offset, b & 0xff, opCode, Util.bytesToHex(arg));
        offsetToInstruction.put(offset, instruction);
        log.trace("{} {}", offset, instruction);
        return offset + 1 + arg.length;
    }

    public Instruction getInstruction(int pc) {
        return offsetToInstruction.get(pc);
    }

    public boolean isJumpDest(int pc) {
        return jumpDests.contains(pc);
    }
}
