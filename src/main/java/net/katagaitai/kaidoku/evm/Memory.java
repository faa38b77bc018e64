package net.katagaitai.kaidoku.evm;

import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import net.katagaitai.kaidoku.evm.expr.Expr;
import net.katagaitai.kaidoku.util.Constants;

import java.util.List;
import java.util.Map;

public class Memory {
    private final Map<Integer, Expr> bytes;
    private int size;

    public Memory() {
        this(Maps.newHashMap(), 0);
    }

    private Memory(Map<Integer, Expr> bytes, int size) {
        this.bytes = bytes;
        this.size = size;
    }

    public Memory copy() {
        return new Memory(Maps.newHashMap(bytes), size);
    }

    public Expr readByte(int offset) {
        return bytes.getOrDefault(offset, Expr.ZERO_BYTE);
    }

    public void writeByte(int offset, Expr b) {
        bytes.put(offset, b);
        touch(offset, 1);
    }

    public Expr readWord(int offset) {
        touch(offset, Constants.WORD_BYTES);
        List<Expr> word = Lists.newArrayListWithCapacity(Constants.WORD_BYTES);
        for (int i = 0; i < Constants.WORD_BYTES; i++) {
            word.add(readByte(offset + i));
        }
        return Expr.joinBytes(word);
    }

    public void writeWord(int offset, Expr w) {
        for (int i = 0; i < Constants.WORD_BYTES; i++) {
            writeByte(offset + i, Expr.indexWord(i, w));
        }
    }

    public Expr readBuf(int offset, int length) {
        if (length == 0) {
            return Expr.EMPTY_BUF;
        }
        touch(offset, length);
        List<Expr> buf = Lists.newArrayListWithCapacity(length);
        for (int i = 0; i < length; i++) {
            buf.add(readByte(offset + i));
        }
        return Expr.bytes(buf);
    }

    // srcの[srcOffset, srcOffset+length)をoffsetへコピーする。範囲外は0
    public void copyFrom(int offset, Expr srcOffset, int length, Expr src) {
        for (int i = 0; i < length; i++) {
            Expr index = Expr.add(srcOffset, Expr.lit(i));
            writeByte(offset + i, Expr.readByte(index, src));
        }
    }

    private void touch(int offset, int length) {
        if (length == 0) {
            return;
        }
        int end = offset + length;
        int rounded = (end + Constants.WORD_BYTES - 1) / Constants.WORD_BYTES * Constants.WORD_BYTES;
        size = Math.max(size, rounded);
    }

    // MSIZE
    public int size() {
        return size;
    }
}
