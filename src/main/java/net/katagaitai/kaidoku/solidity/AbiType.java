package net.katagaitai.kaidoku.solidity;

import com.google.common.collect.ImmutableList;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.stream.Collectors;

@Getter
@EqualsAndHashCode
public final class AbiType {
    public enum Kind {
        UINT,
        INT,
        ADDRESS,
        BOOL,
        FIXED_BYTES,
        BYTES,
        STRING,
        FIXED_ARRAY,
        ARRAY,
        TUPLE,
        FUNCTION
    }

    private final Kind kind;
    // UINT/INTはビット数、FIXED_BYTESはバイト数、FIXED_ARRAYは要素数
    private final int size;
    // FIXED_ARRAY/ARRAYの要素型、TUPLEの成分型
    private final ImmutableList<AbiType> components;

    private AbiType(Kind kind, int size, List<AbiType> components) {
        this.kind = kind;
        this.size = size;
        this.components = ImmutableList.copyOf(components);
    }

    public static AbiType uint(int bits) {
        checkBits(bits);
        return new AbiType(Kind.UINT, bits, ImmutableList.of());
    }

    public static AbiType sint(int bits) {
        checkBits(bits);
        return new AbiType(Kind.INT, bits, ImmutableList.of());
    }

    public static AbiType address() {
        return new AbiType(Kind.ADDRESS, 160, ImmutableList.of());
    }

    public static AbiType bool() {
        return new AbiType(Kind.BOOL, 8, ImmutableList.of());
    }

    public static AbiType fixedBytes(int n) {
        if (n < 1 || n > 32) {
            throw new IllegalArgumentException("bytesの長さが不正: " + n);
        }
        return new AbiType(Kind.FIXED_BYTES, n, ImmutableList.of());
    }

    public static AbiType bytes() {
        return new AbiType(Kind.BYTES, 0, ImmutableList.of());
    }

    public static AbiType string() {
        return new AbiType(Kind.STRING, 0, ImmutableList.of());
    }

    public static AbiType fixedArray(AbiType element, int length) {
        return new AbiType(Kind.FIXED_ARRAY, length, ImmutableList.of(element));
    }

    public static AbiType array(AbiType element) {
        return new AbiType(Kind.ARRAY, 0, ImmutableList.of(element));
    }

    public static AbiType tuple(List<AbiType> components) {
        return new AbiType(Kind.TUPLE, 0, components);
    }

    public static AbiType function() {
        return new AbiType(Kind.FUNCTION, 24, ImmutableList.of());
    }

    private static void checkBits(int bits) {
        if (bits < 8 || bits > 256 || bits % 8 != 0) {
            throw new IllegalArgumentException("ビット数が不正: " + bits);
        }
    }

    // 型名を解析する。tupleの成分は呼び出し側が渡す
    public static AbiType parse(String name, List<AbiType> tupleComponents) {
        String s = StringUtils.trimToEmpty(name);
        if (s.endsWith("]")) {
            int open = s.lastIndexOf('[');
            if (open < 0) {
                throw new IllegalArgumentException("不正な型名: " + name);
            }
            AbiType element = parse(s.substring(0, open), tupleComponents);
            String length = s.substring(open + 1, s.length() - 1);
            if (length.isEmpty()) {
                return array(element);
            }
            return fixedArray(element, Integer.parseInt(length));
        }
        if (s.equals("tuple")) {
            return tuple(tupleComponents);
        }
        if (s.equals("address") || s.equals("address payable")) {
            return address();
        }
        if (s.equals("bool")) {
            return bool();
        }
        if (s.equals("bytes")) {
            return bytes();
        }
        if (s.equals("string")) {
            return string();
        }
        if (s.equals("function")) {
            return function();
        }
        if (s.startsWith("uint")) {
            return uint(bitsOf(s.substring(4), name));
        }
        if (s.startsWith("int")) {
            return sint(bitsOf(s.substring(3), name));
        }
        if (s.startsWith("bytes") && StringUtils.isNumeric(s.substring(5))) {
            return fixedBytes(Integer.parseInt(s.substring(5)));
        }
        throw new IllegalArgumentException("未対応の型名: " + name);
    }

    public static AbiType parse(String name) {
        return parse(name, ImmutableList.of());
    }

    private static int bitsOf(String suffix, String name) {
        if (suffix.isEmpty()) {
            return 256;
        }
        if (!StringUtils.isNumeric(suffix)) {
            throw new IllegalArgumentException("不正な型名: " + name);
        }
        return Integer.parseInt(suffix);
    }

    public boolean isDynamic() {
        switch (kind) {
            case BYTES:
            case STRING:
            case ARRAY:
                return true;
            case FIXED_ARRAY:
            case TUPLE:
                return components.stream().anyMatch(AbiType::isDynamic);
            default:
                return false;
        }
    }

    // 1ワードに収まる整数として扱える型
    public boolean isInteger() {
        return kind == Kind.UINT || kind == Kind.INT || kind == Kind.ADDRESS || kind == Kind.BOOL;
    }

    // 1スロットに収まる値型
    public boolean isWord() {
        return isInteger() || kind == Kind.FIXED_BYTES;
    }

    public String typeName() {
        switch (kind) {
            case UINT:
                return "uint" + size;
            case INT:
                return "int" + size;
            case ADDRESS:
                return "address";
            case BOOL:
                return "bool";
            case FIXED_BYTES:
                return "bytes" + size;
            case BYTES:
                return "bytes";
            case STRING:
                return "string";
            case FIXED_ARRAY:
                return components.get(0).typeName() + "[" + size + "]";
            case ARRAY:
                return components.get(0).typeName() + "[]";
            case TUPLE:
                return components.stream().map(AbiType::typeName).collect(Collectors.joining(",", "(", ")"));
            case FUNCTION:
                return "function";
            default:
                throw new IllegalStateException("未対応のKind: " + kind);
        }
    }

    @Override
    public String toString() {
        return typeName();
    }
}
