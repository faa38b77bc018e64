package net.katagaitai.kaidoku.util;

import java.math.BigInteger;

public class Constants {
    public static final int WORD_BITS = 256;
    public static final int WORD_BYTES = 32;
    public static final BigInteger TWO_256 = BigInteger.ONE.shiftLeft(WORD_BITS);
    public static final BigInteger MAX_UINT256 = TWO_256.subtract(BigInteger.ONE);

    // ループは1周まで
    public static final int MAX_ITERATIONS = 1;
    public static final int MAX_STACK_SIZE = 1024;
    public static final int MAX_MEMORY_BYTES = 1 << 20;

    public static final int SOLVER_TIMEOUT_MILLS = 30_000;
    public static final int SOLVER_POOL_SIZE = 4;
    public static final int THREAD_POOL_SIZE = Runtime.getRuntime().availableProcessors();
    public static final long MANAGER_TIMEOUT_MILLS = 600_000;

    public static final String STORAGE_NAME = "storage";
    public static final String CALLDATA_NAME = "txdata";
    public static final String SELECTOR_NAME = "selector";
}
