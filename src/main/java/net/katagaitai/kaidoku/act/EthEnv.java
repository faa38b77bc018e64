package net.katagaitai.kaidoku.act;

import lombok.Getter;

public enum EthEnv {
    CALLER("Caller", "caller"),
    CALLVALUE("Callvalue", "callvalue"),
    ORIGIN("Origin", "origin"),
    BLOCKNUMBER("Blocknumber", "number"),
    DIFFICULTY("Difficulty", "difficulty"),
    CHAINID("Chainid", "chainid"),
    GASLIMIT("Gaslimit", "gaslimit"),
    COINBASE("Coinbase", "coinbase"),
    TIMESTAMP("Timestamp", "timestamp"),
    THIS("This", "address");

    @Getter
    private final String label;
    @Getter
    private final String evmName;

    EthEnv(String label, String evmName) {
        this.label = label;
        this.evmName = evmName;
    }

    public static EthEnv fromEvmName(String evmName) {
        for (EthEnv env : values()) {
            if (env.evmName.equals(evmName)) {
                return env;
            }
        }
        return null;
    }
}
