package net.katagaitai.kaidoku.evm;

import net.katagaitai.kaidoku.evm.expr.Expr;

public interface SymbolicExecutor {
    /**
     * @param code          実行するバイトコード
     * @param calldata      作成時はコードの後ろに付くコンストラクタ引数、実行時はトランザクションの入力
     * @param creation      作成コードならtrue。ストレージは空の具体ストアから始まる
     * @param maxIterations 後方ジャンプ1本あたりの上限
     */
    Expr execute(byte[] code, Expr calldata, boolean creation, int maxIterations);
}
