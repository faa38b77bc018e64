package net.katagaitai.kaidoku;

import lombok.extern.slf4j.Slf4j;
import net.katagaitai.kaidoku.act.Act;
import net.katagaitai.kaidoku.act.ActJson;
import net.katagaitai.kaidoku.solidity.ArtifactReader;
import net.katagaitai.kaidoku.solidity.CompiledContract;
import net.katagaitai.kaidoku.util.Constants;

import java.io.File;

@Slf4j(topic = "kaidoku")
public class Start {

    public static void main(String[] args) {
        File artifact = null;
        int solvers = Constants.SOLVER_POOL_SIZE;
        int timeout = Constants.SOLVER_TIMEOUT_MILLS;

        // コマンドライン引数のチェック
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("--help")) {
                printHelp();
                System.exit(1);
            } else if (arg.equals("-artifact")) {
                if (i == args.length - 1) {
                    System.out.println("-artifactの後にパスを指定してください。");
                    System.exit(1);
                }
                artifact = new File(args[i + 1]);
                i++;
            } else if (arg.equals("-solvers")) {
                solvers = parsePositive(args, i, "-solvers");
                i++;
            } else if (arg.equals("-timeout")) {
                timeout = parsePositive(args, i, "-timeout");
                i++;
            } else {
                System.out.println("\"" + arg + "\"は不明なオプションです。");
                printHelp();
                System.exit(1);
            }
        }

        if (artifact == null) {
            System.out.println("-artifactを指定してください。");
            System.exit(1);
        }
        if (!artifact.isFile()) {
            System.out.println(artifact + "が存在しません。正しいパスを指定してください。");
            System.exit(1);
        }

        int status = 0;
        try (Decompiler decompiler = new Decompiler(solvers, timeout)) {
            CompiledContract contract = new ArtifactReader().read(artifact);
            Act act = decompiler.decompile(contract);
            System.out.println(ActJson.write(act));
        } catch (DecompileException e) {
            System.out.println(e.getKind() + ": " + e.getMessage());
            status = 1;
        } catch (Exception e) {
            log.error("", e);
            status = 1;
        }
        System.exit(status);
    }

    private static int parsePositive(String[] args, int i, String option) {
        if (i == args.length - 1 || !args[i + 1].matches("[0-9]+") || Integer.parseInt(args[i + 1]) <= 0) {
            System.out.println(option + "の後に正の整数を指定してください。");
            System.exit(1);
        }
        return Integer.parseInt(args[i + 1]);
    }

    static void printHelp() {
        System.out.println("--help                -- print this message");
        System.out.println("-artifact <path>      -- specify the solc combined JSON artifact of the target contract. it must contain abi, bytecode and storageLayout.");
        System.out.println("-solvers <n>          -- specify the number of Z3 solvers running in parallel. (default: " + Constants.SOLVER_POOL_SIZE + ")");
        System.out.println("-timeout <ms>         -- specify the timeout of each solver query in milliseconds. (default: " + Constants.SOLVER_TIMEOUT_MILLS + ")");
        System.out.println("e.g: cli -artifact build/Token.json -solvers 4 -timeout 30000");
        System.out.println();
    }

}
