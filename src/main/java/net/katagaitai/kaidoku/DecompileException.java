package net.katagaitai.kaidoku;

import com.google.common.collect.ImmutableList;
import lombok.Getter;
import net.katagaitai.kaidoku.verify.VerificationFailure;

import java.util.List;
import java.util.stream.Collectors;

public class DecompileException extends Exception {
    @Getter
    private final ErrorKind kind;
    @Getter
    private final ImmutableList<VerificationFailure> failures;

    public DecompileException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
        this.failures = ImmutableList.of();
    }

    private DecompileException(ErrorKind kind, String message, List<VerificationFailure> failures) {
        super(message);
        this.kind = kind;
        this.failures = ImmutableList.copyOf(failures);
    }

    public static DecompileException unsupported(String message) {
        return new DecompileException(ErrorKind.UNSUPPORTED_CONSTRUCT, message);
    }

    public static DecompileException verification(List<VerificationFailure> failures) {
        if (failures.isEmpty()) {
            throw new IllegalArgumentException("失敗がない");
        }
        // 反例があれば反例を優先する
        ErrorKind kind = failures.stream().map(VerificationFailure::getKind)
                .filter(k -> k == ErrorKind.VERIFICATION_COUNTEREXAMPLE)
                .findFirst()
                .orElse(failures.get(0).getKind());
        String message = failures.stream().map(VerificationFailure::toString).collect(Collectors.joining("\n"));
        return new DecompileException(kind, message, failures);
    }
}
