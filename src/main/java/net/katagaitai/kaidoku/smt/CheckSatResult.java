package net.katagaitai.kaidoku.smt;

import com.google.common.collect.ImmutableSortedMap;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.math.BigInteger;
import java.util.Map;

@Getter
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class CheckSatResult {
    public enum Status {
        SAT,
        UNSAT,
        UNKNOWN
    }

    private static final CheckSatResult UNSAT_RESULT = new CheckSatResult(Status.UNSAT, ImmutableSortedMap.of(), null);

    private final Status status;
    private final Map<String, BigInteger> model;
    private final String reason;

    public static CheckSatResult sat(Map<String, BigInteger> model) {
        return new CheckSatResult(Status.SAT, ImmutableSortedMap.copyOf(model), null);
    }

    public static CheckSatResult unsat() {
        return UNSAT_RESULT;
    }

    public static CheckSatResult unknown(String reason) {
        return new CheckSatResult(Status.UNKNOWN, ImmutableSortedMap.of(), reason);
    }

    public boolean isSat() {
        return status == Status.SAT;
    }

    public boolean isUnsat() {
        return status == Status.UNSAT;
    }

    public boolean isUnknown() {
        return status == Status.UNKNOWN;
    }

    @Override
    public String toString() {
        switch (status) {
            case SAT:
                return "SAT " + model;
            case UNKNOWN:
                return "UNKNOWN (" + reason + ")";
            default:
                return "UNSAT";
        }
    }
}
