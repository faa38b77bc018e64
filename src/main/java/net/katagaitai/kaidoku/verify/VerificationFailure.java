package net.katagaitai.kaidoku.verify;

import lombok.Value;
import net.katagaitai.kaidoku.ErrorKind;

@Value
public class VerificationFailure {
    private ErrorKind kind;
    private String location;
    private String message;

    @Override
    public String toString() {
        return "[" + location + "] " + message;
    }
}
