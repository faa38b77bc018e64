package net.katagaitai.kaidoku;

public enum ErrorKind {
    MISSING_LAYOUT,
    UNEXPLORED_BRANCH,
    UNSUPPORTED_CONSTRUCT,
    VERIFICATION_COUNTEREXAMPLE,
    VERIFICATION_TIMEOUT
}
