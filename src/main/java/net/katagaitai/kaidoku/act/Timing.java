package net.katagaitai.kaidoku.act;

public enum Timing {
    UNSPECIFIED,
    PRE,
    POST;

    public String label() {
        switch (this) {
            case PRE:
                return "Pre";
            case POST:
                return "Post";
            default:
                return "Neither";
        }
    }
}
