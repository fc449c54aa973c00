package io.roundrelay.model;

public final class MessageTypes {
    public static final String TRAIN = "train";
    public static final String EVALUATE = "evaluate";
    public static final String QUERY = "query";
    public static final String SYSTEM = "system";

    private MessageTypes() {
    }
}
