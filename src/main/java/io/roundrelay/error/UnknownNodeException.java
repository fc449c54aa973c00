package io.roundrelay.error;

public final class UnknownNodeException extends RoundRelayException {
    private final long nodeId;

    public UnknownNodeException(long nodeId) {
        super("Unknown node id: " + nodeId);
        this.nodeId = nodeId;
    }

    public long nodeId() {
        return nodeId;
    }
}
