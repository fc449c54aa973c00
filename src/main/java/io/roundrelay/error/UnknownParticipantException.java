package io.roundrelay.error;

public final class UnknownParticipantException extends RoundRelayException {
    private final String address;

    public UnknownParticipantException(String address) {
        super("Unknown participant: " + address);
        this.address = address;
    }

    public String address() {
        return address;
    }
}
