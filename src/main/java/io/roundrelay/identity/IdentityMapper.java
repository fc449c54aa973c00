package io.roundrelay.identity;

import io.roundrelay.error.UnknownNodeException;
import io.roundrelay.error.UnknownParticipantException;
import io.roundrelay.model.Participant;

import java.nio.charset.StandardCharsets;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.CRC32;

/**
 * Fixed, immutable mapping between participant addresses and the unsigned 32-bit node ids used on the wire.
 *
 * <p>Ids are the CRC32 of the UTF-8 address, so they are stable across processes without a persisted table.
 * Construction fails when two addresses, or an address and the coordinator, share an id.
 */
public final class IdentityMapper {
    private final long coordinatorNodeId;
    private final Map<String, Participant> byAddress;
    private final Map<Long, Participant> byNodeId;

    public IdentityMapper(Collection<String> addresses, long coordinatorNodeId) {
        if (addresses == null) {
            throw new IllegalArgumentException("addresses cannot be null");
        }
        LinkedHashMap<String, Participant> addressIndex = new LinkedHashMap<>();
        LinkedHashMap<Long, Participant> nodeIndex = new LinkedHashMap<>();
        for (String raw : addresses) {
            if (raw == null || raw.isBlank()) {
                throw new IllegalArgumentException("participant address cannot be blank");
            }
            String address = raw.trim();
            if (addressIndex.containsKey(address)) {
                continue;
            }
            long nodeId = nodeIdOf(address);
            if (nodeId == coordinatorNodeId) {
                throw new IllegalArgumentException(
                        "Participant " + address + " hashes to the coordinator node id " + coordinatorNodeId);
            }
            Participant existing = nodeIndex.get(nodeId);
            if (existing != null) {
                throw new IllegalArgumentException(
                        "Node id collision: " + existing.address() + " and " + address + " both map to " + nodeId);
            }
            Participant participant = new Participant(address, nodeId);
            addressIndex.put(address, participant);
            nodeIndex.put(nodeId, participant);
        }
        this.coordinatorNodeId = coordinatorNodeId;
        this.byAddress = Collections.unmodifiableMap(addressIndex);
        this.byNodeId = Collections.unmodifiableMap(nodeIndex);
    }

    public static long nodeIdOf(String address) {
        CRC32 crc = new CRC32();
        crc.update(address.trim().getBytes(StandardCharsets.UTF_8));
        return crc.getValue();
    }

    public long resolve(String address) {
        return participant(address).nodeId();
    }

    public String reverse(long nodeId) {
        return participantFor(nodeId).address();
    }

    public Participant participant(String address) {
        Participant participant = address == null ? null : byAddress.get(address.trim());
        if (participant == null) {
            throw new UnknownParticipantException(address);
        }
        return participant;
    }

    public Participant participantFor(long nodeId) {
        Participant participant = byNodeId.get(nodeId);
        if (participant == null) {
            throw new UnknownNodeException(nodeId);
        }
        return participant;
    }

    public boolean contains(String address) {
        return address != null && byAddress.containsKey(address.trim());
    }

    public List<Participant> participants() {
        return List.copyOf(byAddress.values());
    }

    public List<Long> nodeIds() {
        return List.copyOf(byNodeId.keySet());
    }

    public long coordinatorNodeId() {
        return coordinatorNodeId;
    }

    public int size() {
        return byAddress.size();
    }
}
