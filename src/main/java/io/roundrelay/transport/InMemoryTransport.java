package io.roundrelay.transport;

import io.roundrelay.spi.Transport;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-local transport for simulations: participants read requests with {@link #pendingRequests(String)}
 * and answer with {@link #respond(String, byte[])}. Responses can be read again until released.
 */
public final class InMemoryTransport implements Transport {
    private final ConcurrentMap<String, StoredRequest> requests = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, byte[]> responses = new ConcurrentHashMap<>();

    @Override
    public void put(String correlationId, String recipientAddress, byte[] body) {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId cannot be blank");
        }
        StoredRequest request = new StoredRequest(correlationId, recipientAddress, body.clone(), System.currentTimeMillis());
        requests.put(correlationId, request);
    }

    @Override
    public Optional<byte[]> get(String correlationId) {
        byte[] body = responses.get(correlationId);
        return body == null ? Optional.empty() : Optional.of(body.clone());
    }

    @Override
    public void release(String correlationId) {
        requests.remove(correlationId);
        responses.remove(correlationId);
    }

    /**
     * Records the participant's answer. A second answer for the same id is ignored.
     *
     * @return {@code true} when the response was stored
     */
    public boolean respond(String correlationId, byte[] body) {
        if (!requests.containsKey(correlationId)) {
            return false;
        }
        return responses.putIfAbsent(correlationId, body.clone()) == null;
    }

    public List<StoredRequest> pendingRequests(String recipientAddress) {
        List<StoredRequest> out = new ArrayList<>();
        for (StoredRequest request : requests.values()) {
            if (request.recipientAddress().equals(recipientAddress) && !responses.containsKey(request.correlationId())) {
                out.add(request);
            }
        }
        out.sort((a, b) -> Long.compare(a.storedAtMs(), b.storedAtMs()));
        return out;
    }

    public List<StoredRequest> allRequests() {
        List<StoredRequest> out = new ArrayList<>(requests.values());
        out.sort((a, b) -> Long.compare(a.storedAtMs(), b.storedAtMs()));
        return out;
    }

    public int requestCount() {
        return requests.size();
    }

    public record StoredRequest(String correlationId, String recipientAddress, byte[] body, long storedAtMs) {
        @Override
        public byte[] body() {
            return body.clone();
        }
    }
}
