package io.roundrelay.identity;

import io.roundrelay.error.UnknownNodeException;
import io.roundrelay.error.UnknownParticipantException;
import io.roundrelay.model.Participant;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.zip.CRC32;

final class IdentityMapperTest {
    private static final List<String> ADDRESSES = List.of("alice@example.org", "bob@example.org", "carol@example.org");

    @Test
    void resolvesSameIdAcrossInstances() {
        IdentityMapper first = new IdentityMapper(ADDRESSES, 1L);
        IdentityMapper second = new IdentityMapper(List.of("carol@example.org", "alice@example.org", "bob@example.org"), 1L);

        for (String address : ADDRESSES) {
            Assertions.assertEquals(first.resolve(address), first.resolve(address));
            Assertions.assertEquals(first.resolve(address), second.resolve(address));
        }
    }

    @Test
    void nodeIdIsUnsignedCrc32OfAddress() {
        CRC32 crc = new CRC32();
        crc.update("alice@example.org".getBytes(StandardCharsets.UTF_8));

        long nodeId = IdentityMapper.nodeIdOf("alice@example.org");

        Assertions.assertEquals(crc.getValue(), nodeId);
        Assertions.assertTrue(nodeId >= 0L && nodeId <= 0xFFFF_FFFFL);
    }

    @Test
    void reverseReturnsAddressForKnownIdAndRejectsUnknownId() {
        IdentityMapper mapper = new IdentityMapper(ADDRESSES, 1L);

        long bob = mapper.resolve("bob@example.org");
        Assertions.assertEquals("bob@example.org", mapper.reverse(bob));

        UnknownNodeException error = Assertions.assertThrows(UnknownNodeException.class, () -> mapper.reverse(42L));
        Assertions.assertEquals(42L, error.nodeId());
    }

    @Test
    void unknownAddressIsRejected() {
        IdentityMapper mapper = new IdentityMapper(ADDRESSES, 1L);

        Assertions.assertThrows(UnknownParticipantException.class, () -> mapper.resolve("mallory@example.org"));
        Assertions.assertFalse(mapper.contains("mallory@example.org"));
    }

    @Test
    void keepsConstructionOrderAndCollapsesDuplicates() {
        IdentityMapper mapper = new IdentityMapper(
                List.of("alice@example.org", " bob@example.org ", "alice@example.org"), 1L);

        Assertions.assertEquals(2, mapper.size());
        List<Participant> participants = mapper.participants();
        Assertions.assertEquals("alice@example.org", participants.get(0).address());
        Assertions.assertEquals("bob@example.org", participants.get(1).address());
        Assertions.assertEquals(
                List.of(IdentityMapper.nodeIdOf("alice@example.org"), IdentityMapper.nodeIdOf("bob@example.org")),
                mapper.nodeIds()
        );
    }

    @Test
    void rejectsAddressThatHashesToCoordinatorId() {
        long clash = IdentityMapper.nodeIdOf("bob@example.org");

        IllegalArgumentException error = Assertions.assertThrows(IllegalArgumentException.class,
                () -> new IdentityMapper(ADDRESSES, clash));
        Assertions.assertTrue(error.getMessage().contains("bob@example.org"));
    }

    @Test
    void detectsCrc32Collisions() {
        // "plumless" and "buckeroo" share a CRC32.
        Assertions.assertEquals(IdentityMapper.nodeIdOf("plumless"), IdentityMapper.nodeIdOf("buckeroo"));

        IllegalArgumentException error = Assertions.assertThrows(IllegalArgumentException.class,
                () -> new IdentityMapper(List.of("plumless", "buckeroo"), 1L));
        Assertions.assertTrue(error.getMessage().contains("collision"));
    }

    @Test
    void rejectsBlankAddress() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new IdentityMapper(List.of("a@x", " "), 1L));
    }
}
