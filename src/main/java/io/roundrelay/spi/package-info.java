/**
 * Collaborators the orchestrator depends on but does not implement: the store-and-forward
 * {@link io.roundrelay.spi.Transport}, the optional {@link io.roundrelay.spi.PayloadCipher} and the
 * {@link io.roundrelay.spi.EnvelopeCodec} wire format.
 */
package io.roundrelay.spi;
