package com.lennon.idcard.spi;

import org.apache.commons.codec.DecoderException;
import org.apache.commons.codec.binary.Hex;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.prng.DigestRandomGenerator;

/**
 * Reproducible source for fixtures: the same seed always yields the same sequence.
 *
 * - SHA-256 digest generator from Bouncy Castle, seeded once
 * - 4 bytes per draw, reduced modulo bound (unsigned)
 * - the generator is not thread-safe, so draws are serialized
 */
public final class SeededRandomSource implements RandomSource {
    private final DigestRandomGenerator generator;

    public SeededRandomSource(byte[] seed) {
        if (seed == null || seed.length == 0) throw new IllegalArgumentException("seed empty");
        this.generator = new DigestRandomGenerator(new SHA256Digest());
        this.generator.addSeedMaterial(seed.clone());
    }

    public static SeededRandomSource fromHex(String hex) {
        return new SeededRandomSource(hexToBytes(hex));
    }

    @Override
    public synchronized int nextInt(int bound) {
        if (bound <= 0) throw new IllegalArgumentException("bound must be positive: " + bound);
        byte[] out = new byte[4];
        generator.nextBytes(out);
        int v = ((out[0] & 0xff) << 24) | ((out[1] & 0xff) << 16) | ((out[2] & 0xff) << 8) | (out[3] & 0xff);
        // 转成非负
        v = v < 0 ? -(v + 1) : v;
        return v % bound;
    }

    public static byte[] hexToBytes(String hex) {
        if (hex == null) throw new IllegalArgumentException("Bad hex seed: null");
        try {
            return Hex.decodeHex(hex.trim());
        } catch (DecoderException e) {
            throw new IllegalArgumentException("Bad hex seed", e);
        }
    }
}
