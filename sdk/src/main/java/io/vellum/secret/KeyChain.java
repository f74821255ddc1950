package io.vellum.secret;

import com.google.common.primitives.Bytes;
import com.google.common.primitives.Ints;
import io.vellum.crypto.Commitment;
import io.vellum.cryptolibprovider.CommitmentFunctions;
import io.vellum.utils.BytesUtils;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.macs.HMac;
import org.bouncycastle.crypto.params.KeyParameter;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Hierarchical derivation of every wallet secret from the {@link WalletSeed}.
 * All derivation steps are hardened: HMAC-SHA512 over the parent key and chain code.
 * Instances hold the master key and must be closed after the operation that needed them.
 */
public final class KeyChain implements AutoCloseable {
    private static final byte[] MASTER_DOMAIN = "Vellum seed".getBytes(StandardCharsets.UTF_8);
    private static final byte[] NONCE_DOMAIN = "Vellum/slate-nonce".getBytes(StandardCharsets.UTF_8);

    private final CommitmentFunctions functions;
    private final byte[] masterKey;
    private final byte[] masterChainCode;

    private KeyChain(CommitmentFunctions functions, byte[] masterKey, byte[] masterChainCode) {
        this.functions = functions;
        this.masterKey = masterKey;
        this.masterChainCode = masterChainCode;
    }

    public static KeyChain fromSeed(WalletSeed seed, CommitmentFunctions functions) {
        byte[] seedBytes = seed.bytes();
        byte[] digest = hmacSha512(MASTER_DOMAIN, seedBytes);
        try {
            byte[] key = functions.secretKeyFromBytes(Arrays.copyOfRange(digest, 0, 32));
            byte[] chainCode = Arrays.copyOfRange(digest, 32, 64);
            return new KeyChain(functions, key, chainCode);
        } finally {
            BytesUtils.wipe(seedBytes);
            BytesUtils.wipe(digest);
        }
    }

    public BlindingFactor deriveBlindingFactor(KeyId keyId) {
        byte[] key = Arrays.copyOf(masterKey, masterKey.length);
        byte[] chainCode = Arrays.copyOf(masterChainCode, masterChainCode.length);
        try {
            for (int level = 0; level < keyId.depth(); level++) {
                byte[] data = Bytes.concat(new byte[]{0x00}, key, Ints.toByteArray(keyId.index(level)));
                byte[] digest = hmacSha512(chainCode, data);
                byte[] tweak = Arrays.copyOfRange(digest, 0, 32);
                byte[] child = functions.sumSecretKeys(List.of(key, tweak), List.of());
                BytesUtils.wipe(key);
                BytesUtils.wipe(chainCode);
                BytesUtils.wipe(tweak);
                BytesUtils.wipe(data);
                key = child;
                chainCode = Arrays.copyOfRange(digest, 32, 64);
                BytesUtils.wipe(digest);
            }
            return new BlindingFactor(key);
        } finally {
            BytesUtils.wipe(key);
            BytesUtils.wipe(chainCode);
        }
    }

    public Commitment commit(KeyId keyId, long amount) {
        try (BlindingFactor blind = deriveBlindingFactor(keyId)) {
            byte[] blindBytes = blind.bytes();
            try {
                return functions.commit(amount, blindBytes);
            } finally {
                BytesUtils.wipe(blindBytes);
            }
        }
    }

    // Nonce bound to one slate. Reproducible by the same wallet, unpredictable for anybody else.
    public byte[] deriveNonce(UUID slateId) {
        ByteBuffer id = ByteBuffer.allocate(16);
        id.putLong(slateId.getMostSignificantBits());
        id.putLong(slateId.getLeastSignificantBits());
        byte[] digest = hmacSha512(masterKey, Bytes.concat(NONCE_DOMAIN, id.array()));
        try {
            return functions.secretKeyFromBytes(digest);
        } finally {
            BytesUtils.wipe(digest);
        }
    }

    @Override
    public void close() {
        BytesUtils.wipe(masterKey);
        BytesUtils.wipe(masterChainCode);
    }

    private static byte[] hmacSha512(byte[] key, byte[] data) {
        HMac hmac = new HMac(new SHA512Digest());
        hmac.init(new KeyParameter(key));
        hmac.update(data, 0, data.length);
        byte[] result = new byte[hmac.getMacSize()];
        hmac.doFinal(result, 0);
        return result;
    }
}
