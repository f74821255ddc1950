package io.vellum.cryptolibprovider;

import com.google.common.primitives.Ints;
import io.vellum.crypto.Commitment;
import io.vellum.crypto.PublicKey;
import io.vellum.crypto.Signature;
import io.vellum.utils.BytesUtils;
import org.bouncycastle.asn1.x9.X9ECParameters;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.ec.CustomNamedCurves;
import org.bouncycastle.math.ec.ECCurve;
import org.bouncycastle.math.ec.ECPoint;
import org.bouncycastle.math.ec.FixedPointCombMultiplier;
import org.bouncycastle.util.BigIntegers;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.List;

public class Secp256k1CommitmentFunctions implements CommitmentFunctions {
    private static final int SCALAR_LENGTH = 32;
    private static final byte[] GENERATOR_H_DOMAIN = "Vellum/generator/H".getBytes(StandardCharsets.UTF_8);

    private final X9ECParameters params = CustomNamedCurves.getByName("secp256k1");
    private final ECCurve curve = params.getCurve();
    private final BigInteger order = params.getN();
    private final ECPoint g = params.getG();
    private final ECPoint h;
    private final FixedPointCombMultiplier multiplier = new FixedPointCombMultiplier();
    private final SecureRandom random = new SecureRandom();

    public Secp256k1CommitmentFunctions() {
        this.h = deriveGeneratorH();
    }

    // Second generator with unknown discrete log relative to G: first valid x-coordinate in a hash chain.
    private ECPoint deriveGeneratorH() {
        for (int counter = 0; ; counter++) {
            byte[] x = sha256(GENERATOR_H_DOMAIN, Ints.toByteArray(counter));
            byte[] encoded = new byte[SCALAR_LENGTH + 1];
            encoded[0] = 0x02;
            System.arraycopy(x, 0, encoded, 1, SCALAR_LENGTH);
            try {
                ECPoint candidate = curve.decodePoint(encoded);
                if (candidate.isValid())
                    return candidate.normalize();
            } catch (IllegalArgumentException e) {
                // not on the curve, try the next counter
            }
        }
    }

    @Override
    public int secretKeyLength() {
        return SCALAR_LENGTH;
    }

    @Override
    public byte[] generateSecretKey() {
        BigInteger k;
        do {
            k = BigIntegers.createRandomBigInteger(order.bitLength(), random);
        } while (k.signum() == 0 || k.compareTo(order) >= 0);
        return toScalarBytes(k);
    }

    @Override
    public byte[] secretKeyFromBytes(byte[] material) {
        byte[] digest = sha256(material);
        BigInteger k = new BigInteger(1, digest).mod(order);
        while (k.signum() == 0) {
            digest = sha256(digest);
            k = new BigInteger(1, digest).mod(order);
        }
        return toScalarBytes(k);
    }

    @Override
    public byte[] sumSecretKeys(List<byte[]> positive, List<byte[]> negative) {
        BigInteger sum = BigInteger.ZERO;
        for (byte[] key : positive)
            sum = sum.add(toScalar(key));
        for (byte[] key : negative)
            sum = sum.subtract(toScalar(key));
        return toScalarBytes(sum.mod(order));
    }

    @Override
    public PublicKey publicKey(byte[] secretKey) {
        return new PublicKey(encode(multiplyG(toScalar(secretKey))));
    }

    @Override
    public PublicKey sumPublicKeys(List<PublicKey> publicKeys) {
        if (publicKeys.isEmpty())
            throw new IllegalArgumentException("At least one public key expected");
        ECPoint sum = curve.getInfinity();
        for (PublicKey key : publicKeys)
            sum = sum.add(decode(key.toBytes()));
        return new PublicKey(encode(sum));
    }

    @Override
    public Commitment commit(long value, byte[] blindingFactor) {
        if (value < 0)
            throw new IllegalArgumentException("Committed value must be >= 0.");
        ECPoint point = multiplyG(toScalar(blindingFactor)).add(h.multiply(BigInteger.valueOf(value)));
        return new Commitment(encode(point));
    }

    @Override
    public boolean isBalanced(List<Commitment> outputs, List<Commitment> inputs, long value, PublicKey excess, byte[] offset) {
        try {
            ECPoint lhs = curve.getInfinity();
            for (Commitment output : outputs)
                lhs = lhs.add(decode(output.toBytes()));
            for (Commitment input : inputs)
                lhs = lhs.subtract(decode(input.toBytes()));
            lhs = lhs.add(h.multiply(BigInteger.valueOf(value).mod(order)));

            ECPoint rhs = decode(excess.toBytes()).add(multiplyG(toScalar(offset)));
            return lhs.normalize().equals(rhs.normalize());
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    @Override
    public boolean isValidPublicKey(byte[] encoded) {
        if (encoded == null || encoded.length != PublicKey.LENGTH)
            return false;
        try {
            decode(encoded);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    @Override
    public Signature signPartial(byte[] secretKey, byte[] secretNonce, PublicKey aggregateNonce, PublicKey aggregateExcess, byte[] message) {
        BigInteger e = challenge(aggregateNonce, aggregateExcess, message);
        BigInteger s = toScalar(secretNonce).add(e.multiply(toScalar(secretKey))).mod(order);
        return toSignature(aggregateNonce, s);
    }

    @Override
    public boolean verifyPartial(Signature partialSignature, PublicKey publicNonce, PublicKey publicExcess, PublicKey aggregateExcess, byte[] message) {
        try {
            byte[] bytes = partialSignature.toBytes();
            PublicKey aggregateNonce = new PublicKey(Arrays.copyOfRange(bytes, 0, PublicKey.LENGTH));
            BigInteger s = new BigInteger(1, Arrays.copyOfRange(bytes, PublicKey.LENGTH, Signature.LENGTH));
            if (s.compareTo(order) >= 0)
                return false;
            BigInteger e = challenge(aggregateNonce, aggregateExcess, message);

            ECPoint lhs = multiplyG(s);
            ECPoint rhs = decode(publicNonce.toBytes()).add(decode(publicExcess.toBytes()).multiply(e));
            return lhs.normalize().equals(rhs.normalize());
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    @Override
    public Signature aggregateSignatures(List<Signature> partialSignatures, PublicKey aggregateNonce) {
        BigInteger s = BigInteger.ZERO;
        byte[] nonceBytes = aggregateNonce.toBytes();
        for (Signature partial : partialSignatures) {
            byte[] bytes = partial.toBytes();
            if (!Arrays.equals(nonceBytes, Arrays.copyOfRange(bytes, 0, PublicKey.LENGTH)))
                throw new IllegalArgumentException("Partial signature was not created over the aggregate nonce");
            s = s.add(new BigInteger(1, Arrays.copyOfRange(bytes, PublicKey.LENGTH, Signature.LENGTH)));
        }
        return toSignature(aggregateNonce, s.mod(order));
    }

    @Override
    public Signature sign(byte[] secretKey, byte[] message) {
        byte[] nonce = generateSecretKey();
        try {
            PublicKey publicNonce = publicKey(nonce);
            return signPartial(secretKey, nonce, publicNonce, publicKey(secretKey), message);
        } finally {
            BytesUtils.wipe(nonce);
        }
    }

    @Override
    public boolean verify(Signature signature, PublicKey publicKey, byte[] message) {
        byte[] bytes = signature.toBytes();
        byte[] nonceBytes = Arrays.copyOfRange(bytes, 0, PublicKey.LENGTH);
        if (!isValidPublicKey(nonceBytes))
            return false;
        return verifyPartial(signature, new PublicKey(nonceBytes), publicKey, publicKey, message);
    }

    private BigInteger challenge(PublicKey aggregateNonce, PublicKey aggregateExcess, byte[] message) {
        return new BigInteger(1, sha256(aggregateNonce.toBytes(), aggregateExcess.toBytes(), message)).mod(order);
    }

    private Signature toSignature(PublicKey nonce, BigInteger s) {
        byte[] bytes = new byte[Signature.LENGTH];
        System.arraycopy(nonce.toBytes(), 0, bytes, 0, PublicKey.LENGTH);
        System.arraycopy(toScalarBytes(s), 0, bytes, PublicKey.LENGTH, SCALAR_LENGTH);
        return new Signature(bytes);
    }

    private ECPoint multiplyG(BigInteger k) {
        return multiplier.multiply(g, k);
    }

    private ECPoint decode(byte[] encoded) {
        ECPoint point = curve.decodePoint(encoded);
        if (point.isInfinity() || !point.isValid())
            throw new IllegalArgumentException("Point is not a valid curve point");
        return point;
    }

    private byte[] encode(ECPoint point) {
        if (point.isInfinity())
            throw new IllegalArgumentException("Point at infinity can't be encoded");
        return point.normalize().getEncoded(true);
    }

    private BigInteger toScalar(byte[] bytes) {
        if (bytes == null || bytes.length != SCALAR_LENGTH)
            throw new IllegalArgumentException(String.format("Incorrect scalar length, %d expected", SCALAR_LENGTH));
        return new BigInteger(1, bytes).mod(order);
    }

    private byte[] toScalarBytes(BigInteger k) {
        return BigIntegers.asUnsignedByteArray(SCALAR_LENGTH, k);
    }

    private static byte[] sha256(byte[]... parts) {
        SHA256Digest digest = new SHA256Digest();
        for (byte[] part : parts)
            digest.update(part, 0, part.length);
        byte[] out = new byte[digest.getDigestSize()];
        digest.doFinal(out, 0);
        return out;
    }
}
