package com.polymarket.edge.infra;

import com.polymarket.edge.domain.Side;
import lombok.Builder;
import lombok.Value;
import org.springframework.stereotype.Component;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Builds and EIP-712 signs CTF Exchange orders for the Polymarket CLOB (Polygon).
 * <p>
 * Amounts are in 6-decimal base units. A BUY offers USDC ({@code makerAmount}) for
 * outcome tokens ({@code takerAmount}); a SELL is the reverse.
 */
@Component
public class OrderSigner {

    static final String EXCHANGE_ADDRESS = "0x4bFb41d5B3570DeFd03C39a9A4D8dE6Bd8B8982E";
    static final long CHAIN_ID = 137;
    static final String ZERO_ADDRESS = "0x0000000000000000000000000000000000000000";

    private static final BigDecimal BASE_UNITS = BigDecimal.valueOf(1_000_000);

    private static final byte[] DOMAIN_TYPEHASH = keccak(
            "EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)");
    private static final byte[] ORDER_TYPEHASH = keccak(
            "Order(uint256 salt,address maker,address signer,address taker,uint256 tokenId,uint256 makerAmount,"
                    + "uint256 takerAmount,uint256 expiration,uint256 nonce,uint256 feeRateBps,uint8 side,"
                    + "uint8 signatureType)");

    private final byte[] domainSeparator;

    public OrderSigner() {
        this.domainSeparator = keccak(concat(
                DOMAIN_TYPEHASH,
                keccak("Polymarket CTF Exchange"),
                keccak("1"),
                Numeric.toBytesPadded(BigInteger.valueOf(CHAIN_ID), 32),
                address(EXCHANGE_ADDRESS)));
    }

    @Value
    @Builder
    public static class ClobOrder {
        BigInteger salt;
        String maker;
        String signer;
        String taker;
        BigInteger tokenId;
        BigInteger makerAmount;
        BigInteger takerAmount;
        BigInteger expiration;
        BigInteger nonce;
        BigInteger feeRateBps;
        int side; // 0 = BUY, 1 = SELL
        int signatureType; // 0 = EOA
    }

    @Value
    public static class SignedOrder {
        ClobOrder order;
        String signature;
    }

    /**
     * Limit order for {@code size} shares at {@code price} from an EOA wallet.
     *
     * @throws IllegalArgumentException if either amount rounds to zero base units
     */
    public ClobOrder buildOrder(String tokenId, BigDecimal price, BigDecimal size, Side side, String wallet,
            long expirationEpochSeconds, long salt) {
        BigInteger shares = size.multiply(BASE_UNITS).setScale(0, RoundingMode.DOWN).toBigIntegerExact();
        BigInteger usdc = size.multiply(price).multiply(BASE_UNITS).setScale(0, RoundingMode.DOWN)
                .toBigIntegerExact();
        if (shares.signum() <= 0 || usdc.signum() <= 0) {
            throw new IllegalArgumentException("Order amounts must be positive: size=" + size + " price=" + price);
        }
        return ClobOrder.builder()
                .salt(BigInteger.valueOf(salt))
                .maker(wallet)
                .signer(wallet)
                .taker(ZERO_ADDRESS)
                .tokenId(new BigInteger(tokenId))
                .makerAmount(side.isBuy() ? usdc : shares)
                .takerAmount(side.isBuy() ? shares : usdc)
                .expiration(BigInteger.valueOf(expirationEpochSeconds))
                .nonce(BigInteger.ZERO)
                .feeRateBps(BigInteger.ZERO)
                .side(side.isBuy() ? 0 : 1)
                .signatureType(0)
                .build();
    }

    /** Signature is {@code r ‖ s ‖ v} (65 bytes) as 0x-prefixed hex. */
    public SignedOrder sign(ClobOrder order, Credentials credentials) {
        Sign.SignatureData sig = Sign.signMessage(digest(order), credentials.getEcKeyPair(), false);
        byte[] rsv = ByteBuffer.allocate(65)
                .put(sig.getR())
                .put(sig.getS())
                .put(sig.getV())
                .array();
        return new SignedOrder(order, Numeric.toHexString(rsv));
    }

    /** {@code keccak256("\x19\x01" ‖ domainSeparator ‖ hashStruct(order))}. */
    byte[] digest(ClobOrder order) {
        byte[] structHash = keccak(concat(
                ORDER_TYPEHASH,
                uint(order.getSalt()),
                address(order.getMaker()),
                address(order.getSigner()),
                address(order.getTaker()),
                uint(order.getTokenId()),
                uint(order.getMakerAmount()),
                uint(order.getTakerAmount()),
                uint(order.getExpiration()),
                uint(order.getNonce()),
                uint(order.getFeeRateBps()),
                uint(BigInteger.valueOf(order.getSide())),
                uint(BigInteger.valueOf(order.getSignatureType()))));
        return keccak(concat(new byte[] {0x19, 0x01}, domainSeparator, structHash));
    }

    private static byte[] uint(BigInteger value) {
        return Numeric.toBytesPadded(value, 32);
    }

    private static byte[] address(String hex) {
        return Numeric.toBytesPadded(Numeric.toBigInt(hex), 32);
    }

    private static byte[] keccak(String text) {
        return Hash.sha3(text.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] keccak(byte[] data) {
        return Hash.sha3(data);
    }

    private static byte[] concat(byte[]... parts) {
        int length = 0;
        for (byte[] part : parts) {
            length += part.length;
        }
        ByteBuffer buffer = ByteBuffer.allocate(length);
        for (byte[] part : parts) {
            buffer.put(part);
        }
        return buffer.array();
    }
}
