package org.nowstart.perpbot.service.auth;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.ByteArrayOutputStream;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.msgpack.jackson.dataformat.MessagePackFactory;
import org.nowstart.perpbot.data.dto.HyperliquidExchangeRequest;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

/**
 * Signs L1 exchange actions as an EIP-712 {@code Agent} message.
 */
@RequiredArgsConstructor
public class HyperliquidActionSigner {

    private static final ObjectMapper MSGPACK_MAPPER = new ObjectMapper(new MessagePackFactory());
    private static final byte[] DOMAIN_TYPE_HASH = keccak(
            "EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)"
    );
    private static final byte[] AGENT_TYPE_HASH = keccak("Agent(string source,bytes32 connectionId)");
    private static final long CHAIN_ID = 1337L;

    private final String privateKey;
    private final boolean testnet;

    public HyperliquidExchangeRequest sign(Map<String, Object> action, long nonce) {
        if (privateKey == null || privateKey.isBlank()) {
            throw new IllegalStateException("Exchange private key is not configured");
        }
        byte[] digest = typedDataDigest(connectionId(action, nonce));
        Sign.SignatureData signature = Sign.signMessage(digest, Credentials.create(privateKey).getEcKeyPair(), false);
        return new HyperliquidExchangeRequest(
                action,
                nonce,
                new HyperliquidExchangeRequest.Signature(
                        Numeric.toHexString(signature.getR()),
                        Numeric.toHexString(signature.getS()),
                        signature.getV()[0] & 0xff
                ),
                null
        );
    }

    public byte[] connectionId(Map<String, Object> action, long nonce) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        buffer.writeBytes(toMsgpack(action));
        buffer.writeBytes(ByteBuffer.allocate(Long.BYTES).putLong(nonce).array());
        // no vault address
        buffer.write(0);
        return Hash.sha3(buffer.toByteArray());
    }

    public byte[] typedDataDigest(byte[] connectionId) {
        byte[] structHash = Hash.sha3(concat(
                AGENT_TYPE_HASH,
                keccak(testnet ? "b" : "a"),
                connectionId
        ));
        return Hash.sha3(concat(new byte[]{0x19, 0x01}, domainSeparator(), structHash));
    }

    private static byte[] domainSeparator() {
        return Hash.sha3(concat(
                DOMAIN_TYPE_HASH,
                keccak("Exchange"),
                keccak("1"),
                Numeric.toBytesPadded(BigInteger.valueOf(CHAIN_ID), 32),
                new byte[32]
        ));
    }

    private static byte[] toMsgpack(Map<String, Object> action) {
        try {
            return MSGPACK_MAPPER.writeValueAsBytes(action);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode exchange action", e);
        }
    }

    private static byte[] keccak(String value) {
        return Hash.sha3(value.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] concat(byte[]... parts) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        for (byte[] part : parts) {
            buffer.writeBytes(part);
        }
        return buffer.toByteArray();
    }
}
