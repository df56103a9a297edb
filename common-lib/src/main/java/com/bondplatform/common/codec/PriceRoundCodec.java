package com.bondplatform.common.codec;

import com.bondplatform.common.exception.BondException;
import com.bondplatform.common.exception.ErrorCode;
import com.bondplatform.common.model.PriceRound;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.HexFormat;

/**
 * ABI codec for the relayed round payload.
 *
 * <p>Layout: five 32-byte big-endian words, 160 bytes in total.
 * <pre>
 *   word 0  uint80   roundId
 *   word 1  int256   answer           (two's complement)
 *   word 2  uint256  startedAt
 *   word 3  uint256  updatedAt
 *   word 4  uint80   answeredInRound
 * </pre>
 * Decoding is strict: wrong length, dirty padding above 80 bits and timestamps
 * beyond {@code Long.MAX_VALUE} are rejected with {@link ErrorCode#INVALID_PAYLOAD}.
 */
public final class PriceRoundCodec {

    public static final int WORD = 32;
    public static final int ENCODED_LENGTH = 5 * WORD;

    private static final String COMPONENT = "PriceRoundCodec";
    private static final BigInteger UINT80_LIMIT = BigInteger.ONE.shiftLeft(80);
    private static final BigInteger INT256_MAX = BigInteger.ONE.shiftLeft(255).subtract(BigInteger.ONE);
    private static final BigInteger INT256_MIN = BigInteger.ONE.shiftLeft(255).negate();
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    private PriceRoundCodec() {}

    public static byte[] encode(PriceRound round) {
        requireUint80(round.roundId(), "roundId");
        requireUint80(round.answeredInRound(), "answeredInRound");
        if (round.answer().compareTo(INT256_MAX) > 0 || round.answer().compareTo(INT256_MIN) < 0) {
            throw invalid("answer does not fit int256");
        }
        if (round.startedAt() < 0 || round.updatedAt() < 0) {
            throw invalid("timestamps must not be negative");
        }

        byte[] out = new byte[ENCODED_LENGTH];
        writeWord(out, 0, round.roundId());
        writeWord(out, WORD, round.answer());
        writeWord(out, 2 * WORD, BigInteger.valueOf(round.startedAt()));
        writeWord(out, 3 * WORD, BigInteger.valueOf(round.updatedAt()));
        writeWord(out, 4 * WORD, round.answeredInRound());
        return out;
    }

    public static PriceRound decode(byte[] payload) {
        if (payload == null || payload.length != ENCODED_LENGTH) {
            throw invalid("expected " + ENCODED_LENGTH + " bytes but got "
                + (payload == null ? "null" : payload.length));
        }
        BigInteger roundId = readUnsigned(payload, 0);
        BigInteger answer = new BigInteger(Arrays.copyOfRange(payload, WORD, 2 * WORD));
        BigInteger startedAt = readUnsigned(payload, 2 * WORD);
        BigInteger updatedAt = readUnsigned(payload, 3 * WORD);
        BigInteger answeredInRound = readUnsigned(payload, 4 * WORD);

        requireUint80(roundId, "roundId");
        requireUint80(answeredInRound, "answeredInRound");
        if (startedAt.compareTo(LONG_MAX) > 0 || updatedAt.compareTo(LONG_MAX) > 0) {
            throw invalid("timestamp out of range");
        }
        return new PriceRound(roundId, answer, startedAt.longValue(), updatedAt.longValue(), answeredInRound);
    }

    public static String encodeHex(PriceRound round) {
        return toHex(encode(round));
    }

    public static PriceRound decodeHex(String payload) {
        return decode(fromHex(payload));
    }

    public static String toHex(byte[] bytes) {
        return "0x" + HexFormat.of().formatHex(bytes);
    }

    public static byte[] fromHex(String hex) {
        if (hex == null) {
            throw invalid("payload is missing");
        }
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;
        try {
            return HexFormat.of().parseHex(digits);
        } catch (IllegalArgumentException e) {
            throw new BondException(COMPONENT, ErrorCode.INVALID_PAYLOAD, "payload is not hex", e);
        }
    }

    // ── word helpers ─────────────────────────────────────────────────────────

    private static void writeWord(byte[] out, int offset, BigInteger value) {
        byte[] raw = value.toByteArray();
        int start = 0;
        // positive values may carry one extra sign byte
        if (raw.length == WORD + 1 && raw[0] == 0) {
            start = 1;
        }
        int length = raw.length - start;
        if (length > WORD) {
            throw invalid("value does not fit a word");
        }
        byte pad = value.signum() < 0 ? (byte) 0xff : 0;
        Arrays.fill(out, offset, offset + WORD - length, pad);
        System.arraycopy(raw, start, out, offset + WORD - length, length);
    }

    private static BigInteger readUnsigned(byte[] payload, int offset) {
        return new BigInteger(1, Arrays.copyOfRange(payload, offset, offset + WORD));
    }

    private static void requireUint80(BigInteger value, String field) {
        if (value.signum() < 0 || value.compareTo(UINT80_LIMIT) >= 0) {
            throw invalid(field + " does not fit uint80");
        }
    }

    private static BondException invalid(String message) {
        return new BondException(COMPONENT, ErrorCode.INVALID_PAYLOAD, message);
    }
}
