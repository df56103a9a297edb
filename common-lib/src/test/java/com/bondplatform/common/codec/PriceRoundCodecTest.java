package com.bondplatform.common.codec;

import com.bondplatform.common.exception.BondException;
import com.bondplatform.common.exception.ErrorCode;
import com.bondplatform.common.model.PriceRound;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class PriceRoundCodecTest {

    private static final PriceRound ROUND = new PriceRound(
        new BigInteger("18446744073709551617"), BigInteger.valueOf(9_500_000_000_000L),
        1_700_000_000L, 1_700_000_060L, new BigInteger("18446744073709551617"));

    @Nested
    @DisplayName("encode()")
    class EncodeTests {

        @Test
        @DisplayName("five 32-byte words")
        void encodesFixedLength() {
            assertEquals(160, PriceRoundCodec.encode(ROUND).length);
        }

        @Test
        @DisplayName("roundId sits right-aligned in word 0")
        void roundIdWordLayout() {
            byte[] out = PriceRoundCodec.encode(new PriceRound(BigInteger.ONE, BigInteger.TEN, 1, 2, BigInteger.ONE));
            for (int i = 0; i < 31; i++) {
                assertEquals(0, out[i]);
            }
            assertEquals(1, out[31]);
            assertEquals(10, out[63]);
        }

        @Test
        @DisplayName("negative answer is sign-extended")
        void negativeAnswer() {
            byte[] out = PriceRoundCodec.encode(ROUND.withAnswer(BigInteger.valueOf(-1)));
            for (int i = 32; i < 64; i++) {
                assertEquals((byte) 0xff, out[i]);
            }
            assertEquals(BigInteger.valueOf(-1), PriceRoundCodec.decode(out).answer());
        }

        @Test
        @DisplayName("roundId beyond 80 bits → INVALID_PAYLOAD")
        void roundIdTooWide() {
            PriceRound wide = new PriceRound(BigInteger.ONE.shiftLeft(80), BigInteger.ONE, 1, 1, BigInteger.ONE);
            BondException e = assertThrows(BondException.class, () -> PriceRoundCodec.encode(wide));
            assertEquals(ErrorCode.INVALID_PAYLOAD, e.getCode());
        }
    }

    @Nested
    @DisplayName("decode()")
    class DecodeTests {

        @Test
        @DisplayName("decodes what encode produced")
        void decodesEncoded() {
            assertEquals(ROUND, PriceRoundCodec.decode(PriceRoundCodec.encode(ROUND)));
        }

        @Test
        @DisplayName("hex form with 0x prefix")
        void decodesHex() {
            String hex = PriceRoundCodec.encodeHex(ROUND);
            assertTrue(hex.startsWith("0x"));
            assertEquals(2 + 320, hex.length());
            assertEquals(ROUND, PriceRoundCodec.decodeHex(hex));
        }

        @Test
        @DisplayName("short payload → INVALID_PAYLOAD")
        void shortPayload() {
            BondException e = assertThrows(BondException.class, () -> PriceRoundCodec.decode(new byte[159]));
            assertEquals(ErrorCode.INVALID_PAYLOAD, e.getCode());
        }

        @Test
        @DisplayName("null payload → INVALID_PAYLOAD")
        void nullPayload() {
            BondException e = assertThrows(BondException.class, () -> PriceRoundCodec.decode(null));
            assertEquals(ErrorCode.INVALID_PAYLOAD, e.getCode());
        }

        @Test
        @DisplayName("dirty bits above uint80 in roundId → INVALID_PAYLOAD")
        void dirtyRoundIdPadding() {
            byte[] out = PriceRoundCodec.encode(ROUND);
            out[0] = 1;
            BondException e = assertThrows(BondException.class, () -> PriceRoundCodec.decode(out));
            assertEquals(ErrorCode.INVALID_PAYLOAD, e.getCode());
        }

        @Test
        @DisplayName("timestamp beyond Long.MAX_VALUE → INVALID_PAYLOAD")
        void hugeTimestamp() {
            byte[] out = PriceRoundCodec.encode(ROUND);
            Arrays.fill(out, 96, 128, (byte) 0xff);
            BondException e = assertThrows(BondException.class, () -> PriceRoundCodec.decode(out));
            assertEquals(ErrorCode.INVALID_PAYLOAD, e.getCode());
        }

        @Test
        @DisplayName("non-hex text → INVALID_PAYLOAD")
        void notHex() {
            BondException e = assertThrows(BondException.class, () -> PriceRoundCodec.decodeHex("0xzz"));
            assertEquals(ErrorCode.INVALID_PAYLOAD, e.getCode());
        }
    }
}
