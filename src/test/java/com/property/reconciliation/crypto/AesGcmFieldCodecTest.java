package com.property.reconciliation.crypto;

import com.property.reconciliation.TestKeys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Base64;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AES-GCM Field Codec Tests")
class AesGcmFieldCodecTest {

    private AesGcmFieldCodec codec;

    @BeforeEach
    void setUp() {
        codec = new AesGcmFieldCodec(KeyRing.of(TestKeys.key(1)));
    }

    @Nested
    @DisplayName("Round trip")
    class RoundTrip {

        @Test
        @DisplayName("1000 random addresses decrypt to the original text")
        void randomAddressesRoundTrip() {
            Random random = new Random(42);
            for (int i = 0; i < 1000; i++) {
                String address = randomText(random, 1 + random.nextInt(120));
                assertEquals(address, codec.decrypt(codec.encrypt(address)), "iteration " + i);
            }
        }

        @Test
        @DisplayName("Empty string and non-ASCII text survive")
        void edgeTexts() {
            assertEquals("", codec.decrypt(codec.encrypt("")));
            assertEquals("12 Rue de l'Église, Montréal", codec.decrypt(codec.encrypt("12 Rue de l'Église, Montréal")));
            assertEquals("東京都千代田区1-1", codec.decrypt(codec.encrypt("東京都千代田区1-1")));
        }

        @Test
        @DisplayName("Encrypting the same text twice yields different envelopes")
        void nonDeterministic() {
            String first = codec.encrypt("123 Main St");
            String second = codec.encrypt("123 Main St");
            assertNotEquals(first, second);
            assertEquals(codec.decrypt(first), codec.decrypt(second));
        }

        @Test
        @DisplayName("Envelope never contains the plaintext")
        void envelopeHidesPlaintext() {
            String envelope = codec.encrypt("742 Evergreen Terrace");
            assertFalse(envelope.contains("Evergreen"));
            assertTrue(envelope.contains("\"kid\""));
            assertTrue(envelope.contains(TestKeys.key(1).keyId()));
        }

        @Test
        @DisplayName("Null plaintext is rejected")
        void nullPlaintext() {
            assertThrows(NullPointerException.class, () -> codec.encrypt(null));
        }
    }

    @Nested
    @DisplayName("Key rotation")
    class Rotation {

        @Test
        @DisplayName("Values sealed with a prior key open after rotation")
        void priorKeyStillOpens() {
            AesGcmFieldCodec before = new AesGcmFieldCodec(KeyRing.of(TestKeys.key(1)));
            String sealed = before.encrypt("1 Old Key Rd");

            AesGcmFieldCodec after = new AesGcmFieldCodec(new KeyRing(TestKeys.key(2), List.of(TestKeys.key(1))));
            assertEquals("1 Old Key Rd", after.decrypt(sealed));
        }

        @Test
        @DisplayName("New values are sealed with the current key")
        void sealsWithCurrentKey() {
            AesGcmFieldCodec rotated = new AesGcmFieldCodec(new KeyRing(TestKeys.key(2), List.of(TestKeys.key(1))));
            String sealed = rotated.encrypt("2 New Key Ave");

            AesGcmFieldCodec currentOnly = new AesGcmFieldCodec(KeyRing.of(TestKeys.key(2)));
            assertEquals("2 New Key Ave", currentOnly.decrypt(sealed));
            AesGcmFieldCodec oldOnly = new AesGcmFieldCodec(KeyRing.of(TestKeys.key(1)));
            assertThrows(DecryptionException.class, () -> oldOnly.decrypt(sealed));
        }

        @Test
        @DisplayName("A value sealed with a retired key fails once the key is dropped")
        void droppedKeyFails() {
            String sealed = new AesGcmFieldCodec(KeyRing.of(TestKeys.key(1))).encrypt("3 Gone Blvd");
            AesGcmFieldCodec other = new AesGcmFieldCodec(KeyRing.of(TestKeys.key(3)));

            DecryptionException e = assertThrows(DecryptionException.class, () -> other.decrypt(sealed));
            assertFalse(e.getMessage().contains("Gone"));
        }
    }

    @Nested
    @DisplayName("Tampering and malformed input")
    class Tampering {

        @Test
        @DisplayName("A flipped ciphertext bit is detected")
        void flippedBit() {
            String envelope = codec.encrypt("9 Tamper Ct");
            CipherEnvelope parsed = CipherEnvelope.parse(envelope);
            byte[] ct = Base64.getDecoder().decode(parsed.ciphertext());
            ct[0] ^= 0x01;
            String tampered = new CipherEnvelope(parsed.keyId(), parsed.iv(),
                    Base64.getEncoder().encodeToString(ct)).toJson();

            assertThrows(DecryptionException.class, () -> codec.decrypt(tampered));
        }

        @Test
        @DisplayName("Plain text is not an envelope")
        void plainText() {
            assertThrows(DecryptionException.class, () -> codec.decrypt("123 Main St"));
        }

        @Test
        @DisplayName("Truncated JSON is malformed")
        void truncated() {
            String envelope = codec.encrypt("5 Cut Ln");
            assertThrows(DecryptionException.class,
                    () -> codec.decrypt(envelope.substring(0, envelope.length() / 2)));
        }

        @Test
        @DisplayName("Missing fields and bad Base64 are rejected")
        void incompleteEnvelope() {
            assertThrows(DecryptionException.class, () -> codec.decrypt("{\"kid\":\"x\"}"));
            assertThrows(DecryptionException.class, () -> codec.decrypt("{\"kid\":\"x\",\"iv\":\"%%\",\"ct\":\"%%\"}"));
            assertThrows(DecryptionException.class, () -> codec.decrypt(null));
        }

        @Test
        @DisplayName("A wrong IV length is rejected")
        void wrongIvLength() {
            String iv = Base64.getEncoder().encodeToString(new byte[8]);
            String ct = Base64.getEncoder().encodeToString(new byte[32]);
            assertThrows(DecryptionException.class,
                    () -> codec.decrypt(new CipherEnvelope("x", iv, ct).toJson()));
        }
    }

    @Nested
    @DisplayName("Keys")
    class Keys {

        @Test
        @DisplayName("Key material must be 32 bytes")
        void keyLength() {
            assertThrows(IllegalArgumentException.class, () -> EncryptionKey.of(new byte[16]));
            assertThrows(IllegalArgumentException.class, () -> EncryptionKey.fromBase64("not base64!"));
        }

        @Test
        @DisplayName("Key id is stable and does not expose the key")
        void keyId() {
            assertEquals(TestKeys.key(7).keyId(), EncryptionKey.fromBase64(TestKeys.base64(7)).keyId());
            assertNotEquals(TestKeys.key(7).keyId(), TestKeys.key(8).keyId());
            assertFalse(TestKeys.key(7).toString().contains(TestKeys.base64(7)));
        }

        @Test
        @DisplayName("Ring skips blank prior keys")
        void ringFromBase64() {
            KeyRing ring = KeyRing.fromBase64(TestKeys.base64(1), List.of(TestKeys.base64(2), " "));
            assertEquals(2, ring.size());
            assertEquals(TestKeys.key(1), ring.current());
            assertEquals(List.of(TestKeys.key(2)), ring.previous());
        }

        @Test
        @DisplayName("Opening order tries the matching key first, each key once")
        void openingOrder() {
            KeyRing ring = new KeyRing(TestKeys.key(1), List.of(TestKeys.key(2), TestKeys.key(3)));
            assertEquals(List.of(TestKeys.key(3), TestKeys.key(1), TestKeys.key(2)),
                    ring.openingOrder(TestKeys.key(3).keyId()));
            assertEquals(List.of(TestKeys.key(1), TestKeys.key(2), TestKeys.key(3)),
                    ring.openingOrder("unknown"));
        }
    }

    private static String randomText(Random random, int length) {
        StringBuilder sb = new StringBuilder(length);
        for (int i = 0; i < length; i++) {
            int kind = random.nextInt(10);
            if (kind < 7) {
                sb.append((char) (' ' + random.nextInt(95)));
            } else if (kind < 9) {
                sb.append((char) (0x00C0 + random.nextInt(0x0100)));
            } else {
                sb.append((char) (0x4E00 + random.nextInt(0x0500)));
            }
        }
        return sb.toString();
    }
}
