package dev.wsrpc.transport;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Random;

import org.junit.jupiter.api.Test;

class FrameReassemblerTest {

    @Test
    void yieldsConcatenationOfFragmentsAndResets() {
        FrameReassembler reassembler = new FrameReassembler();
        byte[] first = "{\"method\":\"Ec".getBytes(StandardCharsets.UTF_8);
        byte[] second = "ho\",\"isReturn\":0,".getBytes(StandardCharsets.UTF_8);
        byte[] third = "\"arguments\":[\"hi\"]}".getBytes(StandardCharsets.UTF_8);

        reassembler.append(first, first.length, false);
        assertThat(reassembler.isComplete()).isFalse();
        reassembler.append(second, second.length, false);
        reassembler.append(third, third.length, true);
        assertThat(reassembler.isComplete()).isTrue();

        byte[] message = reassembler.extract();

        assertThat(new String(message, StandardCharsets.UTF_8))
            .isEqualTo("{\"method\":\"Echo\",\"isReturn\":0,\"arguments\":[\"hi\"]}");
        assertThat(reassembler.size()).isZero();
        assertThat(reassembler.isComplete()).isFalse();
    }

    @Test
    void onlyCopiesTheReadPortionOfTheBuffer() {
        FrameReassembler reassembler = new FrameReassembler();
        byte[] buffer = new byte[16];
        byte[] chunk = "abc".getBytes(StandardCharsets.UTF_8);
        System.arraycopy(chunk, 0, buffer, 0, chunk.length);

        reassembler.append(buffer, chunk.length, true);

        assertThat(reassembler.extract()).containsExactly(chunk);
    }

    @Test
    void randomFragmentationIsByteIdentical() {
        Random random = new Random(7);
        for (int round = 0; round < 50; round++) {
            byte[] payload = new byte[1 + random.nextInt(5000)];
            random.nextBytes(payload);

            FrameReassembler reassembler = new FrameReassembler(64);
            ByteArrayOutputStream expected = new ByteArrayOutputStream();
            int offset = 0;
            while (offset < payload.length) {
                int length = Math.min(payload.length - offset, 1 + random.nextInt(300));
                byte[] chunk = new byte[length];
                System.arraycopy(payload, offset, chunk, 0, length);
                offset += length;
                expected.write(chunk, 0, length);
                reassembler.append(chunk, length, offset == payload.length);
            }

            assertThat(reassembler.isComplete()).isTrue();
            assertThat(reassembler.extract()).isEqualTo(expected.toByteArray()).isEqualTo(payload);
            assertThat(reassembler.size()).isZero();
        }
    }

    @Test
    void extractBeforeEndOfMessageFails() {
        FrameReassembler reassembler = new FrameReassembler();
        reassembler.append(new byte[] {1, 2}, 2, false);

        assertThatThrownBy(reassembler::extract).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void emptyFinalFrameCompletesMessage() {
        FrameReassembler reassembler = new FrameReassembler();
        reassembler.append(new byte[] {1, 2}, 2, false);
        reassembler.append(new byte[8], 0, true);

        assertThat(reassembler.extract()).containsExactly(1, 2);
    }

    @Test
    void rejectsAppendAfterCompletionUntilExtracted() {
        FrameReassembler reassembler = new FrameReassembler();
        reassembler.append(new byte[] {1}, 1, true);

        assertThatThrownBy(() -> reassembler.append(new byte[] {2}, 1, true))
            .isInstanceOf(IllegalStateException.class);
    }
}
