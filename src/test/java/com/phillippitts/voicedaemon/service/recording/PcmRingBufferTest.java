package com.phillippitts.voicedaemon.service.recording;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PcmRingBufferTest {

    @Test
    void keepsWritesInOrderWithinCapacity() {
        PcmRingBuffer buf = new PcmRingBuffer(8);
        buf.write(new byte[]{1, 2, 3, 4}, 0, 4);
        buf.write(new byte[]{5, 6, 7, 8}, 0, 4);

        assertThat(buf.toByteArray()).containsExactly(1, 2, 3, 4, 5, 6, 7, 8);
        assertThat(buf.isFull()).isTrue();
    }

    @Test
    void overflowKeepsNewestBytes() {
        PcmRingBuffer buf = new PcmRingBuffer(10);
        buf.write(new byte[]{1, 2, 3, 4, 5, 6, 7}, 0, 7);
        buf.write(new byte[]{11, 12, 13, 14, 15, 16, 17, 18}, 0, 8);

        assertThat(buf.toByteArray()).containsExactly(6, 7, 11, 12, 13, 14, 15, 16, 17, 18);
    }

    @Test
    void writeLargerThanCapacityKeepsTail() {
        PcmRingBuffer buf = new PcmRingBuffer(4);
        buf.write(new byte[]{1, 2, 3, 4, 5, 6}, 0, 6);

        assertThat(buf.toByteArray()).containsExactly(3, 4, 5, 6);
    }

    @Test
    void drainEmptiesBuffer() {
        PcmRingBuffer buf = new PcmRingBuffer(4);
        buf.write(new byte[]{9, 9}, 0, 2);

        assertThat(buf.drain()).containsExactly(9, 9);
        assertThat(buf.size()).isZero();
        assertThat(buf.toByteArray()).isEmpty();
    }

    @Test
    void honoursOffset() {
        PcmRingBuffer buf = new PcmRingBuffer(4);
        buf.write(new byte[]{0, 0, 7, 8}, 2, 2);

        assertThat(buf.toByteArray()).containsExactly(7, 8);
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThatThrownBy(() -> new PcmRingBuffer(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
