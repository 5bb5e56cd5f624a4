/*
 * Copyright (c) 2025 sffkit contributors. MIT License. See LICENSE file.
 */

package com.sffkit.codec;

import com.sffkit.SffException;

/**
 * LZ5 decoder (v2 format 4).
 *
 * <p>The stream is a sequence of packets. Before every group of eight packets
 * comes a control byte whose bits, lowest first, select the packet type:
 * <ul>
 *   <li>bit set: back reference. If the low six bits of the packet byte are
 *       zero it is the long form: {@code offset = (b << 2 | next) + 1},
 *       {@code length = next + 2}. Otherwise it is the short form:
 *       {@code length = b & 0x3F}, and the top two bits are stashed into a
 *       recycled byte. The first three short packets of a cycle read their
 *       offset from the next byte, the fourth uses the recycled byte.
 *       {@code length + 1} bytes are copied.</li>
 *   <li>bit clear: literal run. If the top three bits are zero it is the long
 *       form: value {@code b}, {@code length = next + 8}. Otherwise value
 *       {@code b & 0x1F}, {@code length = b >> 5}.</li>
 * </ul>
 */
public final class Lz5Codec {

    private Lz5Codec() {}

    /**
     * Bit state carried between packets.
     */
    public static final class Lz5State {
        private int control;
        private int controlBit;
        private int recycled;
        private int recycledCount;

        /**
         * Whether the next packet is a back reference. Loads a new control
         * byte at the start of every group of eight packets.
         */
        boolean nextIsCopy(ByteCursor in) throws SffException.DecodingFailed {
            if (controlBit == 0) {
                control = in.next();
            }
            return (control & (1 << controlBit)) != 0;
        }

        /** Move to the next control bit. */
        void advance() {
            controlBit = (controlBit + 1) & 7;
        }

        /**
         * Stash the top two bits of a short back-reference byte.
         *
         * @return true when four pairs have been collected and the recycled
         *         byte should be used as the offset
         */
        public boolean recycle(int packet) {
            recycled |= (packet & 0xC0) >> recycledCount;
            recycledCount += 2;
            return recycledCount >= 8;
        }

        /** Take the collected byte and start a new cycle. */
        public int takeRecycled() {
            int value = recycled;
            recycled = 0;
            recycledCount = 0;
            return value;
        }

        public int recycledCount() {
            return recycledCount;
        }

        public int controlBit() {
            return controlBit;
        }
    }

    /**
     * @return {@code width * height} palette indices
     * @throws SffException.DecodingFailed if the stream ends early or a back
     *         reference points before the start of the image
     */
    public static byte[] decode(byte[] source, int width, int height) throws SffException.DecodingFailed {
        byte[] pixels = new byte[Math.multiplyExact(width, height)];
        ByteCursor in = new ByteCursor(source, "LZ5");
        Lz5State state = new Lz5State();
        int dst = 0;

        while (dst < pixels.length) {
            boolean copy = state.nextIsCopy(in);
            int packet = in.next();

            if (copy) {
                int offset;
                int length;
                if ((packet & 0x3F) == 0) {
                    offset = ((packet << 2) | in.next()) + 1;
                    length = in.next() + 2;
                } else {
                    length = packet & 0x3F;
                    if (state.recycle(packet)) {
                        offset = state.takeRecycled() + 1;
                    } else {
                        offset = in.next() + 1;
                    }
                }

                if (dst - offset < 0) {
                    throw new SffException.DecodingFailed(String.format(
                            "LZ5 back reference of %d at output position %d", offset, dst));
                }
                for (int i = 0; i <= length && dst < pixels.length; i++) {
                    pixels[dst] = pixels[dst - offset];
                    dst++;
                }
            } else {
                int value;
                int length;
                if ((packet & 0xE0) == 0) {
                    value = packet;
                    length = in.next() + 8;
                } else {
                    value = packet & 0x1F;
                    length = packet >> 5;
                }
                for (int i = 0; i < length && dst < pixels.length; i++) {
                    pixels[dst++] = (byte) value;
                }
            }

            state.advance();
        }
        return pixels;
    }
}
