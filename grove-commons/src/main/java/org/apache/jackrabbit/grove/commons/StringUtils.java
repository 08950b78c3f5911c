/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.jackrabbit.grove.commons;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import org.jetbrains.annotations.NotNull;

/**
 * Hex conversion helpers for object names.
 */
public final class StringUtils {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private StringUtils() {}

    /**
     * Convert a byte array to a lower case hex encoded string.
     *
     * @param value the byte array
     * @return the hex encoded string
     */
    @NotNull
    public static String convertBytesToHex(@NotNull byte[] value) {
        checkNotNull(value);
        return convertBytesToHex(value, 0, value.length);
    }

    /**
     * Convert a range of a byte array to a lower case hex encoded string.
     *
     * @param value the byte array
     * @param off first byte to convert
     * @param len number of bytes to convert
     * @return the hex encoded string, {@code 2 * len} characters long
     */
    @NotNull
    public static String convertBytesToHex(@NotNull byte[] value, int off, int len) {
        checkNotNull(value);
        checkArgument(off >= 0 && len >= 0 && off + len <= value.length,
                "range [%s, %s) outside of buffer of length %s", off, off + len, value.length);
        char[] buff = new char[len + len];
        for (int i = 0; i < len; i++) {
            int c = value[off + i] & 0xff;
            buff[i + i] = HEX[c >> 4];
            buff[i + i + 1] = HEX[c & 0xf];
        }
        return new String(buff);
    }

    /**
     * Convert a hex encoded string to a byte array.
     *
     * @param s the hex encoded string, upper or lower case
     * @return the byte array
     * @throws IllegalArgumentException if the string has an odd length or a
     *             character that is not a hex digit
     */
    @NotNull
    public static byte[] convertHexToBytes(@NotNull String s) {
        checkNotNull(s);
        int len = s.length();
        checkArgument(len % 2 == 0, "odd length hex string: %s", s);

        len /= 2;
        byte[] buff = new byte[len];
        for (int i = 0; i < len; i++) {
            buff[i] = (byte) ((getHexDigit(s, i + i) << 4) | getHexDigit(s, i + i + 1));
        }
        return buff;
    }

    /**
     * Whether every character of the string is a hex digit.
     */
    public static boolean isHex(@NotNull String s) {
        for (int i = 0; i < s.length(); i++) {
            if (hexValue(s.charAt(i)) < 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Convert the digit at the given position to a hex number.
     */
    public static int getHexDigit(String s, int i) {
        int v = hexValue(s.charAt(i));
        if (v < 0) {
            throw new IllegalArgumentException(s);
        }
        return v;
    }

    private static int hexValue(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        } else if (c >= 'a' && c <= 'f') {
            return c - 'a' + 0xa;
        } else if (c >= 'A' && c <= 'F') {
            return c - 'A' + 0xa;
        }
        return -1;
    }
}
