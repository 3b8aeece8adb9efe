package com.autoreports.sync.extract;

import com.autoreports.sync.config.Config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;

/**
 * Guesses the charset of job artifacts written by Windows tooling.
 * Order: byte-order mark, strict UTF-8, then Cyrillic single-byte scoring (windows-1251 vs IBM866).
 * Pure ASCII samples resolve to the configured fallback code page.
 */
public final class EncodingDetector {
    static final Charset CP1251 = Charset.forName("windows-1251");
    static final Charset CP866 = Charset.forName("IBM866");

    private final Charset fallback;
    private final int sniffBytes;

    public EncodingDetector(Charset fallback, int sniffBytes) {
        this.fallback = fallback == null ? CP1251 : fallback;
        this.sniffBytes = Math.max(64, sniffBytes);
    }

    public static EncodingDetector fromConfig(Config config) {
        return new EncodingDetector(
                Charset.forName(config.getString("encoding.fallback", "windows-1251")),
                config.getInt("encoding.sniff-bytes", 5000)
        );
    }

    public Charset detect(Path file) throws IOException {
        byte[] buffer = new byte[sniffBytes];
        int total = 0;
        try (InputStream in = Files.newInputStream(file)) {
            while (total < buffer.length) {
                int read = in.read(buffer, total, buffer.length - total);
                if (read < 0) {
                    break;
                }
                total += read;
            }
        }
        return detect(Arrays.copyOf(buffer, total), total < sniffBytes);
    }

    /**
     * @param complete whether {@code sample} is the whole content; a truncated sample may end mid-sequence
     */
    public Charset detect(byte[] sample, boolean complete) {
        if (sample == null || sample.length == 0) {
            return fallback;
        }
        Charset bom = fromBom(sample);
        if (bom != null) {
            return bom;
        }
        if (isAscii(sample)) {
            return fallback;
        }
        byte[] checked = complete ? sample : dropTrailingPartialSequence(sample);
        if (isStrictUtf8(checked)) {
            return StandardCharsets.UTF_8;
        }
        int score1251 = cyrillicScore(new String(sample, CP1251));
        int score866 = cyrillicScore(new String(sample, CP866));
        if (score866 > score1251) {
            return CP866;
        }
        if (score1251 > 0) {
            return CP1251;
        }
        return fallback;
    }

    /**
     * Reads the whole file with the detected charset.
     */
    public String readString(Path file) throws IOException {
        Charset charset = detect(file);
        String text = new String(Files.readAllBytes(file), charset);
        return stripBom(text);
    }

    static String stripBom(String text) {
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            return text.substring(1);
        }
        return text;
    }

    private static Charset fromBom(byte[] b) {
        if (b.length >= 3 && (b[0] & 0xFF) == 0xEF && (b[1] & 0xFF) == 0xBB && (b[2] & 0xFF) == 0xBF) {
            return StandardCharsets.UTF_8;
        }
        if (b.length >= 2 && (b[0] & 0xFF) == 0xFF && (b[1] & 0xFF) == 0xFE) {
            return StandardCharsets.UTF_16LE;
        }
        if (b.length >= 2 && (b[0] & 0xFF) == 0xFE && (b[1] & 0xFF) == 0xFF) {
            return StandardCharsets.UTF_16BE;
        }
        return null;
    }

    private static boolean isAscii(byte[] bytes) {
        for (byte b : bytes) {
            if ((b & 0x80) != 0) {
                return false;
            }
        }
        return true;
    }

    private static boolean isStrictUtf8(byte[] bytes) {
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            decoder.decode(ByteBuffer.wrap(bytes));
            return true;
        } catch (CharacterCodingException e) {
            return false;
        }
    }

    private static byte[] dropTrailingPartialSequence(byte[] bytes) {
        int end = bytes.length;
        int back = 0;
        while (back < 3 && end - back - 1 >= 0) {
            int b = bytes[end - back - 1] & 0xFF;
            if ((b & 0xC0) == 0x80) {
                back++;
                continue;
            }
            if ((b & 0xC0) == 0xC0) {
                int needed = (b & 0xE0) == 0xC0 ? 2 : (b & 0xF0) == 0xE0 ? 3 : 4;
                if (back + 1 < needed) {
                    return Arrays.copyOf(bytes, end - back - 1);
                }
            }
            break;
        }
        return bytes;
    }

    private static int cyrillicScore(String decoded) {
        int score = 0;
        for (int i = 0; i < decoded.length(); i++) {
            char c = decoded.charAt(i);
            if ((c >= 'а' && c <= 'я') || c == 'ё') {
                score += 2;
            } else if ((c >= 'А' && c <= 'Я') || c == 'Ё') {
                score += 1;
            } else if (c >= '\u2500' && c <= '\u259F') {
                score -= 3;
            } else if (c > 0x7F && !Character.isLetter(c)) {
                score -= 1;
            }
        }
        return score;
    }
}
