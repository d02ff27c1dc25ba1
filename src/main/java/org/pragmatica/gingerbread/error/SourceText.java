package org.pragmatica.gingerbread.error;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Source text split into lines, translating UTF-8 byte offsets into line and column positions.
 */
final class SourceText {
    private final byte[] bytes;
    private final int[] lineStarts;
    private final List<String> lines;

    private SourceText(byte[] bytes, int[] lineStarts, List<String> lines) {
        this.bytes = bytes;
        this.lineStarts = lineStarts;
        this.lines = lines;
    }

    static SourceText of(String input) {
        var bytes = input.getBytes(StandardCharsets.UTF_8);
        var starts = new ArrayList<Integer>();
        starts.add(0);
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == '\n') {
                starts.add(i + 1);
            }
        }
        var lines = new ArrayList<String>(starts.size());
        for (int i = 0; i < starts.size(); i++) {
            int start = starts.get(i);
            int end = i + 1 < starts.size()
                      ? starts.get(i + 1) - 1
                      : bytes.length;
            if (end > start && bytes[end - 1] == '\r') {
                end--;
            }
            lines.add(new String(bytes, start, end - start, StandardCharsets.UTF_8));
        }
        return new SourceText(bytes, starts.stream().mapToInt(Integer::intValue).toArray(), lines);
    }

    int byteLength() {
        return bytes.length;
    }

    /**
     * Location of a byte offset. Offsets past the end are clamped to the end of the text.
     */
    SourceLocation locate(int offset) {
        int clamped = Math.max(0, Math.min(offset, bytes.length));
        int found = Arrays.binarySearch(lineStarts, clamped);
        int lineIdx = found >= 0 ? found : -found - 2;
        int column = 1 + codePoints(lineStarts[lineIdx], clamped);
        return SourceLocation.at(lineIdx + 1, column, clamped);
    }

    /**
     * Text of a 1-based line without its terminator.
     */
    String line(int line) {
        return lines.get(line - 1);
    }

    private int codePoints(int from, int to) {
        int count = 0;
        for (int i = from; i < to; i++) {
            if ((bytes[i] & 0xC0) != 0x80) {
                count++;
            }
        }
        return count;
    }
}
