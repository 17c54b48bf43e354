package com.hbsparser;

import com.hbsparser.ast.SourceLocation;

import java.util.ArrayList;
import java.util.List;

/**
 * Maps source offsets to line/column positions.
 */
final class LineMap {
    private final int sourceLength;
    private final int[] lineOffsets; // Starting offset of each line

    LineMap(char[] sourceBuf) {
        this.sourceLength = sourceBuf.length;
        this.lineOffsets = buildLineOffsetIndex(sourceBuf);
    }

    // Built once per source (O(n))
    private static int[] buildLineOffsetIndex(char[] sourceBuf) {
        List<Integer> offsets = new ArrayList<>();
        offsets.add(0); // Line 1 starts at offset 0

        for (int i = 0; i < sourceBuf.length; i++) {
            char ch = sourceBuf[i];
            if (ch == '\n') {
                offsets.add(i + 1);
            } else if (ch == '\r') {
                // CRLF counts as one terminator
                if (i + 1 < sourceBuf.length && sourceBuf[i + 1] == '\n') {
                    i++;
                }
                offsets.add(i + 1);
            }
        }

        return offsets.stream().mapToInt(Integer::intValue).toArray();
    }

    // O(log n) binary search over line starts
    SourceLocation.Position positionOf(int offset) {
        offset = Math.max(0, Math.min(offset, sourceLength));

        int low = 0;
        int high = lineOffsets.length - 1;
        int line = 1;

        while (low <= high) {
            int mid = (low + high) / 2;
            if (lineOffsets[mid] <= offset) {
                line = mid + 1; // Lines are 1-indexed
                low = mid + 1;
            } else {
                high = mid - 1;
            }
        }

        return new SourceLocation.Position(line, offset - lineOffsets[line - 1]);
    }

    SourceLocation span(int start, int end) {
        return new SourceLocation(positionOf(start), positionOf(end));
    }

    TemplateSyntaxException error(String message, int offset) {
        SourceLocation.Position position = positionOf(offset);
        return new TemplateSyntaxException(message, offset, position.line(), position.column());
    }
}
