package com.exchangemetadata.infra.journal.writer;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.zip.CRC32;

/**
 * Line framing for journal segments: {@code <crc32 as 8 hex chars> <json>\n}.
 *
 * <p>Compact JSON never contains a raw newline, so a newline always ends a record.
 */
final class JournalFrames {
  private static final int CRC_LENGTH = 8;
  private static final byte NEWLINE = '\n';

  private JournalFrames() {}

  static byte[] encode(String json) {
    byte[] body = json.getBytes(StandardCharsets.UTF_8);
    String header = String.format(Locale.ROOT, "%08x ", crc(body, 0, body.length));
    byte[] headerBytes = header.getBytes(StandardCharsets.US_ASCII);
    byte[] frame = new byte[headerBytes.length + body.length + 1];
    System.arraycopy(headerBytes, 0, frame, 0, headerBytes.length);
    System.arraycopy(body, 0, frame, headerBytes.length, body.length);
    frame[frame.length - 1] = NEWLINE;
    return frame;
  }

  static SegmentScan scan(byte[] data) {
    List<Frame> frames = new ArrayList<>();
    int firstCorruptLine = -1;
    int lineNumber = 0;
    int position = 0;
    boolean tornTail = false;
    while (position < data.length) {
      int newline = indexOf(data, NEWLINE, position);
      if (newline < 0) {
        tornTail = true;
        break;
      }
      lineNumber++;
      String json = verify(data, position, newline);
      if (json != null) {
        frames.add(new Frame(lineNumber, position, json));
      } else if (firstCorruptLine < 0) {
        firstCorruptLine = lineNumber;
      }
      position = newline + 1;
    }
    long validLength = tornTail ? position : data.length;
    return new SegmentScan(List.copyOf(frames), validLength, tornTail, firstCorruptLine);
  }

  private static String verify(byte[] data, int start, int end) {
    int bodyStart = start + CRC_LENGTH + 1;
    if (bodyStart > end || data[start + CRC_LENGTH] != ' ') {
      return null;
    }
    String header = new String(data, start, CRC_LENGTH, StandardCharsets.US_ASCII);
    long expected;
    try {
      expected = Long.parseLong(header, 16);
    } catch (NumberFormatException ex) {
      return null;
    }
    if (expected != crc(data, bodyStart, end - bodyStart)) {
      return null;
    }
    return new String(data, bodyStart, end - bodyStart, StandardCharsets.UTF_8);
  }

  private static long crc(byte[] data, int offset, int length) {
    CRC32 crc32 = new CRC32();
    crc32.update(data, offset, length);
    return crc32.getValue();
  }

  private static int indexOf(byte[] data, byte value, int from) {
    for (int i = from; i < data.length; i++) {
      if (data[i] == value) {
        return i;
      }
    }
    return -1;
  }

  record Frame(int lineNumber, long offset, String json) {}

  record SegmentScan(
      List<Frame> frames, long validLength, boolean tornTail, int firstCorruptLine) {
    boolean corrupt() {
      return firstCorruptLine > 0;
    }
  }
}
