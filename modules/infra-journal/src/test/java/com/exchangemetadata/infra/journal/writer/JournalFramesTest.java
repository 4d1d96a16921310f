package com.exchangemetadata.infra.journal.writer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class JournalFramesTest {
  @Test
  void shouldScanIntactFrames() {
    byte[] data = concat(JournalFrames.encode("{\"a\":1}"), JournalFrames.encode("{\"a\":2}"));

    JournalFrames.SegmentScan scan = JournalFrames.scan(data);

    assertEquals(2, scan.frames().size());
    assertEquals("{\"a\":2}", scan.frames().get(1).json());
    assertFalse(scan.tornTail());
    assertFalse(scan.corrupt());
    assertEquals(data.length, scan.validLength());
  }

  @Test
  void shouldTreatUnterminatedLastRecordAsTornTail() {
    byte[] first = JournalFrames.encode("{\"a\":1}");
    byte[] second = JournalFrames.encode("{\"a\":2}");
    byte[] data = concat(first, java.util.Arrays.copyOf(second, second.length - 3));

    JournalFrames.SegmentScan scan = JournalFrames.scan(data);

    assertTrue(scan.tornTail());
    assertEquals(first.length, scan.validLength());
    assertEquals(1, scan.frames().size());
  }

  @Test
  void shouldFlagChecksumMismatchBeforeTheTail() {
    byte[] corrupted = "00000000 {\"a\":1}\n".getBytes(StandardCharsets.UTF_8);
    byte[] data = concat(corrupted, JournalFrames.encode("{\"a\":2}"));

    JournalFrames.SegmentScan scan = JournalFrames.scan(data);

    assertTrue(scan.corrupt());
    assertEquals(1, scan.firstCorruptLine());
    assertFalse(scan.tornTail());
    assertEquals(1, scan.frames().size());
  }

  @Test
  void shouldFlagTerminatedChecksumMismatchOnLastLineAsCorruptNotTorn() {
    byte[] first = JournalFrames.encode("{\"a\":1}");
    byte[] corrupted = "00000000 {\"a\":2}\n".getBytes(StandardCharsets.UTF_8);
    byte[] data = concat(first, corrupted);

    JournalFrames.SegmentScan scan = JournalFrames.scan(data);

    assertTrue(scan.corrupt());
    assertEquals(2, scan.firstCorruptLine());
    assertFalse(scan.tornTail());
    assertEquals(data.length, scan.validLength());
  }

  private static byte[] concat(byte[]... parts) {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    for (byte[] part : parts) {
      out.writeBytes(part);
    }
    return out.toByteArray();
  }
}
