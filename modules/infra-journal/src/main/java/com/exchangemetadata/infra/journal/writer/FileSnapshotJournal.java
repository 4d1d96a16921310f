package com.exchangemetadata.infra.journal.writer;

import com.exchangemetadata.domain.metadata.ResourceKind;
import com.exchangemetadata.domain.metadata.ResourceSnapshot;
import com.exchangemetadata.infra.journal.contract.JournalAck;
import com.exchangemetadata.infra.journal.contract.JournalEntry;
import com.exchangemetadata.infra.journal.observability.JournalTelemetry;
import com.exchangemetadata.infra.journal.serde.JournalEntryJsonCodec;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class FileSnapshotJournal implements SnapshotJournal, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(FileSnapshotJournal.class);
  private static final String SEGMENT_SUFFIX = ".log";

  private final Path baseDir;
  private final boolean fsync;
  private final long maxSegmentBytes;
  private final JournalEntryJsonCodec codec;
  private final JournalTelemetry telemetry;
  private final Clock clock;
  private final Map<ResourceKind, KindLog> logs = new EnumMap<>(ResourceKind.class);

  public FileSnapshotJournal(
      Path baseDir,
      boolean fsync,
      long maxSegmentBytes,
      JournalEntryJsonCodec codec,
      JournalTelemetry telemetry,
      Clock clock) {
    this.baseDir = Objects.requireNonNull(baseDir, "baseDir must not be null");
    this.codec = Objects.requireNonNull(codec, "codec must not be null");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry must not be null");
    this.clock = Objects.requireNonNull(clock, "clock must not be null");
    if (maxSegmentBytes <= 0) {
      throw new IllegalArgumentException("maxSegmentBytes must be > 0");
    }
    this.fsync = fsync;
    this.maxSegmentBytes = maxSegmentBytes;
    for (ResourceKind kind : ResourceKind.values()) {
      logs.put(kind, new KindLog(kind, baseDir.resolve(kind.slug())));
    }
  }

  @Override
  public JournalAck append(ResourceSnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot must not be null");
    KindLog kindLog = logs.get(snapshot.kind());
    long startedAt = System.nanoTime();
    kindLog.lock.lock();
    try {
      JournalAck ack = kindLog.append(snapshot);
      telemetry.onAppendSuccess(
          snapshot.kind(), (int) Math.min(Integer.MAX_VALUE, kindLog.lastFrameBytes),
          System.nanoTime() - startedAt);
      return ack;
    } catch (JournalWriteException ex) {
      telemetry.onAppendFailure(snapshot.kind(), ex);
      throw ex;
    } finally {
      kindLog.lock.unlock();
    }
  }

  @Override
  public List<JournalEntry> read(ResourceKind kind) {
    KindLog kindLog = logs.get(Objects.requireNonNull(kind, "kind must not be null"));
    kindLog.lock.lock();
    try {
      kindLog.ensureOpen();
      List<JournalEntry> entries = new ArrayList<>();
      for (Path segment : kindLog.segments()) {
        entries.addAll(kindLog.readSegment(segment));
      }
      return entries;
    } catch (IOException ex) {
      throw new JournalReadException(kind, null, "Failed to read journal for " + kind, ex);
    } finally {
      kindLog.lock.unlock();
    }
  }

  @Override
  public Optional<JournalEntry> findLatest(ResourceKind kind, Predicate<JournalEntry> filter) {
    KindLog kindLog = logs.get(Objects.requireNonNull(kind, "kind must not be null"));
    Objects.requireNonNull(filter, "filter must not be null");
    kindLog.lock.lock();
    try {
      kindLog.ensureOpen();
      List<Path> segments = new ArrayList<>(kindLog.segments());
      Collections.reverse(segments);
      for (Path segment : segments) {
        List<JournalEntry> entries = kindLog.readSegment(segment);
        for (int i = entries.size() - 1; i >= 0; i--) {
          if (filter.test(entries.get(i))) {
            return Optional.of(entries.get(i));
          }
        }
      }
      return Optional.empty();
    } catch (IOException ex) {
      throw new JournalReadException(kind, null, "Failed to read journal for " + kind, ex);
    } finally {
      kindLog.lock.unlock();
    }
  }

  @Override
  public OptionalLong lastSequence(ResourceKind kind) {
    KindLog kindLog = logs.get(Objects.requireNonNull(kind, "kind must not be null"));
    kindLog.lock.lock();
    try {
      kindLog.ensureOpen();
      return kindLog.lastSequence > 0 ? OptionalLong.of(kindLog.lastSequence) : OptionalLong.empty();
    } catch (IOException ex) {
      throw new JournalReadException(kind, null, "Failed to open journal for " + kind, ex);
    } finally {
      kindLog.lock.unlock();
    }
  }

  public Path baseDir() {
    return baseDir;
  }

  @Override
  public void close() {
    for (KindLog kindLog : logs.values()) {
      kindLog.lock.lock();
      try {
        kindLog.closeChannel();
      } finally {
        kindLog.lock.unlock();
      }
    }
  }

  private static String segmentName(long firstSequence) {
    return String.format("%020d", firstSequence) + SEGMENT_SUFFIX;
  }

  private final class KindLog {
    private final ReentrantLock lock = new ReentrantLock();
    private final ResourceKind kind;
    private final Path directory;
    private boolean opened;
    private FileChannel channel;
    private Path currentSegment;
    private long currentSize;
    private long lastSequence;
    private long lastFrameBytes;

    private KindLog(ResourceKind kind, Path directory) {
      this.kind = kind;
      this.directory = directory;
    }

    private JournalAck append(ResourceSnapshot snapshot) {
      long sequence = snapshot.sequence();
      try {
        ensureOpen();
      } catch (IOException | RuntimeException ex) {
        throw new JournalWriteException(
            kind, sequence, "Failed to open journal for " + kind + ": " + ex.getMessage(), ex);
      }
      if (sequence <= lastSequence) {
        throw new JournalWriteException(
            kind,
            sequence,
            "Sequence "
                + sequence
                + " is not greater than last journaled sequence "
                + lastSequence
                + " for "
                + kind);
      }

      JournalEntry entry = new JournalEntry(snapshot, clock.instant());
      byte[] frame;
      try {
        frame = JournalFrames.encode(codec.encode(entry));
      } catch (IllegalStateException ex) {
        throw new JournalWriteException(kind, sequence, ex.getMessage(), ex);
      }

      long position = 0L;
      try {
        if (channel == null || (currentSize > 0 && currentSize + frame.length > maxSegmentBytes)) {
          rollTo(sequence);
        }
        position = currentSize;
        ByteBuffer buffer = ByteBuffer.wrap(frame);
        while (buffer.hasRemaining()) {
          channel.write(buffer);
        }
        if (fsync) {
          channel.force(false);
        }
      } catch (IOException ex) {
        // Reopen on the next append so recovery discards whatever part of the frame was written.
        closeChannel();
        opened = false;
        throw new JournalWriteException(
            kind, sequence, "Failed to append " + kind + "#" + sequence + ": " + ex.getMessage(), ex);
      }
      currentSize += frame.length;
      lastSequence = sequence;
      lastFrameBytes = frame.length;
      return new JournalAck(
          kind, sequence, entry.writtenAt(), currentSegment.getFileName().toString(), position);
    }

    private void ensureOpen() throws IOException {
      if (opened) {
        return;
      }
      Files.createDirectories(directory);
      List<Path> segments = segments();
      lastSequence = 0L;
      currentSize = 0L;
      currentSegment = null;
      if (!segments.isEmpty()) {
        Path newest = segments.get(segments.size() - 1);
        recoverTail(newest);
        currentSegment = newest;
        currentSize = Files.size(newest);
        for (int i = segments.size() - 1; i >= 0 && lastSequence == 0L; i--) {
          lastSequence = lastValidSequence(segments.get(i));
        }
        channel = openChannel(newest);
      }
      opened = true;
      log.info(
          "Journal opened kind={} dir={} segments={} lastSequence={}",
          kind,
          directory,
          segments.size(),
          lastSequence);
    }

    private void recoverTail(Path segment) throws IOException {
      JournalFrames.SegmentScan scan = JournalFrames.scan(Files.readAllBytes(segment));
      if (!scan.tornTail()) {
        return;
      }
      long size = Files.size(segment);
      long discarded = size - scan.validLength();
      try (FileChannel truncating = FileChannel.open(segment, StandardOpenOption.WRITE)) {
        truncating.truncate(scan.validLength());
        truncating.force(true);
      }
      telemetry.onTailTruncated(kind, discarded);
      log.warn(
          "Truncated torn journal tail kind={} segment={} validBytes={} discardedBytes={}",
          kind,
          segment.getFileName(),
          scan.validLength(),
          discarded);
    }

    private long lastValidSequence(Path segment) throws IOException {
      JournalFrames.SegmentScan scan = JournalFrames.scan(Files.readAllBytes(segment));
      if (scan.corrupt()) {
        log.error(
            "Corrupt journal record kind={} segment={} line={}",
            kind,
            segment.getFileName(),
            scan.firstCorruptLine());
      }
      List<JournalFrames.Frame> frames = scan.frames();
      for (int i = frames.size() - 1; i >= 0; i--) {
        try {
          return codec.decode(frames.get(i).json()).sequence();
        } catch (IllegalStateException ex) {
          log.warn(
              "Undecodable journal record kind={} segment={} line={} reason={}",
              kind,
              segment.getFileName(),
              frames.get(i).lineNumber(),
              ex.getMessage());
        }
      }
      return 0L;
    }

    private List<JournalEntry> readSegment(Path segment) throws IOException {
      JournalFrames.SegmentScan scan = JournalFrames.scan(Files.readAllBytes(segment));
      String segmentName = segment.getFileName().toString();
      if (scan.corrupt() || scan.tornTail()) {
        int line = scan.corrupt() ? scan.firstCorruptLine() : scan.frames().size() + 1;
        throw new JournalReadException(
            kind,
            segmentName,
            "Corrupt journal record for " + kind + " in " + segmentName + " at line " + line,
            null);
      }
      List<JournalEntry> entries = new ArrayList<>(scan.frames().size());
      for (JournalFrames.Frame frame : scan.frames()) {
        try {
          entries.add(codec.decode(frame.json()));
        } catch (IllegalStateException ex) {
          throw new JournalReadException(
              kind,
              segmentName,
              "Undecodable journal record for "
                  + kind
                  + " in "
                  + segmentName
                  + " at line "
                  + frame.lineNumber(),
              ex);
        }
      }
      return entries;
    }

    private List<Path> segments() throws IOException {
      if (!Files.isDirectory(directory)) {
        return List.of();
      }
      try (Stream<Path> files = Files.list(directory)) {
        return files
            .filter(path -> path.getFileName().toString().endsWith(SEGMENT_SUFFIX))
            .sorted()
            .toList();
      }
    }

    private void rollTo(long firstSequence) throws IOException {
      closeChannel();
      currentSegment = directory.resolve(segmentName(firstSequence));
      channel = openChannel(currentSegment);
      currentSize = channel.size();
      if (fsync) {
        // Persist the directory entry of the new segment.
        forceDirectory();
      }
      log.info("Journal segment started kind={} segment={}", kind, currentSegment.getFileName());
    }

    private FileChannel openChannel(Path segment) throws IOException {
      return FileChannel.open(
          segment, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    }

    private void forceDirectory() {
      try (FileChannel dir = FileChannel.open(directory, StandardOpenOption.READ)) {
        dir.force(true);
      } catch (IOException ex) {
        // Not every platform allows opening a directory as a channel.
        log.debug("Directory fsync unsupported dir={} reason={}", directory, ex.getMessage());
      }
    }

    private void closeChannel() {
      if (channel == null) {
        return;
      }
      try {
        channel.close();
      } catch (IOException ex) {
        log.warn("Failed to close journal segment kind={} reason={}", kind, ex.getMessage());
      } finally {
        channel = null;
      }
    }
  }
}
