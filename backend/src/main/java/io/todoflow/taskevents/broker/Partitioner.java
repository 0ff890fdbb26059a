package io.todoflow.taskevents.broker;

import java.nio.charset.StandardCharsets;
import java.util.zip.CRC32;

/** Stable key-to-partition mapping, independent of JVM hash seeds. */
final class Partitioner {

  private Partitioner() {}

  static int partitionFor(String key, int partitionCount) {
    if (key == null) {
      return 0;
    }
    var crc = new CRC32();
    crc.update(key.getBytes(StandardCharsets.UTF_8));
    return (int) (crc.getValue() % partitionCount);
  }
}
