package io.github.panghy.tokengraph.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

/**
 * Uncompressed block layout.
 *
 * <pre>
 * u32 LE   header length H
 * H bytes  UTF-8 JSON header {"v":1,"tokenId":..,"part":..,"count":..,"cols":[..]}
 * u32[count] neighbor | u16[count] type | u32[count] weight | u32[count] lastSeen | [u8[count] flags]
 * </pre>
 *
 * All integers are little-endian.
 */
public final class RawEdgeBlockCodec implements EdgeBlockCodec {
  private static final ObjectMapper MAPPER =
      new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  @Override
  public String name() {
    return "raw";
  }

  @Override
  public byte[] encode(EdgeBlock block) {
    byte[] header;
    try {
      header = MAPPER.writeValueAsBytes(EdgeBlockHeader.describe(block));
    } catch (JsonProcessingException e) {
      throw new EdgeBlockEncodingException("Failed to write block header", e);
    }
    int count = block.count();
    int rowWidth = block.hasFlags() ? 15 : 14;
    ByteBuffer bb = ByteBuffer.allocate(4 + header.length + count * rowWidth).order(ByteOrder.LITTLE_ENDIAN);
    bb.putInt(header.length);
    bb.put(header);
    for (int i = 0; i < count; i++) bb.putInt((int) block.neighborAt(i));
    for (int i = 0; i < count; i++) bb.putShort((short) block.typeAt(i));
    for (int i = 0; i < count; i++) bb.putInt((int) block.weightAt(i));
    for (int i = 0; i < count; i++) bb.putInt((int) block.lastSeenAt(i));
    if (block.hasFlags()) {
      for (int i = 0; i < count; i++) bb.put((byte) (int) block.flagsAt(i));
    }
    return bb.array();
  }

  @Override
  public EdgeBlock decode(byte[] bytes) {
    if (bytes == null || bytes.length < 4) {
      throw new EdgeBlockEncodingException("Block too short for a header length prefix");
    }
    ByteBuffer bb = ByteBuffer.wrap(bytes).order(ByteOrder.LITTLE_ENDIAN);
    long headerLength = Integer.toUnsignedLong(bb.getInt());
    if (headerLength == 0 || headerLength > bb.remaining()) {
      throw new EdgeBlockEncodingException(
          "Declared header length " + headerLength + " does not fit " + bb.remaining() + " remaining bytes");
    }
    EdgeBlockHeader header = readHeader(bytes, (int) headerLength);
    bb.position(4 + (int) headerLength);

    int count = header.count();
    long needed = (long) count * header.rowWidth();
    if (needed > bb.remaining()) {
      throw new EdgeBlockEncodingException(
          "Declared count " + count + " needs " + needed + " bytes but only " + bb.remaining() + " remain");
    }
    long[] neighbor = new long[count];
    int[] type = new int[count];
    long[] weight = new long[count];
    long[] lastSeen = new long[count];
    int[] flags = header.hasFlags() ? new int[count] : null;
    try {
      for (int i = 0; i < count; i++) neighbor[i] = Integer.toUnsignedLong(bb.getInt());
      for (int i = 0; i < count; i++) type[i] = Short.toUnsignedInt(bb.getShort());
      for (int i = 0; i < count; i++) weight[i] = Integer.toUnsignedLong(bb.getInt());
      for (int i = 0; i < count; i++) lastSeen[i] = Integer.toUnsignedLong(bb.getInt());
      if (flags != null) {
        for (int i = 0; i < count; i++) flags[i] = Byte.toUnsignedInt(bb.get());
      }
    } catch (BufferUnderflowException e) {
      throw new EdgeBlockEncodingException("Block columns truncated", e);
    }
    return new EdgeBlock(header.tokenId(), header.part(), neighbor, type, weight, lastSeen, flags);
  }

  private static EdgeBlockHeader readHeader(byte[] bytes, int headerLength) {
    EdgeBlockHeader header;
    try {
      header = MAPPER.readValue(bytes, 4, headerLength, EdgeBlockHeader.class);
    } catch (IOException e) {
      throw new EdgeBlockEncodingException("Unreadable block header", e);
    }
    if (header.version() != EdgeBlockHeader.VERSION) {
      throw new EdgeBlockEncodingException("Unsupported block version " + header.version());
    }
    if (header.count() < 0 || header.count() > EdgeBlock.BLOCK_MAX) {
      throw new EdgeBlockEncodingException("Declared count out of range: " + header.count());
    }
    if (header.part() < 0) {
      throw new EdgeBlockEncodingException("Negative part number " + header.part());
    }
    if (!EdgeBlockHeader.BASE_COLUMNS.equals(header.cols()) && !header.hasFlags()) {
      throw new EdgeBlockEncodingException("Unknown column list " + header.cols());
    }
    return header;
  }
}
