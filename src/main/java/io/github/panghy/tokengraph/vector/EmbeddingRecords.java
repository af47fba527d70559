package io.github.panghy.tokengraph.vector;

import com.google.protobuf.ByteString;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Timestamp;
import io.github.panghy.tokengraph.proto.EmbeddingRecord;
import io.github.panghy.tokengraph.util.BytePacker;
import java.time.Instant;
import java.util.concurrent.CompletionException;

/**
 * Conversions between vectors and {@link EmbeddingRecord} messages.
 */
final class EmbeddingRecords {
  private EmbeddingRecords() {}

  static EmbeddingRecord toRecord(
      long tokenId, String provider, int dimension, float[] vector, boolean quantize, Instant now) {
    EmbeddingRecord.Builder builder = EmbeddingRecord.newBuilder()
        .setTokenId(tokenId)
        .setProvider(provider)
        .setDimension(dimension)
        .setUpdatedAt(Timestamp.newBuilder().setSeconds(now.getEpochSecond()).setNanos(now.getNano()));
    if (quantize) {
      QuantizedVector qv = AffineQuantizer.quantize(vector);
      builder.setQuantized(true)
          .setScale(qv.scale())
          .setZero(qv.zero())
          .setData(ByteString.copyFrom(qv.q()));
    } else {
      builder.setData(ByteString.copyFrom(BytePacker.floatsToBytes(vector)));
    }
    return builder.build();
  }

  static float[] toVector(EmbeddingRecord record) {
    byte[] data = record.getData().toByteArray();
    if (record.getQuantized()) {
      return AffineQuantizer.dequantize(new QuantizedVector(data, record.getScale(), record.getZero()));
    }
    return BytePacker.bytesToFloats(data);
  }

  static EmbeddingRecord parse(byte[] bytes) {
    try {
      return EmbeddingRecord.parseFrom(bytes);
    } catch (InvalidProtocolBufferException e) {
      throw new CompletionException("Failed to parse embedding record", e);
    }
  }
}
