package com.heavyai.client.api.impl.ipc;

import com.heavyai.client.exception.HeavyClientErrorCode;
import com.heavyai.client.exception.HeavyClientException;
import com.heavyai.client.log.HeavyLogger;
import com.heavyai.client.log.HeavyLoggerFactory;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.channels.ReadableByteChannel;
import java.util.ArrayList;
import java.util.List;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.ValueVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.dictionary.Dictionary;
import org.apache.arrow.vector.dictionary.DictionaryEncoder;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.ipc.ArrowStreamReader;
import org.apache.arrow.vector.types.pojo.DictionaryEncoding;
import org.apache.arrow.vector.types.pojo.Field;
import org.apache.arrow.vector.types.pojo.FieldType;
import org.apache.arrow.vector.types.pojo.Schema;
import org.apache.arrow.vector.util.TransferPair;
import org.apache.arrow.vector.util.VectorSchemaRootAppender;

/**
 * Decodes an Arrow IPC stream into a single table owned by the caller.
 *
 * <p>Dictionary-encoded columns are replaced by their decoded values under the original column
 * name. When the stream holds several record batches they are concatenated in order. A stream
 * with a schema but no batches decodes to an empty table.
 */
public class ArrowStreamDecoder {

  private static final HeavyLogger LOGGER = HeavyLoggerFactory.getLogger(ArrowStreamDecoder.class);

  private final BufferAllocator allocator;

  public ArrowStreamDecoder(BufferAllocator allocator) {
    this.allocator = allocator;
  }

  public VectorSchemaRoot decode(byte[] stream) throws HeavyClientException {
    return decode(Channels.newChannel(new ByteArrayInputStream(stream)));
  }

  /**
   * Reads the stream to its end and closes the channel.
   *
   * @throws HeavyClientException with {@link HeavyClientErrorCode#ARROW_PARSING_ERROR} if the
   *     bytes are not a valid Arrow stream
   */
  public VectorSchemaRoot decode(ReadableByteChannel channel) throws HeavyClientException {
    VectorSchemaRoot result = null;
    try (ArrowStreamReader reader = new ArrowStreamReader(channel, allocator)) {
      VectorSchemaRoot batch = reader.getVectorSchemaRoot();
      int batchCount = 0;
      while (reader.loadNextBatch()) {
        VectorSchemaRoot decoded = decodeBatch(reader, batch);
        if (result == null) {
          result = decoded;
        } else {
          try (VectorSchemaRoot appended = decoded) {
            VectorSchemaRootAppender.append(result, appended);
          }
        }
        batchCount++;
      }
      if (result == null) {
        result = VectorSchemaRoot.create(decodedSchema(reader, batch.getSchema()), allocator);
      }
      LOGGER.debug(
          "Decoded Arrow stream: {} batches, {} rows x {} columns",
          batchCount,
          result.getRowCount(),
          result.getFieldVectors().size());
      return result;
    } catch (IOException | RuntimeException e) {
      if (result != null) {
        result.close();
      }
      LOGGER.error("Failed to decode Arrow stream: {}", e.getMessage(), e);
      throw new HeavyClientException(
          "Failed to decode Arrow stream: " + e.getMessage(),
          e,
          HeavyClientErrorCode.ARROW_PARSING_ERROR);
    }
  }

  /** Moves the reader's current batch into a new table, decoding dictionary columns. */
  private VectorSchemaRoot decodeBatch(DictionaryProvider dictionaries, VectorSchemaRoot batch) {
    List<FieldVector> vectors = new ArrayList<>(batch.getFieldVectors().size());
    try {
      for (FieldVector vector : batch.getFieldVectors()) {
        DictionaryEncoding encoding = vector.getField().getDictionary();
        if (encoding == null) {
          TransferPair transfer = vector.getTransferPair(allocator);
          transfer.transfer();
          vectors.add((FieldVector) transfer.getTo());
          continue;
        }
        Dictionary dictionary = dictionaries.lookup(encoding.getId());
        if (dictionary == null) {
          throw new IllegalStateException(
              "Missing dictionary " + encoding.getId() + " for column " + vector.getName());
        }
        try (ValueVector values = DictionaryEncoder.decode(vector, dictionary)) {
          TransferPair rename = values.getTransferPair(vector.getName(), allocator);
          rename.transfer();
          vectors.add((FieldVector) rename.getTo());
        }
      }
    } catch (RuntimeException e) {
      vectors.forEach(FieldVector::close);
      throw e;
    }
    List<Field> fields = new ArrayList<>(vectors.size());
    for (FieldVector vector : vectors) {
      fields.add(vector.getField());
    }
    return new VectorSchemaRoot(fields, vectors, batch.getRowCount());
  }

  private static Schema decodedSchema(DictionaryProvider dictionaries, Schema schema) {
    List<Field> fields = new ArrayList<>(schema.getFields().size());
    for (Field field : schema.getFields()) {
      DictionaryEncoding encoding = field.getDictionary();
      if (encoding == null) {
        fields.add(field);
      } else {
        FieldType valueType =
            new FieldType(
                field.isNullable(), dictionaries.lookup(encoding.getId()).getVectorType(), null);
        fields.add(new Field(field.getName(), valueType, null));
      }
    }
    return new Schema(fields);
  }
}
