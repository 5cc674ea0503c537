package com.flamingo.ai.ephemeralrag.service.export;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.flamingo.ai.ephemeralrag.domain.enums.ContentKind;
import com.flamingo.ai.ephemeralrag.domain.model.Chunk;
import com.flamingo.ai.ephemeralrag.store.SessionSnapshot;
import java.io.IOException;
import java.io.OutputStream;

/**
 * An export bound to a session snapshot. Records are serialized one at a time while streaming, so
 * the whole payload is never held in memory.
 */
public class SessionExport {

  private final SessionSnapshot snapshot;
  private final ExportFormat format;
  private final ContentKind kind;
  private final boolean includeVectors;
  private final String embeddingModel;
  private final ObjectMapper objectMapper;

  SessionExport(
      SessionSnapshot snapshot,
      ExportFormat format,
      ContentKind kind,
      boolean includeVectors,
      String embeddingModel,
      ObjectMapper objectMapper) {
    this.snapshot = snapshot;
    this.format = format;
    this.kind = kind;
    this.includeVectors = includeVectors;
    this.embeddingModel = embeddingModel;
    this.objectMapper = objectMapper;
  }

  public ExportFormat getFormat() {
    return format;
  }

  public String getFileName() {
    return "session-" + snapshot.sessionId() + "." + format.getExtension();
  }

  /**
   * Writes the export. The stream is flushed but not closed.
   *
   * @return the number of records written
   */
  public int writeTo(OutputStream out) throws IOException {
    JsonGenerator generator = objectMapper.getFactory().createGenerator(out);
    generator.disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);

    ObjectWriter writer = objectMapper.writerFor(ChunkView.class);
    if (format == ExportFormat.JSONL) {
      writer = writer.withRootValueSeparator("\n");
    }

    int written = 0;
    try (SequenceWriter sequence =
        format == ExportFormat.JSON
            ? writer.writeValuesAsArray(generator)
            : writer.writeValues(generator)) {
      for (Chunk chunk : snapshot.chunks()) {
        if (kind != null && chunk.metadata().kind() != kind) {
          continue;
        }
        sequence.write(ChunkView.of(snapshot.sessionId(), chunk, embeddingModel, includeVectors));
        written++;
      }
    }
    if (format == ExportFormat.JSONL && written > 0) {
      generator.writeRaw('\n');
    }
    generator.flush();
    generator.close();
    return written;
  }
}
