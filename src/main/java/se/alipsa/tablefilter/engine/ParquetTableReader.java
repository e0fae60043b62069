package se.alipsa.tablefilter.engine;

import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.apache.avro.Schema;
import org.apache.avro.generic.GenericRecord;
import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.Path;
import org.apache.parquet.avro.AvroReadSupport;
import org.apache.parquet.avro.AvroSchemaConverter;
import org.apache.parquet.filter2.compat.FilterCompat;
import org.apache.parquet.filter2.predicate.FilterPredicate;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.hadoop.ParquetReader;
import org.apache.parquet.hadoop.metadata.FileMetaData;
import org.apache.parquet.hadoop.util.HadoopInputFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Reads Parquet tables with an optional predicate pushed down to the reader. */
public final class ParquetTableReader {

  private static final Logger log = LoggerFactory.getLogger(ParquetTableReader.class);

  private ParquetTableReader() {
  }

  /**
   * Reads the Avro schema from a Parquet file, from the schema the Avro writer
   * stored in the footer or else converted from the Parquet schema.
   *
   * @param file
   *          the Parquet file
   * @return the Avro record schema
   * @throws IOException
   *           if the file cannot be read
   */
  public static Schema readAvroSchema(java.nio.file.Path file) throws IOException {
    Configuration conf = new Configuration(false);
    try (ParquetFileReader reader = ParquetFileReader.open(HadoopInputFile.fromPath(toHadoop(file), conf))) {
      FileMetaData meta = reader.getFooter().getFileMetaData();
      String avroJson = meta.getKeyValueMetaData().get("parquet.avro.schema");
      if (avroJson == null) {
        avroJson = meta.getKeyValueMetaData().get("avro.schema");
      }
      if (avroJson != null && !avroJson.isEmpty()) {
        return new Schema.Parser().parse(avroJson);
      }
      return new AvroSchemaConverter().convert(meta.getSchema());
    }
  }

  /**
   * Open a reader over a Parquet file.
   *
   * @param file
   *          the Parquet file
   * @param predicate
   *          the predicate records must satisfy, empty to read every record
   * @return a reader the caller must close
   * @throws IOException
   *           if the file cannot be opened
   */
  public static RecordReader open(java.nio.file.Path file, Optional<FilterPredicate> predicate) throws IOException {
    Configuration conf = new Configuration(false);
    ParquetReader.Builder<GenericRecord> builder = ParquetReader
        .<GenericRecord>builder(new AvroReadSupport<>(), toHadoop(file)).withConf(conf);
    if (predicate.isPresent()) {
      log.debug("Reading {} with filter {}", file, predicate.get());
      builder = builder.withFilter(FilterCompat.get(predicate.get()));
    }
    return new ParquetRecordReaderAdapter(builder.build());
  }

  /**
   * Read every record of a Parquet file that satisfies a predicate.
   *
   * @param file
   *          the Parquet file
   * @param predicate
   *          the predicate, empty to read every record
   * @return the records in file order
   * @throws IOException
   *           if reading fails
   */
  public static List<Map<String, Object>> read(java.nio.file.Path file, Optional<FilterPredicate> predicate)
      throws IOException {
    try (RecordReader reader = open(file, predicate)) {
      return InMemoryEvaluator.filter(RecordMatcher.ALL, reader);
    }
  }

  private static Path toHadoop(java.nio.file.Path file) {
    return new Path(file.toAbsolutePath().toUri());
  }
}
