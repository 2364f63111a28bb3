package com.ospicorp.salesinsights.web;

import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.salesinsights.artifact.TabularDataset;
import java.io.IOException;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;

/**
 * Writes datasets and lists of records as {@code text/csv}. Datasets keep their column order;
 * records get a header from their properties (or map keys, in first-seen order).
 */
public class CsvHttpMessageConverter extends AbstractHttpMessageConverter<Object> {
  private final CsvMapper mapper = new CsvMapper();

  public CsvHttpMessageConverter() {
    super(ResponseFormats.CSV);
    mapper.findAndRegisterModules();
    mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return TabularDataset.class.isAssignableFrom(clazz) || Collection.class.isAssignableFrom(clazz);
  }

  @Override
  @NonNull
  protected Object readInternal(@NonNull Class<?> clazz, @NonNull HttpInputMessage inputMessage)
      throws IOException, HttpMessageNotReadableException {
    throw new HttpMessageNotReadableException("CSV reading not supported", inputMessage);
  }

  @Override
  protected void writeInternal(@NonNull Object object, @NonNull HttpOutputMessage outputMessage)
      throws IOException, HttpMessageNotWritableException {
    Collection<?> rows;
    CsvSchema schema;
    if (object instanceof TabularDataset dataset) {
      rows = dataset.toRecords();
      schema = schemaFor(dataset.columns());
    } else {
      rows = (Collection<?>) object;
      schema = determineSchema(rows);
    }
    var writer = mapper.writer(schema).writeValues(outputMessage.getBody());
    for (Object row : rows) {
      writer.write(row);
    }
    writer.flush();
  }

  private CsvSchema determineSchema(Collection<?> rows) {
    Object sample = null;
    for (Object row : rows) {
      if (row != null) {
        sample = row;
        break;
      }
    }
    if (sample instanceof Map<?, ?>) {
      Set<String> columns = new LinkedHashSet<>();
      for (Object row : rows) {
        if (row instanceof Map<?, ?> map) {
          for (Object key : map.keySet()) {
            if (key != null) {
              columns.add(key.toString());
            }
          }
        }
      }
      return schemaFor(List.copyOf(columns));
    }
    if (sample != null) {
      return mapper.schemaFor(sample.getClass()).withHeader();
    }
    return CsvSchema.emptySchema().withHeader();
  }

  private static CsvSchema schemaFor(List<String> columns) {
    CsvSchema.Builder builder = CsvSchema.builder();
    columns.forEach(builder::addColumn);
    return builder.setUseHeader(true).build();
  }
}
