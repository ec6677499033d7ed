package com.ospicorp.tstoolbox.series.io;

import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.ospicorp.tstoolbox.series.model.TimeSeries;
import java.io.IOException;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.springframework.http.HttpInputMessage;
import org.springframework.http.HttpOutputMessage;
import org.springframework.http.MediaType;
import org.springframework.http.converter.AbstractHttpMessageConverter;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.http.converter.HttpMessageNotWritableException;
import org.springframework.lang.NonNull;

/**
 * {@code text/csv} support: reads and writes {@link TimeSeries} bodies and writes result tables
 * (collections of records) with a header derived from the element type.
 */
public class CsvHttpMessageConverter extends AbstractHttpMessageConverter<Object> {
  public static final MediaType TEXT_CSV = MediaType.valueOf("text/csv");

  private final CsvMapper mapper = new CsvMapper();
  private final TimeSeriesCsvCodec codec;

  public CsvHttpMessageConverter(TimeSeriesCsvCodec codec) {
    super(TEXT_CSV);
    this.codec = codec;
    mapper.findAndRegisterModules();
  }

  @Override
  protected boolean supports(@NonNull Class<?> clazz) {
    return TimeSeries.class.isAssignableFrom(clazz)
        || Collection.class.isAssignableFrom(clazz) || clazz.isArray();
  }

  @Override
  protected boolean canRead(MediaType mediaType) {
    return mediaType != null && super.canRead(mediaType);
  }

  @Override
  @NonNull
  protected Object readInternal(@NonNull Class<?> clazz, @NonNull HttpInputMessage inputMessage)
      throws IOException, HttpMessageNotReadableException {
    if (!TimeSeries.class.isAssignableFrom(clazz)) {
      throw new HttpMessageNotReadableException("CSV reading only supported for time series",
          inputMessage);
    }
    return codec.read(inputMessage.getBody());
  }

  @Override
  protected void writeInternal(@NonNull Object object, @NonNull HttpOutputMessage outputMessage)
      throws IOException, HttpMessageNotWritableException {
    if (object instanceof TimeSeries series) {
      codec.write(series, outputMessage.getBody());
      return;
    }
    List<Object> rows = asList(object);
    CsvSchema schema = rows.isEmpty() || rows.get(0) == null
        ? mapper.schemaFor(Object.class).withHeader()
        : mapper.schemaFor(rows.get(0).getClass()).withHeader();
    var writer = mapper.writer(schema).writeValues(outputMessage.getBody());
    for (Object row : rows) {
      writer.write(row);
    }
    writer.flush();
  }

  private static List<Object> asList(Object value) {
    if (value instanceof Collection<?> collection) {
      return new ArrayList<>(collection);
    }
    int length = Array.getLength(value);
    List<Object> elements = new ArrayList<>(length);
    for (int i = 0; i < length; i++) {
      elements.add(Array.get(value, i));
    }
    return elements;
  }
}
